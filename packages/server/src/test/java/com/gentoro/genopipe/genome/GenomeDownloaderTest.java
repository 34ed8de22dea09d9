package com.gentoro.genopipe.genome;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.genopipe.exception.AdapterException;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPOutputStream;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GenomeDownloaderTest {

  @TempDir Path temp;

  private MockWebServer server;
  private GenomeDownloader downloader;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    downloader = new GenomeDownloader(new OkHttpClient());
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  private GenomeRecord genome(String path) {
    return GenomeRecord.ofUrl(server.url(path).toString());
  }

  @Test
  void decompressesGzipIntoRequestedFile() throws Exception {
    ByteArrayOutputStream gz = new ByteArrayOutputStream();
    try (GZIPOutputStream out = new GZIPOutputStream(gz)) {
      out.write(">chr1 test\nACGT\nTTGA\n".getBytes(StandardCharsets.UTF_8));
    }
    server.enqueue(new MockResponse().setBody(new Buffer().write(gz.toByteArray())));

    GenomeRecord genome = genome("/GCF_1_genomic.fna.gz");
    Path file = downloader.download(genome, temp, genome.fileStem() + ".fna");

    assertEquals("GCF_1_genomic.fna", file.getFileName().toString());
    assertEquals(">chr1 test\nACGT\nTTGA\n", Files.readString(file));
  }

  @Test
  void dropsLeadingNoiseAndNormalizesLines() throws Exception {
    server.enqueue(new MockResponse().setBody("\uFEFF# comment\r\n\r\n>seq  \r\nACGT  \r\n"));

    Path file = downloader.download(genome("/g.fasta"), temp, "out.fasta");

    assertEquals(">seq\nACGT\n", Files.readString(file));
  }

  @Test
  void rejectsContentWithoutHeader() {
    server.enqueue(new MockResponse().setBody("<html>not found</html>"));

    assertThrows(
        AdapterException.class, () -> downloader.download(genome("/g.fna"), temp, "g.fna"));
    assertFalse(Files.exists(temp.resolve("g.fna")));
  }

  @Test
  void httpErrorsAreAdapterFailures() {
    server.enqueue(new MockResponse().setResponseCode(404));

    AdapterException e =
        assertThrows(
        AdapterException.class, () -> downloader.download(genome("/g.fna"), temp, "g.fna"));
    assertTrue(e.getMessage().contains("HTTP 404"));
  }

  @Test
  void fileStemPrefersAccession() {
    GenomeRecord withAccession =
        new GenomeRecord(
            "https://x/y.fna.gz", null, null, null, null, "GCA_1.1", null, null, null, null, null,
            null, null, null);
    assertEquals("GCA_1.1", withAccession.fileStem());
    assertEquals("sample_7", GenomeRecord.ofUrl("https://x/sample_7.fasta?dl=1").fileStem());
  }

  @Test
  void repeatedGenomesGetDistinctFileStems() {
    GenomeRecord a = GenomeRecord.ofUrl("https://x/a.fna.gz");
    GenomeRecord a2 = GenomeRecord.ofUrl("https://mirror/a.fna");
    GenomeRecord b = GenomeRecord.ofUrl("https://x/a_2.fna");

    assertEquals(
        List.of("a", "a_2", "a_2_2", "a_3"), GenomeRecord.uniqueFileStems(List.of(a, a, b, a2)));
  }
}
