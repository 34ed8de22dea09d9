package com.gentoro.genopipe.genome;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.genopipe.exception.NotFoundException;
import com.gentoro.genopipe.exception.UpstreamUnavailableException;
import com.gentoro.genopipe.utility.JacksonUtility;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NcbiAssemblyClientTest {

  private MockWebServer server;
  private NcbiAssemblyClient client;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    client =
        new NcbiAssemblyClient(
            new OkHttpClient(), server.url("/eutils").toString(), "secret", "", 500);
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  @Test
  void fetchesAssembliesWithDownloadableFasta() throws Exception {
    server.enqueue(json("{\"esearchresult\": {\"idlist\": [\"101\", \"102\"]}}"));
    server.enqueue(json(resource("/ncbi/esummary.json")));

    List<GenomeRecord> genomes = client.fetchAssemblies("PRJNA57779");

    assertEquals(1, genomes.size());
    GenomeRecord g = genomes.get(0);
    assertEquals(
        "https://ftp.ncbi.nlm.nih.gov/genomes/all/GCF/000/005/845/GCF_000005845.2_ASM584v2/"
            + "GCF_000005845.2_ASM584v2_genomic.fna.gz",
        g.url());
    assertEquals("Escherichia", g.genus());
    assertEquals("coli str.", g.species());
    assertEquals("K-12", g.strain());
    assertEquals("GCF_000005845.2", g.assemblyAccession());
    assertEquals("Complete Genome", g.assemblyLevel());
    assertEquals("1", g.contigCount());
    assertEquals("4641652", g.genomeSize());
    assertEquals("PRJNA57779", g.bioprojectId());

    RecordedRequest search = server.takeRequest();
    assertEquals("/eutils/esearch.fcgi", search.getRequestUrl().encodedPath());
    assertEquals("PRJNA57779[BioProject]", search.getRequestUrl().queryParameter("term"));
    assertEquals("assembly", search.getRequestUrl().queryParameter("db"));
    assertEquals("secret", search.getRequestUrl().queryParameter("api_key"));
    assertEquals("500", search.getRequestUrl().queryParameter("retmax"));
    RecordedRequest summary = server.takeRequest();
    assertEquals("101,102", summary.getRequestUrl().queryParameter("id"));
  }

  @Test
  void emptySearchIsNotFound() {
    server.enqueue(json("{\"esearchresult\": {\"idlist\": []}}"));

    NotFoundException e =
        assertThrows(NotFoundException.class, () -> client.fetchAssemblies("PRJNA0"));
    assertEquals("PRJNA0", e.getContext().get("bioproject_id"));
  }

  @Test
  void serverErrorsAreUpstreamUnavailable() {
    server.enqueue(new MockResponse().setResponseCode(502));

    assertThrows(UpstreamUnavailableException.class, () -> client.fetchAssemblies("PRJNA1"));
  }

  @Test
  void missingFieldsBecomeUnknown() throws Exception {
    JsonNode summary =
        JacksonUtility.getJsonMapper()
            .readTree("{\"ftppath_genbank\": \"https://host/dir/GCA_9_x/\"}");

    GenomeRecord g = NcbiAssemblyClient.toRecord(summary, "PRJEB1");

    assertEquals("https://host/dir/GCA_9_x/GCA_9_x_genomic.fna.gz", g.url());
    assertEquals("Unknown", g.organism());
    assertEquals("Unknown", g.genus());
    assertEquals("Unknown", g.species());
    assertEquals("Unknown", g.strain());
    assertEquals("Unknown", g.contigCount());
  }

  private static String resource(String path) throws Exception {
    try (InputStream in = NcbiAssemblyClientTest.class.getResourceAsStream(path)) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  private static MockResponse json(String body) {
    return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
  }
}
