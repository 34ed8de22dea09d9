package com.gentoro.genopipe.artifacts;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.gentoro.genopipe.exception.AdapterException;
import com.gentoro.genopipe.exception.NotFoundException;
import com.gentoro.genopipe.exception.ValidationException;
import com.gentoro.genopipe.genome.GenomeDownloader;
import com.gentoro.genopipe.genome.GenomeRecord;
import com.gentoro.genopipe.jobs.InMemoryJobRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FastaBundleServiceTest {

  @TempDir Path temp;

  private ArtifactManager artifacts;
  private GenomeDownloader downloader;
  private FastaBundleService bundles;

  @BeforeEach
  void setUp() {
    artifacts = new ArtifactManager(temp.resolve("storage"), new InMemoryJobRegistry());
    downloader = mock(GenomeDownloader.class);
    bundles = new FastaBundleService(artifacts, downloader);
  }

  @Test
  void noStagedInputsIsNotFound() throws Exception {
    NotFoundException e =
        assertThrows(NotFoundException.class, () -> bundles.bundleStagedResfinderInputs());
    assertEquals(
        "No ResFinder input FASTA files found. Run a ResFinder analysis first.", e.getMessage());
    assertEquals(0, tempFastaNamespaces());
  }

  @Test
  void bundlesStagedResfinderInputs() throws Exception {
    for (String name : List.of("GCA_1.fna", "GCA_2.fna")) {
      Path source = Files.writeString(temp.resolve(name), ">" + name + "\nACGT\n");
      artifacts.publishTemporary(ArtifactManager.RESFINDER_INPUTS, source, name);
    }
    Path notes = Files.writeString(temp.resolve("notes.txt"), "x");
    artifacts.publishTemporary(ArtifactManager.RESFINDER_INPUTS, notes, "notes.txt");

    TemporaryArtifact bundle = bundles.bundleStagedResfinderInputs();

    assertEquals("phastest_fasta_files_2_genomes.zip", bundle.filename());
    assertTrue(bundle.namespace().startsWith(ArtifactManager.TEMP_FASTA_PREFIX));
    try (ArtifactStream stream = artifacts.openTemporary(bundle.namespace(), bundle.filename())) {
      assertEquals(List.of("GCA_1.fna", "GCA_2.fna"), entryNames(stream));
    }
  }

  @Test
  void bundlesDownloadableGenomesAndSkipsFailures() throws Exception {
    GenomeRecord ok = GenomeRecord.ofUrl("https://example.org/ok.fna");
    GenomeRecord broken = GenomeRecord.ofUrl("https://example.org/broken.fna");
    when(downloader.download(eq(ok), any(Path.class), anyString()))
        .thenAnswer(
            inv -> {
              Path dir = inv.getArgument(1);
              Files.createDirectories(dir);
              return Files.writeString(dir.resolve((String) inv.getArgument(2)), ">ok\nA\n");
            });
    when(downloader.download(eq(broken), any(Path.class), anyString()))
        .thenThrow(new AdapterException("HTTP 404"));

    TemporaryArtifact bundle = bundles.bundleGenomes(List.of(ok, broken));

    assertEquals(bundle.namespace() + "_fasta_files.zip", bundle.filename());
    try (ArtifactStream stream = artifacts.openTemporary(bundle.namespace(), bundle.filename())) {
      assertEquals(List.of("genome_1.fasta"), entryNames(stream));
    }
    assertEquals(1, artifacts.listTemporaryByPrefix(ArtifactManager.TEMP_FASTA_PREFIX).size());
  }

  @Test
  void failsWhenNothingDownloads() throws Exception {
    GenomeRecord broken = GenomeRecord.ofUrl("https://example.org/broken.fna");
    when(downloader.download(eq(broken), any(Path.class), anyString()))
        .thenThrow(new AdapterException("HTTP 500"));

    AdapterException e =
        assertThrows(AdapterException.class, () -> bundles.bundleGenomes(List.of(broken)));
    assertEquals("No FASTA files could be downloaded", e.getMessage());
    assertEquals(0, tempFastaNamespaces());
  }

  @Test
  void emptyGenomeListIsInvalid() {
    assertThrows(ValidationException.class, () -> bundles.bundleGenomes(List.of()));
  }

  private long tempFastaNamespaces() throws Exception {
    Path root = temp.resolve("storage/temp");
    if (!Files.isDirectory(root)) return 0;
    try (Stream<Path> dirs = Files.list(root)) {
      return dirs.filter(
              d -> d.getFileName().toString().startsWith(ArtifactManager.TEMP_FASTA_PREFIX))
          .count();
    }
  }

  private static List<String> entryNames(ArtifactStream stream) throws Exception {
    List<String> names = new ArrayList<>();
    try (ZipInputStream in = new ZipInputStream(stream.stream())) {
      ZipEntry entry;
      while ((entry = in.getNextEntry()) != null) {
        names.add(entry.getName());
      }
    }
    return names;
  }
}
