package com.gentoro.genopipe.api.endpoints;

import static com.gentoro.genopipe.api.endpoints.ServletTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.genopipe.artifacts.ArtifactManager;
import com.gentoro.genopipe.artifacts.FastaBundleService;
import com.gentoro.genopipe.cleanup.CleanupScheduler;
import com.gentoro.genopipe.genome.GenomeDownloader;
import com.gentoro.genopipe.jobs.InMemoryJobRegistry;
import com.gentoro.genopipe.jobs.JobManager;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import org.eclipse.jetty.ee10.servlet.ServletTester;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TemporaryEndpointsTest {

  @TempDir Path temp;

  private ArtifactManager artifacts;
  private FastaBundleService bundles;
  private ServletTester tester;

  @BeforeEach
  void setUp() {
    artifacts = new ArtifactManager(temp.resolve("storage"), new InMemoryJobRegistry());
    bundles = new FastaBundleService(artifacts, mock(GenomeDownloader.class));
  }

  @AfterEach
  void tearDown() throws Exception {
    if (tester != null) tester.stop();
  }

  private Path file(String name, String content) throws Exception {
    return Files.writeString(temp.resolve(name), content);
  }

  @Test
  void listsPhastestArchives() throws Exception {
    artifacts.publishTemporary(
        ArtifactManager.PHASTEST_RESULTS, file("a.zip", "abc"), "GCA_1.PHASTEST.zip");
    artifacts.publishTemporary(ArtifactManager.PHASTEST_RESULTS, file("n.txt", "x"), "notes.txt");
    tester = start(TemporaryListServlet.phastestZips(artifacts), "/phastest-zip-files");

    JsonNode files = json(get(tester, "/phastest-zip-files")).path("zip_files");

    assertEquals(1, files.size());
    assertEquals("GCA_1.PHASTEST.zip", files.get(0).path("filename").asText());
    assertEquals(3, files.get(0).path("size").asLong());
    assertTrue(files.get(0).has("size_mb"));
    assertFalse(files.get(0).has("temp_dir"));
  }

  @Test
  void listsAndDownloadsTempFastaBundles() throws Exception {
    String namespace = artifacts.newTempFastaNamespace();
    artifacts.publishTemporary(namespace, file("b.zip", "PK"), "bundle.zip");
    ServletTester listing = start(TemporaryListServlet.tempFastaZips(artifacts), "/list");
    tester = start(new TemporaryDownloadServlet(artifacts), "/download-temp-fasta-zip/*");

    JsonNode files = json(get(listing, "/list")).path("zip_files");
    listing.stop();
    assertEquals(1, files.size());
    assertEquals(namespace, files.get(0).path("temp_dir").asText());
    assertTrue(files.get(0).path("created_time").asDouble() > 0);

    HttpTester.Response resp =
        get(tester, "/download-temp-fasta-zip/" + namespace + "/bundle.zip");
    assertEquals(200, resp.getStatus());
    assertEquals("PK", resp.getContent());
    assertEquals("application/zip", resp.get("Content-Type"));
  }

  @Test
  void tempDownloadRejectsForeignNamespacesAndNames() throws Exception {
    tester = start(new TemporaryDownloadServlet(artifacts), "/download-temp-fasta-zip/*");

    assertEquals(400, get(tester, "/download-temp-fasta-zip/resfinder_inputs/x.zip").getStatus());
    assertEquals(400, get(tester, "/download-temp-fasta-zip/temp_fasta_1/x.fna").getStatus());
    assertEquals(404, get(tester, "/download-temp-fasta-zip/temp_fasta_1/x.zip").getStatus());
  }

  @Test
  void resfinderBundleWithoutStagedInputsIs404() throws Exception {
    tester =
        start(new ResfinderFastaZipServlet(bundles, artifacts), "/download-resfinder-fasta-zip");

    HttpTester.Response resp = get(tester, "/download-resfinder-fasta-zip");

    assertEquals(404, resp.getStatus());
    assertEquals(
        "No ResFinder input FASTA files found. Run a ResFinder analysis first.",
        json(resp).path("error").asText());
  }

  @Test
  void resfinderBundleZipsStagedInputs() throws Exception {
    artifacts.publishTemporary(ArtifactManager.RESFINDER_INPUTS, file("g.fna", ">g\n"), "g.fna");
    tester =
        start(new ResfinderFastaZipServlet(bundles, artifacts), "/download-resfinder-fasta-zip");

    HttpTester.Response resp = get(tester, "/download-resfinder-fasta-zip");

    assertEquals(200, resp.getStatus());
    assertEquals(
        "attachment; filename=\"phastest_fasta_files_1_genomes.zip\"",
        resp.get("Content-Disposition"));
  }

  @Test
  void cleanupFilesSweepsExpiredFiles() throws Exception {
    artifacts.publishTemporary("temp_fasta_1", file("o.zip", "o"), "old.zip");
    Files.setLastModifiedTime(
        temp.resolve("storage/temp/temp_fasta_1/old.zip"),
        FileTime.from(Instant.now().minus(Duration.ofDays(10))));
    InMemoryJobRegistry registry = new InMemoryJobRegistry();
    try (JobManager jobs = new JobManager(registry, artifacts, 1)) {
      CleanupScheduler cleanup =
          new CleanupScheduler(
              jobs, artifacts, Duration.ofHours(1), Duration.ofDays(7), Duration.ofDays(31));
      tester = start(new CleanupFilesServlet(cleanup), "/cleanup-files");

      HttpTester.Response resp = post(tester, "/cleanup-files", null);

      assertEquals(200, resp.getStatus());
      JsonNode body = json(resp);
      assertEquals("success", body.path("status").asText());
      assertEquals(1, body.path("removed").asInt());
    }
  }
}
