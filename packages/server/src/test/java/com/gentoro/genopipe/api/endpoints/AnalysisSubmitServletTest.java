package com.gentoro.genopipe.api.endpoints;

import static com.gentoro.genopipe.api.endpoints.ServletTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.genopipe.artifacts.ArtifactManager;
import com.gentoro.genopipe.jobs.AdapterResult;
import com.gentoro.genopipe.jobs.InMemoryJobRegistry;
import com.gentoro.genopipe.jobs.JobManager;
import com.gentoro.genopipe.jobs.JobType;
import com.gentoro.genopipe.jobs.ScriptedAdapter;
import com.gentoro.genopipe.jobs.adapters.PhastestClient;
import java.nio.file.Path;
import java.util.Map;
import org.eclipse.jetty.ee10.servlet.ServletTester;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AnalysisSubmitServletTest {

  @TempDir Path temp;

  private JobManager jobs;
  private ServletTester tester;

  @BeforeEach
  void setUp() {
    InMemoryJobRegistry registry = new InMemoryJobRegistry();
    jobs = new JobManager(registry, new ArtifactManager(temp, registry), 1);
    for (JobType type : new JobType[] {JobType.RESFINDER, JobType.PHASTEST}) {
      jobs.register(
          new ScriptedAdapter(type, (ctx, in, p) -> AdapterResult.artifacts("none", Map.of())));
    }
  }

  @AfterEach
  void tearDown() throws Exception {
    if (tester != null) tester.stop();
    jobs.close();
  }

  @Test
  void acceptsUrlsAndReturnsPendingJob() throws Exception {
    tester = start(new AnalysisSubmitServlet(jobs, JobType.RESFINDER), "/run-resfinder");

    HttpTester.Response resp =
        post(
            tester,
            "/run-resfinder",
            "{\"genome_urls\": [\"https://h/a.fna\", \"https://h/b.fna\"]}");

    assertEquals(200, resp.getStatus());
    JsonNode body = json(resp);
    assertFalse(body.path("job_id").asText().isBlank());
    assertEquals("pending", body.path("status").asText());
    assertEquals("resfinder analysis started for 2 genome(s)", body.path("message").asText());
    assertEquals(1, jobs.list().size());
  }

  @Test
  void acceptsGenomeRecordObjects() throws Exception {
    tester = start(new AnalysisSubmitServlet(jobs, JobType.RESFINDER), "/run-resfinder");

    HttpTester.Response resp =
        post(
            tester,
            "/run-resfinder",
            """
            {"genome_urls": [{"url": "https://h/a.fna", "assembly_accession": "GCA_1"}]}
            """);

    assertEquals(200, resp.getStatus());
  }

  @Test
  void emptyGenomeListIsRejectedWithoutCreatingAJob() throws Exception {
    tester = start(new AnalysisSubmitServlet(jobs, JobType.RESFINDER), "/run-resfinder");

    HttpTester.Response resp = post(tester, "/run-resfinder", "{\"genome_urls\": []}");

    assertEquals(400, resp.getStatus());
    JsonNode body = json(resp);
    assertEquals("No genome URLs provided", body.path("error").asText());
    assertEquals("VALIDATION_ERROR", body.path("code").asText());
    assertTrue(jobs.list().isEmpty());
  }

  @Test
  void malformedBodyIsRejected() throws Exception {
    tester = start(new AnalysisSubmitServlet(jobs, JobType.RESFINDER), "/run-resfinder");

    assertEquals(400, post(tester, "/run-resfinder", "{not json").getStatus());
    assertEquals(400, post(tester, "/run-resfinder", "[1, 2]").getStatus());
    assertEquals(400, post(tester, "/run-resfinder", "{\"genome_urls\": \"x\"}").getStatus());
    assertTrue(jobs.list().isEmpty());
  }

  @Test
  void unavailablePhastestOffersFallback() throws Exception {
    PhastestClient gate = mock(PhastestClient.class);
    when(gate.probe()).thenReturn(new PhastestClient.Availability(false, 503, null));
    tester = start(new AnalysisSubmitServlet(jobs, JobType.PHASTEST, gate), "/run-phastest");

    HttpTester.Response resp =
        post(tester, "/run-phastest", "{\"genome_urls\": [\"https://h/a.fna\"]}");

    assertEquals(503, resp.getStatus());
    JsonNode body = json(resp);
    assertEquals("api_unavailable", body.path("status").asText());
    assertTrue(body.path("fallback_available").asBoolean());
    assertEquals("PHASTEST API returned HTTP 503", body.path("error").asText());
    assertEquals("UPSTREAM_UNAVAILABLE", body.path("code").asText());
    assertTrue(jobs.list().isEmpty());
  }

  @Test
  void availablePhastestAcceptsSubmission() throws Exception {
    PhastestClient gate = mock(PhastestClient.class);
    when(gate.probe()).thenReturn(new PhastestClient.Availability(true, 200, null));
    tester = start(new AnalysisSubmitServlet(jobs, JobType.PHASTEST, gate), "/run-phastest");

    HttpTester.Response resp =
        post(tester, "/run-phastest", "{\"genome_urls\": [\"https://h/a.fna\"]}");

    assertEquals(200, resp.getStatus());
    assertEquals("phastest analysis started for 1 genome(s)", json(resp).path("message").asText());
  }
}
