package com.gentoro.genopipe.api.endpoints;

import static com.gentoro.genopipe.api.endpoints.ServletTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.genopipe.exception.InvalidTransitionException;
import com.gentoro.genopipe.exception.NotFoundException;
import com.gentoro.genopipe.exception.UpstreamUnavailableException;
import com.gentoro.genopipe.exception.ValidationException;
import com.gentoro.genopipe.genome.GenomeRecord;
import com.gentoro.genopipe.jobs.BioProjectInput;
import com.gentoro.genopipe.jobs.GenomeFetchResult;
import com.gentoro.genopipe.jobs.Job;
import com.gentoro.genopipe.jobs.JobManager;
import com.gentoro.genopipe.jobs.JobStatus;
import com.gentoro.genopipe.jobs.JobType;
import java.time.Instant;
import java.util.List;
import org.eclipse.jetty.ee10.servlet.ServletTester;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class JobEndpointsTest {

  private static final Instant CREATED = Instant.parse("2025-03-01T10:00:00Z");

  private final JobManager jobs = mock(JobManager.class);
  private ServletTester tester;

  @AfterEach
  void tearDown() throws Exception {
    if (tester != null) tester.stop();
  }

  private static Job job(String id, JobStatus status) {
    return new Job(id, JobType.RESFINDER, status, 40, "working", null, null, CREATED, null);
  }

  @Test
  void statusReturnsFullRecord() throws Exception {
    Job done =
        new Job(
            "abc",
            JobType.FETCH_GENOMES,
            JobStatus.COMPLETED,
            100,
            "Completed",
            GenomeFetchResult.of(List.of(GenomeRecord.ofUrl("https://h/a.fna"))),
            null,
            CREATED,
            CREATED.plusSeconds(5));
    when(jobs.status("abc")).thenReturn(done);
    tester = start(new JobStatusServlet(jobs), "/job-status/*");

    HttpTester.Response resp = get(tester, "/job-status/abc");

    assertEquals(200, resp.getStatus());
    JsonNode body = json(resp);
    assertEquals("abc", body.path("job_id").asText());
    assertEquals("fetch_genomes", body.path("job_type").asText());
    assertEquals("completed", body.path("status").asText());
    assertEquals(100, body.path("progress").asInt());
    assertEquals(1, body.path("result").path("count").asInt());
    JsonNode genome = body.path("result").path("genomes").get(0);
    assertEquals("https://h/a.fna", genome.path("url").asText());
    assertEquals("2025-03-01T10:00:00Z", body.path("created_at").asText());
  }

  @Test
  void unknownJobIs404() throws Exception {
    when(jobs.status("nope")).thenThrow(new NotFoundException("Job not found: nope"));
    tester = start(new JobStatusServlet(jobs), "/job-status/*");

    HttpTester.Response resp = get(tester, "/job-status/nope");

    assertEquals(404, resp.getStatus());
    assertEquals("NOT_FOUND", json(resp).path("code").asText());
    assertEquals("Job not found: nope", json(resp).path("error").asText());
  }

  @Test
  void listWrapsJobs() throws Exception {
    when(jobs.list()).thenReturn(List.of(job("b", JobStatus.RUNNING), job("a", JobStatus.PENDING)));
    tester = start(new JobsListServlet(jobs), "/jobs");

    JsonNode body = json(get(tester, "/jobs"));

    assertEquals(2, body.path("jobs").size());
    assertEquals("b", body.path("jobs").get(0).path("job_id").asText());
  }

  @Test
  void stopAndResume() throws Exception {
    when(jobs.stop("abc")).thenReturn(job("abc", JobStatus.PAUSED));
    when(jobs.resume("abc")).thenThrow(new InvalidTransitionException("Job abc is not paused"));
    tester = start(new JobControlServlet(jobs), "/jobs/*");

    HttpTester.Response stopped = post(tester, "/jobs/abc/stop", null);
    assertEquals(200, stopped.getStatus());
    assertEquals("paused", json(stopped).path("status").asText());

    HttpTester.Response resumed = post(tester, "/jobs/abc/resume", null);
    assertEquals(409, resumed.getStatus());
    assertEquals("INVALID_TRANSITION", json(resumed).path("code").asText());

    assertEquals(404, post(tester, "/jobs/abc/restart", null).getStatus());
  }

  @Test
  void cleanupDeletesJob() throws Exception {
    doThrow(new NotFoundException("Job not found: gone")).when(jobs).delete("gone");
    tester = start(new CleanupJobServlet(jobs), "/cleanup/*");

    HttpTester.Response ok = delete(tester, "/cleanup/abc");
    assertEquals(200, ok.getStatus());
    assertEquals("Job cleaned up successfully", json(ok).path("message").asText());
    verify(jobs).delete("abc");

    assertEquals(404, delete(tester, "/cleanup/gone").getStatus());
  }

  @Test
  void fetchGenomesSubmitsBioProject() throws Exception {
    when(jobs.submit(eq(JobType.FETCH_GENOMES), eq(new BioProjectInput("PRJNA1"))))
        .thenReturn(job("f1", JobStatus.PENDING));
    when(jobs.submit(eq(JobType.FETCH_GENOMES), eq(new BioProjectInput(null))))
        .thenThrow(new ValidationException("BioProject ID is required"));
    tester = start(new FetchGenomesServlet(jobs), "/fetch-genomes");

    HttpTester.Response ok = post(tester, "/fetch-genomes", "{\"bioproject_id\": \"PRJNA1\"}");
    assertEquals(200, ok.getStatus());
    assertEquals("f1", json(ok).path("job_id").asText());
    assertEquals("Genome fetching started", json(ok).path("message").asText());

    HttpTester.Response missing = post(tester, "/fetch-genomes", "{}");
    assertEquals(400, missing.getStatus());
    assertEquals("BioProject ID is required", json(missing).path("error").asText());
  }

  @Test
  void unexpectedFailuresAre500() throws Exception {
    when(jobs.list()).thenThrow(new IllegalStateException("disk gone"));
    tester = start(new JobsListServlet(jobs), "/jobs");

    HttpTester.Response resp = get(tester, "/jobs");

    assertEquals(500, resp.getStatus());
    assertEquals("UNKNOWN", json(resp).path("code").asText());
    assertEquals("IllegalStateException: disk gone", json(resp).path("error").asText());
    assertTrue(json(resp).path("context").isMissingNode());
  }

  @Test
  void errorBodyCarriesExceptionContext() throws Exception {
    when(jobs.list())
        .thenThrow(
            new UpstreamUnavailableException("NCBI Datasets unreachable")
                .with("bioproject_id", "PRJNA1")
                .with("status", 502));
    tester = start(new JobsListServlet(jobs), "/jobs");

    HttpTester.Response resp = get(tester, "/jobs");

    assertEquals(503, resp.getStatus());
    JsonNode body = json(resp);
    assertEquals("NCBI Datasets unreachable", body.path("error").asText());
    assertEquals("UPSTREAM_UNAVAILABLE", body.path("code").asText());
    assertEquals("PRJNA1", body.path("context").path("bioproject_id").asText());
    assertEquals(502, body.path("context").path("status").asInt());
  }
}
