package com.gentoro.genopipe.client;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.genopipe.exception.NotFoundException;
import com.gentoro.genopipe.exception.StateException;
import com.gentoro.genopipe.exception.UpstreamUnavailableException;
import com.gentoro.genopipe.jobs.GenomeFetchResult;
import com.gentoro.genopipe.jobs.Job;
import com.gentoro.genopipe.jobs.JobStatus;
import com.gentoro.genopipe.jobs.JobType;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class JobStatusPollerTest {

  private static final Instant CREATED = Instant.parse("2026-01-05T10:00:00Z");

  private final GenoPipeClient client = mock(GenoPipeClient.class);
  private final JobStatusPoller poller = new JobStatusPoller(client, Duration.ofMillis(10));

  @AfterEach
  void tearDown() {
    poller.close();
  }

  @Test
  void completesWhenJobReachesTerminalState() throws Exception {
    when(client.status("j1"))
        .thenReturn(job(JobStatus.PENDING, 0), job(JobStatus.RUNNING, 40), completed());
    List<Job> seen = new CopyOnWriteArrayList<>();

    Job done = poller.await("j1", seen::add).get(5, TimeUnit.SECONDS);

    assertEquals(JobStatus.COMPLETED, done.status());
    assertEquals(100, done.progress());
    assertEquals(
        List.of(JobStatus.PENDING, JobStatus.RUNNING, JobStatus.COMPLETED),
        seen.stream().map(Job::status).toList());
  }

  @Test
  void transientErrorsAreRetried() throws Exception {
    when(client.status("j1"))
        .thenThrow(new UpstreamUnavailableException("connection refused"))
        .thenReturn(completed());

    assertEquals(JobStatus.COMPLETED, poller.await("j1").get(5, TimeUnit.SECONDS).status());
    verify(client, times(2)).status("j1");
  }

  @Test
  void slowStatusCallDoesNotDelayOtherJobs() throws Exception {
    when(client.status("slow"))
        .thenAnswer(
            invocation -> {
              Thread.sleep(3_000);
              return job(JobStatus.RUNNING, 10);
            });
    when(client.status("fast")).thenReturn(job(JobStatus.RUNNING, 50), completed());

    poller.await("slow");
    Thread.sleep(50);
    long started = System.nanoTime();
    Job done = poller.await("fast").get(1, TimeUnit.SECONDS);

    assertEquals(JobStatus.COMPLETED, done.status());
    assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(1)) < 0);
  }

  @Test
  void decreasingProgressFailsTheFuture() {
    when(client.status("j1")).thenReturn(job(JobStatus.RUNNING, 60), job(JobStatus.RUNNING, 30));

    ExecutionException ex =
        assertThrows(
            ExecutionException.class, () -> poller.await("j1").get(5, TimeUnit.SECONDS));
    assertInstanceOf(StateException.class, ex.getCause());
  }

  @Test
  void deletedJobFailsTheFuture() {
    when(client.status("j1")).thenThrow(new NotFoundException("Job not found"));

    ExecutionException ex =
        assertThrows(
            ExecutionException.class, () -> poller.await("j1").get(5, TimeUnit.SECONDS));
    assertInstanceOf(NotFoundException.class, ex.getCause());
  }

  @Test
  void progressionAllowsSkippedIntermediateStates() {
    assertDoesNotThrow(
        () -> JobStatusPoller.verifyProgression(job(JobStatus.PENDING, 0), completed()));
    assertDoesNotThrow(
        () ->
            JobStatusPoller.verifyProgression(
                job(JobStatus.PAUSED, 20), job(JobStatus.PAUSED, 20)));
    assertThrows(
        StateException.class,
        () -> JobStatusPoller.verifyProgression(completed(), job(JobStatus.RUNNING, 100)));
  }

  @Test
  void rejectsNonPositiveInterval() {
    assertThrows(IllegalArgumentException.class, () -> new JobStatusPoller(client, Duration.ZERO));
  }

  private static Job job(JobStatus status, int progress) {
    return new Job("j1", JobType.FETCH_GENOMES, status, progress, "", null, null, CREATED, null);
  }

  private static Job completed() {
    return new Job(
        "j1",
        JobType.FETCH_GENOMES,
        JobStatus.COMPLETED,
        100,
        "Completed",
        GenomeFetchResult.of(List.of()),
        null,
        CREATED,
        CREATED.plusSeconds(5));
  }
}
