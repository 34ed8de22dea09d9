package com.gentoro.genopipe.client;

import com.gentoro.genopipe.exception.NotFoundException;
import com.gentoro.genopipe.exception.StateException;
import com.gentoro.genopipe.jobs.Job;
import com.gentoro.genopipe.jobs.JobStatus;
import com.gentoro.genopipe.logging.LoggingService;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;

/**
 * Polls job status until each job reaches a terminal state.
 *
 * <p>A shared scheduler only times the polls; the blocking status calls run on a separate pool, so
 * a slow answer for one job never delays another. Each job has at most one call in flight and
 * schedules its next poll when that call returns.
 *
 * <p>Every observed snapshot is checked against the last one: progress must not decrease and the
 * status must follow the lifecycle graph. A violation completes the job's future with a {@link
 * StateException}. A job that disappears completes it with a {@link NotFoundException}.
 */
public class JobStatusPoller implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(JobStatusPoller.class);
  public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(2);

  private final GenoPipeClient client;
  private final Duration interval;
  private final ScheduledExecutorService scheduler;
  private final ExecutorService calls;

  public JobStatusPoller(GenoPipeClient client) {
    this(client, DEFAULT_INTERVAL);
  }

  public JobStatusPoller(GenoPipeClient client, Duration interval) {
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("Polling interval must be positive");
    }
    this.client = Objects.requireNonNull(client);
    this.interval = interval;
    this.scheduler = Executors.newSingleThreadScheduledExecutor(daemon("genopipe-poller-"));
    this.calls = Executors.newCachedThreadPool(daemon("genopipe-poll-call-"));
  }

  private static ThreadFactory daemon(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  /** Polls {@code jobId} until it completes or fails. */
  public CompletableFuture<Job> await(String jobId) {
    return await(jobId, job -> {});
  }

  /**
   * Polls {@code jobId} until it completes or fails, handing each snapshot to {@code listener}.
   * Cancelling the returned future stops the polling.
   */
  public CompletableFuture<Job> await(String jobId, Consumer<Job> listener) {
    CompletableFuture<Job> future = new CompletableFuture<>();
    submit(new PollTask(jobId, listener, future));
    return future;
  }

  private void submit(PollTask task) {
    try {
      calls.execute(task);
    } catch (RejectedExecutionException e) {
      task.future.completeExceptionally(new StateException("Poller is closed", e));
    }
  }

  private void scheduleNext(PollTask task) {
    try {
      scheduler.schedule(() -> submit(task), interval.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      task.future.completeExceptionally(new StateException("Poller is closed", e));
    }
  }

  private final class PollTask implements Runnable {
    private final String jobId;
    private final Consumer<Job> listener;
    private final CompletableFuture<Job> future;
    private Job last;

    PollTask(String jobId, Consumer<Job> listener, CompletableFuture<Job> future) {
      this.jobId = jobId;
      this.listener = listener;
      this.future = future;
    }

    @Override
    public void run() {
      if (future.isDone()) return;
      try {
        Job job = client.status(jobId);
        verifyProgression(last, job);
        last = job;
        listener.accept(job);
        if (job.isTerminal()) {
          future.complete(job);
        }
      } catch (NotFoundException e) {
        log.debug("Job {} no longer exists", jobId);
        future.completeExceptionally(e);
      } catch (StateException e) {
        log.warn("Job {} reported an inconsistent state: {}", jobId, e.getMessage());
        future.completeExceptionally(e);
      } catch (RuntimeException e) {
        // Transient failures are retried on the next tick.
        log.debug("Polling job {} failed: {}", jobId, e.toString());
      }
      if (!future.isDone()) {
        scheduleNext(this);
      }
    }
  }

  static void verifyProgression(Job previous, Job current) {
    if (previous == null) return;
    if (current.progress() < previous.progress()) {
      throw new StateException(
          "Progress of job %s went back from %d to %d"
              .formatted(current.jobId(), previous.progress(), current.progress()));
    }
    JobStatus from = previous.status();
    JobStatus to = current.status();
    if (from != to && !reachable(from, to)) {
      throw new StateException(
          "Job %s moved from %s to %s".formatted(current.jobId(), from.wireName(), to.wireName()));
    }
  }

  // Between two polls the job may take several steps, e.g. pending -> running -> completed.
  private static boolean reachable(JobStatus from, JobStatus to) {
    if (from.canTransitionTo(to)) return true;
    for (JobStatus via : JobStatus.values()) {
      if (via != from && from.canTransitionTo(via) && via.canTransitionTo(to)) return true;
    }
    return false;
  }

  @Override
  public void close() {
    scheduler.shutdownNow();
    calls.shutdownNow();
  }
}
