package com.gentoro.genopipe.jobs;

import com.gentoro.genopipe.exception.InvalidTransitionException;
import com.gentoro.genopipe.exception.JobCancelledException;
import com.gentoro.genopipe.logging.LoggingService;
import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * Per-job monitor coordinating the worker thread with stop, resume and delete requests. Every
 * status change made by the executor goes through this monitor, so a stop can never interleave
 * with the job starting or completing.
 *
 * <p>A stop marks a running job {@code paused} right away; the worker keeps going until its next
 * checkpoint and parks there. A stop on a pending job takes effect at its first checkpoint. A
 * result produced while paused is held back until the job is resumed.
 *
 * <p>A job runs only while it holds one of the executor's worker slots. Parking at a checkpoint
 * gives the slot back; after a resume the worker waits for a free slot before it goes on.
 */
final class ExecutionControl implements JobContext.Control {
  private static final Logger log = LoggingService.getLogger(ExecutionControl.class);
  private static final long SLOT_POLL_MILLIS = 200;

  private final String jobId;
  private final JobRegistry registry;
  private final Semaphore slots;
  private boolean holdsSlot;
  private boolean started;
  private boolean stopRequested;
  private boolean paused;
  private boolean cancelled;

  ExecutionControl(String jobId, JobRegistry registry, Semaphore slots) {
    this.jobId = jobId;
    this.registry = registry;
    this.slots = slots;
  }

  /**
   * Blocks until a worker slot is free. Called without holding the monitor, so stop, resume and
   * delete requests are answered while the job waits.
   *
   * @throws JobCancelledException if the job is deleted or the worker interrupted meanwhile
   */
  void acquireSlot() {
    try {
      while (!slots.tryAcquire(SLOT_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
        if (isCancelled()) {
          throw new JobCancelledException(jobId);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new JobCancelledException(jobId);
    }
    synchronized (this) {
      if (cancelled) {
        slots.release();
        throw new JobCancelledException(jobId);
      }
      holdsSlot = true;
    }
  }

  synchronized void releaseSlot() {
    if (holdsSlot) {
      holdsSlot = false;
      slots.release();
    }
  }

  /** Moves the job to {@code running}. */
  synchronized void start(int progress, String message) {
    ensureNotCancelled();
    registry.update(
        jobId, JobUpdate.status(JobStatus.RUNNING).withProgress(progress).withMessage(message));
    started = true;
  }

  synchronized Job requestStop() {
    ensureNotCancelled();
    if (stopRequested) {
      throw new InvalidTransitionException("Job " + jobId + " is already paused");
    }
    Job current = registry.require(jobId);
    if (current.isTerminal()) {
      throw new InvalidTransitionException(
          "Job %s is already %s".formatted(jobId, current.status().wireName()));
    }
    stopRequested = true;
    if (started) {
      paused = true;
      log.info("Job {} paused", jobId);
      return registry.update(
          jobId,
          JobUpdate.status(JobStatus.PAUSED).withMessage("Paused; stopping at next checkpoint"));
    }
    log.info("Job {} will pause when it starts", jobId);
    return registry.update(jobId, JobUpdate.progress(0, "Stop requested; pausing on start"));
  }

  synchronized Job resume() {
    ensureNotCancelled();
    if (!paused) {
      throw new InvalidTransitionException("Job " + jobId + " is not paused");
    }
    Job job =
        registry.update(jobId, JobUpdate.status(JobStatus.RUNNING).withMessage("Resumed"));
    stopRequested = false;
    paused = false;
    notifyAll();
    log.info("Job {} resumed", jobId);
    return job;
  }

  @Override
  public void checkpoint() {
    while (!parkIfStopped()) {
      acquireSlot();
    }
  }

  /** Parks while a stop is pending. Returns whether the worker still holds its slot. */
  private synchronized boolean parkIfStopped() {
    ensureNotCancelled();
    if (stopRequested && !paused) {
      registry.update(jobId, JobUpdate.status(JobStatus.PAUSED).withMessage("Paused"));
      paused = true;
      log.info("Job {} paused", jobId);
    }
    if (stopRequested) {
      releaseSlot();
      awaitResume();
    }
    return holdsSlot;
  }

  /**
   * Applies the successful outcome of the job once it is not paused. The action runs under the
   * monitor, so a concurrent delete either happens before (the outcome is dropped) or after.
   */
  void complete(Runnable action) {
    while (true) {
      checkpoint();
      synchronized (this) {
        ensureNotCancelled();
        if (!stopRequested) {
          action.run();
          return;
        }
      }
    }
  }

  /** Applies a failure. Failing is allowed from {@code paused}, so this does not wait. */
  synchronized void fail(Runnable action) {
    ensureNotCancelled();
    action.run();
  }

  synchronized void cancel() {
    cancelled = true;
    notifyAll();
  }

  @Override
  public synchronized boolean isCancelled() {
    return cancelled;
  }

  @Override
  public synchronized void sleep(Duration duration) throws InterruptedException {
    long deadline = System.nanoTime() + duration.toNanos();
    while (!cancelled) {
      long remainingMillis = (deadline - System.nanoTime()) / 1_000_000;
      if (remainingMillis <= 0) return;
      wait(remainingMillis);
    }
    throw new JobCancelledException(jobId);
  }

  private void awaitResume() {
    while (stopRequested && !cancelled) {
      try {
        wait();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new JobCancelledException(jobId);
      }
    }
    ensureNotCancelled();
  }

  private void ensureNotCancelled() {
    if (cancelled) {
      throw new JobCancelledException(jobId);
    }
  }
}
