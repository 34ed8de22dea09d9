package com.gentoro.genopipe.jobs;

import com.gentoro.genopipe.artifacts.ArtifactManager;
import com.gentoro.genopipe.artifacts.ArtifactRef;
import com.gentoro.genopipe.exception.ExceptionUtil;
import com.gentoro.genopipe.exception.GenoPipeException;
import com.gentoro.genopipe.exception.InvalidTransitionException;
import com.gentoro.genopipe.exception.JobCancelledException;
import com.gentoro.genopipe.exception.NotFoundException;
import com.gentoro.genopipe.exception.StateException;
import com.gentoro.genopipe.exception.ValidationException;
import com.gentoro.genopipe.logging.LoggingService;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Runs submitted jobs off the request path, driving their registry state from {@code pending} to a
 * terminal state. At most {@code workerThreads} jobs run at a time; a paused job gives its slot
 * back until it is resumed, so paused jobs never hold up later submissions.
 *
 * <p>Every job that gets a record reaches {@code completed} or {@code failed}, or is deleted:
 * adapter faults are recorded as failures and never escape the worker.
 */
public final class JobManager implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(JobManager.class);

  static final int STARTED_PROGRESS = 5;
  static final int FINISHING_PROGRESS = 95;

  private final JobRegistry registry;
  private final ArtifactManager artifacts;
  private final ExecutorService executor;
  private final Semaphore slots;
  private final Clock clock;
  private final Map<JobType, JobAdapter<?>> adapters = new EnumMap<>(JobType.class);
  private final Map<String, ExecutionControl> controls = new ConcurrentHashMap<>();

  public JobManager(JobRegistry registry, ArtifactManager artifacts, int workerThreads) {
    this(registry, artifacts, workerThreads, Clock.systemUTC());
  }

  public JobManager(
      JobRegistry registry, ArtifactManager artifacts, int workerThreads, Clock clock) {
    if (workerThreads < 1) {
      throw new ValidationException("jobs.worker-threads must be at least 1");
    }
    this.registry = registry;
    this.artifacts = artifacts;
    this.clock = clock;
    this.slots = new Semaphore(workerThreads, true);
    AtomicInteger counter = new AtomicInteger();
    this.executor =
        Executors.newCachedThreadPool(
            r -> {
              Thread t = new Thread(r, "genopipe-worker-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  public synchronized void register(JobAdapter<?> adapter) {
    adapters.put(adapter.type(), adapter);
  }

  /**
   * Validates the input, creates a {@code pending} record and schedules the work. Returns without
   * waiting for the adapter.
   *
   * @throws ValidationException if the input is rejected; no record is created
   */
  public Job submit(JobType type, JobInput input) {
    JobAdapter<?> adapter;
    synchronized (this) {
      adapter = adapters.get(type);
    }
    if (adapter == null) {
      throw new StateException("No adapter registered for job type " + type.wireName());
    }
    return submitTo(adapter, input);
  }

  private <I extends JobInput> Job submitTo(JobAdapter<I> adapter, JobInput rawInput) {
    if (rawInput == null || !adapter.inputType().isInstance(rawInput)) {
      throw new ValidationException(
          "Invalid input for %s job".formatted(adapter.type().wireName()));
    }
    I input = adapter.inputType().cast(rawInput);
    adapter.validate(input);

    Job job = registry.create(adapter.type());
    ExecutionControl control = new ExecutionControl(job.jobId(), registry, slots);
    controls.put(job.jobId(), control);
    try {
      executor.execute(() -> run(job.jobId(), adapter, input, control));
    } catch (RejectedExecutionException e) {
      controls.remove(job.jobId());
      log.error("Job {} could not be scheduled", job.jobId(), e);
      return registry.update(job.jobId(), JobUpdate.failed("Job could not be scheduled"));
    }
    log.info("Submitted {} job {}", adapter.type().wireName(), job.jobId());
    return job;
  }

  private <I extends JobInput> void run(
      String jobId, JobAdapter<I> adapter, I input, ExecutionControl control) {
    JobType type = adapter.type();
    try {
      control.acquireSlot();
      control.start(STARTED_PROGRESS, "Running " + type.wireName());
      log.info("Job {} ({}) started", jobId, type.wireName());
      control.checkpoint();

      Path workspace = artifacts.workspaceFor(jobId);
      JobContext ctx = new JobContext(jobId, type, workspace, control);
      AdapterResult outcome =
          adapter.run(
              ctx, input, (total, current, message) -> progress(jobId, total, current, message));
      if (outcome == null) {
        throw new StateException("Adapter for " + type.wireName() + " returned no result");
      }

      control.complete(() -> registry.update(jobId, JobUpdate.completed(publish(jobId, outcome))));
      log.info("Job {} ({}) completed", jobId, type.wireName());
    } catch (JobCancelledException e) {
      if (control.isCancelled()) {
        log.info("Job {} was deleted while running; outcome discarded", jobId);
      } else {
        log.warn("Job {} ({}) interrupted while waiting", jobId, type.wireName());
        recordFailure(jobId, control, "Job was interrupted");
      }
    } catch (GenoPipeException e) {
      log.warn("Job {} ({}) failed: {}", jobId, type.wireName(), e.getMessage());
      recordFailure(jobId, control, e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Job {} ({}) interrupted", jobId, type.wireName());
      recordFailure(jobId, control, "Job was interrupted");
    } catch (Exception e) {
      log.error(
          "Job {} ({}) failed unexpectedly: {}",
          jobId,
          type.wireName(),
          ExceptionUtil.formatCompactStackTrace(e),
          e);
      recordFailure(
          jobId,
          control,
          "Unexpected error while running %s: %s"
              .formatted(type.wireName(), ExceptionUtil.extractErrorMessage(e)));
    } finally {
      control.releaseSlot();
      controls.remove(jobId, control);
      artifacts.releaseWorkspace(jobId);
      ensureTerminal(jobId, control);
    }
  }

  private JobResult publish(String jobId, AdapterResult outcome) {
    for (Map.Entry<String, List<Path>> e : outcome.temporaries().entrySet()) {
      for (Path file : e.getValue()) {
        artifacts.publishTemporary(e.getKey(), file, file.getFileName().toString());
      }
    }
    if (outcome.hasGenomes()) {
      return GenomeFetchResult.of(outcome.genomes());
    }
    List<ArtifactRef> refs = artifacts.register(jobId, outcome.artifacts());
    return new AnalysisResult(outcome.message(), refs);
  }

  private void recordFailure(String jobId, ExecutionControl control, String error) {
    String message = error == null || error.isBlank() ? "Job failed" : error;
    try {
      control.fail(() -> registry.update(jobId, JobUpdate.failed(message)));
    } catch (JobCancelledException | NotFoundException e) {
      log.debug("Job {} deleted before its failure was recorded", jobId);
    } catch (InvalidTransitionException e) {
      log.warn("Could not record failure of job {}: {}", jobId, e.getMessage());
    }
  }

  /** Last line of defense: a worker that exits must not leave its job non-terminal. */
  private void ensureTerminal(String jobId, ExecutionControl control) {
    if (control.isCancelled()) return;
    registry
        .get(jobId)
        .filter(job -> !job.isTerminal())
        .ifPresent(
            job -> {
              log.error("Job {} left {} by its worker; marking failed", jobId, job.status());
              try {
                registry.update(jobId, JobUpdate.failed("Job ended without a result"));
              } catch (NotFoundException | InvalidTransitionException e) {
                log.debug("Job {} changed concurrently: {}", jobId, e.getMessage());
              }
            });
  }

  private void progress(String jobId, long total, long current, String message) {
    int percent = STARTED_PROGRESS;
    if (total > 0 && current >= 0) {
      double fraction = Math.min(1.0, (double) current / total);
      percent = STARTED_PROGRESS + (int) (fraction * (FINISHING_PROGRESS - STARTED_PROGRESS));
    }
    String text =
        total > 0 && current >= 0 ? "[%d / %d] %s".formatted(current, total, message) : message;
    log.debug("Job {} progress {}%: {}", jobId, percent, text);
    try {
      registry.update(jobId, JobUpdate.progress(percent, text));
    } catch (NotFoundException | InvalidTransitionException e) {
      log.debug("Progress of job {} not recorded: {}", jobId, e.getMessage());
    }
  }

  public Job status(String jobId) {
    return registry.require(jobId);
  }

  /** All jobs, newest first. */
  public List<Job> list() {
    return registry.list().stream()
        .sorted(Comparator.comparing(Job::createdAt).reversed())
        .toList();
  }

  /**
   * Requests a {@code running -> paused} transition. See {@link ExecutionControl} for when it
   * takes effect.
   *
   * @throws NotFoundException if the job does not exist
   * @throws InvalidTransitionException if the job is terminal or already paused
   */
  public Job stop(String jobId) {
    return controlFor(jobId).requestStop();
  }

  /**
   * Resumes a paused job.
   *
   * @throws InvalidTransitionException if the job is not paused
   */
  public Job resume(String jobId) {
    return controlFor(jobId).resume();
  }

  private ExecutionControl controlFor(String jobId) {
    Job job = registry.require(jobId);
    ExecutionControl control = controls.get(jobId);
    if (control == null || job.isTerminal()) {
      throw new InvalidTransitionException(
          "Job %s is %s and cannot be stopped or resumed"
              .formatted(jobId, job.status().wireName()));
    }
    return control;
  }

  /**
   * Deletes the job and its artifacts. A running adapter is told to stop at its next checkpoint;
   * whatever it produces afterwards is discarded.
   *
   * @throws NotFoundException if the job does not exist
   */
  public void delete(String jobId) {
    ExecutionControl control = controls.get(jobId);
    if (control != null) {
      control.cancel();
    }
    registry.delete(jobId);
    artifacts.deleteForJob(jobId);
    log.info("Job {} deleted", jobId);
  }

  /**
   * Deletes terminal jobs created before {@code now - retention}.
   *
   * @return number of jobs removed
   */
  public int purgeOlderThan(Duration retention) {
    Instant cutoff = clock.instant().minus(retention);
    int removed = 0;
    for (Job job : registry.list()) {
      if (!job.isTerminal() || !job.createdAt().isBefore(cutoff)) continue;
      try {
        delete(job.jobId());
        removed++;
      } catch (NotFoundException e) {
        log.debug("Job {} already deleted", job.jobId());
      }
    }
    if (removed > 0) {
      log.info("Purged {} job(s) created before {}", removed, cutoff);
    }
    return removed;
  }

  /** Interrupts running workers; their jobs are recorded as failed. */
  @Override
  public void close() {
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Job workers did not stop within 5 seconds");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
