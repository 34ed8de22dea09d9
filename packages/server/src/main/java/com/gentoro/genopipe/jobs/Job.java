package com.gentoro.genopipe.jobs;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.genopipe.exception.InvalidTransitionException;
import java.time.Instant;

/**
 * Immutable snapshot of a job. The registry replaces snapshots atomically, so a reader always sees
 * a consistent record.
 *
 * <p>Invariants enforced by {@link #apply(JobUpdate, Instant)}:
 *
 * <ul>
 *   <li>status moves only along {@link JobStatus#canTransitionTo(JobStatus)}, never out of a
 *       terminal state;
 *   <li>progress never decreases, and is 100 exactly when the job is completed;
 *   <li>{@code result} is set only with {@code COMPLETED}, {@code error} only with {@code FAILED};
 *   <li>{@code completedAt} is set once, on entry into a terminal state.
 * </ul>
 */
public record Job(
    @JsonProperty("job_id") String jobId,
    @JsonProperty("job_type") JobType jobType,
    @JsonProperty("status") JobStatus status,
    @JsonProperty("progress") int progress,
    @JsonProperty("message") String message,
    @JsonProperty("result") JobResult result,
    @JsonProperty("error") String error,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("completed_at") Instant completedAt) {

  static final int MAX_RUNNING_PROGRESS = 99;

  static Job pending(String jobId, JobType type, Instant now) {
    return new Job(jobId, type, JobStatus.PENDING, 0, "Queued", null, null, now, null);
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }

  /** Returns the snapshot that results from applying {@code update} at time {@code now}. */
  Job apply(JobUpdate update, Instant now) {
    if (isTerminal()) {
      throw new InvalidTransitionException(
          "Job %s is already %s and cannot change".formatted(jobId, status.wireName()));
    }

    JobStatus next = update.status() == null ? status : update.status();
    if (next != status && !status.canTransitionTo(next)) {
      throw new InvalidTransitionException(
          "Job %s cannot move from %s to %s"
              .formatted(jobId, status.wireName(), next.wireName()));
    }
    if (next == JobStatus.COMPLETED && update.result() == null) {
      throw new InvalidTransitionException("Job " + jobId + " cannot complete without a result");
    }
    if (next == JobStatus.FAILED && (update.error() == null || update.error().isBlank())) {
      throw new InvalidTransitionException("Job " + jobId + " cannot fail without an error");
    }
    if (update.result() != null && next != JobStatus.COMPLETED) {
      throw new InvalidTransitionException("A result can only be set when completing " + jobId);
    }
    if (update.error() != null && next != JobStatus.FAILED) {
      throw new InvalidTransitionException("An error can only be set when failing " + jobId);
    }

    int nextProgress;
    if (next == JobStatus.COMPLETED) {
      nextProgress = 100;
    } else if (update.progress() == null) {
      nextProgress = progress;
    } else {
      nextProgress = Math.max(progress, Math.min(update.progress(), MAX_RUNNING_PROGRESS));
    }

    String nextMessage = update.message() == null ? message : update.message();
    if (next == JobStatus.FAILED && update.message() == null) {
      nextMessage = "Failed";
    } else if (next == JobStatus.COMPLETED && update.message() == null) {
      nextMessage = "Completed";
    }

    return new Job(
        jobId,
        jobType,
        next,
        nextProgress,
        nextMessage,
        update.result(),
        update.error(),
        createdAt,
        next.isTerminal() ? now : null);
  }
}
