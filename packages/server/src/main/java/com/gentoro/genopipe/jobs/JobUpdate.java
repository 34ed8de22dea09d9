package com.gentoro.genopipe.jobs;

/**
 * A partial change to a {@link Job}. Fields left {@code null} keep their current value. Instances
 * are immutable; the {@code with*} methods return copies.
 */
public final class JobUpdate {
  private final JobStatus status;
  private final Integer progress;
  private final String message;
  private final JobResult result;
  private final String error;

  private JobUpdate(
      JobStatus status, Integer progress, String message, JobResult result, String error) {
    this.status = status;
    this.progress = progress;
    this.message = message;
    this.result = result;
    this.error = error;
  }

  public static JobUpdate status(JobStatus status) {
    return new JobUpdate(status, null, null, null, null);
  }

  public static JobUpdate progress(int progress, String message) {
    return new JobUpdate(null, progress, message, null, null);
  }

  public static JobUpdate completed(JobResult result) {
    return new JobUpdate(JobStatus.COMPLETED, 100, null, result, null);
  }

  public static JobUpdate failed(String error) {
    return new JobUpdate(JobStatus.FAILED, null, null, null, error);
  }

  public JobUpdate withProgress(int value) {
    return new JobUpdate(status, value, message, result, error);
  }

  public JobUpdate withMessage(String value) {
    return new JobUpdate(status, progress, value, result, error);
  }

  public JobStatus status() {
    return status;
  }

  public Integer progress() {
    return progress;
  }

  public String message() {
    return message;
  }

  public JobResult result() {
    return result;
  }

  public String error() {
    return error;
  }

  @Override
  public String toString() {
    return "JobUpdate[status=%s, progress=%s, message=%s, result=%s, error=%s]"
        .formatted(status, progress, message, result != null, error);
  }
}
