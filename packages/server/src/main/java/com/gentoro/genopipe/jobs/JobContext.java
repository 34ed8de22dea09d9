package com.gentoro.genopipe.jobs;

import java.nio.file.Path;
import java.time.Duration;

/** Context passed to a {@link JobAdapter}: identity, scratch space and cooperative control. */
public final class JobContext {
  private final String jobId;
  private final JobType jobType;
  private final Path workDirectory;
  private final Control control;

  /** Cooperative control points, implemented by the executor. */
  public interface Control {
    /**
     * Blocks while the job is paused.
     *
     * @throws com.gentoro.genopipe.exception.JobCancelledException if the job was deleted
     */
    void checkpoint();

    boolean isCancelled();

    /** Sleeps for {@code duration}, returning early with an exception if the job is deleted. */
    void sleep(Duration duration) throws InterruptedException;
  }

  public JobContext(String jobId, JobType jobType, Path workDirectory, Control control) {
    this.jobId = jobId;
    this.jobType = jobType;
    this.workDirectory = workDirectory;
    this.control = control;
  }

  public String jobId() {
    return jobId;
  }

  public JobType jobType() {
    return jobType;
  }

  /** Private scratch directory, removed when the job ends. */
  public Path workDirectory() {
    return workDirectory;
  }

  public void checkpoint() {
    control.checkpoint();
  }

  public boolean isCancelled() {
    return control.isCancelled() || Thread.currentThread().isInterrupted();
  }

  public void sleep(Duration duration) throws InterruptedException {
    control.sleep(duration);
  }
}
