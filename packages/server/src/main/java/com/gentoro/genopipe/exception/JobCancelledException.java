package com.gentoro.genopipe.exception;

/**
 * Raised inside a running job when its record was deleted. Never surfaces at the API boundary;
 * the executor drops the job's outcome when it sees it.
 */
public class JobCancelledException extends GenoPipeException {
  public JobCancelledException(String jobId) {
    super(GenoPipeErrorCode.JOB_CANCELLED, "Job " + jobId + " was cancelled");
  }
}
