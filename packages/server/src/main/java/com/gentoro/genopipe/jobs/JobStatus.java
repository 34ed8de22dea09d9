package com.gentoro.genopipe.jobs;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.genopipe.exception.ValidationException;

/**
 * Job lifecycle. {@code PENDING} is the single entry state; {@code COMPLETED} and {@code FAILED}
 * are absorbing.
 *
 * <pre>
 *   PENDING -> RUNNING -> COMPLETED
 *      |         |  ^
 *      |         v  |
 *      |       PAUSED
 *      v         |
 *    FAILED  <---+  (from PENDING, RUNNING or PAUSED)
 * </pre>
 */
public enum JobStatus {
  /** Accepted, not yet picked up by a worker. */
  PENDING("pending"),
  /** A worker is executing the adapter. */
  RUNNING("running"),
  /** Stopped at a cooperative checkpoint, waiting for resume. */
  PAUSED("paused"),
  /** Finished successfully; result is set. */
  COMPLETED("completed"),
  /** Finished with an error; error is set. */
  FAILED("failed");

  private final String wireName;

  JobStatus(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  public boolean canTransitionTo(JobStatus next) {
    return switch (this) {
      case PENDING -> next == RUNNING || next == FAILED;
      case RUNNING -> next == PAUSED || next == COMPLETED || next == FAILED;
      case PAUSED -> next == RUNNING || next == FAILED;
      case COMPLETED, FAILED -> false;
    };
  }

  @JsonCreator
  public static JobStatus fromWireName(String value) {
    for (JobStatus status : values()) {
      if (status.wireName.equalsIgnoreCase(value)) return status;
    }
    throw new ValidationException("Unknown job status: " + value);
  }
}
