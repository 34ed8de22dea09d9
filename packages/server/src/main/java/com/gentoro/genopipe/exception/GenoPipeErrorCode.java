package com.gentoro.genopipe.exception;

/** Error codes shared by every {@link GenoPipeException} and rendered on the wire. */
public enum GenoPipeErrorCode {
  VALIDATION_ERROR(400),
  NOT_FOUND(404),
  NOT_READY(409),
  INVALID_TRANSITION(409),
  UPSTREAM_UNAVAILABLE(503),
  ADAPTER_FAILURE(502),
  JOB_CANCELLED(410),
  CONFIG_ERROR(500),
  IO_ERROR(500),
  STATE_ERROR(500),
  UNKNOWN(500);

  private final int httpStatus;

  GenoPipeErrorCode(int httpStatus) {
    this.httpStatus = httpStatus;
  }

  /** HTTP status used when this error reaches the API boundary. */
  public int httpStatus() {
    return httpStatus;
  }
}
