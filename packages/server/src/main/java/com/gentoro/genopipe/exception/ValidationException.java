package com.gentoro.genopipe.exception;

/** Rejected input: malformed or empty submissions, unknown file types. */
public class ValidationException extends GenoPipeException {
  public ValidationException(String message) {
    super(GenoPipeErrorCode.VALIDATION_ERROR, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(GenoPipeErrorCode.VALIDATION_ERROR, message, cause);
  }
}
