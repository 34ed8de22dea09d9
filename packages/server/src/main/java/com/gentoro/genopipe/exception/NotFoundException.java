package com.gentoro.genopipe.exception;

/** Unknown job, artifact or temporary file. */
public class NotFoundException extends GenoPipeException {
  public NotFoundException(String message) {
    super(GenoPipeErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(GenoPipeErrorCode.NOT_FOUND, message, cause);
  }
}
