package com.gentoro.genopipe.exception;

/** File system failures while handling artifacts. */
public class IoException extends GenoPipeException {
  public IoException(String message) {
    super(GenoPipeErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(GenoPipeErrorCode.IO_ERROR, message, cause);
  }
}
