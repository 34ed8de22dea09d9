package com.gentoro.genopipe.exception;

/** An artifact was requested before its job completed, or for a kind the job never produced. */
public class NotReadyException extends GenoPipeException {
  public NotReadyException(String message) {
    super(GenoPipeErrorCode.NOT_READY, message);
  }

  public NotReadyException(String message, Throwable cause) {
    super(GenoPipeErrorCode.NOT_READY, message, cause);
  }
}
