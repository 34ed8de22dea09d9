package com.gentoro.genopipe.exception;

/** A component was used in a state it does not support. */
public class StateException extends GenoPipeException {
  public StateException(String message) {
    super(GenoPipeErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(GenoPipeErrorCode.STATE_ERROR, message, cause);
  }
}
