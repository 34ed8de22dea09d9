package com.gentoro.genopipe.exception;

/** A job status change that the transition graph does not allow. */
public class InvalidTransitionException extends GenoPipeException {
  public InvalidTransitionException(String message) {
    super(GenoPipeErrorCode.INVALID_TRANSITION, message);
  }

  public InvalidTransitionException(String message, Throwable cause) {
    super(GenoPipeErrorCode.INVALID_TRANSITION, message, cause);
  }
}
