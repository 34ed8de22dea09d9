package com.gentoro.genopipe.exception;

/** An external tool ran and reported an error. */
public class AdapterException extends GenoPipeException {
  public AdapterException(String message) {
    super(GenoPipeErrorCode.ADAPTER_FAILURE, message);
  }

  public AdapterException(String message, Throwable cause) {
    super(GenoPipeErrorCode.ADAPTER_FAILURE, message, cause);
  }
}
