package com.gentoro.genopipe.exception;

/** An external dependency (NCBI, PHASTEST) could not be reached. */
public class UpstreamUnavailableException extends GenoPipeException {
  public UpstreamUnavailableException(String message) {
    super(GenoPipeErrorCode.UPSTREAM_UNAVAILABLE, message);
  }

  public UpstreamUnavailableException(String message, Throwable cause) {
    super(GenoPipeErrorCode.UPSTREAM_UNAVAILABLE, message, cause);
  }
}
