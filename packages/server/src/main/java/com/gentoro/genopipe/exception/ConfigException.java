package com.gentoro.genopipe.exception;

/** Missing or invalid configuration. */
public class ConfigException extends GenoPipeException {
  public ConfigException(String message) {
    super(GenoPipeErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(GenoPipeErrorCode.CONFIG_ERROR, message, cause);
  }
}
