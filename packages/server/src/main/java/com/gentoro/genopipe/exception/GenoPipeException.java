package com.gentoro.genopipe.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the unchecked exception hierarchy. Carries a {@link GenoPipeErrorCode} and an optional
 * context map with structured details (job id, file type, upstream URL...).
 */
public class GenoPipeException extends RuntimeException {
  private final GenoPipeErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public GenoPipeException(GenoPipeErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public GenoPipeException(GenoPipeErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public GenoPipeErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context entry and return {@code this} for chaining. */
  public GenoPipeException with(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
