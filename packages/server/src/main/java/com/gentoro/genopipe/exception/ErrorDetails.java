package com.gentoro.genopipe.exception;

import java.time.Instant;
import java.util.Map;

/** Structured view of a failure, suitable for logs and API responses. */
public record ErrorDetails(
    String type, String message, GenoPipeErrorCode code, Map<String, Object> context, Instant at) {}
