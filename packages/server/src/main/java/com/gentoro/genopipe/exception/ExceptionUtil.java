package com.gentoro.genopipe.exception;

import java.time.Instant;
import java.util.Map;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or API responses. The
   * message is the one {@link #extractErrorMessage} produces. If the throwable is a {@link
   * GenoPipeException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof GenoPipeException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          extractErrorMessage(ex),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        extractErrorMessage(t),
        GenoPipeErrorCode.UNKNOWN,
        Map.of(),
        Instant.now());
  }

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, top frames first.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main
   * (App.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  /** Convenience overload using a default of 10 frames. */
  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /**
   * Extract a user-facing message from a throwable, without stack trace information.
   *
   * <p>Messages of {@link GenoPipeException}s are returned verbatim, since they are written for
   * users. For anything else the innermost non-blank message in the cause chain is used, prefixed
   * with the exception type so that an unstructured fault stays recognisable.
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    if (t instanceof GenoPipeException && !isBlank(t.getMessage())) {
      return t.getMessage().trim();
    }

    Throwable candidate = t;
    Throwable current = t;
    while (current != null) {
      if (!isBlank(current.getMessage())) {
        candidate = current;
      }
      if (current.getCause() == current) break;
      current = current.getCause();
    }

    String className = candidate.getClass().getSimpleName();
    String message = candidate.getMessage();
    if (isBlank(message)) {
      return className;
    }
    // Messages that embed a stack trace are not useful to users.
    if (message.contains(" > ") || message.contains(".java:")) {
      return className;
    }
    return className + ": " + message.trim();
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }

  public static GenoPipeException rethrowIfUnchecked(
      Throwable t, Function<Throwable, GenoPipeException> supplier) {
    if (t instanceof GenoPipeException) {
      return (GenoPipeException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
