package com.gentoro.genopipe.http;

import com.gentoro.genopipe.logging.LoggingService;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/** Logs outbound calls. Bodies are never read, since genome downloads can be large. */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log = LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    long startTime = System.nanoTime();
    log.debug("➡️ {} {}", request.method(), request.url());

    Response response;
    try {
      response = chain.proceed(request);
    } catch (SocketTimeoutException e) {
      log.warn(
          "Request timed out: {} {} ({}ms)", request.method(), request.url(), elapsed(startTime));
      throw e;
    } catch (ConnectException e) {
      log.warn(
          "Connection error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsed(startTime),
          e.getMessage());
      throw e;
    } catch (IOException e) {
      log.warn(
          "IO error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsed(startTime),
          e.toString());
      throw e;
    }

    log.debug(
        "⬅️ {} {} answered {} in {} ms",
        request.method(),
        response.request().url(),
        response.code(),
        elapsed(startTime));
    return response;
  }

  private static long elapsed(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }
}
