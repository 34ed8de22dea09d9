package com.gentoro.genopipe.http;

import java.time.Duration;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/** Builds the OkHttp clients used for outbound calls (NCBI, PHASTEST, genome downloads). */
public class OkHttpFactory {

  private OkHttpFactory() {}

  /**
   * Client with timeouts read from {@code <prefix>.connect-timeout-seconds} and {@code
   * <prefix>.read-timeout-seconds}.
   */
  public static OkHttpClient create(Configuration configuration, String prefix) {
    long connect = configuration.getLong(prefix + ".connect-timeout-seconds", 10);
    long read = configuration.getLong(prefix + ".read-timeout-seconds", 60);
    return create(Duration.ofSeconds(connect), Duration.ofSeconds(read));
  }

  public static OkHttpClient create(Duration connectTimeout, Duration readTimeout) {
    return new OkHttpClient.Builder()
        .connectTimeout(connectTimeout)
        .readTimeout(readTimeout)
        .followRedirects(true)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
