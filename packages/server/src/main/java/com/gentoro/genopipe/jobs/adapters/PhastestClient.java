package com.gentoro.genopipe.jobs.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.genopipe.exception.AdapterException;
import com.gentoro.genopipe.exception.UpstreamUnavailableException;
import com.gentoro.genopipe.logging.LoggingService;
import com.gentoro.genopipe.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;

/**
 * Client of the PHASTEST web API: raw FASTA submission, polling by accession and download of the
 * result archive.
 */
public class PhastestClient {
  private static final Logger log = LoggingService.getLogger(PhastestClient.class);
  private static final MediaType FASTA = MediaType.get("text/plain; charset=utf-8");

  static final String DEFAULT_API_URL = "https://phastest.ca/phastest_api";

  private final OkHttpClient http;
  private final OkHttpClient probeHttp;
  private final HttpUrl apiUrl;

  /** Outcome of an availability probe. {@code statusCode} is null when nothing answered. */
  public record Availability(boolean available, Integer statusCode, String error) {}

  /** State of a submission. {@code zipUrl} is set once the submission is complete. */
  public record SubmissionStatus(String status, String zipUrl) {
    public boolean isComplete() {
      return zipUrl != null && status != null && status.toLowerCase().startsWith("complete");
    }
  }

  public PhastestClient(OkHttpClient http, String apiUrl, Duration probeTimeout) {
    this.http = http;
    this.probeHttp =
        http.newBuilder().callTimeout(probeTimeout).readTimeout(probeTimeout).build();
    this.apiUrl = HttpUrl.get(apiUrl);
  }

  public String apiUrl() {
    return apiUrl.toString();
  }

  /** Checks whether the API answers with HTTP 200. Never throws. */
  public Availability probe() {
    Request request = new Request.Builder().url(apiUrl).get().build();
    try (Response response = probeHttp.newCall(request).execute()) {
      return new Availability(response.code() == 200, response.code(), null);
    } catch (IOException e) {
      log.debug("PHASTEST probe failed: {}", e.toString());
      return new Availability(false, null, e.getMessage() == null ? e.toString() : e.getMessage());
    }
  }

  /**
   * Submits a FASTA file.
   *
   * @return the PHASTEST submission id
   */
  public String submit(Path fasta) {
    RequestBody body;
    try {
      body = RequestBody.create(Files.readAllBytes(fasta), FASTA);
    } catch (IOException e) {
      throw new AdapterException("Cannot read " + fasta.getFileName() + " for PHASTEST", e);
    }
    JsonNode data = call(new Request.Builder().url(apiUrl).post(body).build());
    String id = data.path("job_id").asText("");
    if (id.isBlank()) {
      throw new AdapterException(
          "PHASTEST rejected %s: %s"
              .formatted(fasta.getFileName(), data.path("error").asText("no job id returned")));
    }
    return id;
  }

  public SubmissionStatus poll(String submissionId) {
    HttpUrl url = apiUrl.newBuilder().addQueryParameter("acc", submissionId).build();
    JsonNode data = call(new Request.Builder().url(url).get().build());
    if (data.hasNonNull("status")) {
      String zip = data.hasNonNull("zip") ? data.get("zip").asText() : null;
      return new SubmissionStatus(data.get("status").asText(), zip);
    }
    if (data.hasNonNull("error")) {
      throw new AdapterException(
          "PHASTEST reported an error for %s: %s"
              .formatted(submissionId, data.get("error").asText()));
    }
    throw new AdapterException("Unexpected PHASTEST response for " + submissionId);
  }

  public Path downloadZip(String zipUrl, Path target) {
    String absolute = zipUrl.startsWith("http") ? zipUrl : "https://" + zipUrl;
    HttpUrl url = HttpUrl.parse(absolute);
    if (url == null) {
      throw new AdapterException("Invalid PHASTEST result URL: " + zipUrl);
    }
    Request request = new Request.Builder().url(url).get().build();
    try (Response response = http.newCall(request).execute()) {
      ResponseBody body = response.body();
      if (!response.isSuccessful() || body == null) {
        throw new AdapterException(
            "Downloading PHASTEST results failed with HTTP " + response.code());
      }
      Files.createDirectories(target.getParent());
      try (InputStream in = body.byteStream()) {
        Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
      }
      return target;
    } catch (IOException e) {
      throw new UpstreamUnavailableException("Could not download PHASTEST results: " + e, e);
    }
  }

  private JsonNode call(Request request) {
    try (Response response = http.newCall(request).execute()) {
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      if (response.code() >= 500) {
        throw new UpstreamUnavailableException("PHASTEST answered HTTP " + response.code())
            .with("status", response.code());
      }
      try {
        return JacksonUtility.getJsonMapper().readTree(text);
      } catch (IOException e) {
        throw new AdapterException(
            "Non-JSON response from PHASTEST (HTTP %d)".formatted(response.code()), e);
      }
    } catch (IOException e) {
      throw new UpstreamUnavailableException("Could not reach PHASTEST: " + e.getMessage(), e);
    }
  }
}
