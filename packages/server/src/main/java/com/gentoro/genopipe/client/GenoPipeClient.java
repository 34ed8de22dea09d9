package com.gentoro.genopipe.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.genopipe.artifacts.FileKind;
import com.gentoro.genopipe.exception.AdapterException;
import com.gentoro.genopipe.exception.GenoPipeErrorCode;
import com.gentoro.genopipe.exception.GenoPipeException;
import com.gentoro.genopipe.exception.InvalidTransitionException;
import com.gentoro.genopipe.exception.NotFoundException;
import com.gentoro.genopipe.exception.NotReadyException;
import com.gentoro.genopipe.exception.StateException;
import com.gentoro.genopipe.exception.UpstreamUnavailableException;
import com.gentoro.genopipe.exception.ValidationException;
import com.gentoro.genopipe.genome.GenomeRecord;
import com.gentoro.genopipe.jobs.Job;
import com.gentoro.genopipe.jobs.JobType;
import com.gentoro.genopipe.logging.LoggingService;
import com.gentoro.genopipe.utility.JacksonUtility;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;

/**
 * Java client of the REST API. Error responses are turned back into the matching {@link
 * GenoPipeException} subclass, so callers handle the same failure kinds as the server.
 */
public class GenoPipeClient {
  private static final Logger log = LoggingService.getLogger(GenoPipeClient.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient http;
  private final HttpUrl baseUrl;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  /** Submission acknowledgement. */
  public record Submission(String jobId, String status, String message) {}

  /** Downloaded file. */
  public record Download(String filename, byte[] content) {}

  /** {@code baseUrl} includes the context path, e.g. {@code http://localhost:8080/api}. */
  public GenoPipeClient(OkHttpClient http, String baseUrl) {
    this.http = http;
    this.baseUrl = HttpUrl.get(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/");
  }

  public Submission fetchGenomes(String bioprojectId) {
    return submission(post("fetch-genomes", Map.of("bioproject_id", bioprojectId)));
  }

  /** Submits an analysis job over {@code genomes}. */
  public Submission runAnalysis(JobType type, List<GenomeRecord> genomes) {
    String path =
        switch (type) {
          case RESFINDER -> "run-resfinder";
          case PHASTEST -> "run-phastest";
          case VFDB -> "run-vfdb";
          default -> throw new ValidationException("Not an analysis job type: " + type.wireName());
        };
    return submission(post(path, Map.of("genome_urls", genomes)));
  }

  public Job status(String jobId) {
    return treeToValue(get(url("job-status", jobId)), Job.class);
  }

  public List<Job> list() {
    JsonNode root = get(url("jobs"));
    List<Job> jobs = new ArrayList<>();
    for (JsonNode node : root.path("jobs")) {
      jobs.add(treeToValue(node, Job.class));
    }
    return jobs;
  }

  public Job stop(String jobId) {
    return treeToValue(post(url("jobs", jobId, "stop"), Map.of()), Job.class);
  }

  public Job resume(String jobId) {
    return treeToValue(post(url("jobs", jobId, "resume"), Map.of()), Job.class);
  }

  public void delete(String jobId) {
    execute(new Request.Builder().url(url("cleanup", jobId)).delete().build());
  }

  /** True when PHASTEST reports itself available. Network errors read as unavailable. */
  public boolean isPhastestAvailable() {
    Request request = new Request.Builder().url(url("phastest-status")).get().build();
    try (Response response = http.newCall(request).execute()) {
      ResponseBody body = response.body();
      if (body == null) return false;
      return "available".equals(mapper.readTree(body.byteStream()).path("status").asText());
    } catch (IOException e) {
      log.debug("PHASTEST status check failed: {}", e.toString());
      return false;
    }
  }

  public Download download(String jobId, FileKind kind) {
    return downloadFrom(url("download", jobId, kind.wireName()));
  }

  /** PHASTEST fallback bundle of earlier ResFinder inputs. */
  public Download downloadResfinderFastaZip() {
    return downloadFrom(url("download-resfinder-fasta-zip"));
  }

  /** Sweeps expired temporary files; returns the number removed. */
  public int cleanupFiles() {
    return post(url("cleanup-files"), Map.of()).path("removed").asInt();
  }

  private Download downloadFrom(HttpUrl url) {
    Request request = new Request.Builder().url(url).get().build();
    try (Response response = http.newCall(request).execute()) {
      ResponseBody body = response.body();
      byte[] bytes = body == null ? new byte[0] : body.bytes();
      if (!response.isSuccessful()) {
        throw toException(response.code(), bytes);
      }
      return new Download(filename(response.header("Content-Disposition")), bytes);
    } catch (IOException e) {
      throw new UpstreamUnavailableException("Could not reach GenoPipe at " + url, e);
    }
  }

  private static String filename(String disposition) {
    if (disposition == null) return null;
    int idx = disposition.indexOf("filename=");
    if (idx < 0) return null;
    return disposition.substring(idx + "filename=".length()).replace("\"", "").trim();
  }

  private Submission submission(JsonNode node) {
    return new Submission(
        node.path("job_id").asText(null),
        node.path("status").asText(null),
        node.path("message").asText(null));
  }

  private HttpUrl url(String... segments) {
    HttpUrl.Builder builder = baseUrl.newBuilder();
    for (String segment : segments) builder.addPathSegment(segment);
    return builder.build();
  }

  private JsonNode post(String path, Object body) {
    return post(url(path), body);
  }

  private JsonNode post(HttpUrl url, Object body) {
    byte[] payload;
    try {
      payload = mapper.writeValueAsBytes(body);
    } catch (IOException e) {
      throw new StateException("Cannot serialize request body", e);
    }
    return execute(new Request.Builder().url(url).post(RequestBody.create(payload, JSON)).build());
  }

  private JsonNode get(HttpUrl url) {
    return execute(new Request.Builder().url(url).get().build());
  }

  private JsonNode execute(Request request) {
    try (Response response = http.newCall(request).execute()) {
      ResponseBody body = response.body();
      byte[] bytes = body == null ? new byte[0] : body.bytes();
      if (!response.isSuccessful()) {
        throw toException(response.code(), bytes);
      }
      return bytes.length == 0 ? mapper.createObjectNode() : mapper.readTree(bytes);
    } catch (IOException e) {
      throw new UpstreamUnavailableException(
          "Could not reach GenoPipe at " + request.url() + ": " + e.getMessage(), e);
    }
  }

  GenoPipeException toException(int status, byte[] body) {
    String message = "HTTP " + status;
    GenoPipeErrorCode code = null;
    try {
      JsonNode node = body.length == 0 ? null : mapper.readTree(body);
      if (node != null && node.hasNonNull("error")) message = node.get("error").asText();
      if (node != null && node.hasNonNull("code")) code = parseCode(node.get("code").asText());
    } catch (IOException e) {
      log.debug("Error body is not JSON: {}", e.toString());
    }
    if (code == null) {
      code =
          switch (status) {
            case 400 -> GenoPipeErrorCode.VALIDATION_ERROR;
            case 404 -> GenoPipeErrorCode.NOT_FOUND;
            case 409 -> GenoPipeErrorCode.NOT_READY;
            case 503 -> GenoPipeErrorCode.UPSTREAM_UNAVAILABLE;
            case 502 -> GenoPipeErrorCode.ADAPTER_FAILURE;
            default -> GenoPipeErrorCode.UNKNOWN;
          };
    }
    return switch (code) {
      case VALIDATION_ERROR -> new ValidationException(message);
      case NOT_FOUND -> new NotFoundException(message);
      case NOT_READY -> new NotReadyException(message);
      case INVALID_TRANSITION -> new InvalidTransitionException(message);
      case UPSTREAM_UNAVAILABLE -> new UpstreamUnavailableException(message);
      case ADAPTER_FAILURE -> new AdapterException(message);
      default -> new GenoPipeException(code, message);
    };
  }

  private static GenoPipeErrorCode parseCode(String value) {
    try {
      return GenoPipeErrorCode.valueOf(value);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private <T> T treeToValue(JsonNode node, Class<T> type) {
    try {
      return mapper.treeToValue(node, type);
    } catch (IOException e) {
      throw new StateException("Unexpected response shape for " + type.getSimpleName(), e);
    }
  }
}
