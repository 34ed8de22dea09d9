package com.gentoro.genopipe.api.endpoints;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.genopipe.artifacts.ArtifactStream;
import com.gentoro.genopipe.exception.ErrorDetails;
import com.gentoro.genopipe.exception.ExceptionUtil;
import com.gentoro.genopipe.exception.GenoPipeErrorCode;
import com.gentoro.genopipe.exception.GenoPipeException;
import com.gentoro.genopipe.exception.ValidationException;
import com.gentoro.genopipe.genome.GenomeRecord;
import com.gentoro.genopipe.logging.LoggingService;
import com.gentoro.genopipe.utility.JacksonUtility;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;

/**
 * Base of the REST endpoints. Renders JSON bodies and maps every {@link GenoPipeException} to its
 * HTTP status with a {@code {"error", "code"}} body, plus a {@code context} object when the
 * exception carries one; anything else becomes a 500.
 */
public abstract class ApiServlet extends HttpServlet {
  private static final Logger log = LoggingService.getLogger(ApiServlet.class);

  protected final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  @Override
  protected void service(HttpServletRequest req, HttpServletResponse resp)
      throws ServletException, IOException {
    try {
      super.service(req, resp);
    } catch (GenoPipeException e) {
      if (e.getCode().httpStatus() >= 500) {
        log.warn("{} {} failed: {}", req.getMethod(), req.getRequestURI(), e.getMessage(), e);
      } else {
        log.debug("{} {} rejected: {}", req.getMethod(), req.getRequestURI(), e.getMessage());
      }
      writeError(resp, ExceptionUtil.toErrorDetails(e));
    } catch (RuntimeException e) {
      log.error("{} {} failed", req.getMethod(), req.getRequestURI(), e);
      writeError(resp, ExceptionUtil.toErrorDetails(e));
    }
  }

  protected void writeJson(HttpServletResponse resp, int status, Object body) throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    mapper.writeValue(resp.getOutputStream(), body);
  }

  protected void writeError(HttpServletResponse resp, ErrorDetails details) throws IOException {
    if (resp.isCommitted()) {
      log.debug("Response already committed; dropping {}: {}", details.type(), details.message());
      return;
    }
    resp.reset();
    GenoPipeErrorCode code = details.code();
    ObjectNode node = mapper.createObjectNode();
    node.put("error", details.message().isBlank() ? code.name() : details.message());
    node.put("code", code.name());
    if (!details.context().isEmpty()) {
      node.set("context", mapper.valueToTree(details.context()));
    }
    writeJson(resp, code.httpStatus(), node);
  }

  /** Streams an artifact as an attachment and closes it. */
  protected void writeAttachment(HttpServletResponse resp, ArtifactStream artifact)
      throws IOException {
    try (artifact) {
      resp.setStatus(200);
      resp.setContentType(artifact.contentType());
      resp.setContentLengthLong(artifact.size());
      resp.setHeader(
          "Content-Disposition", "attachment; filename=\"%s\"".formatted(artifact.filename()));
      artifact.stream().transferTo(resp.getOutputStream());
    }
  }

  /** Request body as a JSON object; an empty body reads as an empty object. */
  protected JsonNode readJson(HttpServletRequest req) throws IOException {
    try (InputStream in = req.getInputStream()) {
      byte[] bytes = in.readAllBytes();
      if (bytes.length == 0) {
        return mapper.createObjectNode();
      }
      JsonNode node = mapper.readTree(bytes);
      if (node == null || !node.isObject()) {
        throw new ValidationException("Request body must be a JSON object");
      }
      return node;
    } catch (JsonProcessingException e) {
      throw new ValidationException("Malformed JSON body: " + e.getOriginalMessage(), e);
    }
  }

  /**
   * Reads {@code genome_urls}: a list of genome record objects or of plain URL strings. A missing
   * field reads as an empty list.
   */
  protected List<GenomeRecord> readGenomes(JsonNode body) {
    JsonNode list = body.path("genome_urls");
    List<GenomeRecord> genomes = new ArrayList<>();
    if (list.isMissingNode() || list.isNull()) {
      return genomes;
    }
    if (!list.isArray()) {
      throw new ValidationException("genome_urls must be a list");
    }
    for (JsonNode item : list) {
      if (item.isTextual()) {
        genomes.add(GenomeRecord.ofUrl(item.asText().trim()));
      } else if (item.isObject()) {
        try {
          genomes.add(mapper.treeToValue(item, GenomeRecord.class));
        } catch (JsonProcessingException e) {
          throw new ValidationException("Invalid genome record: " + e.getOriginalMessage(), e);
        }
      } else {
        throw new ValidationException("genome_urls entries must be URLs or genome records");
      }
    }
    return genomes;
  }

  /** Non-empty segments of the path info: {@code /a/b} gives {@code [a, b]}. */
  protected static List<String> pathSegments(HttpServletRequest req) {
    List<String> out = new ArrayList<>();
    String info = req.getPathInfo();
    if (info == null) return out;
    for (String part : info.split("/")) {
      if (!part.isEmpty()) out.add(part);
    }
    return out;
  }
}
