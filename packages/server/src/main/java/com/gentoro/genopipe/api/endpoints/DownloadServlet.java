package com.gentoro.genopipe.api.endpoints;

import com.gentoro.genopipe.artifacts.ArtifactManager;
import com.gentoro.genopipe.artifacts.FileKind;
import com.gentoro.genopipe.exception.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;

/**
 * GET /api/download/{job_id}/{file_type}
 *
 * <p>404 for an unknown job, 409 while the job is not completed or when it did not produce the
 * requested kind.
 */
public final class DownloadServlet extends ApiServlet {
  private final ArtifactManager artifacts;

  public DownloadServlet(ArtifactManager artifacts) {
    this.artifacts = artifacts;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    List<String> segments = pathSegments(req);
    if (segments.size() != 2) {
      throw new ValidationException("Expected /download/{job_id}/{file_type}");
    }
    FileKind kind = FileKind.fromWireName(segments.get(1));
    writeAttachment(resp, artifacts.open(segments.get(0), kind));
  }
}
