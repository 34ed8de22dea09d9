package com.gentoro.genopipe.api.endpoints;

import com.gentoro.genopipe.artifacts.ArtifactManager;
import com.gentoro.genopipe.exception.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;

/** GET /api/download-temp-fasta-zip/{temp_dir}/{filename} */
public final class TemporaryDownloadServlet extends ApiServlet {
  private final ArtifactManager artifacts;

  public TemporaryDownloadServlet(ArtifactManager artifacts) {
    this.artifacts = artifacts;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    List<String> segments = pathSegments(req);
    if (segments.size() != 2) {
      throw new ValidationException("Expected /download-temp-fasta-zip/{temp_dir}/{filename}");
    }
    String dir = segments.get(0);
    String filename = segments.get(1);
    if (!dir.startsWith(ArtifactManager.TEMP_FASTA_PREFIX) || dir.contains("..")) {
      throw new ValidationException("Invalid directory name");
    }
    if (!filename.endsWith(".zip") || filename.contains("..")) {
      throw new ValidationException("Invalid filename");
    }
    writeAttachment(resp, artifacts.openTemporary(dir, filename));
  }
}
