package com.gentoro.genopipe.api.endpoints;

import com.gentoro.genopipe.cleanup.CleanupScheduler;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/** POST /api/cleanup-files: sweeps expired temporary artifacts now. */
public final class CleanupFilesServlet extends ApiServlet {
  private final CleanupScheduler cleanup;

  public CleanupFilesServlet(CleanupScheduler cleanup) {
    this.cleanup = cleanup;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    int removed = cleanup.sweepTemporary();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("message", "File cleanup completed successfully");
    body.put("status", "success");
    body.put("removed", removed);
    writeJson(resp, 200, body);
  }
}
