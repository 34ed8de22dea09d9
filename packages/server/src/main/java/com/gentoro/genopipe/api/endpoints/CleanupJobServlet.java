package com.gentoro.genopipe.api.endpoints;

import com.gentoro.genopipe.exception.ValidationException;
import com.gentoro.genopipe.jobs.JobManager;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** DELETE /api/cleanup/{job_id}: deletes the job and its artifacts. */
public final class CleanupJobServlet extends ApiServlet {
  private final JobManager jobs;

  public CleanupJobServlet(JobManager jobs) {
    this.jobs = jobs;
  }

  @Override
  protected void doDelete(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    List<String> segments = pathSegments(req);
    if (segments.size() != 1) {
      throw new ValidationException("Missing job id");
    }
    jobs.delete(segments.get(0));
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("message", "Job cleaned up successfully");
    body.put("status", "ok");
    writeJson(resp, 200, body);
  }
}
