package com.gentoro.genopipe.api.endpoints;

import com.gentoro.genopipe.exception.ValidationException;
import com.gentoro.genopipe.jobs.JobManager;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;

/** GET /api/job-status/{job_id}: the full job record. */
public final class JobStatusServlet extends ApiServlet {
  private final JobManager jobs;

  public JobStatusServlet(JobManager jobs) {
    this.jobs = jobs;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    List<String> segments = pathSegments(req);
    if (segments.size() != 1) {
      throw new ValidationException("Missing job id");
    }
    writeJson(resp, 200, jobs.status(segments.get(0)));
  }
}
