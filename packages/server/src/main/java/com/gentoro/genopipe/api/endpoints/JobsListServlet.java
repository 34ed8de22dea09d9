package com.gentoro.genopipe.api.endpoints;

import com.gentoro.genopipe.jobs.JobManager;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;

/** GET /api/jobs: every job, newest first. */
public final class JobsListServlet extends ApiServlet {
  private final JobManager jobs;

  public JobsListServlet(JobManager jobs) {
    this.jobs = jobs;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    writeJson(resp, 200, Map.of("jobs", jobs.list()));
  }
}
