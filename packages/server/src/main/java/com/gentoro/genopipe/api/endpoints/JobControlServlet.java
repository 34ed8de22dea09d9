package com.gentoro.genopipe.api.endpoints;

import com.gentoro.genopipe.exception.NotFoundException;
import com.gentoro.genopipe.jobs.Job;
import com.gentoro.genopipe.jobs.JobManager;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;

/** POST /api/jobs/{job_id}/stop and POST /api/jobs/{job_id}/resume */
public final class JobControlServlet extends ApiServlet {
  private final JobManager jobs;

  public JobControlServlet(JobManager jobs) {
    this.jobs = jobs;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    List<String> segments = pathSegments(req);
    if (segments.size() != 2) {
      throw new NotFoundException("Unknown endpoint " + req.getRequestURI());
    }
    String jobId = segments.get(0);
    Job job =
        switch (segments.get(1)) {
          case "stop" -> jobs.stop(jobId);
          case "resume" -> jobs.resume(jobId);
          default -> throw new NotFoundException("Unknown job action: " + segments.get(1));
        };
    writeJson(resp, 200, job);
  }
}
