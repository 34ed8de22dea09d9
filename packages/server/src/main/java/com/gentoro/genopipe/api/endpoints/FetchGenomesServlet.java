package com.gentoro.genopipe.api.endpoints;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.genopipe.jobs.BioProjectInput;
import com.gentoro.genopipe.jobs.Job;
import com.gentoro.genopipe.jobs.JobManager;
import com.gentoro.genopipe.jobs.JobType;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** POST /api/fetch-genomes {@code {"bioproject_id": "PRJNA123456"}} */
public final class FetchGenomesServlet extends ApiServlet {
  private final JobManager jobs;

  public FetchGenomesServlet(JobManager jobs) {
    this.jobs = jobs;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    JsonNode body = readJson(req);
    JsonNode id = body.path("bioproject_id");
    Job job =
        jobs.submit(
            JobType.FETCH_GENOMES, new BioProjectInput(id.isTextual() ? id.asText() : null));
    writeJson(resp, 200, SubmissionResponse.of(job, "Genome fetching started"));
  }
}
