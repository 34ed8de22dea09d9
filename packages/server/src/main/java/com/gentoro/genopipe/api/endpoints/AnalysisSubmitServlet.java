package com.gentoro.genopipe.api.endpoints;

import com.gentoro.genopipe.jobs.GenomeSetInput;
import com.gentoro.genopipe.jobs.Job;
import com.gentoro.genopipe.jobs.JobManager;
import com.gentoro.genopipe.jobs.JobType;
import com.gentoro.genopipe.jobs.adapters.PhastestClient;
import com.gentoro.genopipe.logging.LoggingService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;

/**
 * POST /api/run-resfinder, /api/run-phastest and /api/run-vfdb with {@code {"genome_urls": [...]}}.
 *
 * <p>When an availability gate is given (PHASTEST), the upstream service is probed first. If it is
 * down no job is created and the caller is pointed at the FASTA bundle fallback.
 */
public final class AnalysisSubmitServlet extends ApiServlet {
  private static final Logger log = LoggingService.getLogger(AnalysisSubmitServlet.class);

  private final JobManager jobs;
  private final JobType type;
  private final PhastestClient gate;

  public AnalysisSubmitServlet(JobManager jobs, JobType type) {
    this(jobs, type, null);
  }

  public AnalysisSubmitServlet(JobManager jobs, JobType type, PhastestClient gate) {
    this.jobs = jobs;
    this.type = type;
    this.gate = gate;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    GenomeSetInput input = new GenomeSetInput(readGenomes(readJson(req)));

    if (gate != null) {
      PhastestClient.Availability availability = gate.probe();
      if (!availability.available()) {
        log.warn("PHASTEST unavailable ({}); {} job not submitted", describe(availability), type);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "api_unavailable");
        body.put("message", "PHASTEST API is currently unavailable");
        body.put("fallback_available", true);
        body.put("instructions", "Download FASTA files and submit manually to phastest.ca");
        body.put("error", describe(availability));
        body.put("code", "UPSTREAM_UNAVAILABLE");
        writeJson(resp, 503, body);
        return;
      }
    }

    Job job = jobs.submit(type, input);
    writeJson(
        resp,
        200,
        SubmissionResponse.of(
            job,
            "%s analysis started for %d genome(s)"
                .formatted(type.wireName(), input.genomes().size())));
  }

  private static String describe(PhastestClient.Availability availability) {
    if (availability.error() != null) return availability.error();
    return "PHASTEST API returned HTTP " + availability.statusCode();
  }
}
