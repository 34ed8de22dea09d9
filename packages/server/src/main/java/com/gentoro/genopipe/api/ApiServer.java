package com.gentoro.genopipe.api;

import com.gentoro.genopipe.api.endpoints.AnalysisSubmitServlet;
import com.gentoro.genopipe.api.endpoints.CleanupFilesServlet;
import com.gentoro.genopipe.api.endpoints.CleanupJobServlet;
import com.gentoro.genopipe.api.endpoints.DownloadServlet;
import com.gentoro.genopipe.api.endpoints.FastaBundleServlet;
import com.gentoro.genopipe.api.endpoints.FetchGenomesServlet;
import com.gentoro.genopipe.api.endpoints.HealthServlet;
import com.gentoro.genopipe.api.endpoints.JobControlServlet;
import com.gentoro.genopipe.api.endpoints.JobStatusServlet;
import com.gentoro.genopipe.api.endpoints.JobsListServlet;
import com.gentoro.genopipe.api.endpoints.PhastestStatusServlet;
import com.gentoro.genopipe.api.endpoints.ResfinderFastaZipServlet;
import com.gentoro.genopipe.api.endpoints.TemporaryDownloadServlet;
import com.gentoro.genopipe.api.endpoints.TemporaryListServlet;
import com.gentoro.genopipe.artifacts.ArtifactManager;
import com.gentoro.genopipe.artifacts.FastaBundleService;
import com.gentoro.genopipe.cleanup.CleanupScheduler;
import com.gentoro.genopipe.jobs.JobManager;
import com.gentoro.genopipe.jobs.JobType;
import com.gentoro.genopipe.jobs.adapters.PhastestClient;
import com.gentoro.genopipe.logging.LoggingService;
import jakarta.servlet.http.HttpServlet;
import java.time.Clock;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.slf4j.Logger;

/**
 * Registers the REST endpoints used by the web front end under a common context path ({@code
 * /api} by default). Submissions go to the {@link JobManager}; downloads and temporary bundles to
 * the {@link ArtifactManager}.
 */
public final class ApiServer {
  private static final Logger log = LoggingService.getLogger(ApiServer.class);

  private final String contextPath;
  private final JobManager jobs;
  private final ArtifactManager artifacts;
  private final FastaBundleService bundles;
  private final PhastestClient phastest;
  private final boolean probePhastestOnSubmit;
  private final CleanupScheduler cleanup;
  private final Clock clock;

  public ApiServer(
      String contextPath,
      JobManager jobs,
      ArtifactManager artifacts,
      FastaBundleService bundles,
      PhastestClient phastest,
      boolean probePhastestOnSubmit,
      CleanupScheduler cleanup,
      Clock clock) {
    String path = contextPath == null ? "" : contextPath.trim();
    if (path.endsWith("/")) path = path.substring(0, path.length() - 1);
    if (!path.isEmpty() && !path.startsWith("/")) path = "/" + path;
    this.contextPath = path;
    this.jobs = jobs;
    this.artifacts = artifacts;
    this.bundles = bundles;
    this.phastest = phastest;
    this.probePhastestOnSubmit = probePhastestOnSubmit;
    this.cleanup = cleanup;
    this.clock = clock;
  }

  /** Register all servlets with the Jetty context handler. */
  public void register(ServletContextHandler ctx) {
    add(ctx, new HealthServlet(clock), "/health");

    // Submissions
    add(ctx, new FetchGenomesServlet(jobs), "/fetch-genomes");
    add(ctx, new AnalysisSubmitServlet(jobs, JobType.RESFINDER), "/run-resfinder");
    add(
        ctx,
        probePhastestOnSubmit
            ? new AnalysisSubmitServlet(jobs, JobType.PHASTEST, phastest)
            : new AnalysisSubmitServlet(jobs, JobType.PHASTEST),
        "/run-phastest");
    add(ctx, new AnalysisSubmitServlet(jobs, JobType.VFDB), "/run-vfdb");

    // Polling and job control
    add(ctx, new JobStatusServlet(jobs), "/job-status/*");
    add(ctx, new JobsListServlet(jobs), "/jobs");
    add(ctx, new JobControlServlet(jobs), "/jobs/*");
    add(ctx, new CleanupJobServlet(jobs), "/cleanup/*");

    // Job-scoped artifacts
    add(ctx, new DownloadServlet(artifacts), "/download/*");

    // PHASTEST availability and fallback bundles
    add(ctx, new PhastestStatusServlet(phastest), "/phastest-status");
    add(ctx, TemporaryListServlet.phastestZips(artifacts), "/phastest-zip-files");
    add(ctx, TemporaryListServlet.tempFastaZips(artifacts), "/temp-fasta-zip-files");
    add(ctx, new TemporaryDownloadServlet(artifacts), "/download-temp-fasta-zip/*");
    add(ctx, new ResfinderFastaZipServlet(bundles, artifacts), "/download-resfinder-fasta-zip");
    add(ctx, new FastaBundleServlet(bundles, artifacts), "/download-fasta-files");
    add(ctx, new CleanupFilesServlet(cleanup), "/cleanup-files");

    log.info("REST endpoints registered under {}", contextPath.isEmpty() ? "/" : contextPath);
  }

  private void add(ServletContextHandler ctx, HttpServlet servlet, String path) {
    ctx.addServlet(new ServletHolder(servlet), contextPath + path);
  }
}
