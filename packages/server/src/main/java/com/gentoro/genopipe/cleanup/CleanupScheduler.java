package com.gentoro.genopipe.cleanup;

import com.gentoro.genopipe.artifacts.ArtifactManager;
import com.gentoro.genopipe.exception.ConfigException;
import com.gentoro.genopipe.exception.ExceptionUtil;
import com.gentoro.genopipe.jobs.JobManager;
import com.gentoro.genopipe.logging.LoggingService;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Periodic housekeeping: sweeps temporary artifacts past their maximum age and deletes terminal
 * jobs past their retention period. Job-scoped artifacts go with their job.
 */
public final class CleanupScheduler implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(CleanupScheduler.class);

  private final JobManager jobs;
  private final ArtifactManager artifacts;
  private final Duration interval;
  private final Duration temporaryMaxAge;
  private final Duration jobRetention;
  private ScheduledExecutorService scheduler;

  public CleanupScheduler(
      JobManager jobs,
      ArtifactManager artifacts,
      Duration interval,
      Duration temporaryMaxAge,
      Duration jobRetention) {
    if (interval.isZero() || interval.isNegative()) {
      throw new ConfigException("cleanup.interval-minutes must be positive");
    }
    this.jobs = jobs;
    this.artifacts = artifacts;
    this.interval = interval;
    this.temporaryMaxAge = temporaryMaxAge;
    this.jobRetention = jobRetention;
  }

  public static CleanupScheduler fromConfiguration(
      Configuration config, JobManager jobs, ArtifactManager artifacts) {
    return new CleanupScheduler(
        jobs,
        artifacts,
        Duration.ofMinutes(config.getLong("cleanup.interval-minutes", 60)),
        Duration.ofDays(config.getLong("cleanup.temporary-max-age-days", 7)),
        Duration.ofDays(config.getLong("cleanup.job-retention-days", 31)));
  }

  public synchronized void start() {
    if (scheduler != null) return;
    scheduler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "genopipe-cleanup");
              t.setDaemon(true);
              return t;
            });
    long millis = interval.toMillis();
    scheduler.scheduleWithFixedDelay(this::runOnce, millis, millis, TimeUnit.MILLISECONDS);
    log.info(
        "Cleanup every {} (temporary files kept {}, jobs kept {})",
        interval,
        temporaryMaxAge,
        jobRetention);
  }

  /** Sweeps temporary artifacts now. */
  public int sweepTemporary() {
    return artifacts.sweepTemporary(temporaryMaxAge);
  }

  void runOnce() {
    // An exception would cancel the periodic task.
    try {
      int files = sweepTemporary();
      int purged = jobs.purgeOlderThan(jobRetention);
      log.debug("Scheduled cleanup removed {} file(s) and {} job(s)", files, purged);
    } catch (RuntimeException e) {
      log.error("Scheduled cleanup failed: {}", ExceptionUtil.extractErrorMessage(e), e);
    }
  }

  @Override
  public synchronized void close() {
    if (scheduler != null) {
      scheduler.shutdownNow();
      scheduler = null;
    }
  }
}
