package com.gentoro.genopipe.jobs;

import com.gentoro.genopipe.exception.NotFoundException;
import com.gentoro.genopipe.logging.LoggingService;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;

/**
 * {@link JobRegistry} backed by a {@link ConcurrentHashMap}. Every write to a record runs inside
 * {@code compute} for that key, which serializes writers per job while readers get the latest
 * immutable snapshot without blocking.
 */
public final class InMemoryJobRegistry implements JobRegistry {
  private static final Logger log = LoggingService.getLogger(InMemoryJobRegistry.class);

  private final Map<String, Job> jobs = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryJobRegistry() {
    this(Clock.systemUTC());
  }

  public InMemoryJobRegistry(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Job create(JobType type) {
    while (true) {
      String id = UUID.randomUUID().toString();
      Job job = Job.pending(id, type, clock.instant());
      if (jobs.putIfAbsent(id, job) == null) {
        log.debug("Created {} job {}", type.wireName(), id);
        return job;
      }
    }
  }

  @Override
  public Optional<Job> get(String jobId) {
    if (jobId == null) return Optional.empty();
    return Optional.ofNullable(jobs.get(jobId));
  }

  @Override
  public List<Job> list() {
    return new ArrayList<>(jobs.values());
  }

  @Override
  public Job update(String jobId, JobUpdate update) {
    Job updated =
        jobs.computeIfPresent(jobId, (id, current) -> current.apply(update, clock.instant()));
    if (updated == null) {
      throw new NotFoundException("Job not found: " + jobId);
    }
    return updated;
  }

  @Override
  public void delete(String jobId) {
    if (jobId == null || jobs.remove(jobId) == null) {
      throw new NotFoundException("Job not found: " + jobId);
    }
    log.debug("Deleted job {}", jobId);
  }
}
