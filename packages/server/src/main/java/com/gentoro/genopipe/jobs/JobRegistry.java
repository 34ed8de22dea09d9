package com.gentoro.genopipe.jobs;

import com.gentoro.genopipe.exception.NotFoundException;
import java.util.List;
import java.util.Optional;

/** Source of truth for job existence and state. Implementations must be safe for concurrent use. */
public interface JobRegistry {

  /** Inserts a new {@code pending} record with a fresh identifier. Never blocks. */
  Job create(JobType type);

  Optional<Job> get(String jobId);

  default Job require(String jobId) {
    return get(jobId).orElseThrow(() -> new NotFoundException("Job not found: " + jobId));
  }

  /** Snapshot of all records, in no particular order. */
  List<Job> list();

  /**
   * Atomically applies {@code update} to the record.
   *
   * @throws NotFoundException if the job does not exist
   * @throws com.gentoro.genopipe.exception.InvalidTransitionException if the update would leave a
   *     terminal state or skip the allowed status transitions; the record is left unchanged
   */
  Job update(String jobId, JobUpdate update);

  /**
   * Removes the record.
   *
   * @throws NotFoundException if the job does not exist, including when it was already deleted
   */
  void delete(String jobId);
}
