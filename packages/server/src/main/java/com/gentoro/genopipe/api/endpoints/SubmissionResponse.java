package com.gentoro.genopipe.api.endpoints;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.genopipe.jobs.Job;
import com.gentoro.genopipe.jobs.JobStatus;

/** Body returned when a job is accepted. */
record SubmissionResponse(
    @JsonProperty("job_id") String jobId,
    @JsonProperty("status") JobStatus status,
    @JsonProperty("message") String message) {

  static SubmissionResponse of(Job job, String message) {
    return new SubmissionResponse(job.jobId(), job.status(), message);
  }
}
