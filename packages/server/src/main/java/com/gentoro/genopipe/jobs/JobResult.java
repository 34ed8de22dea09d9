package com.gentoro.genopipe.jobs;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Payload of a completed job. The concrete shape depends on the job type and is told apart on the
 * wire by its properties alone.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.DEDUCTION)
@JsonSubTypes({
  @JsonSubTypes.Type(GenomeFetchResult.class),
  @JsonSubTypes.Type(AnalysisResult.class)
})
public interface JobResult {}
