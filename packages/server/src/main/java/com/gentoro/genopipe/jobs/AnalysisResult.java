package com.gentoro.genopipe.jobs;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.genopipe.artifacts.ArtifactRef;
import com.gentoro.genopipe.artifacts.FileKind;
import java.util.List;
import java.util.Optional;

/** Result of an analysis job: references to the downloadable artifacts it produced. */
public record AnalysisResult(
    @JsonProperty("message") String message,
    @JsonProperty("artifacts") List<ArtifactRef> artifacts)
    implements JobResult {

  public AnalysisResult {
    artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
  }

  public Optional<ArtifactRef> artifact(FileKind kind) {
    return artifacts.stream().filter(a -> a.kind() == kind).findFirst();
  }
}
