package com.gentoro.genopipe.artifacts;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Reference to a job-scoped artifact, as exposed in a completed job's result. */
public record ArtifactRef(
    @JsonProperty("file_type") FileKind kind,
    @JsonProperty("filename") String filename,
    @JsonProperty("size") long size) {}
