package com.gentoro.genopipe.jobs;

/** Input of a genome fetch: a single BioProject identifier such as {@code PRJNA123456}. */
public record BioProjectInput(String bioprojectId) implements JobInput {
  public BioProjectInput {
    bioprojectId = bioprojectId == null ? null : bioprojectId.trim();
  }
}
