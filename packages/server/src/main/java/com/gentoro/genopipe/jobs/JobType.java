package com.gentoro.genopipe.jobs;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.genopipe.exception.ValidationException;

/** Kinds of work the executor knows how to run. Immutable for the lifetime of a job. */
public enum JobType {
  FETCH_GENOMES("fetch_genomes"),
  RESFINDER("resfinder"),
  PHASTEST("phastest"),
  VFDB("vfdb");

  private final String wireName;

  JobType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static JobType fromWireName(String value) {
    for (JobType type : values()) {
      if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new ValidationException("Unknown job type: " + value);
  }
}
