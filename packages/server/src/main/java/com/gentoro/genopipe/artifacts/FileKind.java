package com.gentoro.genopipe.artifacts;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.genopipe.exception.ValidationException;
import com.gentoro.genopipe.jobs.JobType;

/**
 * Downloadable artifact kinds. Each kind belongs to exactly one job type and has a deterministic
 * download filename.
 */
public enum FileKind {
  RESFINDER_CSV("resfinder_csv", JobType.RESFINDER, "resfinder_results.csv", "text/csv"),
  PHASTEST_CSV("phastest_csv", JobType.PHASTEST, "phastest_results.csv", "text/csv"),
  PHASTEST_ZIP("phastest_zip", JobType.PHASTEST, "phastest_results_%s.zip", "application/zip"),
  VFDB_EXCEL(
      "vfdb_excel",
      JobType.VFDB,
      "vfdb_results.xlsx",
      "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

  /** Older clients ask for the VFDB workbook under this name. */
  static final String LEGACY_VFDB_ALIAS = "vfdb_csv";

  private final String wireName;
  private final JobType jobType;
  private final String filenamePattern;
  private final String contentType;

  FileKind(String wireName, JobType jobType, String filenamePattern, String contentType) {
    this.wireName = wireName;
    this.jobType = jobType;
    this.filenamePattern = filenamePattern;
    this.contentType = contentType;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public JobType jobType() {
    return jobType;
  }

  public String contentType() {
    return contentType;
  }

  public String filename(String jobId) {
    return filenamePattern.contains("%s") ? filenamePattern.formatted(jobId) : filenamePattern;
  }

  @JsonCreator
  public static FileKind fromWireName(String value) {
    if (value == null || value.isBlank()) {
      throw new ValidationException("file_type is required");
    }
    String normalized = value.trim().toLowerCase();
    if (LEGACY_VFDB_ALIAS.equals(normalized)) {
      return VFDB_EXCEL;
    }
    for (FileKind kind : values()) {
      if (kind.wireName.equals(normalized)) {
        return kind;
      }
    }
    throw new ValidationException("Unknown file type: " + value);
  }
}
