package com.gentoro.genopipe.jobs.adapters;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One line of {@code phastest_results.csv}. The prophage columns stay empty when the genome failed
 * or its archive had no readable region list.
 */
@JsonPropertyOrder({
  "genome",
  "assembly_accession",
  "submission_id",
  "status",
  "zip_file",
  "accession_no",
  "genus",
  "strain",
  "intact",
  "incomplete",
  "questionable",
  "total_prophages",
  "link"
})
record PhastestSummaryRow(
    @JsonProperty("genome") String genome,
    @JsonProperty("assembly_accession") String assemblyAccession,
    @JsonProperty("submission_id") String submissionId,
    @JsonProperty("status") String status,
    @JsonProperty("zip_file") String zipFile,
    @JsonProperty("accession_no") String accessionNo,
    @JsonProperty("genus") String genus,
    @JsonProperty("strain") String strain,
    @JsonProperty("intact") Integer intact,
    @JsonProperty("incomplete") Integer incomplete,
    @JsonProperty("questionable") Integer questionable,
    @JsonProperty("total_prophages") Integer totalProphages,
    @JsonProperty("link") String link) {

  static PhastestSummaryRow of(
      String genome,
      String assemblyAccession,
      String submissionId,
      String status,
      String zipFile,
      PhageRegionCounts counts,
      String link) {
    boolean known = counts != null;
    return new PhastestSummaryRow(
        genome,
        assemblyAccession,
        submissionId,
        status,
        zipFile,
        known ? counts.accession() : null,
        known ? counts.genus() : null,
        known ? counts.strain() : null,
        known ? counts.intact() : null,
        known ? counts.incomplete() : null,
        known ? counts.questionable() : null,
        known ? counts.total() : null,
        link);
  }
}
