package com.gentoro.genopipe.genome;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Metadata for one genome assembly, as produced by a BioProject lookup. Immutable; analysis jobs
 * keep their own copy of the list they were submitted with.
 *
 * <p>{@code url} points at the gzip-compressed FASTA of the assembly and is the only field the
 * analysis jobs require.
 */
public record GenomeRecord(
    @JsonProperty("url") String url,
    @JsonProperty("genus") String genus,
    @JsonProperty("species") String species,
    @JsonProperty("strain") String strain,
    @JsonProperty("organism") String organism,
    @JsonProperty("assembly_accession") String assemblyAccession,
    @JsonProperty("assembly_name") String assemblyName,
    @JsonProperty("assembly_level") String assemblyLevel,
    @JsonProperty("taxonomy_id") String taxonomyId,
    @JsonProperty("submitter") String submitter,
    @JsonProperty("submission_date") String submissionDate,
    @JsonProperty("contig_count") String contigCount,
    @JsonProperty("genome_size") String genomeSize,
    @JsonProperty("bioproject_id") String bioprojectId) {

  /** A record that only knows where its FASTA lives; used for plain URL submissions. */
  public static GenomeRecord ofUrl(String url) {
    return new GenomeRecord(
        url, null, null, null, null, null, null, null, null, null, null, null, null, null);
  }

  /**
   * Name used for this genome's files: the assembly accession when known, otherwise the last
   * path segment of the URL without compression and FASTA suffixes.
   */
  public String fileStem() {
    if (assemblyAccession != null
        && !assemblyAccession.isBlank()
        && !"Unknown".equals(assemblyAccession)) {
      return sanitize(assemblyAccession);
    }
    String name = url == null ? "genome" : url.substring(url.lastIndexOf('/') + 1);
    int query = name.indexOf('?');
    if (query >= 0) name = name.substring(0, query);
    for (String suffix : new String[] {".gz", ".fna", ".fasta", ".fa"}) {
      if (name.endsWith(suffix)) name = name.substring(0, name.length() - suffix.length());
    }
    return name.isBlank() ? "genome" : sanitize(name);
  }

  /**
   * File stems for {@code genomes}, in order, distinct within the list. A stem already taken by an
   * earlier genome gets a {@code _2}, {@code _3}... suffix.
   */
  public static List<String> uniqueFileStems(List<GenomeRecord> genomes) {
    Set<String> used = new HashSet<>();
    List<String> stems = new ArrayList<>(genomes.size());
    for (GenomeRecord genome : genomes) {
      String stem = genome.fileStem();
      String candidate = stem;
      for (int i = 2; !used.add(candidate); i++) {
        candidate = stem + "_" + i;
      }
      stems.add(candidate);
    }
    return stems;
  }

  private static String sanitize(String value) {
    return value.replaceAll("[^A-Za-z0-9._-]", "_");
  }
}
