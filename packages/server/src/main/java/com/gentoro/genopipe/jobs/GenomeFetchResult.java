package com.gentoro.genopipe.jobs;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.genopipe.genome.GenomeRecord;
import java.util.List;

/** Result of a {@link JobType#FETCH_GENOMES} job. */
public record GenomeFetchResult(
    @JsonProperty("genomes") List<GenomeRecord> genomes, @JsonProperty("count") int count)
    implements JobResult {

  public GenomeFetchResult {
    genomes = genomes == null ? List.of() : List.copyOf(genomes);
  }

  public static GenomeFetchResult of(List<GenomeRecord> genomes) {
    return new GenomeFetchResult(genomes, genomes == null ? 0 : genomes.size());
  }
}
