package com.gentoro.genopipe.jobs;

import com.gentoro.genopipe.genome.GenomeRecord;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Input of an analysis job. The list is copied so later changes by the caller are not seen. */
public record GenomeSetInput(List<GenomeRecord> genomes) implements JobInput {
  public GenomeSetInput {
    // List.copyOf rejects null elements; those must reach validation instead.
    genomes = genomes == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(genomes));
  }
}
