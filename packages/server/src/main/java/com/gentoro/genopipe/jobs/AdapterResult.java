package com.gentoro.genopipe.jobs;

import com.gentoro.genopipe.artifacts.FileKind;
import com.gentoro.genopipe.genome.GenomeRecord;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What an adapter hands back to the executor: either genome records, or files for the job's
 * artifact set. Files for temporary namespaces may be attached to either.
 */
public final class AdapterResult {
  private final List<GenomeRecord> genomes;
  private final String message;
  private final Map<FileKind, Path> artifacts;
  private final Map<String, List<Path>> temporaries = new LinkedHashMap<>();

  private AdapterResult(List<GenomeRecord> genomes, String message, Map<FileKind, Path> artifacts) {
    this.genomes = genomes;
    this.message = message;
    this.artifacts = artifacts;
  }

  public static AdapterResult genomes(List<GenomeRecord> genomes) {
    return new AdapterResult(List.copyOf(genomes), null, Map.of());
  }

  public static AdapterResult artifacts(String message, Map<FileKind, Path> files) {
    Map<FileKind, Path> copy = new EnumMap<>(FileKind.class);
    copy.putAll(files);
    return new AdapterResult(null, message, copy);
  }

  /** Publishes {@code files} to a temporary namespace once the job completes. */
  public AdapterResult withTemporary(String namespace, List<Path> files) {
    temporaries.computeIfAbsent(namespace, n -> new ArrayList<>()).addAll(files);
    return this;
  }

  public boolean hasGenomes() {
    return genomes != null;
  }

  public List<GenomeRecord> genomes() {
    return genomes;
  }

  public String message() {
    return message;
  }

  public Map<FileKind, Path> artifacts() {
    return artifacts;
  }

  public Map<String, List<Path>> temporaries() {
    return temporaries;
  }
}
