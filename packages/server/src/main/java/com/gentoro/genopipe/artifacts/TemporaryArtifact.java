package com.gentoro.genopipe.artifacts;

import java.time.Instant;

/** Descriptor of a file in a temporary namespace. */
public record TemporaryArtifact(String namespace, String filename, long size, Instant createdAt) {

  public double sizeMb() {
    return Math.round(size / (1024.0 * 1024.0) * 100.0) / 100.0;
  }
}
