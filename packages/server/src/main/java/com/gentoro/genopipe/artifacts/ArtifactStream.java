package com.gentoro.genopipe.artifacts;

import java.io.IOException;
import java.io.InputStream;

/**
 * An open artifact. While it is open, the artifact cannot be deleted; closing it releases the
 * underlying stream and the read lock. Must be closed on the thread that opened it.
 */
public final class ArtifactStream implements AutoCloseable {
  private final String filename;
  private final String contentType;
  private final long size;
  private final InputStream stream;
  private final Runnable release;
  private boolean closed;

  ArtifactStream(
      String filename, String contentType, long size, InputStream stream, Runnable release) {
    this.filename = filename;
    this.contentType = contentType;
    this.size = size;
    this.stream = stream;
    this.release = release;
  }

  public String filename() {
    return filename;
  }

  public String contentType() {
    return contentType;
  }

  public long size() {
    return size;
  }

  public InputStream stream() {
    return stream;
  }

  /** Reads the remaining bytes. Only meant for small artifacts and tests. */
  public byte[] readAllBytes() throws IOException {
    return stream.readAllBytes();
  }

  @Override
  public void close() throws IOException {
    if (closed) return;
    closed = true;
    try {
      stream.close();
    } finally {
      release.run();
    }
  }
}
