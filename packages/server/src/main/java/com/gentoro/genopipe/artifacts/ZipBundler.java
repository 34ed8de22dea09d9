package com.gentoro.genopipe.artifacts;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Writes a flat list of files as a deflated zip archive. Entries are named after the file name
 * only; clashing names get a numeric suffix.
 */
public final class ZipBundler {

  private ZipBundler() {}

  /** Write {@code files} as a zip stream. The output stream is finished but not closed. */
  public static void writeZip(List<Path> files, OutputStream out) throws IOException {
    ZipOutputStream zip = new ZipOutputStream(out);
    Set<String> used = new HashSet<>();
    for (Path file : files) {
      String name = uniqueName(file.getFileName().toString(), used);
      ZipEntry entry = new ZipEntry(name);
      entry.setTime(Files.getLastModifiedTime(file).toMillis());
      zip.putNextEntry(entry);
      try (InputStream in = Files.newInputStream(file)) {
        in.transferTo(zip);
      }
      zip.closeEntry();
    }
    zip.finish();
  }

  /** Write {@code files} into a new zip file at {@code target}. */
  public static void writeZip(List<Path> files, Path target) throws IOException {
    Files.createDirectories(target.getParent());
    try (OutputStream out = Files.newOutputStream(target)) {
      writeZip(files, out);
    }
  }

  private static String uniqueName(String name, Set<String> used) {
    if (used.add(name)) return name;
    int dot = name.lastIndexOf('.');
    String stem = dot > 0 ? name.substring(0, dot) : name;
    String ext = dot > 0 ? name.substring(dot) : "";
    for (int i = 2; ; i++) {
      String candidate = stem + "_" + i + ext;
      if (used.add(candidate)) return candidate;
    }
  }
}
