package com.gentoro.genopipe.artifacts;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ZipBundlerTest {

  @TempDir Path temp;

  @Test
  void writesEveryFileAsFlatEntry() throws Exception {
    Path a = Files.writeString(temp.resolve("a.fasta"), ">a\nACGT\n");
    Path b = Files.writeString(temp.resolve("b.fasta"), ">b\nTTTT\n");

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ZipBundler.writeZip(List.of(a, b), out);

    Map<String, String> entries = read(out.toByteArray());
    assertEquals(List.of("a.fasta", "b.fasta"), List.copyOf(entries.keySet()));
    assertEquals(">b\nTTTT\n", entries.get("b.fasta"));
  }

  @Test
  void clashingNamesGetASuffix() throws Exception {
    Path first = Files.createDirectories(temp.resolve("one")).resolve("g.fna");
    Path second = Files.createDirectories(temp.resolve("two")).resolve("g.fna");
    Files.writeString(first, "1");
    Files.writeString(second, "2");

    Path target = temp.resolve("out/bundle.zip");
    ZipBundler.writeZip(List.of(first, second), target);

    Map<String, String> entries = read(Files.readAllBytes(target));
    assertEquals("1", entries.get("g.fna"));
    assertEquals("2", entries.get("g_2.fna"));
  }

  private static Map<String, String> read(byte[] zip) throws Exception {
    Map<String, String> entries = new LinkedHashMap<>();
    try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(zip))) {
      ZipEntry entry;
      while ((entry = in.getNextEntry()) != null) {
        entries.put(entry.getName(), new String(in.readAllBytes(), StandardCharsets.UTF_8));
      }
    }
    return entries;
  }
}
