package com.gentoro.genopipe.jobs.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.genopipe.logging.LoggingService;
import com.gentoro.genopipe.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import org.slf4j.Logger;

/**
 * Prophage counts read from the {@code predicted_phage_regions.json} inside a PHASTEST result
 * archive, together with the accession, genus and strain named by the regions' contig tags.
 *
 * <p>A contig tag reads like {@code "NZ_CP000001.1, Escherichia coli, strain, K-12"}: the
 * first element is the accession, the next two the genus and species, and the element after {@code
 * strain} the strain. Values default to {@code Unknown} and the last tag seen wins.
 */
record PhageRegionCounts(
    String accession,
    String genus,
    String strain,
    int intact,
    int incomplete,
    int questionable) {
  private static final Logger log = LoggingService.getLogger(PhageRegionCounts.class);
  static final String REGIONS_ENTRY = "predicted_phage_regions.json";
  static final String UNKNOWN = "Unknown";

  int total() {
    return intact + incomplete + questionable;
  }

  /** Empty when the archive has no readable region list. */
  static Optional<PhageRegionCounts> read(Path archive) {
    try (ZipFile zip = new ZipFile(archive.toFile())) {
      ZipEntry entry = findRegions(zip);
      if (entry == null) {
        log.warn("{} not found in {}", REGIONS_ENTRY, archive.getFileName());
        return Optional.empty();
      }
      JsonNode regions;
      try (InputStream in = zip.getInputStream(entry)) {
        regions = JacksonUtility.getJsonMapper().readTree(in);
      }
      if (regions == null || !regions.isArray()) {
        log.warn("Unexpected {} layout in {}", REGIONS_ENTRY, archive.getFileName());
        return Optional.empty();
      }
      return Optional.of(count(regions));
    } catch (JsonProcessingException e) {
      log.warn("Invalid JSON in {}: {}", archive.getFileName(), e.getOriginalMessage());
      return Optional.empty();
    } catch (IOException e) {
      log.warn("Could not read {}: {}", archive.getFileName(), e.toString());
      return Optional.empty();
    }
  }

  private static ZipEntry findRegions(ZipFile zip) {
    Enumeration<? extends ZipEntry> entries = zip.entries();
    while (entries.hasMoreElements()) {
      ZipEntry entry = entries.nextElement();
      String name = entry.getName();
      if (!entry.isDirectory()
          && (name.equals(REGIONS_ENTRY) || name.endsWith("/" + REGIONS_ENTRY))) {
        return entry;
      }
    }
    return null;
  }

  static PhageRegionCounts count(JsonNode regions) {
    int intact = 0;
    int incomplete = 0;
    int questionable = 0;
    String accession = UNKNOWN;
    String genus = UNKNOWN;
    String strain = UNKNOWN;
    for (JsonNode region : regions) {
      switch (region.path("completeness").asText("").toLowerCase(Locale.ROOT)) {
        case "intact" -> intact++;
        case "incomplete" -> incomplete++;
        case "questionable" -> questionable++;
        default -> {}
      }
      String tag = region.path("contig_tag").asText("");
      if (tag.isEmpty()) continue;
      List<String> parts = Arrays.stream(tag.split(",")).map(String::strip).toList();
      accession = parts.get(0);
      if (parts.size() >= 3) {
        genus = parts.get(1) + " " + parts.get(2);
      }
      int strainIndex = parts.indexOf("strain");
      if (strainIndex >= 0 && strainIndex + 1 < parts.size()) {
        strain = parts.get(strainIndex + 1);
      }
    }
    return new PhageRegionCounts(accession, genus, strain, intact, incomplete, questionable);
  }
}
