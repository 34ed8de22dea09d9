package com.gentoro.genopipe.api.endpoints;

import com.gentoro.genopipe.artifacts.ArtifactManager;
import com.gentoro.genopipe.artifacts.TemporaryArtifact;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Lists temporary zip files as {@code {"zip_files": [...]}}.
 *
 * <ul>
 *   <li>GET /api/phastest-zip-files: {@code .PHASTEST.zip} downloads of PHASTEST jobs;
 *   <li>GET /api/temp-fasta-zip-files: FASTA bundles of every {@code temp_fasta_*} namespace,
 *       newest first.
 * </ul>
 */
public final class TemporaryListServlet extends ApiServlet {
  private final Supplier<List<TemporaryArtifact>> source;
  private final boolean detailed;

  private TemporaryListServlet(Supplier<List<TemporaryArtifact>> source, boolean detailed) {
    this.source = source;
    this.detailed = detailed;
  }

  public static TemporaryListServlet phastestZips(ArtifactManager artifacts) {
    return new TemporaryListServlet(
        () ->
            artifacts.listTemporary(ArtifactManager.PHASTEST_RESULTS).stream()
                .filter(a -> a.filename().endsWith(".PHASTEST.zip"))
                .toList(),
        false);
  }

  public static TemporaryListServlet tempFastaZips(ArtifactManager artifacts) {
    return new TemporaryListServlet(
        () ->
            artifacts.listTemporaryByPrefix(ArtifactManager.TEMP_FASTA_PREFIX).stream()
                .filter(a -> a.filename().endsWith(".zip"))
                .toList(),
        true);
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    List<Map<String, Object>> files = new ArrayList<>();
    for (TemporaryArtifact artifact : source.get()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("filename", artifact.filename());
      if (detailed) {
        entry.put("temp_dir", artifact.namespace());
      }
      entry.put("size", artifact.size());
      entry.put("size_mb", artifact.sizeMb());
      if (detailed) {
        entry.put("created_time", artifact.createdAt().toEpochMilli() / 1000.0);
      }
      files.add(entry);
    }
    writeJson(resp, 200, Map.of("zip_files", files));
  }
}
