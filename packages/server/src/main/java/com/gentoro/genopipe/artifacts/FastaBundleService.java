package com.gentoro.genopipe.artifacts;

import com.gentoro.genopipe.exception.AdapterException;
import com.gentoro.genopipe.exception.ExceptionUtil;
import com.gentoro.genopipe.exception.NotFoundException;
import com.gentoro.genopipe.exception.ValidationException;
import com.gentoro.genopipe.genome.GenomeDownloader;
import com.gentoro.genopipe.genome.GenomeRecord;
import com.gentoro.genopipe.logging.LoggingService;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;

/**
 * Builds the FASTA zip bundles used for manual PHASTEST submission when the PHASTEST service is
 * unavailable. Bundles are temporary artifacts in a fresh {@code temp_fasta_<millis>} namespace;
 * no job is created.
 */
public class FastaBundleService {
  private static final Logger log = LoggingService.getLogger(FastaBundleService.class);

  private final ArtifactManager artifacts;
  private final GenomeDownloader downloader;

  public FastaBundleService(ArtifactManager artifacts, GenomeDownloader downloader) {
    this.artifacts = artifacts;
    this.downloader = downloader;
  }

  /**
   * Zips the FASTA inputs staged by completed ResFinder jobs. The {@code temp_fasta_} namespace is
   * only allocated once there is something to bundle.
   *
   * @throws NotFoundException if no ResFinder input has been staged yet
   */
  public TemporaryArtifact bundleStagedResfinderInputs() {
    TemporaryArtifact bundle =
        artifacts.withTemporaryFiles(
            ArtifactManager.RESFINDER_INPUTS,
            files -> {
              List<Path> fasta = files.stream().filter(FastaBundleService::isFasta).toList();
              if (fasta.isEmpty()) {
                return null;
              }
              String filename = "phastest_fasta_files_%d_genomes.zip".formatted(fasta.size());
              return artifacts.writeTemporary(
                  artifacts.newTempFastaNamespace(),
                  filename,
                  out -> ZipBundler.writeZip(fasta, out));
            });
    if (bundle == null) {
      throw new NotFoundException(
          "No ResFinder input FASTA files found. Run a ResFinder analysis first.");
    }
    log.info(
        "Bundled staged ResFinder inputs into {}/{}", bundle.namespace(), bundle.filename());
    return bundle;
  }

  /**
   * Downloads each genome and zips the ones that downloaded. Individual failures are logged and
   * skipped.
   *
   * @throws AdapterException if no genome could be downloaded
   */
  public TemporaryArtifact bundleGenomes(List<GenomeRecord> genomes) {
    if (genomes == null || genomes.isEmpty()) {
      throw new ValidationException("No genome URLs provided");
    }
    String scratchId = "bundle-" + UUID.randomUUID();
    Path scratch = artifacts.workspaceFor(scratchId);
    try {
      List<Path> downloaded = new ArrayList<>();
      for (int i = 0; i < genomes.size(); i++) {
        GenomeRecord genome = genomes.get(i);
        String stem =
            genome.assemblyAccession() == null || genome.assemblyAccession().isBlank()
                ? "genome_" + (i + 1)
                : genome.fileStem();
        try {
          downloaded.add(downloader.download(genome, scratch, stem + ".fasta"));
        } catch (RuntimeException e) {
          log.warn(
              "Skipping {} in FASTA bundle: {}",
              genome.url(),
              ExceptionUtil.extractErrorMessage(e));
        }
      }
      if (downloaded.isEmpty()) {
        throw new AdapterException("No FASTA files could be downloaded");
      }
      String namespace = artifacts.newTempFastaNamespace();
      TemporaryArtifact bundle =
          artifacts.writeTemporary(
              namespace,
              namespace + "_fasta_files.zip",
              out -> ZipBundler.writeZip(downloaded, out));
      log.info(
          "Bundled {} of {} genome(s) into {}/{}",
          downloaded.size(),
          genomes.size(),
          namespace,
          bundle.filename());
      return bundle;
    } finally {
      artifacts.releaseWorkspace(scratchId);
    }
  }

  static boolean isFasta(Path file) {
    String name = file.getFileName().toString().toLowerCase();
    return Files.isRegularFile(file)
        && (name.endsWith(".fna") || name.endsWith(".fasta") || name.endsWith(".fa"));
  }
}
