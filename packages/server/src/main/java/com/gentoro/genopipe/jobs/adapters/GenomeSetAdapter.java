package com.gentoro.genopipe.jobs.adapters;

import com.gentoro.genopipe.exception.ValidationException;
import com.gentoro.genopipe.genome.GenomeDownloader;
import com.gentoro.genopipe.genome.GenomeRecord;
import com.gentoro.genopipe.jobs.GenomeSetInput;
import com.gentoro.genopipe.jobs.JobAdapter;
import com.gentoro.genopipe.jobs.JobContext;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Common base of the analyses that consume a list of genomes. */
abstract class GenomeSetAdapter implements JobAdapter<GenomeSetInput> {
  protected final GenomeDownloader downloader;

  protected GenomeSetAdapter(GenomeDownloader downloader) {
    this.downloader = downloader;
  }

  @Override
  public Class<GenomeSetInput> inputType() {
    return GenomeSetInput.class;
  }

  @Override
  public void validate(GenomeSetInput input) {
    if (input.genomes().isEmpty()) {
      throw new ValidationException("No genome URLs provided");
    }
    for (int i = 0; i < input.genomes().size(); i++) {
      GenomeRecord genome = input.genomes().get(i);
      if (genome == null || genome.url() == null || genome.url().isBlank()) {
        throw new ValidationException("Genome #%d has no URL".formatted(i + 1));
      }
      if (!isHttpUrl(genome.url())) {
        throw new ValidationException(
            "Genome #%d has an invalid URL: %s".formatted(i + 1, genome.url()));
      }
    }
  }

  static boolean isHttpUrl(String value) {
    try {
      URI uri = URI.create(value.trim());
      String scheme = uri.getScheme();
      return ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
          && uri.getHost() != null;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  /**
   * Downloads every genome into {@code <workspace>/inputs}, checking in between for stop and
   * delete requests. Reports one progress unit per genome out of {@code totalUnits}. Files are
   * named after {@link GenomeRecord#uniqueFileStems}, so repeated genomes never overwrite each
   * other.
   */
  protected List<Path> downloadAll(
      JobContext ctx, GenomeSetInput input, ProgressReporter progress, int totalUnits) {
    Path dir = ctx.workDirectory().resolve("inputs");
    List<Path> files = new ArrayList<>();
    List<GenomeRecord> genomes = input.genomes();
    List<String> stems = GenomeRecord.uniqueFileStems(genomes);
    for (int i = 0; i < genomes.size(); i++) {
      ctx.checkpoint();
      String stem = stems.get(i);
      progress.reportProgress(totalUnits, i, "Downloading " + stem);
      files.add(downloader.download(genomes.get(i), dir, stem + ".fna"));
    }
    return files;
  }
}
