package com.gentoro.genopipe.jobs.adapters;

import com.gentoro.genopipe.artifacts.ArtifactManager;
import com.gentoro.genopipe.artifacts.FileKind;
import com.gentoro.genopipe.genome.GenomeDownloader;
import com.gentoro.genopipe.jobs.AdapterResult;
import com.gentoro.genopipe.jobs.GenomeSetInput;
import com.gentoro.genopipe.jobs.JobContext;
import com.gentoro.genopipe.jobs.JobType;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Runs ResFinder over a genome set and produces {@code resfinder_results.csv}. The downloaded
 * FASTA inputs are kept in the {@value ArtifactManager#RESFINDER_INPUTS} namespace for the
 * PHASTEST fallback bundle.
 */
public class ResFinderAdapter extends GenomeSetAdapter {
  private final ExternalToolRunner tool;

  public ResFinderAdapter(GenomeDownloader downloader, ExternalToolRunner tool) {
    super(downloader);
    this.tool = tool;
  }

  @Override
  public JobType type() {
    return JobType.RESFINDER;
  }

  @Override
  public AdapterResult run(JobContext ctx, GenomeSetInput input, ProgressReporter progress)
      throws Exception {
    int total = input.genomes().size() + 1;
    List<Path> fasta = downloadAll(ctx, input, progress, total);
    ctx.checkpoint();

    progress.reportProgress(
        total, total - 1, "Running ResFinder on %d genome(s)".formatted(fasta.size()));
    Path output = ctx.workDirectory().resolve(FileKind.RESFINDER_CSV.filename(ctx.jobId()));
    tool.run(ctx, fasta, output);

    return AdapterResult.artifacts(
            "ResFinder analysis completed for %d genome(s)".formatted(fasta.size()),
            Map.of(FileKind.RESFINDER_CSV, output))
        .withTemporary(ArtifactManager.RESFINDER_INPUTS, fasta);
  }
}
