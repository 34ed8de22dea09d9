package com.gentoro.genopipe.jobs.adapters;

import com.gentoro.genopipe.artifacts.FileKind;
import com.gentoro.genopipe.genome.GenomeDownloader;
import com.gentoro.genopipe.jobs.AdapterResult;
import com.gentoro.genopipe.jobs.GenomeSetInput;
import com.gentoro.genopipe.jobs.JobContext;
import com.gentoro.genopipe.jobs.JobType;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** Screens a genome set against VFDB and produces the {@code vfdb_results.xlsx} workbook. */
public class VfdbAdapter extends GenomeSetAdapter {
  private final ExternalToolRunner tool;

  public VfdbAdapter(GenomeDownloader downloader, ExternalToolRunner tool) {
    super(downloader);
    this.tool = tool;
  }

  @Override
  public JobType type() {
    return JobType.VFDB;
  }

  @Override
  public AdapterResult run(JobContext ctx, GenomeSetInput input, ProgressReporter progress)
      throws Exception {
    int total = input.genomes().size() + 1;
    List<Path> fasta = downloadAll(ctx, input, progress, total);
    ctx.checkpoint();

    progress.reportProgress(total, total - 1, "Running VFDB screen");
    Path output = ctx.workDirectory().resolve(FileKind.VFDB_EXCEL.filename(ctx.jobId()));
    tool.run(ctx, fasta, output);

    return AdapterResult.artifacts(
        "VFDB analysis completed for %d genome(s)".formatted(fasta.size()),
        Map.of(FileKind.VFDB_EXCEL, output));
  }
}
