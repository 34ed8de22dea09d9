package com.gentoro.genopipe.jobs.adapters;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.gentoro.genopipe.artifacts.ArtifactManager;
import com.gentoro.genopipe.artifacts.FileKind;
import com.gentoro.genopipe.artifacts.ZipBundler;
import com.gentoro.genopipe.exception.AdapterException;
import com.gentoro.genopipe.exception.ExceptionUtil;
import com.gentoro.genopipe.genome.GenomeDownloader;
import com.gentoro.genopipe.genome.GenomeRecord;
import com.gentoro.genopipe.jobs.AdapterResult;
import com.gentoro.genopipe.jobs.GenomeSetInput;
import com.gentoro.genopipe.jobs.JobContext;
import com.gentoro.genopipe.jobs.JobType;
import com.gentoro.genopipe.logging.LoggingService;
import com.gentoro.genopipe.utility.JacksonUtility;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Submits each genome to PHASTEST, polls until the prediction completes and downloads the result
 * archive. Produces {@code phastest_results.csv} with one line per genome, carrying the prophage
 * counts read from each archive, and, when at least one archive was downloaded, {@code
 * phastest_results_<job_id>.zip} bundling them. The per-genome {@code .PHASTEST.zip} files are
 * also published to the {@value ArtifactManager#PHASTEST_RESULTS} namespace.
 *
 * <p>A genome that PHASTEST rejects is recorded as failed in the summary; the job only fails when
 * no genome succeeds or PHASTEST becomes unreachable.
 */
public class PhastestAdapter extends GenomeSetAdapter {
  private static final Logger log = LoggingService.getLogger(PhastestAdapter.class);
  static final String SUBMISSION_LINK = "https://phastest.ca/submissions/";

  private final PhastestClient client;
  private final Duration pollInterval;

  public PhastestAdapter(
      GenomeDownloader downloader, PhastestClient client, Duration pollInterval) {
    super(downloader);
    this.client = client;
    this.pollInterval = pollInterval;
  }

  @Override
  public JobType type() {
    return JobType.PHASTEST;
  }

  @Override
  public AdapterResult run(JobContext ctx, GenomeSetInput input, ProgressReporter progress)
      throws Exception {
    List<GenomeRecord> genomes = input.genomes();
    int total = genomes.size();
    Path inputs = ctx.workDirectory().resolve("inputs");
    Path zips = ctx.workDirectory().resolve("phastest");
    List<PhastestSummaryRow> rows = new ArrayList<>();
    List<Path> archives = new ArrayList<>();

    List<String> stems = GenomeRecord.uniqueFileStems(genomes);
    for (int i = 0; i < total; i++) {
      ctx.checkpoint();
      GenomeRecord genome = genomes.get(i);
      String name = stems.get(i);
      progress.reportProgress(total, i, "Submitting " + name + " to PHASTEST");

      Path fasta = downloader.download(genome, inputs, name + ".fna");
      String submissionId;
      try {
        submissionId = client.submit(fasta);
      } catch (AdapterException e) {
        log.warn("Job {}: {}", ctx.jobId(), e.getMessage());
        rows.add(
            row(genome, name, null, "failed: " + ExceptionUtil.extractErrorMessage(e), null));
        continue;
      }

      PhastestClient.SubmissionStatus status =
          awaitCompletion(ctx, submissionId, progress, total, i);
      if (status == null) {
        rows.add(row(genome, name, submissionId, "failed: PHASTEST reported an error", null));
        continue;
      }
      Path archive = client.downloadZip(status.zipUrl(), zips.resolve(name + ".PHASTEST.zip"));
      archives.add(archive);
      rows.add(row(genome, name, submissionId, status.status(), archive));
    }

    if (archives.isEmpty()) {
      throw new AdapterException(
          "PHASTEST produced no results for any of the %d genome(s)".formatted(total));
    }
    ctx.checkpoint();
    progress.reportProgress(total, total, "Writing PHASTEST summary");

    Map<FileKind, Path> files = new EnumMap<>(FileKind.class);
    Path csv = ctx.workDirectory().resolve(FileKind.PHASTEST_CSV.filename(ctx.jobId()));
    writeSummary(rows, csv);
    files.put(FileKind.PHASTEST_CSV, csv);
    Path bundle = ctx.workDirectory().resolve(FileKind.PHASTEST_ZIP.filename(ctx.jobId()));
    ZipBundler.writeZip(archives, bundle);
    files.put(FileKind.PHASTEST_ZIP, bundle);

    return AdapterResult.artifacts(
            "PHASTEST analysis completed for %d of %d genome(s)".formatted(archives.size(), total),
            files)
        .withTemporary(ArtifactManager.PHASTEST_RESULTS, archives);
  }

  /** Polls until complete; returns null if PHASTEST reports an error for the submission. */
  private PhastestClient.SubmissionStatus awaitCompletion(
      JobContext ctx, String submissionId, ProgressReporter progress, int total, int index)
      throws InterruptedException {
    while (true) {
      PhastestClient.SubmissionStatus status;
      try {
        status = client.poll(submissionId);
      } catch (AdapterException e) {
        log.warn("Job {}: {}", ctx.jobId(), e.getMessage());
        return null;
      }
      if (status.isComplete()) {
        return status;
      }
      progress.reportProgress(
          total, index, "PHASTEST submission %s: %s".formatted(submissionId, status.status()));
      ctx.sleep(pollInterval);
      ctx.checkpoint();
    }
  }

  private static PhastestSummaryRow row(
      GenomeRecord genome, String name, String submissionId, String status, Path archive) {
    return PhastestSummaryRow.of(
        name,
        genome.assemblyAccession(),
        submissionId,
        status,
        archive == null ? null : archive.getFileName().toString(),
        archive == null ? null : PhageRegionCounts.read(archive).orElse(null),
        submissionId == null ? null : SUBMISSION_LINK + submissionId);
  }

  static void writeSummary(List<PhastestSummaryRow> rows, Path csv) throws IOException {
    CsvMapper mapper = JacksonUtility.getCsvMapper();
    CsvSchema schema = mapper.schemaFor(PhastestSummaryRow.class).withHeader();
    try (Writer writer = Files.newBufferedWriter(csv, StandardCharsets.UTF_8);
        SequenceWriter out = mapper.writer(schema).writeValues(writer)) {
      out.writeAll(rows);
    }
  }
}
