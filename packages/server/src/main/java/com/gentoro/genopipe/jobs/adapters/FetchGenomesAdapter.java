package com.gentoro.genopipe.jobs.adapters;

import com.gentoro.genopipe.exception.ValidationException;
import com.gentoro.genopipe.genome.GenomeRecord;
import com.gentoro.genopipe.genome.NcbiAssemblyClient;
import com.gentoro.genopipe.jobs.AdapterResult;
import com.gentoro.genopipe.jobs.BioProjectInput;
import com.gentoro.genopipe.jobs.JobAdapter;
import com.gentoro.genopipe.jobs.JobContext;
import com.gentoro.genopipe.jobs.JobType;
import com.gentoro.genopipe.logging.LoggingService;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;

/** Resolves a BioProject to its genome assemblies. */
public class FetchGenomesAdapter implements JobAdapter<BioProjectInput> {
  private static final Logger log = LoggingService.getLogger(FetchGenomesAdapter.class);
  private static final Pattern BIOPROJECT = Pattern.compile("PRJ[A-Z]{1,2}\\d+");

  private final NcbiAssemblyClient ncbi;

  public FetchGenomesAdapter(NcbiAssemblyClient ncbi) {
    this.ncbi = ncbi;
  }

  @Override
  public JobType type() {
    return JobType.FETCH_GENOMES;
  }

  @Override
  public Class<BioProjectInput> inputType() {
    return BioProjectInput.class;
  }

  @Override
  public void validate(BioProjectInput input) {
    String id = input.bioprojectId();
    if (id == null || id.isEmpty()) {
      throw new ValidationException("BioProject ID is required");
    }
    if (!BIOPROJECT.matcher(id).matches()) {
      throw new ValidationException("Invalid BioProject ID: " + id)
          .with("bioproject_id", id);
    }
  }

  @Override
  public AdapterResult run(JobContext ctx, BioProjectInput input, ProgressReporter progress) {
    progress.reportProgress(-1, -1, "Querying NCBI for " + input.bioprojectId());
    List<GenomeRecord> genomes = ncbi.fetchAssemblies(input.bioprojectId());
    ctx.checkpoint();
    log.info(
        "Job {}: BioProject {} resolved to {} genome(s)",
        ctx.jobId(),
        input.bioprojectId(),
        genomes.size());
    return AdapterResult.genomes(genomes);
  }
}
