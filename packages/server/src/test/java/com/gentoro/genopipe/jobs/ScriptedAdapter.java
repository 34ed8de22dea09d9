package com.gentoro.genopipe.jobs;

import com.gentoro.genopipe.exception.ValidationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** Test adapter whose behavior is supplied per test, with latches to hold it mid-run. */
public class ScriptedAdapter implements JobAdapter<GenomeSetInput> {

  @FunctionalInterface
  public interface Script {
    AdapterResult run(JobContext ctx, GenomeSetInput input, ProgressReporter progress)
        throws Exception;
  }

  private final JobType type;
  private final Script script;
  public final CountDownLatch started = new CountDownLatch(1);
  public final CountDownLatch proceed = new CountDownLatch(1);
  public final CountDownLatch finished = new CountDownLatch(1);

  public ScriptedAdapter(JobType type, Script script) {
    this.type = type;
    this.script = script;
  }

  @Override
  public JobType type() {
    return type;
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
  }

  @Override
  public AdapterResult run(JobContext ctx, GenomeSetInput input, ProgressReporter progress)
      throws Exception {
    try {
      return script.run(ctx, input, progress);
    } finally {
      finished.countDown();
    }
  }

  /** Signals {@link #started} and blocks until {@link #proceed} is released. */
  public void hold() throws InterruptedException {
    started.countDown();
    if (!proceed.await(10, TimeUnit.SECONDS)) {
      throw new IllegalStateException("test never released the adapter");
    }
  }
}
