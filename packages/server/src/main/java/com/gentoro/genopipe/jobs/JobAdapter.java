package com.gentoro.genopipe.jobs;

/**
 * SPI implemented by each kind of long-running external operation. One adapter is registered per
 * {@link JobType}.
 *
 * @param <I> typed input the adapter consumes
 */
public interface JobAdapter<I extends JobInput> {

  JobType type();

  Class<I> inputType();

  /**
   * Rejects empty or malformed input. Called on the submitting thread, before any job record
   * exists.
   *
   * @throws com.gentoro.genopipe.exception.ValidationException if the input cannot be acted on
   */
  void validate(I input);

  /**
   * Runs the operation. Adapters call {@link JobContext#checkpoint()} between units of work and
   * never touch the registry or the artifact store; produced files are returned in the {@link
   * AdapterResult} and published by the executor.
   */
  AdapterResult run(JobContext ctx, I input, ProgressReporter progressReporter) throws Exception;

  interface ProgressReporter {
    /** Reports that {@code current} of {@code total} units are done ({@code -1} if unknown). */
    void reportProgress(long total, long current, String message);
  }
}
