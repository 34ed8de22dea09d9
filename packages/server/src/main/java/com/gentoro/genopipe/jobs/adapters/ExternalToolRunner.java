package com.gentoro.genopipe.jobs.adapters;

import com.gentoro.genopipe.exception.AdapterException;
import com.gentoro.genopipe.exception.ConfigException;
import com.gentoro.genopipe.exception.JobCancelledException;
import com.gentoro.genopipe.jobs.JobContext;
import com.gentoro.genopipe.logging.LoggingService;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * Runs an analysis tool as an external process. The command is a list of arguments in which
 * {@code {output}} and {@code {output_dir}} are replaced by the expected output file and its
 * directory, and an argument that is exactly {@code {inputs}} expands to one argument per input
 * FASTA file.
 */
public class ExternalToolRunner {
  private static final Logger log = LoggingService.getLogger(ExternalToolRunner.class);
  private static final int TAIL_LINES = 20;

  private final String toolName;
  private final List<String> commandTemplate;

  public ExternalToolRunner(String toolName, List<String> commandTemplate) {
    this.toolName = toolName;
    this.commandTemplate = commandTemplate == null ? List.of() : List.copyOf(commandTemplate);
  }

  public String toolName() {
    return toolName;
  }

  List<String> command(List<Path> inputs, Path output) {
    if (commandTemplate.isEmpty()) {
      throw new ConfigException("No command configured for " + toolName);
    }
    Path outputDir = output.toAbsolutePath().getParent();
    List<String> command = new ArrayList<>();
    for (String arg : commandTemplate) {
      if ("{inputs}".equals(arg)) {
        inputs.forEach(p -> command.add(p.toAbsolutePath().toString()));
      } else {
        command.add(
            arg.replace("{output}", output.toAbsolutePath().toString())
                .replace("{output_dir}", outputDir.toString()));
      }
    }
    return command;
  }

  /**
   * Runs the tool in the job workspace and waits for it. The process is destroyed if the job is
   * deleted meanwhile.
   *
   * @throws AdapterException if the tool exits with a non-zero code or writes no output file
   */
  public Path run(JobContext ctx, List<Path> inputs, Path output)
      throws IOException, InterruptedException {
    List<String> command = command(inputs, output);
    Path console = ctx.workDirectory().resolve(toolName.toLowerCase() + ".log");
    log.info("Job {}: running {}", ctx.jobId(), String.join(" ", command));

    Process process =
        new ProcessBuilder(command)
            .directory(ctx.workDirectory().toFile())
            .redirectErrorStream(true)
            .redirectOutput(console.toFile())
            .start();
    try {
      while (!process.waitFor(1, TimeUnit.SECONDS)) {
        if (ctx.isCancelled()) {
          process.destroyForcibly();
          throw new JobCancelledException(ctx.jobId());
        }
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      throw e;
    }

    String tail = tail(console);
    if (!tail.isEmpty()) {
      log.debug("Job {}: {} output:\n{}", ctx.jobId(), toolName, tail);
    }
    int exit = process.exitValue();
    if (exit != 0) {
      throw new AdapterException(
              "%s failed with exit code %d%s"
                  .formatted(toolName, exit, tail.isEmpty() ? "" : ": " + lastLine(tail)))
          .with("exit_code", exit);
    }
    if (!Files.isRegularFile(output)) {
      throw new AdapterException(toolName + " did not produce output file");
    }
    return output;
  }

  private static String tail(Path console) throws IOException {
    if (!Files.exists(console)) return "";
    List<String> lines =
        new String(Files.readAllBytes(console), StandardCharsets.UTF_8).lines().toList();
    return String.join("\n", lines.subList(Math.max(0, lines.size() - TAIL_LINES), lines.size()))
        .strip();
  }

  private static String lastLine(String text) {
    return text.substring(text.lastIndexOf('\n') + 1);
  }
}
