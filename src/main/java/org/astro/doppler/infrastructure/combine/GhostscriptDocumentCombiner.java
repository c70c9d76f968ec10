package org.astro.doppler.infrastructure.combine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.astro.doppler.application.port.DocumentCombiner;
import org.astro.doppler.logging.Logs;
import org.astro.doppler.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges PDF documents with Ghostscript's {@code pdfwrite} device.
 *
 * <p>Runs {@code gs -dBATCH -dNOPAUSE -q -sDEVICE=pdfwrite -sOutputFile=OUT IN...} and blocks until the
 * process exits; there is no timeout. Standard error is folded into standard output and logged truncated.</p>
 *
 * @since 0.1.0
 */
public final class GhostscriptDocumentCombiner implements DocumentCombiner {
  private static final Logger log = LoggerFactory.getLogger(GhostscriptDocumentCombiner.class);
  private static final int MAX_LOGGED_OUTPUT = 2_000;

  private final String executable;

  /**
   * @param executable Ghostscript executable name or path (usually {@code gs})
   */
  public GhostscriptDocumentCombiner(String executable) {
    this.executable = Strings.requireNonBlank("combiner", executable).trim();
  }

  List<String> command(List<Path> inputs, Path output) {
    List<String> command = new ArrayList<>(inputs.size() + 6);
    command.add(executable);
    command.add("-dBATCH");
    command.add("-dNOPAUSE");
    command.add("-q");
    command.add("-sDEVICE=pdfwrite");
    command.add("-sOutputFile=" + output);
    for (Path input : inputs) {
      command.add(input.toString());
    }
    return command;
  }

  @Override
  public void combine(List<Path> inputs, Path output) throws IOException, InterruptedException {
    Objects.requireNonNull(inputs, "inputs");
    Objects.requireNonNull(output, "output");
    if (inputs.isEmpty()) {
      throw new IllegalArgumentException("at least one document is required");
    }
    List<String> command = command(inputs, output);
    log.debug("Running {}", String.join(" ", command));

    ProcessBuilder builder = new ProcessBuilder(command);
    builder.redirectErrorStream(true);
    Process process = builder.start();
    String toolOutput;
    int exit;
    try {
      toolOutput = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).strip();
      exit = process.waitFor();
    } finally {
      destroyIfAlive(process);
    }
    String truncated = Logs.truncate(toolOutput, MAX_LOGGED_OUTPUT);
    if (exit != 0) {
      log.error("{} failed with status {} combining {} documents into {}", executable, exit, inputs.size(), output);
      throw new CombinerFailureException(executable, exit, truncated);
    }
    if (!toolOutput.isEmpty()) {
      log.debug("{} output: {}", executable, truncated);
    }
  }

  private void destroyIfAlive(Process process) {
    if (process.isAlive()) {
      log.warn("Stopping {} (pid {}) abandoned before it exited", executable, process.pid());
      process.destroyForcibly();
    }
  }
}
