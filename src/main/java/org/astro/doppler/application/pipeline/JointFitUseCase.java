package org.astro.doppler.application.pipeline;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.astro.doppler.application.port.MetricsPort;
import org.astro.doppler.application.port.RvFitEngine;
import org.astro.doppler.config.FitConfig;
import org.astro.doppler.domain.fit.JointFitResult;
import org.astro.doppler.domain.output.OutputPaths;
import org.astro.doppler.domain.spectrum.Spectrum;
import org.astro.doppler.util.PathUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Loads every input, runs one joint fit and writes a single combined container.
 * <p><strong>Why:</strong> A joint fit is undefined over a partial set of spectra, so any missing or unreadable
 * input aborts the run before the engine is called.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; intended for single-threaded batch execution.</p>
 * <p><strong>Observability:</strong> Emits {@code doppler.joint.fits}, {@code doppler.output.written} and the
 * {@code doppler.fit.latencyMillis} histogram.</p>
 *
 * @since 0.1.0
 */
public final class JointFitUseCase {
  private static final Logger log = LoggerFactory.getLogger(JointFitUseCase.class);

  private final FitConfig config;
  private final SpectrumLoader loader;
  private final RvFitEngine engine;
  private final OutputAssembler assembler;
  private final OutputPaths paths;
  private final JointPlotPipeline plots;
  private final MetricsPort metrics;

  public JointFitUseCase(
      FitConfig config,
      SpectrumLoader loader,
      RvFitEngine engine,
      OutputAssembler assembler,
      OutputPaths paths,
      JointPlotPipeline plots,
      MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.loader = Objects.requireNonNull(loader, "loader");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.assembler = Objects.requireNonNull(assembler, "assembler");
    this.paths = Objects.requireNonNull(paths, "paths");
    this.plots = Objects.requireNonNull(plots, "plots");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs the joint fit.
   *
   * @return paths written by the run
   * @throws NoSuchFileException if any input is missing; nothing has been fitted or written
   * @throws Exception if loading, fitting, writing, rendering or combining fails
   */
  public JointRunResult run() throws Exception {
    List<Path> inputs = config.inputs();
    for (Path input : inputs) {
      if (!Files.exists(input)) {
        throw new NoSuchFileException(input.toString(), null, "joint fit input not found");
      }
    }

    List<Spectrum> spectra = new ArrayList<>(inputs.size());
    for (Path input : inputs) {
      MDC.put(IndividualFitUseCase.MDC_KEY, PathUtils.fileName(input).orElse(input.toString()));
      try {
        spectra.add(loader.load(input));
      } finally {
        MDC.remove(IndividualFitUseCase.MDC_KEY);
      }
    }

    log.info("Running joint fit over {} spectra", spectra.size());
    long start = System.nanoTime();
    JointFitResult result;
    try {
      result = engine.jointFit(
          spectra, config.mcmc(), config.plot(), config.snrCutoff(), config.verbose(), config.outdir());
    } finally {
      metrics.observe("doppler.fit.latencyMillis", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    }
    if (result.spectrumCount() != spectra.size()) {
      throw new IllegalStateException(
          "joint fit returned " + result.spectrumCount() + " results for " + spectra.size() + " spectra");
    }
    metrics.increment("doppler.joint.fits");

    Path output = paths.jointOutput(inputs, config.outfile());
    assembler.write(output, assembler.joint(result));
    metrics.increment("doppler.output.written");

    Optional<Path> combined = Optional.empty();
    if (config.plot()) {
      combined = Optional.of(plots.run(inputs, spectra, result, config.figfile()));
    }
    return new JointRunResult(output, combined);
  }

  /**
   * Files produced by a joint run.
   *
   * @param output joint output container
   * @param combinedDocument combined diagnostic document, when plotting was enabled
   */
  public record JointRunResult(Path output, Optional<Path> combinedDocument) {}
}
