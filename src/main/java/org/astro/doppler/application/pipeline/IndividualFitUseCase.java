package org.astro.doppler.application.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.astro.doppler.application.port.MetricsPort;
import org.astro.doppler.application.port.RvFitEngine;
import org.astro.doppler.config.FitConfig;
import org.astro.doppler.domain.fit.FitResult;
import org.astro.doppler.domain.output.OutputPaths;
import org.astro.doppler.domain.spectrum.Spectrum;
import org.astro.doppler.util.PathUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Fits each input spectrum on its own and writes one container per spectrum.
 * <p><strong>Why:</strong> A bad file must not cost the rest of the batch, so missing files, load failures and
 * engine failures are recorded as {@link SpectrumOutcome}s and the loop moves on.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Skip missing inputs with a warning.</li>
 *   <li>Load, fit and write each remaining input in order.</li>
 *   <li>Collect an ordered {@link IndividualRunReport}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; intended for single-threaded batch execution.</p>
 * <p><strong>Observability:</strong> Puts the input file name under MDC key {@code spectrum} and emits
 * {@code doppler.spectra.*} counters and the {@code doppler.fit.latencyMillis} histogram.</p>
 *
 * @implNote Output write failures are not caught; they abort the run.
 * @since 0.1.0
 */
public final class IndividualFitUseCase {
  private static final Logger log = LoggerFactory.getLogger(IndividualFitUseCase.class);
  static final String MDC_KEY = "spectrum";

  private final FitConfig config;
  private final SpectrumLoader loader;
  private final RvFitEngine engine;
  private final OutputAssembler assembler;
  private final OutputPaths paths;
  private final MetricsPort metrics;

  public IndividualFitUseCase(
      FitConfig config,
      SpectrumLoader loader,
      RvFitEngine engine,
      OutputAssembler assembler,
      OutputPaths paths,
      MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.loader = Objects.requireNonNull(loader, "loader");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.assembler = Objects.requireNonNull(assembler, "assembler");
    this.paths = Objects.requireNonNull(paths, "paths");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Processes every configured input in order.
   *
   * @return ordered per-file outcomes
   * @throws IOException if writing an output container fails
   * @throws InterruptedException if interrupted while a collaborator is running
   */
  public IndividualRunReport run() throws IOException, InterruptedException {
    List<SpectrumOutcome> outcomes = new ArrayList<>(config.inputs().size());
    for (Path input : config.inputs()) {
      MDC.put(MDC_KEY, PathUtils.fileName(input).orElse(input.toString()));
      try {
        outcomes.add(process(input));
      } finally {
        MDC.remove(MDC_KEY);
      }
    }
    IndividualRunReport report = new IndividualRunReport(outcomes);
    log.info("Individual fitting finished: {} fitted, {} skipped of {} files",
        report.fitted(), report.skipped(), outcomes.size());
    return report;
  }

  private SpectrumOutcome process(Path input) throws IOException, InterruptedException {
    if (!Files.exists(input)) {
      log.warn("{} NOT FOUND, skipping", input);
      metrics.increment("doppler.spectra.skipped.missing");
      return new SpectrumOutcome.Missing(input);
    }

    Spectrum spectrum;
    try {
      spectrum = loader.load(input);
    } catch (InterruptedException ex) {
      throw ex;
    } catch (Exception ex) {
      log.error("Failed to load {}, skipping", input, ex);
      metrics.increment("doppler.spectra.skipped.load");
      return new SpectrumOutcome.LoadFailed(input, ex);
    }

    Optional<Path> figure = paths.individualFigure(input, config.figfile(), config.plot());
    FitResult result;
    long start = System.nanoTime();
    try {
      result = engine.fit(spectrum, config.mcmc(), figure, config.verbose());
    } catch (InterruptedException ex) {
      throw ex;
    } catch (Exception ex) {
      log.error("Fit failed for {}, skipping", input, ex);
      metrics.increment("doppler.spectra.skipped.fit");
      return new SpectrumOutcome.FitFailed(input, ex);
    } finally {
      metrics.observe("doppler.fit.latencyMillis", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    }
    metrics.increment("doppler.spectra.fitted");
    figure.ifPresent(path -> log.debug("Engine figure requested at {}", path));

    Path output = paths.individualOutput(input, config.outfile());
    assembler.write(output, assembler.individual(result));
    metrics.increment("doppler.output.written");
    return new SpectrumOutcome.Fitted(input, output);
  }
}
