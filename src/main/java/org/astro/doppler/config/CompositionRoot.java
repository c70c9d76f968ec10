package org.astro.doppler.config;

import java.util.Locale;
import java.util.Objects;
import org.astro.doppler.application.pipeline.FitRunner;
import org.astro.doppler.application.pipeline.IndividualFitUseCase;
import org.astro.doppler.application.pipeline.JointFitUseCase;
import org.astro.doppler.application.pipeline.JointPlotPipeline;
import org.astro.doppler.application.pipeline.OutputAssembler;
import org.astro.doppler.application.pipeline.SpectrumLoader;
import org.astro.doppler.application.port.ContainerWriter;
import org.astro.doppler.application.port.DocumentCombiner;
import org.astro.doppler.application.port.MetricsPort;
import org.astro.doppler.application.port.SpectralBackend;
import org.astro.doppler.domain.output.OutputPaths;
import org.astro.doppler.infrastructure.backend.SpectralBackendLocator;
import org.astro.doppler.infrastructure.combine.GhostscriptDocumentCombiner;
import org.astro.doppler.infrastructure.container.FitsContainerWriter;
import org.astro.doppler.infrastructure.metrics.NoOpMetricsAdapter;
import org.astro.doppler.infrastructure.metrics.OpenTelemetryMetricsAdapter;

/**
 * <strong>What:</strong> Central composition root wiring the fit drivers to concrete adapters.
 * <p><strong>Why:</strong> Provides a single place to translate a {@link FitConfig} into a runnable
 * {@link FitRunner}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Locate the spectral backend and create the FITS writer and Ghostscript combiner.</li>
 *   <li>Construct the individual and joint use cases over shared collaborators.</li>
 *   <li>Share the caller's metrics port with every driver; the caller closes it when the run ends.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods create new instances.</p>
 *
 * @since 0.1.0
 * @see org.astro.doppler.application.pipeline.IndividualFitUseCase
 * @see org.astro.doppler.application.pipeline.JointFitUseCase
 */
public final class CompositionRoot {
  private final FitConfig config;
  private final SpectralBackend backend;
  private final ContainerWriter writer;
  private final DocumentCombiner combiner;
  private final MetricsPort metrics;

  /**
   * Creates a composition root using the installed backend and the shipped adapters.
   *
   * @param config resolved run configuration
   * @param metrics metrics adapter used by the drivers
   * @throws IllegalStateException if no suitable spectral backend is installed
   */
  public CompositionRoot(FitConfig config, MetricsPort metrics) {
    this(
        config,
        SpectralBackendLocator.locate(config.backend()),
        new FitsContainerWriter(),
        new GhostscriptDocumentCombiner(config.combiner()),
        metrics);
  }

  /**
   * Creates a composition root with explicit collaborators.
   *
   * @param config resolved run configuration
   * @param backend numerical collaborators
   * @param writer container writer
   * @param combiner document combiner
   * @param metrics metrics adapter
   */
  public CompositionRoot(
      FitConfig config,
      SpectralBackend backend,
      ContainerWriter writer,
      DocumentCombiner combiner,
      MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.backend = Objects.requireNonNull(backend, "backend");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.combiner = Objects.requireNonNull(combiner, "combiner");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Chooses a metrics adapter for the configured exporter.
   *
   * @param exporter {@code otlp} or {@code none}
   * @return OpenTelemetry adapter for {@code otlp}, otherwise a no-op adapter
   */
  public static MetricsPort metricsFor(String exporter) {
    String normalized = exporter == null ? "none" : exporter.trim().toLowerCase(Locale.ROOT);
    return "otlp".equals(normalized) ? new OpenTelemetryMetricsAdapter() : new NoOpMetricsAdapter();
  }

  public SpectralBackend backend() {
    return backend;
  }

  public OutputPaths outputPaths() {
    return new OutputPaths(config.outdir());
  }

  public SpectrumLoader spectrumLoader() {
    return new SpectrumLoader(backend.reader(), backend.preprocessor(), config.reader());
  }

  public OutputAssembler outputAssembler() {
    return new OutputAssembler(writer);
  }

  public IndividualFitUseCase individualFitUseCase() {
    return new IndividualFitUseCase(
        config, spectrumLoader(), backend.engine(), outputAssembler(), outputPaths(), metrics);
  }

  public JointPlotPipeline jointPlotPipeline() {
    return new JointPlotPipeline(backend.renderer(), combiner, outputPaths(), metrics, config.verbose());
  }

  public JointFitUseCase jointFitUseCase() {
    return new JointFitUseCase(
        config,
        spectrumLoader(),
        backend.engine(),
        outputAssembler(),
        outputPaths(),
        jointPlotPipeline(),
        metrics);
  }

  public FitRunner fitRunner() {
    return new FitRunner(config, individualFitUseCase(), jointFitUseCase());
  }
}
