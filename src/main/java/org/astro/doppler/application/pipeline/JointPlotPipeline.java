package org.astro.doppler.application.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.astro.doppler.application.port.DocumentCombiner;
import org.astro.doppler.application.port.MetricsPort;
import org.astro.doppler.application.port.PlotRenderer;
import org.astro.doppler.domain.fit.JointFitResult;
import org.astro.doppler.domain.output.ArtifactKind;
import org.astro.doppler.domain.output.OutputPaths;
import org.astro.doppler.domain.spectrum.ContinuumCorrection;
import org.astro.doppler.domain.spectrum.Spectrum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Draws per-spectrum diagnostic figures after a joint fit and merges the vector copies
 * into one document.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Back-correct each original spectrum to the fitted continuum for the overlay.</li>
 *   <li>Render an image and a vector figure per spectrum, in input order.</li>
 *   <li>Replace the combined document and delete the per-spectrum vector files once merged.</li>
 * </ul>
 * <p>A combiner failure propagates and leaves the per-spectrum vector files in place. Image figures are
 * always kept.</p>
 *
 * @since 0.1.0
 */
public final class JointPlotPipeline {
  private static final Logger log = LoggerFactory.getLogger(JointPlotPipeline.class);

  private final PlotRenderer renderer;
  private final DocumentCombiner combiner;
  private final OutputPaths paths;
  private final MetricsPort metrics;
  private final boolean verbose;

  public JointPlotPipeline(
      PlotRenderer renderer, DocumentCombiner combiner, OutputPaths paths, MetricsPort metrics, boolean verbose) {
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.combiner = Objects.requireNonNull(combiner, "combiner");
    this.paths = Objects.requireNonNull(paths, "paths");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.verbose = verbose;
  }

  /**
   * Renders all figures and produces the combined document.
   *
   * @param inputs input paths in order
   * @param originals spectra as loaded before the fit, aligned with {@code inputs}
   * @param result joint fit result aligned with {@code inputs}
   * @param explicitCombined user-supplied combined document path
   * @return path of the combined document
   * @throws Exception when rendering fails or the combiner exits non-zero
   */
  public Path run(
      List<Path> inputs, List<Spectrum> originals, JointFitResult result, Optional<Path> explicitCombined)
      throws Exception {
    if (inputs.size() != originals.size() || inputs.size() != result.spectrumCount()) {
      throw new IllegalArgumentException("inputs, spectra and fit results must be aligned: "
          + inputs.size() + "/" + originals.size() + "/" + result.spectrumCount());
    }
    List<Path> vectorDocuments = new ArrayList<>(inputs.size());
    for (int i = 0; i < inputs.size(); i++) {
      Path input = inputs.get(i);
      Spectrum matched = result.matched().get(i);
      Spectrum overlay = ContinuumCorrection.between(matched, originals.get(i)).applyTo(originals.get(i));
      Path image = paths.derive(input, ArtifactKind.JOINT_FIGURE_IMAGE);
      Path vector = paths.derive(input, ArtifactKind.JOINT_FIGURE_VECTOR);
      for (Path figure : List.of(image, vector)) {
        renderer.render(
            figure, matched, result.models().get(i), result.finalParameters().row(i), overlay, verbose);
        metrics.increment("doppler.plots.rendered");
        log.debug("Rendered {}", figure);
      }
      vectorDocuments.add(vector);
    }

    Path combined = paths.combinedDocument(inputs, explicitCombined);
    if (Files.deleteIfExists(combined)) {
      log.debug("Removed existing combined document {}", combined);
    }
    combiner.combine(vectorDocuments, combined);
    metrics.increment("doppler.documents.combined");
    log.info("Combined {} figures into {}", vectorDocuments.size(), combined);
    for (Path vector : vectorDocuments) {
      deleteFigure(vector);
    }
    return combined;
  }

  private static void deleteFigure(Path path) throws IOException {
    if (!Files.deleteIfExists(path)) {
      log.warn("Expected figure {} was not present for cleanup", path);
    }
  }
}
