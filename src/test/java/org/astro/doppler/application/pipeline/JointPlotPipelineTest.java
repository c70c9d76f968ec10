package org.astro.doppler.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.astro.doppler.domain.fit.JointFitResult;
import org.astro.doppler.domain.output.OutputPaths;
import org.astro.doppler.domain.spectrum.Spectrum;
import org.astro.doppler.testing.FakeDocumentCombiner;
import org.astro.doppler.testing.RecordingMetricsPort;
import org.astro.doppler.testing.RecordingPlotRenderer;
import org.astro.doppler.testing.ScriptedFitEngine;
import org.astro.doppler.testing.TestSpectra;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JointPlotPipelineTest {
  @TempDir Path tempDir;

  private final RecordingPlotRenderer renderer = new RecordingPlotRenderer();
  private final FakeDocumentCombiner combiner = new FakeDocumentCombiner();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void combinesVectorFiguresInInputOrder() throws Exception {
    List<Path> inputs = List.of(tempDir.resolve("a.fits"), tempDir.resolve("b.fits"));
    List<Spectrum> originals = spectra(inputs);

    Path combined = pipeline().run(inputs, originals, fit(originals), Optional.empty());

    assertEquals(tempDir.resolve("a_dopjointfit_all.pdf"), combined);
    assertEquals(
        List.of(List.of(tempDir.resolve("a_dopjointfit.pdf"), tempDir.resolve("b_dopjointfit.pdf"))),
        combiner.calls());
    assertEquals(List.of("a_dopjointfit.pdf", "b_dopjointfit.pdf"), Files.readAllLines(combined));
  }

  @Test
  void overlayIsContinuumCorrectedOriginal() throws Exception {
    List<Path> inputs = List.of(tempDir.resolve("a.fits"), tempDir.resolve("b.fits"));
    List<Spectrum> originals = spectra(inputs);

    pipeline().run(inputs, originals, fit(originals), Optional.empty());

    double scale = ScriptedFitEngine.MATCHED_CONTINUUM_SCALE;
    Spectrum overlay = renderer.overlays().get(0);
    double[] expectedFlux = originals.get(0).flux();
    for (int i = 0; i < expectedFlux.length; i++) {
      expectedFlux[i] /= scale;
    }
    assertArrayEquals(expectedFlux, overlay.flux(), 1e-9);
    assertArrayEquals(TestSpectra.filled(TestSpectra.PIXELS, scale), overlay.continuum(), 1e-9);
  }

  @Test
  void replacesExistingCombinedDocument() throws Exception {
    List<Path> inputs = List.of(tempDir.resolve("a.fits"), tempDir.resolve("b.fits"));
    List<Spectrum> originals = spectra(inputs);
    Path explicit = Files.writeString(tempDir.resolve("all.pdf"), "old");

    Path combined = pipeline().run(inputs, originals, fit(originals), Optional.of(explicit));

    assertSame(explicit, combined);
    assertEquals(List.of("a_dopjointfit.pdf", "b_dopjointfit.pdf"), Files.readAllLines(explicit));
  }

  @Test
  void combinerFailureKeepsVectorFigures() throws Exception {
    combiner.failWith(new IOException("gs exited with 1"));
    List<Path> inputs = List.of(tempDir.resolve("a.fits"), tempDir.resolve("b.fits"));
    List<Spectrum> originals = spectra(inputs);
    JointFitResult result = fit(originals);
    JointPlotPipeline pipeline = pipeline();

    IOException ex = assertThrows(IOException.class, () -> pipeline.run(inputs, originals, result, Optional.empty()));

    assertEquals("gs exited with 1", ex.getMessage());
    assertTrue(Files.exists(tempDir.resolve("a_dopjointfit.pdf")));
    assertTrue(Files.exists(tempDir.resolve("b_dopjointfit.pdf")));
    assertEquals(0, metrics.count("doppler.documents.combined"));
    assertEquals(4, metrics.count("doppler.plots.rendered"));
  }

  @Test
  void rejectsMisalignedInputs() throws Exception {
    List<Path> inputs = List.of(tempDir.resolve("a.fits"), tempDir.resolve("b.fits"));
    List<Spectrum> originals = spectra(inputs);
    JointFitResult result = fit(originals);
    JointPlotPipeline pipeline = pipeline();

    assertThrows(
        IllegalArgumentException.class,
        () -> pipeline.run(inputs.subList(0, 1), originals, result, Optional.empty()));
  }

  private JointPlotPipeline pipeline() {
    return new JointPlotPipeline(renderer, combiner, new OutputPaths(Optional.empty()), metrics, false);
  }

  private static List<Spectrum> spectra(List<Path> inputs) {
    return inputs.stream().map(TestSpectra::spectrum).toList();
  }

  private static JointFitResult fit(List<Spectrum> spectra) throws Exception {
    return new ScriptedFitEngine().jointFit(spectra, false, true, 10.0, false, Optional.empty());
  }
}
