package org.astro.doppler.testing;

import java.io.IOException;
import org.astro.doppler.application.port.PlotRenderer;
import org.astro.doppler.application.port.RvFitEngine;
import org.astro.doppler.application.port.SpectralBackend;
import org.astro.doppler.application.port.SpectrumPreprocessor;
import org.astro.doppler.application.port.SpectrumReader;
import org.astro.doppler.domain.spectrum.Spectrum;

/**
 * Backend registered for tests through {@code META-INF/services}. Files whose name contains
 * {@code corrupt} fail to read.
 */
public final class StubSpectralBackend implements SpectralBackend {
  public static final String NAME = "stub";

  private final ScriptedFitEngine engine = new ScriptedFitEngine();
  private final RecordingPlotRenderer renderer = new RecordingPlotRenderer();

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public SpectrumReader reader() {
    return (path, format) -> {
      if (path.getFileName().toString().contains("corrupt")) {
        throw new IOException("unparseable spectrum " + path);
      }
      return TestSpectra.raw();
    };
  }

  @Override
  public SpectrumPreprocessor preprocessor() {
    return (source, raw) -> new Spectrum(
        source, raw.flux(), raw.err(), raw.wave(), raw.mask(), TestSpectra.filled(raw.size(), 1.0), Double.NaN);
  }

  @Override
  public RvFitEngine engine() {
    return engine;
  }

  @Override
  public PlotRenderer renderer() {
    return renderer;
  }
}
