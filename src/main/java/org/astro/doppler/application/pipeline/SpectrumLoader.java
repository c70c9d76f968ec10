package org.astro.doppler.application.pipeline;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.astro.doppler.application.port.SpectrumPreprocessor;
import org.astro.doppler.application.port.SpectrumReader;
import org.astro.doppler.domain.spectrum.RawSpectrum;
import org.astro.doppler.domain.spectrum.SignalToNoise;
import org.astro.doppler.domain.spectrum.Spectrum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads, masks and normalizes one spectrum file, then confirms its signal-to-noise.
 *
 * <p>When the preprocessor leaves S/N undefined it is estimated as median flux over median error, skipping
 * NaN samples.</p>
 *
 * @since 0.1.0
 */
public final class SpectrumLoader {
  private static final Logger log = LoggerFactory.getLogger(SpectrumLoader.class);

  private final SpectrumReader reader;
  private final SpectrumPreprocessor preprocessor;
  private final Optional<String> format;

  /**
   * @param reader parser for spectrum files
   * @param preprocessor masking and normalization step
   * @param format reader format override; empty for auto-detect
   */
  public SpectrumLoader(SpectrumReader reader, SpectrumPreprocessor preprocessor, Optional<String> format) {
    this.reader = Objects.requireNonNull(reader, "reader");
    this.preprocessor = Objects.requireNonNull(preprocessor, "preprocessor");
    this.format = Objects.requireNonNull(format, "format");
  }

  /**
   * Loads and prepares the spectrum stored at {@code path}.
   *
   * @param path existing spectrum file
   * @return prepared spectrum with a confirmed S/N
   * @throws Exception when reading or preprocessing fails
   */
  public Spectrum load(Path path) throws Exception {
    RawSpectrum raw = reader.read(path, format);
    Spectrum spectrum = preprocessor.prepare(path, raw);
    if (!spectrum.hasSnr()) {
      spectrum = spectrum.withSnr(SignalToNoise.estimate(spectrum.flux(), spectrum.err()));
    }
    if (log.isDebugEnabled()) {
      log.debug(spectrum.summary());
    }
    return spectrum;
  }
}
