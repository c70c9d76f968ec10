package org.astro.doppler.application.port;

import java.nio.file.Path;
import org.astro.doppler.domain.spectrum.RawSpectrum;
import org.astro.doppler.domain.spectrum.Spectrum;

/**
 * Port applying masking and continuum normalization to raw reader output.
 *
 * @since 0.1.0
 */
public interface SpectrumPreprocessor {
  /**
   * Masks and normalizes {@code raw}.
   *
   * @param source file the spectrum was read from
   * @param raw reader output
   * @return prepared spectrum; its S/N may be {@link Double#NaN} when the preprocessor does not compute it
   * @throws Exception on preprocessing failure
   */
  Spectrum prepare(Path source, RawSpectrum raw) throws Exception;
}
