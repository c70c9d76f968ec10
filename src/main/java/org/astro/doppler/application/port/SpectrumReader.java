package org.astro.doppler.application.port;

import java.nio.file.Path;
import java.util.Optional;
import org.astro.doppler.domain.spectrum.RawSpectrum;

/**
 * <strong>What:</strong> Port parsing one spectrum file into a {@link RawSpectrum}.
 * <p><strong>Role:</strong> Supplied by a {@link SpectralBackend}; the driver never inspects file formats
 * itself.</p>
 *
 * @since 0.1.0
 */
public interface SpectrumReader {
  /**
   * Reads the spectrum stored at {@code path}.
   *
   * @param path existing spectrum file
   * @param format parser variant to use; empty means auto-detect
   * @return parsed spectrum
   * @throws Exception reader-specific failure on unparseable input
   */
  RawSpectrum read(Path path, Optional<String> format) throws Exception;
}
