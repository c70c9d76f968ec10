package org.astro.doppler.application.port;

import java.nio.file.Path;
import org.astro.doppler.domain.fit.ModelSpectrum;
import org.astro.doppler.domain.fit.ParameterRow;
import org.astro.doppler.domain.spectrum.Spectrum;

/**
 * Port drawing one diagnostic figure. The extension of {@code path} selects the output format.
 *
 * @since 0.1.0
 */
public interface PlotRenderer {
  /**
   * Renders the figure.
   *
   * @param path destination file ({@code .png}, {@code .pdf}, ...)
   * @param matched model-matched spectrum
   * @param model best-fit model
   * @param parameters final fit parameters for this spectrum
   * @param overlay continuum-corrected copy of the original spectrum
   * @param verbose whether to emit renderer diagnostics
   * @throws Exception on rendering failure
   */
  void render(
      Path path,
      Spectrum matched,
      ModelSpectrum model,
      ParameterRow parameters,
      Spectrum overlay,
      boolean verbose)
      throws Exception;
}
