package org.astro.doppler.domain.fit;

import java.util.Objects;
import org.astro.doppler.domain.spectrum.Spectrum;

/**
 * Engine output for one individually fitted spectrum.
 *
 * @param parameters flat fit-parameter record
 * @param model best-fit model
 * @param matched model-matched (normalized) spectrum
 * @since 0.1.0
 */
public record FitResult(ParameterRow parameters, ModelSpectrum model, Spectrum matched) {
  public FitResult {
    Objects.requireNonNull(parameters, "parameters");
    Objects.requireNonNull(model, "model");
    Objects.requireNonNull(matched, "matched");
  }
}
