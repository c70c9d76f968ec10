package org.astro.doppler.domain.fit;

import java.util.List;
import java.util.Objects;
import org.astro.doppler.domain.spectrum.Spectrum;

/**
 * Engine output for one joint fit. Every per-spectrum collection is index-aligned with the input files.
 *
 * @param summary summary table, one row per spectrum
 * @param finalParameters final per-spectrum parameters, one row per spectrum
 * @param models best-fit models in input order
 * @param matched model-matched spectra in input order
 * @since 0.1.0
 */
public record JointFitResult(
    ParameterTable summary,
    ParameterTable finalParameters,
    List<ModelSpectrum> models,
    List<Spectrum> matched) {

  public JointFitResult {
    Objects.requireNonNull(summary, "summary");
    Objects.requireNonNull(finalParameters, "finalParameters");
    models = List.copyOf(Objects.requireNonNull(models, "models"));
    matched = List.copyOf(Objects.requireNonNull(matched, "matched"));
    if (matched.size() != models.size()) {
      throw new IllegalArgumentException(
          "engine returned " + models.size() + " models but " + matched.size() + " matched spectra");
    }
    if (finalParameters.size() != models.size()) {
      throw new IllegalArgumentException("engine returned " + finalParameters.size()
          + " final parameter rows for " + models.size() + " spectra");
    }
  }

  /**
   * Number of spectra covered by the fit.
   *
   * @return spectrum count
   */
  public int spectrumCount() {
    return models.size();
  }
}
