package org.astro.doppler.domain.spectrum;

import java.util.Objects;

/**
 * <strong>What:</strong> Element-wise continuum ratio between a model-matched spectrum and the original.
 * <p><strong>Why:</strong> The joint fit tweaks each spectrum's continuum; drawing the pre-fit spectrum under
 * the tweaked continuum lets the diagnostic figure compare like with like.</p>
 * <p>Applying the correction produces a display copy with {@code flux / cratio}, {@code err / cratio} and
 * {@code continuum * cratio}; the source spectrum is never modified.</p>
 *
 * @since 0.1.0
 */
public final class ContinuumCorrection {
  private final double[] ratio;

  private ContinuumCorrection(double[] ratio) {
    this.ratio = ratio;
  }

  /**
   * Computes {@code cratio = matched.continuum / original.continuum}.
   *
   * @param matched model-matched spectrum returned by the engine
   * @param original spectrum as loaded before fitting
   * @return correction sized to the original spectrum
   * @throws IllegalArgumentException when the two continua differ in length
   */
  public static ContinuumCorrection between(Spectrum matched, Spectrum original) {
    Objects.requireNonNull(matched, "matched");
    Objects.requireNonNull(original, "original");
    double[] modelContinuum = matched.continuum();
    double[] originalContinuum = original.continuum();
    if (modelContinuum.length != originalContinuum.length) {
      throw new IllegalArgumentException("model continuum has " + modelContinuum.length
          + " pixels but original " + original.source() + " has " + originalContinuum.length);
    }
    double[] ratio = new double[originalContinuum.length];
    for (int i = 0; i < ratio.length; i++) {
      ratio[i] = modelContinuum[i] / originalContinuum[i];
    }
    return new ContinuumCorrection(ratio);
  }

  /**
   * Wraps an explicit ratio array.
   *
   * @param ratio per-pixel continuum ratio
   * @return correction using a copy of {@code ratio}
   */
  static ContinuumCorrection of(double[] ratio) {
    return new ContinuumCorrection(Objects.requireNonNull(ratio, "ratio").clone());
  }

  /**
   * Per-pixel ratio.
   *
   * @return copy of the ratio array
   */
  public double[] ratio() {
    return ratio.clone();
  }

  /**
   * Correction that undoes this one.
   *
   * @return correction with the reciprocal ratio
   */
  ContinuumCorrection inverse() {
    double[] inverse = new double[ratio.length];
    for (int i = 0; i < ratio.length; i++) {
      inverse[i] = 1.0 / ratio[i];
    }
    return new ContinuumCorrection(inverse);
  }

  /**
   * Builds the display copy of {@code spectrum} under this correction.
   *
   * @param spectrum spectrum to correct; must have the same pixel count as the ratio
   * @return new spectrum with corrected flux, error and continuum
   */
  public Spectrum applyTo(Spectrum spectrum) {
    Spectrum.requireLength("spectrum", spectrum.size(), ratio.length);
    double[] flux = spectrum.flux();
    double[] err = spectrum.err();
    double[] continuum = spectrum.continuum();
    for (int i = 0; i < ratio.length; i++) {
      flux[i] /= ratio[i];
      err[i] /= ratio[i];
      continuum[i] *= ratio[i];
    }
    return spectrum.withFluxErrContinuum(flux, err, continuum);
  }
}
