package org.astro.doppler.domain.fit;

import java.util.Arrays;
import java.util.Objects;

/**
 * Best-fit model returned by the RV engine. Only the flux is persisted; the continuum feeds the
 * diagnostic figure.
 *
 * @param flux model flux samples
 * @param continuum model continuum, same length as {@code flux}
 * @since 0.1.0
 */
public record ModelSpectrum(double[] flux, double[] continuum) {

  public ModelSpectrum {
    flux = Objects.requireNonNull(flux, "flux").clone();
    continuum = Objects.requireNonNull(continuum, "continuum").clone();
    if (continuum.length != flux.length) {
      throw new IllegalArgumentException(
          "model continuum length " + continuum.length + " does not match flux length " + flux.length);
    }
  }

  @Override
  public double[] flux() {
    return flux.clone();
  }

  @Override
  public double[] continuum() {
    return continuum.clone();
  }

  public int size() {
    return flux.length;
  }

  @Override
  public boolean equals(Object other) {
    return this == other
        || (other instanceof ModelSpectrum that
            && Arrays.equals(flux, that.flux)
            && Arrays.equals(continuum, that.continuum));
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(flux) + Arrays.hashCode(continuum);
  }

  @Override
  public String toString() {
    return "ModelSpectrum{pixels=" + flux.length + "}";
  }
}
