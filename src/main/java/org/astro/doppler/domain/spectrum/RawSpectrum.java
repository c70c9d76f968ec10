package org.astro.doppler.domain.spectrum;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Spectrum exactly as a {@code SpectrumReader} parsed it, before masking and normalization.
 *
 * @param flux measured flux samples; must not be {@code null}
 * @param err per-pixel flux uncertainty, same length as {@code flux}
 * @param wave wavelength per pixel, same length as {@code flux}
 * @param mask bad-pixel mask ({@code true} = bad); {@code null} means no pixel is masked
 * @param instrument optional instrument label reported by the reader
 * @since 0.1.0
 */
public record RawSpectrum(
    double[] flux, double[] err, double[] wave, boolean[] mask, Optional<String> instrument) {

  public RawSpectrum {
    flux = Objects.requireNonNull(flux, "flux").clone();
    err = Objects.requireNonNull(err, "err").clone();
    wave = Objects.requireNonNull(wave, "wave").clone();
    mask = mask == null ? new boolean[flux.length] : mask.clone();
    instrument = instrument == null ? Optional.empty() : instrument;
    Spectrum.requireLength("err", err.length, flux.length);
    Spectrum.requireLength("wave", wave.length, flux.length);
    Spectrum.requireLength("mask", mask.length, flux.length);
  }

  @Override
  public double[] flux() {
    return flux.clone();
  }

  @Override
  public double[] err() {
    return err.clone();
  }

  @Override
  public double[] wave() {
    return wave.clone();
  }

  @Override
  public boolean[] mask() {
    return mask.clone();
  }

  /**
   * Number of pixels in the spectrum.
   *
   * @return pixel count
   */
  public int size() {
    return flux.length;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof RawSpectrum that)) {
      return false;
    }
    return Arrays.equals(flux, that.flux)
        && Arrays.equals(err, that.err)
        && Arrays.equals(wave, that.wave)
        && Arrays.equals(mask, that.mask)
        && instrument.equals(that.instrument);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(instrument);
    result = 31 * result + Arrays.hashCode(flux);
    result = 31 * result + Arrays.hashCode(err);
    result = 31 * result + Arrays.hashCode(wave);
    return 31 * result + Arrays.hashCode(mask);
  }

  @Override
  public String toString() {
    return "RawSpectrum{pixels=" + flux.length + ", instrument=" + instrument.orElse("<unknown>") + "}";
  }
}
