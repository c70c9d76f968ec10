package org.astro.doppler.domain.spectrum;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> One loaded, masked and normalized spectrum ready for RV fitting.
 * <p><strong>Why:</strong> Gives the fit drivers an immutable view of the preprocessor output so the same record
 * can be handed to the engine and, in joint mode, reused later for the diagnostic overlay.</p>
 * <p><strong>Thread-safety:</strong> Immutable; array components are copied on the way in and on the way out.</p>
 *
 * @param source file the spectrum was read from
 * @param flux normalized flux samples
 * @param err flux uncertainty, same length as {@code flux}
 * @param wave wavelength per pixel, same length as {@code flux}
 * @param mask bad-pixel mask ({@code true} = bad), same length as {@code flux}
 * @param continuum continuum estimate used for normalization, same length as {@code flux}
 * @param snr signal-to-noise ratio; {@link Double#NaN} when not yet determined
 * @since 0.1.0
 */
public record Spectrum(
    Path source,
    double[] flux,
    double[] err,
    double[] wave,
    boolean[] mask,
    double[] continuum,
    double snr) {

  public Spectrum {
    Objects.requireNonNull(source, "source");
    flux = Objects.requireNonNull(flux, "flux").clone();
    err = Objects.requireNonNull(err, "err").clone();
    wave = Objects.requireNonNull(wave, "wave").clone();
    mask = Objects.requireNonNull(mask, "mask").clone();
    continuum = Objects.requireNonNull(continuum, "continuum").clone();
    requireLength("err", err.length, flux.length);
    requireLength("wave", wave.length, flux.length);
    requireLength("mask", mask.length, flux.length);
    requireLength("continuum", continuum.length, flux.length);
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

  @Override
  public double[] continuum() {
    return continuum.clone();
  }

  /**
   * Number of pixels in the spectrum.
   *
   * @return pixel count
   */
  public int size() {
    return flux.length;
  }

  /**
   * Indicates whether a signal-to-noise value has been established.
   *
   * @return {@code true} when {@link #snr()} is a finite number
   */
  public boolean hasSnr() {
    return Double.isFinite(snr);
  }

  /**
   * Returns a copy carrying the supplied signal-to-noise ratio.
   *
   * @param value signal-to-noise ratio
   * @return new spectrum sharing all other components
   */
  public Spectrum withSnr(double value) {
    return new Spectrum(source, flux, err, wave, mask, continuum, value);
  }

  /**
   * Returns a copy with replaced flux, error and continuum arrays.
   *
   * @param newFlux flux samples
   * @param newErr flux uncertainty
   * @param newContinuum continuum estimate
   * @return new spectrum sharing source, wavelength, mask and S/N
   */
  public Spectrum withFluxErrContinuum(double[] newFlux, double[] newErr, double[] newContinuum) {
    return new Spectrum(source, newFlux, newErr, wave, mask, newContinuum, snr);
  }

  /**
   * One-line human readable description used in DEBUG logs.
   *
   * @return summary naming the file, pixel count and S/N
   */
  public String summary() {
    String snrText = hasSnr() ? String.format(Locale.ROOT, "%7.2f", snr).trim() : "n/a";
    return "File = " + source + ", pixels = " + flux.length + ", S/N = " + snrText;
  }

  static void requireLength(String name, int actual, int expected) {
    if (actual != expected) {
      throw new IllegalArgumentException(
          name + " length " + actual + " does not match flux length " + expected);
    }
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Spectrum that)) {
      return false;
    }
    return source.equals(that.source)
        && Double.compare(snr, that.snr) == 0
        && Arrays.equals(flux, that.flux)
        && Arrays.equals(err, that.err)
        && Arrays.equals(wave, that.wave)
        && Arrays.equals(mask, that.mask)
        && Arrays.equals(continuum, that.continuum);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(source, snr);
    result = 31 * result + Arrays.hashCode(flux);
    result = 31 * result + Arrays.hashCode(err);
    result = 31 * result + Arrays.hashCode(wave);
    result = 31 * result + Arrays.hashCode(mask);
    return 31 * result + Arrays.hashCode(continuum);
  }

  @Override
  public String toString() {
    return "Spectrum{" + summary() + "}";
  }
}
