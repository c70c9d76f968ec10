package org.astro.doppler.domain.spectrum;

import java.util.Arrays;

/**
 * Signal-to-noise estimate used when the preprocessor leaves it undefined: the median flux over the median
 * error, both ignoring NaN samples. Infinite samples take part in the median.
 *
 * @since 0.1.0
 */
public final class SignalToNoise {
  private SignalToNoise() {}

  /**
   * Estimates S/N as {@code median(flux) / median(err)}.
   *
   * @param flux flux samples
   * @param err error samples
   * @return the ratio, or {@link Double#NaN} when either array has only NaN samples
   */
  public static double estimate(double[] flux, double[] err) {
    double medianFlux = nanMedian(flux);
    double medianErr = nanMedian(err);
    if (Double.isNaN(medianFlux) || Double.isNaN(medianErr)) {
      return Double.NaN;
    }
    return medianFlux / medianErr;
  }

  static double nanMedian(double[] values) {
    double[] present = Arrays.stream(values).filter(v -> !Double.isNaN(v)).sorted().toArray();
    int n = present.length;
    if (n == 0) {
      return Double.NaN;
    }
    int mid = n / 2;
    return n % 2 == 1 ? present[mid] : (present[mid - 1] + present[mid]) / 2.0;
  }
}
