package org.astro.doppler.application.port;

/**
 * <strong>What:</strong> Port abstracting Doppler driver metrics emission.
 * <p><strong>Why:</strong> Lets the fit drivers count fitted and skipped spectra without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Output port implemented by {@code OpenTelemetryMetricsAdapter} and
 * {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from any thread, although the driver
 * itself is single-threaded.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code doppler.spectra.fitted}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code doppler.spectra.skipped.missing}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value, such as a latency in milliseconds
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
