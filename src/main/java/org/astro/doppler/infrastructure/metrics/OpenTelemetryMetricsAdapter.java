package org.astro.doppler.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.astro.doppler.application.port.MetricsPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards driver counters and histograms to OpenTelemetry.
 *
 * <p>Instruments are created lazily on first use and cached by key. Closing the adapter flushes pending
 * exports and shuts the meter provider down, which a batch run does once when it finishes.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("doppler.metric.key");
  private static final String FALLBACK_METRIC_NAME = "doppler.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final boolean noop;
  private final Map<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final Map<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /** Creates an adapter wired to the exporter configured through system properties or environment. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    this.noop = bootstrap.isNoop();
    if (noop) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    if (noop) {
      return;
    }
    Instrument<LongCounter> instrument = counters.computeIfAbsent(key, this::createCounter);
    instrument.delegate().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    if (noop) {
      return;
    }
    Instrument<LongHistogram> instrument = histograms.computeIfAbsent(key, this::createHistogram);
    instrument.delegate().record(value, instrument.attributes());
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  private Instrument<LongCounter> createCounter(String key) {
    String name = sanitizeName(key);
    LongCounter counter = meter.counterBuilder(name)
        .setUnit("1")
        .setDescription("Doppler counter for " + key)
        .build();
    if (!name.equals(key)) {
      log.debug("Sanitized counter name '{}' -> '{}'", key, name);
    }
    return new Instrument<>(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Instrument<LongHistogram> createHistogram(String key) {
    String name = sanitizeName(key);
    LongHistogram histogram = meter.histogramBuilder(name)
        .ofLongs()
        .setDescription("Doppler observation for " + key)
        .build();
    if (!name.equals(key)) {
      log.debug("Sanitized histogram name '{}' -> '{}'", key, name);
    }
    return new Instrument<>(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private record Instrument<T>(T delegate, Attributes attributes) {}
}
