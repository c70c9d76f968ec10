package org.astro.doppler.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bootstraps the OpenTelemetry meter provider for a driver run.
 *
 * <p>Settings are read from system properties first ({@code otel.metrics.exporter},
 * {@code otel.exporter.otlp.endpoint}, {@code otel.resource.attributes}) and then from the matching
 * {@code OTEL_*} environment variables. The batch driver exports nothing unless asked to.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final String INSTRUMENTATION_SCOPE = "org.astro.doppler";
  private static final String DEFAULT_EXPORTER = "none";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

  private OpenTelemetryBootstrap() {}

  static BootstrapResult initialize() {
    try {
      String exporter = firstNonBlank(
          System.getProperty("otel.metrics.exporter"), System.getenv("OTEL_METRICS_EXPORTER"), DEFAULT_EXPORTER);
      if (!"otlp".equals(exporter.toLowerCase(Locale.ROOT))) {
        if (!"none".equals(exporter.toLowerCase(Locale.ROOT))) {
          log.warn("Unknown metrics exporter '{}'; metrics disabled", exporter);
        }
        log.debug("OpenTelemetry metrics exporter disabled (exporter={})", exporter);
        return BootstrapResult.noop();
      }
      String endpoint = firstNonBlank(
          System.getProperty("otel.exporter.otlp.endpoint"),
          System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"),
          DEFAULT_ENDPOINT);
      String attributes = firstNonBlank(
          System.getProperty("otel.resource.attributes"), System.getenv("OTEL_RESOURCE_ATTRIBUTES"), "");
      OtlpGrpcMetricExporter otlp = OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build();
      MetricReader reader = PeriodicMetricReader.builder(otlp).setInterval(Duration.ofSeconds(30)).build();
      BootstrapResult result = build(reader, parseResourceAttributes(attributes));
      log.info("OpenTelemetry metrics initialized with OTLP exporter targeting {}", endpoint);
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop adapter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static BootstrapResult build(MetricReader reader, Attributes extra) {
    String version = detectServiceVersion();
    Resource resource = Resource.getDefault()
        .merge(Resource.create(Attributes.builder()
            .put(SERVICE_NAME, "doppler")
            .put(SERVICE_NAMESPACE, "org.astro")
            .put(SERVICE_VERSION, version)
            .build()))
        .merge(extra.isEmpty() ? Resource.empty() : Resource.create(extra));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(version)
        .build();
    return new BootstrapResult(meter, provider);
  }

  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      int idx = trimmed.indexOf('=');
      if (idx <= 0 || idx == trimmed.length() - 1) {
        log.warn("Ignoring malformed resource attribute entry: {}", trimmed);
        continue;
      }
      builder.put(AttributeKey.stringKey(trimmed.substring(0, idx).trim()), trimmed.substring(idx + 1).trim());
    }
    return builder.build();
  }

  private static String detectServiceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    if (pkg != null && pkg.getImplementationVersion() != null && !pkg.getImplementationVersion().isBlank()) {
      return pkg.getImplementationVersion();
    }
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(
        "/META-INF/maven/org.astro/doppler-driver/pom.properties")) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        String version = props.getProperty("version");
        if (version != null && !version.isBlank()) {
          return version;
        }
      }
    } catch (IOException ex) {
      log.debug("Unable to read pom.properties for version detection", ex);
    }
    return "0.0.0-dev";
  }

  private static String firstNonBlank(String first, String second, String defaultValue) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return defaultValue;
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush().join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        CompletableResultCode shutdown = provider.shutdown().join(5, TimeUnit.SECONDS);
        if (!shutdown.isSuccess()) {
          log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }
  }
}
