package org.astro.doppler.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {
  private String previousExporter;

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    result.close();
  }

  @Test
  void parsesResourceAttributesAndSkipsMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes(
        "deployment.environment=survey, broken, team = stellar ,=x");

    assertEquals(2, attributes.size());
    assertEquals("survey", attributes.get(AttributeKey.stringKey("deployment.environment")));
    assertEquals("stellar", attributes.get(AttributeKey.stringKey("team")));
  }
}
