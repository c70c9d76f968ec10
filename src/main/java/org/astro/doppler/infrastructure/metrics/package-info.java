/**
 * Metrics adapters: OpenTelemetry SDK with an optional OTLP exporter, and a no-op fallback.
 *
 * @since 0.1.0
 */
package org.astro.doppler.infrastructure.metrics;
