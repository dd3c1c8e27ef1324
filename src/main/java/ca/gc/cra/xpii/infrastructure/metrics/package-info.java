/**
 * <strong>Purpose:</strong> OpenTelemetry-backed {@link ca.gc.cra.xpii.application.port.MetricsPort} adapter.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; safe from any thread.
 * <p><strong>Observability:</strong> Exporter selection follows {@code OTEL_METRICS_EXPORTER} and
 * {@code OTEL_EXPORTER_OTLP_ENDPOINT}; {@code none} yields a noop meter.
 *
 * @since 0.1.0
 */
package ca.gc.cra.xpii.infrastructure.metrics;
