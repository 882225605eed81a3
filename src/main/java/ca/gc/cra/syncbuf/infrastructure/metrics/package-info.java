/**
 * Metrics adapters implementing {@link ca.gc.cra.syncbuf.application.port.MetricsPort}.
 * <p><strong>Role:</strong> Adapter layer bridging buffer counters to OpenTelemetry.</p>
 * <p><strong>Concurrency:</strong> Adapters are safe for concurrent updates.</p>
 */
package ca.gc.cra.syncbuf.infrastructure.metrics;
