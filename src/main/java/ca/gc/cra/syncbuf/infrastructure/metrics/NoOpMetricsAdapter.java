package ca.gc.cra.syncbuf.infrastructure.metrics;

import ca.gc.cra.syncbuf.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations; selected when the exporter is {@code none}.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
