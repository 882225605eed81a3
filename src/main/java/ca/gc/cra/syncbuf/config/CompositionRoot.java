package ca.gc.cra.syncbuf.config;

import ca.gc.cra.syncbuf.application.port.ClockPort;
import ca.gc.cra.syncbuf.application.port.MetricsPort;
import ca.gc.cra.syncbuf.application.sync.TimeSyncBuffer;
import ca.gc.cra.syncbuf.domain.buffer.ChannelSpec;
import ca.gc.cra.syncbuf.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.syncbuf.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.syncbuf.infrastructure.time.SystemClockAdapter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires buffer configuration to concrete clock and metrics adapters.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Pick the metrics adapter matching the configured exporter.</li>
 *   <li>Build {@link TimeSyncBuffer} instances sharing that adapter.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable references; construct during startup.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final BufferConfig bufferConfig;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a composition root whose metrics adapter follows {@code metricsExporter} ({@code otlp} or
   * {@code none}).
   *
   * @param bufferConfig buffer settings
   * @param metricsExporter exporter name; {@code null} or blank means {@code none}
   * @throws IllegalArgumentException for any other exporter name
   */
  public CompositionRoot(BufferConfig bufferConfig, String metricsExporter) {
    this(
        bufferConfig,
        selectMetrics(metricsExporter, Objects.requireNonNull(bufferConfig, "bufferConfig").workerThreadName()),
        new SystemClockAdapter());
  }

  /**
   * Creates a composition root with explicit adapters, used by tests.
   *
   * @param bufferConfig buffer settings
   * @param metrics metrics adapter
   * @param clock clock adapter
   */
  public CompositionRoot(BufferConfig bufferConfig, MetricsPort metrics, ClockPort clock) {
    this.bufferConfig = Objects.requireNonNull(bufferConfig, "bufferConfig");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds a buffer over {@code channels} using this root's configuration and adapters.
   *
   * @param channels ordered channel declarations
   * @return new buffer; the caller owns and closes it
   */
  public TimeSyncBuffer newBuffer(List<? extends ChannelSpec<?, ?>> channels) {
    return new TimeSyncBuffer(bufferConfig, clock, metrics, channels);
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ClockPort clock() {
    return clock;
  }

  public BufferConfig bufferConfig() {
    return bufferConfig;
  }

  private static MetricsPort selectMetrics(String exporter, String bufferName) {
    String normalized = exporter == null ? "" : exporter.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "", "none" -> new NoOpMetricsAdapter();
      case "otlp" -> new OpenTelemetryMetricsAdapter(bufferName);
      default -> throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    };
  }
}
