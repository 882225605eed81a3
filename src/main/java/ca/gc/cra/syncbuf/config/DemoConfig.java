package ca.gc.cra.syncbuf.config;

import ca.gc.cra.syncbuf.domain.buffer.BufferConfigurationException;
import ca.gc.cra.syncbuf.validation.Numbers;
import java.time.Duration;
import java.util.Map;

/**
 * Settings of the producer/consumer demo.
 *
 * @param iterations number of producer rounds
 * @param producerPeriod pause between producer rounds
 * @param consumerPeriod pause between consumer reads
 * @param maxDiff recency tolerance passed to {@code readLast}
 * @since 0.1.0
 */
public record DemoConfig(int iterations, Duration producerPeriod, Duration consumerPeriod, Duration maxDiff) {
  private static final int DEFAULT_ITERATIONS = 50;
  private static final long DEFAULT_PRODUCER_PERIOD_MS = 10;
  private static final long DEFAULT_CONSUMER_PERIOD_MS = 25;
  private static final long DEFAULT_MAX_DIFF_MS = 100;
  private static final int MAX_ITERATIONS = 1_000_000;
  private static final long MAX_PERIOD_MS = 60_000;

  public DemoConfig {
    Numbers.requireRange("iterations", iterations, 1, MAX_ITERATIONS);
    Numbers.requireNonNegative("producerPeriod", producerPeriod);
    Numbers.requireNonNegative("consumerPeriod", consumerPeriod);
    Numbers.requireNonNegative("maxDiff", maxDiff);
  }

  public static DemoConfig defaults() {
    return new DemoConfig(
        DEFAULT_ITERATIONS,
        Duration.ofMillis(DEFAULT_PRODUCER_PERIOD_MS),
        Duration.ofMillis(DEFAULT_CONSUMER_PERIOD_MS),
        Duration.ofMillis(DEFAULT_MAX_DIFF_MS));
  }

  /**
   * Parses {@code iterations}, {@code producerPeriodMs}, {@code consumerPeriodMs}, and {@code maxDiffMs}.
   *
   * @param kv settings; absent keys keep their defaults
   * @return parsed configuration
   * @throws BufferConfigurationException when a value is not an integer in range
   */
  public static DemoConfig fromMap(Map<String, String> kv) {
    Map<String, String> args = kv == null ? Map.of() : kv;
    DemoConfig defaults = defaults();
    int iterations = (int) parse(args, "iterations", defaults.iterations(), 1, MAX_ITERATIONS);
    long producer = parse(args, "producerPeriodMs", defaults.producerPeriod().toMillis(), 0, MAX_PERIOD_MS);
    long consumer = parse(args, "consumerPeriodMs", defaults.consumerPeriod().toMillis(), 0, MAX_PERIOD_MS);
    long maxDiff = parse(args, "maxDiffMs", defaults.maxDiff().toMillis(), 0, Long.MAX_VALUE / 1_000_000);
    return new DemoConfig(
        iterations, Duration.ofMillis(producer), Duration.ofMillis(consumer), Duration.ofMillis(maxDiff));
  }

  private static long parse(Map<String, String> args, String key, long fallback, long min, long max) {
    String raw = args.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Numbers.requireRange(key, Long.parseLong(raw.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new BufferConfigurationException(key + " must be an integer between " + min + " and " + max, ex);
    } catch (IllegalArgumentException ex) {
      throw new BufferConfigurationException(ex.getMessage(), ex);
    }
  }
}
