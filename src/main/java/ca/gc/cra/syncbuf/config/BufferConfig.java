package ca.gc.cra.syncbuf.config;

import ca.gc.cra.syncbuf.domain.buffer.BufferConfigurationException;
import ca.gc.cra.syncbuf.validation.Numbers;
import ca.gc.cra.syncbuf.validation.Strings;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration shared by every channel of one buffer.
 *
 * @param capacity maximum entries retained per channel before the oldest is evicted
 * @param drainTimeout how long {@code close()} waits for queued insertions before cancelling them
 * @param workerThreadName thread-name prefix of the insertion worker
 * @param dumpValueBytes UTF-8 byte budget for each value rendered by {@code dump()}
 * @since 0.1.0
 */
public record BufferConfig(
    int capacity,
    Duration drainTimeout,
    String workerThreadName,
    int dumpValueBytes) {

  public static final int DEFAULT_CAPACITY = 10;
  public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(5);
  public static final String DEFAULT_WORKER_THREAD_NAME = "syncbuf-worker";
  public static final int DEFAULT_DUMP_VALUE_BYTES = 64;
  private static final int MIN_CAPACITY = 1;
  private static final int MAX_CAPACITY = 1_000_000;
  private static final long MAX_DRAIN_TIMEOUT_MILLIS = 600_000L;
  private static final int MIN_DUMP_VALUE_BYTES = 8;
  private static final int MAX_DUMP_VALUE_BYTES = 65_536;

  /**
   * Validates buffer configuration values.
   *
   * @throws BufferConfigurationException when a value is missing or out of range
   */
  public BufferConfig {
    try {
      Numbers.requireRange("capacity", capacity, MIN_CAPACITY, MAX_CAPACITY);
      Objects.requireNonNull(drainTimeout, "drainTimeout");
      Numbers.requireRange("drainTimeoutMillis", drainTimeout.toMillis(), 0, MAX_DRAIN_TIMEOUT_MILLIS);
      workerThreadName = Strings.requireIdentifier("workerThreadName", workerThreadName);
      Numbers.requireRange("dumpValueBytes", dumpValueBytes, MIN_DUMP_VALUE_BYTES, MAX_DUMP_VALUE_BYTES);
    } catch (IllegalArgumentException | NullPointerException | ArithmeticException ex) {
      if (ex instanceof BufferConfigurationException bce) {
        throw bce;
      }
      throw new BufferConfigurationException("invalid buffer configuration: " + ex.getMessage(), ex);
    }
  }

  /**
   * Provides default settings.
   *
   * @return default configuration
   */
  public static BufferConfig defaults() {
    return new BufferConfig(
        DEFAULT_CAPACITY, DEFAULT_DRAIN_TIMEOUT, DEFAULT_WORKER_THREAD_NAME, DEFAULT_DUMP_VALUE_BYTES);
  }

  /**
   * Returns a copy with a different per-channel capacity.
   *
   * @param newCapacity capacity in entries
   * @return updated configuration
   */
  public BufferConfig withCapacity(int newCapacity) {
    return new BufferConfig(newCapacity, drainTimeout, workerThreadName, dumpValueBytes);
  }

  /**
   * Parses {@code key=value} settings into a configuration, falling back to defaults for absent keys.
   *
   * <p>Recognized keys: {@code capacity}, {@code drainTimeoutMs}, {@code workerThreadName},
   * {@code dumpValueBytes}. Unknown keys are ignored so one merged map can feed several consumers.</p>
   *
   * @param args settings; may be {@code null}
   * @return parsed configuration
   * @throws BufferConfigurationException when values are invalid
   */
  public static BufferConfig fromMap(Map<String, String> args) {
    Map<String, String> kv = args == null ? Map.of() : new HashMap<>(args);
    BufferConfig defaults = defaults();
    int capacity = parseBoundedInt(kv, "capacity", defaults.capacity(), MIN_CAPACITY, MAX_CAPACITY);
    long drainMillis =
        parseBoundedLong(kv, "drainTimeoutMs", defaults.drainTimeout().toMillis(), 0, MAX_DRAIN_TIMEOUT_MILLIS);
    String threadName = kv.getOrDefault("workerThreadName", defaults.workerThreadName());
    int dumpBytes = parseBoundedInt(
        kv, "dumpValueBytes", defaults.dumpValueBytes(), MIN_DUMP_VALUE_BYTES, MAX_DUMP_VALUE_BYTES);
    return new BufferConfig(capacity, Duration.ofMillis(drainMillis), threadName, dumpBytes);
  }

  private static int parseBoundedInt(
      Map<String, String> kv, String key, int defaultValue, int min, int max) {
    return Math.toIntExact(parseBoundedLong(kv, key, defaultValue, min, max));
  }

  private static long parseBoundedLong(
      Map<String, String> kv, String key, long defaultValue, long min, long max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      long parsed = Long.parseLong(raw.trim());
      Numbers.requireRange(key, parsed, min, max);
      return parsed;
    } catch (NumberFormatException ex) {
      throw new BufferConfigurationException(key + " must be an integer between " + min + " and " + max, ex);
    } catch (IllegalArgumentException ex) {
      throw new BufferConfigurationException(ex.getMessage(), ex);
    }
  }
}
