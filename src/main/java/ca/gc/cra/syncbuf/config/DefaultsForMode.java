package ca.gc.cra.syncbuf.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI mode.
 *
 * <p>The keys listed here are also the set of keys a mode recognizes; {@link ConfigMerger} warns about any
 * other key.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode ({@code demo})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "demo" -> buildDemoDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    BufferConfig buffer = BufferConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("capacity", Integer.toString(buffer.capacity()));
    map.put("drainTimeoutMs", Long.toString(buffer.drainTimeout().toMillis()));
    map.put("workerThreadName", buffer.workerThreadName());
    map.put("dumpValueBytes", Integer.toString(buffer.dumpValueBytes()));
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildDemoDefaults() {
    DemoConfig demo = DemoConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("iterations", Integer.toString(demo.iterations()));
    map.put("producerPeriodMs", Long.toString(demo.producerPeriod().toMillis()));
    map.put("consumerPeriodMs", Long.toString(demo.consumerPeriod().toMillis()));
    map.put("maxDiffMs", Long.toString(demo.maxDiff().toMillis()));
    map.put("dump", "true");
    return map;
  }
}
