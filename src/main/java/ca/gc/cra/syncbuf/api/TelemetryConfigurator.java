package ca.gc.cra.syncbuf.api;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies telemetry-related CLI settings to the JVM before the OpenTelemetry bootstrap reads them.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);

  private TelemetryConfigurator() {}

  /**
   * Consumes {@code metricsExporter} and {@code otelEndpoint} from {@code args}.
   *
   * @param args mutable settings map; telemetry keys are removed
   * @return normalized exporter name ({@code otlp} or {@code none})
   * @throws IllegalArgumentException when the exporter or endpoint is invalid
   */
  static String configureMetrics(Map<String, String> args) {
    String exporter = normalizeExporter(args.remove("metricsExporter"));
    System.setProperty("otel.metrics.exporter", exporter);
    log.debug("Configuring OpenTelemetry metrics exporter: {}", exporter);

    String endpoint = args.remove("otelEndpoint");
    if (endpoint != null && !endpoint.isBlank()) {
      String trimmed = endpoint.trim();
      validateEndpoint(trimmed);
      log.debug("Configuring OTLP endpoint: {}", trimmed);
      System.setProperty("otel.exporter.otlp.endpoint", trimmed);
    }
    return exporter;
  }

  private static String normalizeExporter(String raw) {
    String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    if (normalized.isEmpty()) {
      return "none";
    }
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    return normalized;
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
