package ca.gc.cra.metawriter.api;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves telemetry settings out of the command's settings into the system properties read by the OpenTelemetry
 * bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);

  private TelemetryConfigurator() {}

  /**
   * Applies and removes {@code metricsExporter} and {@code otelEndpoint}.
   *
   * @param settings mutable settings
   * @throws IllegalArgumentException when the exporter or endpoint is invalid
   */
  static void configureMetrics(Map<String, String> settings) {
    String exporter = settings.remove("metricsExporter");
    if (exporter != null && !exporter.isBlank()) {
      String normalized = exporter.trim().toLowerCase(Locale.ROOT);
      if (!normalized.equals("otlp") && !normalized.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      log.debug("Configuring OpenTelemetry metrics exporter: {}", normalized);
      System.setProperty("otel.metrics.exporter", normalized);
    }
    String endpoint = settings.remove("otelEndpoint");
    if (endpoint != null && !endpoint.isBlank()) {
      validateEndpoint(endpoint.trim());
      log.debug("Configuring OTLP endpoint: {}", endpoint.trim());
      System.setProperty("otel.exporter.otlp.endpoint", endpoint.trim());
    }
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
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
