package ca.gc.cra.courier.api;

import ca.gc.cra.courier.infrastructure.metrics.TelemetrySettings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves OpenTelemetry exporter settings from merged CLI/YAML settings. The standard {@code otel.*}
 * system properties and {@code OTEL_*} environment variables are consulted only for keys the settings
 * leave unset.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);

  private TelemetryConfigurator() {}

  /**
   * Removes {@code metricsExporter} and {@code otelEndpoint} from {@code args} and resolves settings.
   *
   * @param args mutable settings map
   * @return exporter settings
   * @throws IllegalArgumentException if the exporter is unknown or the endpoint is not an http(s) URI
   */
  static TelemetrySettings fromArgs(Map<String, String> args) {
    String exporter = args.remove("metricsExporter");
    String endpoint = args.remove("otelEndpoint");

    TelemetrySettings.Exporter mode = exporter == null || exporter.isBlank()
        ? TelemetrySettings.exporterFromEnvironment()
        : TelemetrySettings.Exporter.parse(exporter);
    String target = endpoint == null || endpoint.isBlank()
        ? TelemetrySettings.endpointFromEnvironment()
        : validateEndpoint(endpoint.trim());
    log.debug("Metrics exporter {} targeting {}", mode, target);
    return new TelemetrySettings(mode, target);
  }

  private static String validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
      return raw;
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
