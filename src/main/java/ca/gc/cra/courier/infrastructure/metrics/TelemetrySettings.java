package ca.gc.cra.courier.infrastructure.metrics;

import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exporter selection for the OpenTelemetry meter provider.
 *
 * @param exporter exporter mode
 * @param endpoint OTLP gRPC endpoint; ignored when the exporter is {@link Exporter#NONE}
 * @since 0.1.0
 */
public record TelemetrySettings(Exporter exporter, String endpoint) {
  private static final Logger log = LoggerFactory.getLogger(TelemetrySettings.class);

  /** Default OTLP collector endpoint. */
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  /** Supported exporters. */
  public enum Exporter {
    /** Periodic push to an OTLP gRPC collector. */
    OTLP,
    /** Metrics are dropped. */
    NONE;

    /**
     * Parses an exporter name.
     *
     * @param raw {@code otlp} or {@code none}, case-insensitive
     * @return parsed exporter
     * @throws IllegalArgumentException for any other value
     */
    public static Exporter parse(String raw) {
      String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
      switch (normalized) {
        case "otlp":
          return OTLP;
        case "none":
          return NONE;
        default:
          throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
    }
  }

  public TelemetrySettings {
    Objects.requireNonNull(exporter, "exporter");
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
  }

  /**
   * Settings that disable metric export.
   *
   * @return disabled settings
   */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings(Exporter.NONE, DEFAULT_ENDPOINT);
  }

  /**
   * Resolves the exporter from {@code otel.metrics.exporter} or {@code OTEL_METRICS_EXPORTER}.
   *
   * <p>Other OpenTelemetry exporters ({@code prometheus}, {@code logging}, ...) are not supported here and
   * resolve to {@link Exporter#NONE} with a warning.</p>
   *
   * @return configured exporter, or {@link Exporter#NONE}
   */
  public static Exporter exporterFromEnvironment() {
    String raw = firstNonBlank(
        System.getProperty("otel.metrics.exporter"), System.getenv("OTEL_METRICS_EXPORTER"), null);
    if (raw == null) {
      return Exporter.NONE;
    }
    try {
      return Exporter.parse(raw);
    } catch (IllegalArgumentException ex) {
      log.warn("Unsupported OpenTelemetry metrics exporter '{}' in environment; metrics export disabled", raw);
      return Exporter.NONE;
    }
  }

  /**
   * Resolves the OTLP endpoint from {@code otel.exporter.otlp.endpoint} or
   * {@code OTEL_EXPORTER_OTLP_ENDPOINT}.
   *
   * @return configured endpoint, or {@link #DEFAULT_ENDPOINT}
   */
  public static String endpointFromEnvironment() {
    return firstNonBlank(
        System.getProperty("otel.exporter.otlp.endpoint"),
        System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"),
        DEFAULT_ENDPOINT);
  }

  private static String firstNonBlank(String first, String second, String defaultValue) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return defaultValue;
  }
}
