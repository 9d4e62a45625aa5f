package ca.gc.cra.courier.application.port;

/**
 * <strong>What:</strong> Port for counters and observations emitted by the consume loop.
 * <p><strong>Why:</strong> Lets readers report fetch, commit, retry, and dead-letter outcomes without binding
 * to a metrics SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} for tests and
 * embedded use.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept updates from every reader's worker thread.</p>
 * <p><strong>Observability:</strong> Metric names use dotted keys such as {@code consume.retried}.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value in the unit implied by the name (for example nanoseconds)
   */
  void observe(String key, long value);

  /** Metrics implementation that drops every update. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
