package ca.gc.cra.courier.testutil;

import ca.gc.cra.courier.application.port.MetricsPort;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/** {@link MetricsPort} that counts increments and observations per key. */
public final class RecordingMetrics implements MetricsPort {
  private final ConcurrentMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, AtomicLong> observations = new ConcurrentHashMap<>();

  @Override
  public void increment(String key) {
    counters.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
  }

  @Override
  public void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
  }

  public long count(String key) {
    AtomicLong value = counters.get(key);
    return value == null ? 0 : value.get();
  }

  public long observations(String key) {
    AtomicLong value = observations.get(key);
    return value == null ? 0 : value.get();
  }
}
