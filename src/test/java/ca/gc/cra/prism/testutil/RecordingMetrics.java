package ca.gc.cra.prism.testutil;

import ca.gc.cra.prism.application.port.MetricsPort;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** {@link MetricsPort} that keeps counters and last observations in memory. */
public final class RecordingMetrics implements MetricsPort {
  private final Map<String, Long> counters = new ConcurrentHashMap<>();
  private final Map<String, Long> observations = new ConcurrentHashMap<>();

  @Override
  public void increment(String key) {
    counters.merge(key, 1L, Long::sum);
  }

  @Override
  public void observe(String key, long value) {
    observations.put(key, value);
  }

  public long counter(String key) {
    return counters.getOrDefault(key, 0L);
  }

  public Long observation(String key) {
    return observations.get(key);
  }
}
