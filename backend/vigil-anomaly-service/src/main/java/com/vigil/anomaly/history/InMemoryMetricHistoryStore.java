package com.vigil.anomaly.history;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Ring buffer per series. Appends and evictions for one key go through the map's compute, which
 * locks only that key's hash bin; there is no store-wide lock.
 */
@Component
@Profile("!redis-history")
public class InMemoryMetricHistoryStore implements MetricHistoryStore {

  private final ConcurrentHashMap<String, Series> series = new ConcurrentHashMap<>();
  private final int capacity;
  private final Clock clock;

  public InMemoryMetricHistoryStore(@Value("${vigil.history.capacity:100}") int capacity, Clock clock) {
    if (capacity < 1) throw new IllegalArgumentException("history capacity must be positive: " + capacity);
    this.capacity = capacity;
    this.clock = clock;
  }

  @Override
  public double[] snapshot(String key) {
    Series s = series.get(key);
    return s == null ? new double[0] : s.copy();
  }

  @Override
  public double[] append(String key, double value) {
    double[][] prior = new double[1][];
    long now = clock.millis();
    series.compute(key, (k, s) -> {
      Series target = s != null ? s : new Series(capacity);
      prior[0] = target.copy();
      target.add(value, now);
      return target;
    });
    return prior[0];
  }

  @Override
  public int size(String key) {
    Series s = series.get(key);
    return s == null ? 0 : s.size();
  }

  @Override
  public Set<String> keys() {
    return Set.copyOf(series.keySet());
  }

  @Override
  public int capacity() {
    return capacity;
  }

  @Override
  public int evictIdle(Duration idle) {
    long cutoff = clock.millis() - idle.toMillis();
    AtomicInteger removed = new AtomicInteger();
    for (String key : series.keySet()) {
      series.computeIfPresent(key, (k, s) -> {
        if (s.lastAppendAt() < cutoff) {
          removed.incrementAndGet();
          return null;
        }
        return s;
      });
    }
    return removed.get();
  }

  private static final class Series {
    private final double[] buf;
    private int head;
    private int count;
    private long lastAppendAt;

    Series(int capacity) {
      this.buf = new double[capacity];
    }

    synchronized void add(double value, long at) {
      buf[head] = value;
      head = (head + 1) % buf.length;
      if (count < buf.length) count++;
      lastAppendAt = at;
    }

    synchronized double[] copy() {
      double[] out = new double[count];
      int start = (head - count + buf.length) % buf.length;
      for (int i = 0; i < count; i++) {
        out[i] = buf[(start + i) % buf.length];
      }
      return out;
    }

    synchronized int size() {
      return count;
    }

    synchronized long lastAppendAt() {
      return lastAppendAt;
    }
  }
}
