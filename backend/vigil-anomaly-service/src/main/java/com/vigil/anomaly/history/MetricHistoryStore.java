package com.vigil.anomaly.history;

import java.time.Duration;
import java.util.Set;

/**
 * Bounded per-series sample history. Values come back oldest first; every returned array is a
 * copy the caller may keep.
 */
public interface MetricHistoryStore {

  double[] snapshot(String key);

  /**
   * Appends {@code value} to the series and returns the retained values that preceded it, read
   * atomically with the append.
   */
  double[] append(String key, double value);

  int size(String key);

  Set<String> keys();

  int capacity();

  /** Drops series not appended to within {@code idle}; returns how many were removed. */
  int evictIdle(Duration idle);
}
