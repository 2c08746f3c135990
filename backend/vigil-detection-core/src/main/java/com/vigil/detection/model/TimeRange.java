package com.vigil.detection.model;

/** Inclusive epoch-millisecond window. */
public record TimeRange(long start, long end) {

  public boolean contains(long timestamp) {
    return timestamp >= start && timestamp <= end;
  }
}
