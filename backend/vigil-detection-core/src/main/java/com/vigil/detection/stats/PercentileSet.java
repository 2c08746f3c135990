package com.vigil.detection.stats;

public record PercentileSet(double p50, double p75, double p90, double p95, double p99) {

  public static final PercentileSet EMPTY = new PercentileSet(0, 0, 0, 0, 0);
}
