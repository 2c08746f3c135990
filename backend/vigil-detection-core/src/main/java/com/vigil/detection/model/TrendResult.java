package com.vigil.detection.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TrendResult(
    Trend trend,
    double deviation,
    @JsonProperty("isSignificant") boolean isSignificant,
    int windowSize,
    double average,
    double lastValue
) {

  public static TrendResult stable(int windowSize) {
    return new TrendResult(Trend.STABLE, 0.0, false, windowSize, 0.0, 0.0);
  }
}
