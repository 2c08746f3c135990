package com.vigil.detection.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Trend {
  INCREASING,
  DECREASING,
  STABLE;

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
