package com.vigil.detection.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DetectionMethod {
  ZSCORE("zscore"),
  P95("p95"),
  P99("p99");

  private final String tag;

  DetectionMethod(String tag) {
    this.tag = tag;
  }

  @JsonValue
  public String tag() {
    return tag;
  }

  @JsonCreator
  public static DetectionMethod fromTag(String tag) {
    for (DetectionMethod m : values()) {
      if (m.tag.equalsIgnoreCase(tag)) return m;
    }
    throw new IllegalArgumentException("Unknown detection method: " + tag);
  }
}
