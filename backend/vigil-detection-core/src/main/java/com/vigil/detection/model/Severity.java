package com.vigil.detection.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

public enum Severity {
  LOW(1),
  MEDIUM(2),
  HIGH(3),
  CRITICAL(4);

  private final int rank;

  Severity(int rank) {
    this.rank = rank;
  }

  public int rank() {
    return rank;
  }

  public boolean atLeast(Severity other) {
    return rank >= other.rank;
  }

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Classifies a deviation score by magnitude only: below 2 low, 2 medium, 3 high, 3.5 critical. */
  public static Severity fromScore(double score) {
    double abs = Math.abs(score);
    if (abs >= 3.5) return CRITICAL;
    if (abs >= 3.0) return HIGH;
    if (abs >= 2.0) return MEDIUM;
    return LOW;
  }

  public static Optional<Severity> parse(String label) {
    if (label == null || label.isBlank()) return Optional.empty();
    try {
      return Optional.of(valueOf(label.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  @JsonCreator
  static Severity fromJson(String label) {
    return parse(label).orElseThrow(() -> new IllegalArgumentException("Unknown severity: " + label));
  }
}
