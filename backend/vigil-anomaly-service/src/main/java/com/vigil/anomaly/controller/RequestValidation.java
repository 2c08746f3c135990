package com.vigil.anomaly.controller;

import com.vigil.detection.model.AnomalyScore;
import com.vigil.detection.model.Severity;
import java.util.List;

final class RequestValidation {

  // keeps the metric and the alert message built from it inside their columns
  static final int MAX_METRIC_LENGTH = 200;
  static final int MAX_RESOLVER_LENGTH = 255;

  private RequestValidation() {}

  static String requireMetric(String metric) {
    if (metric == null || metric.isBlank()) throw new InvalidRequestException("metric is required");
    String trimmed = metric.trim();
    if (trimmed.length() > MAX_METRIC_LENGTH) {
      throw new InvalidRequestException("metric must be at most " + MAX_METRIC_LENGTH + " characters");
    }
    return trimmed;
  }

  static String resolver(String resolvedBy) {
    if (resolvedBy != null && resolvedBy.length() > MAX_RESOLVER_LENGTH) {
      throw new InvalidRequestException("resolvedBy must be at most " + MAX_RESOLVER_LENGTH + " characters");
    }
    return resolvedBy;
  }

  static double[] values(List<Double> values, boolean allowEmpty) {
    if (values == null) throw new InvalidRequestException("values array is required");
    if (!allowEmpty && values.isEmpty()) throw new InvalidRequestException("values array cannot be empty");
    double[] out = new double[values.size()];
    for (int i = 0; i < out.length; i++) {
      Double v = values.get(i);
      if (v == null) throw new InvalidRequestException("values[" + i + "] must be a number");
      out[i] = v;
    }
    return out;
  }

  /** Returns null when the caller sent no timestamps, letting the detector synthesize them. */
  static long[] timestamps(List<Long> timestamps, int expectedLength) {
    if (timestamps == null) return null;
    if (timestamps.size() != expectedLength) {
      throw new InvalidRequestException("timestamps array length must match values array length");
    }
    long[] out = new long[expectedLength];
    for (int i = 0; i < out.length; i++) {
      Long t = timestamps.get(i);
      if (t == null) throw new InvalidRequestException("timestamps[" + i + "] must be a number");
      out[i] = t;
    }
    return out;
  }

  static List<AnomalyScore> scores(List<AnomalyScore> scores, String field) {
    if (scores == null) throw new InvalidRequestException(field + " array is required");
    for (int i = 0; i < scores.size(); i++) {
      requireScore(scores.get(i), field + "[" + i + "]");
    }
    return scores;
  }

  static AnomalyScore requireScore(AnomalyScore score, String field) {
    if (score == null) throw new InvalidRequestException(field + " is required");
    if (score.severity() == null) throw new InvalidRequestException(field + ".severity is required");
    return score;
  }

  static Severity severity(String label) {
    if (label == null || label.isBlank()) return null;
    return Severity.parse(label)
        .orElseThrow(() -> new InvalidRequestException("severity must be one of low, medium, high, critical"));
  }
}
