package com.vigil.detection.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Locale;

/**
 * One scored sample. Scores built by the detector go through {@link #of}, which derives
 * severity, flag and message from the raw score.
 */
public record AnomalyScore(
    int index,
    double value,
    double score,
    Severity severity,
    double deviation,
    DetectionMethod percentile,
    @JsonProperty("isAnomaly") boolean isAnomaly,
    long timestamp,
    String message,
    @JsonInclude(JsonInclude.Include.NON_NULL) AnomalyContext context
) {

  public static AnomalyScore of(int index, double value, double score, long timestamp,
                                DetectionMethod method, AnomalyContext context) {
    Severity severity = Severity.fromScore(score);
    return new AnomalyScore(
        index,
        value,
        score,
        severity,
        score,
        method,
        severity.atLeast(Severity.MEDIUM),
        timestamp,
        String.format(Locale.ROOT, "%s anomaly detected (score: %.2f)", severity.name(), score),
        context == null || context.isEmpty() ? null : context);
  }
}
