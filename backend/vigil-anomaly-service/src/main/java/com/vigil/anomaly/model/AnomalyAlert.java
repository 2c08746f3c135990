package com.vigil.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vigil.detection.model.AnomalyContext;
import com.vigil.detection.model.AnomalyScore;
import com.vigil.detection.model.Severity;
import java.time.Instant;

public record AnomalyAlert(
    String id,
    String metric,
    Severity severity,
    String message,
    AnomalyScore anomalyScore,
    @JsonInclude(JsonInclude.Include.NON_NULL) AnomalyContext context,
    Instant createdAt,
    Instant resolvedAt,
    String resolvedBy
) {
  @JsonProperty("resolved")
  public boolean isResolved() {
    return resolvedAt != null;
  }
}
