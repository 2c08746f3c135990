package com.vigil.anomaly.model;

import com.vigil.detection.model.AnomalyScore;

public record IngestResult(
    String metric,
    int historySize,
    boolean warmingUp,
    AnomalyScore anomaly,
    AnomalyAlert alert
) {
  public static IngestResult warmingUp(String metric, int historySize) {
    return new IngestResult(metric, historySize, true, null, null);
  }
}
