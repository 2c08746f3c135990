package com.vigil.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vigil.detection.model.AnomalyContext;
import com.vigil.detection.model.AnomalyScore;
import java.util.List;

/** Request and response bodies of the alert endpoints. */
public final class AlertApi {

  private AlertApi() {}

  public record CreateAlertRequest(String metric, AnomalyScore anomalyScore, AnomalyContext context) {}

  public record ResolveRequest(String resolvedBy) {}

  public record AlertResponse(boolean success, AnomalyAlert alert) {}

  public record AlertListResponse(
      boolean success,
      List<AnomalyAlert> alerts,
      int count,
      int limit,
      @JsonInclude(JsonInclude.Include.NON_NULL) String severity
  ) {}

  public record HistoryResponse(boolean success, AlertHistorySummary history) {}

  public record ResolveResponse(boolean success, String message, String alertId) {}

  public record StatsResponse(boolean success, AlertStats stats, String timeRange) {}

  public record ErrorResponse(boolean success, String error) {
    public static ErrorResponse of(String error) {
      return new ErrorResponse(false, error);
    }
  }
}
