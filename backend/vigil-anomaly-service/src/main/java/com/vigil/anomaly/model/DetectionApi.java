package com.vigil.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vigil.detection.model.AggregatedAnomalyResult;
import com.vigil.detection.model.AnomalyScore;
import com.vigil.detection.model.AnomalyTimeline;
import com.vigil.detection.model.TrendResult;
import com.vigil.detection.stats.PercentileSet;
import java.util.List;

/** Request and response bodies of the detection endpoints. */
public final class DetectionApi {

  private DetectionApi() {}

  public record DetectRequest(String metric, List<Double> values, List<Long> timestamps) {}

  public record SeriesRequest(List<Double> values, List<Long> timestamps, Integer windowSize) {}

  public record ScoresRequest(List<AnomalyScore> scores) {}

  public record CriticalRequest(List<AnomalyScore> anomalies) {}

  public record TimelineRequest(List<AnomalyScore> scores, TimeRangeBody timeRange) {}

  public record TimeRangeBody(Long start, Long end) {}

  public record IngestRequest(String metric, Double value, Long timestamp) {}

  public record DetectResponse(
      boolean success,
      String metric,
      int totalValues,
      int anomalyCount,
      List<AnomalyScore> anomalies,
      @JsonInclude(JsonInclude.Include.NON_EMPTY) List<AnomalyAlert> alerts
  ) {}

  public record PercentileResponse(boolean success, AnomalyScore anomaly, PercentileSet percentiles) {}

  public record AggregateResponse(boolean success, AggregatedAnomalyResult aggregated) {}

  public record CriticalResponse(boolean success, List<AnomalyScore> critical, int count) {}

  public record TrendResponse(boolean success, TrendResult trend) {}

  public record TimelineResponse(boolean success, AnomalyTimeline timeline) {}

  public record IngestResponse(
      boolean success,
      String metric,
      int historySize,
      boolean warmingUp,
      @JsonInclude(JsonInclude.Include.NON_NULL) AnomalyScore anomaly,
      @JsonInclude(JsonInclude.Include.NON_NULL) AnomalyAlert alert
  ) {}

  public record SeriesHistoryResponse(boolean success, String metric, double[] values, int size) {}
}
