package com.vigil.anomaly.controller;

import static com.vigil.anomaly.controller.RequestValidation.requireMetric;
import static com.vigil.anomaly.controller.RequestValidation.scores;
import static com.vigil.anomaly.controller.RequestValidation.timestamps;
import static com.vigil.anomaly.controller.RequestValidation.values;

import com.vigil.anomaly.model.DetectionApi.AggregateResponse;
import com.vigil.anomaly.model.DetectionApi.CriticalRequest;
import com.vigil.anomaly.model.DetectionApi.CriticalResponse;
import com.vigil.anomaly.model.DetectionApi.DetectRequest;
import com.vigil.anomaly.model.DetectionApi.DetectResponse;
import com.vigil.anomaly.model.DetectionApi.IngestRequest;
import com.vigil.anomaly.model.DetectionApi.IngestResponse;
import com.vigil.anomaly.model.DetectionApi.PercentileResponse;
import com.vigil.anomaly.model.DetectionApi.ScoresRequest;
import com.vigil.anomaly.model.DetectionApi.SeriesHistoryResponse;
import com.vigil.anomaly.model.DetectionApi.SeriesRequest;
import com.vigil.anomaly.model.DetectionApi.TimelineRequest;
import com.vigil.anomaly.model.DetectionApi.TimelineResponse;
import com.vigil.anomaly.model.DetectionApi.TrendResponse;
import com.vigil.anomaly.model.DetectionOutcome;
import com.vigil.anomaly.model.IngestResult;
import com.vigil.anomaly.service.AnomalyDetectionService;
import com.vigil.anomaly.service.StreamingDetectionService;
import com.vigil.detection.AnomalyDetector;
import com.vigil.detection.model.AnomalyScore;
import com.vigil.detection.model.AnomalyTimeline;
import com.vigil.detection.model.PercentileDetection;
import com.vigil.detection.model.TrendResult;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/anomalies")
public class AnomalyController {

  private static final Logger log = LoggerFactory.getLogger(AnomalyController.class);
  static final int DEFAULT_WINDOW = 10;

  private final AnomalyDetector detector;
  private final AnomalyDetectionService detection;
  private final StreamingDetectionService streaming;

  public AnomalyController(AnomalyDetector detector,
                           AnomalyDetectionService detection,
                           StreamingDetectionService streaming) {
    this.detector = detector;
    this.detection = detection;
    this.streaming = streaming;
  }

  @PostMapping("/detect")
  public DetectResponse detect(@RequestBody DetectRequest body) {
    String metric = requireMetric(body.metric());
    double[] values = values(body.values(), false);
    long[] ts = timestamps(body.timestamps(), values.length);

    DetectionOutcome out = detection.detectAndAlert(metric, values, ts);
    return new DetectResponse(true, metric, values.length, out.anomalies().size(), out.anomalies(), out.alerts());
  }

  @PostMapping("/p95")
  public PercentileResponse p95(@RequestBody SeriesRequest body) {
    double[] values = values(body.values(), true);
    PercentileDetection result = detector.detectP95Anomaly(values, timestamps(body.timestamps(), values.length));
    logPercentile("P95", result);
    return new PercentileResponse(true, result.anomaly(), result.percentiles());
  }

  @PostMapping("/p99")
  public PercentileResponse p99(@RequestBody SeriesRequest body) {
    double[] values = values(body.values(), true);
    PercentileDetection result = detector.detectP99Anomaly(values, timestamps(body.timestamps(), values.length));
    logPercentile("P99", result);
    return new PercentileResponse(true, result.anomaly(), result.percentiles());
  }

  @PostMapping("/aggregate")
  public AggregateResponse aggregate(@RequestBody ScoresRequest body) {
    return new AggregateResponse(true, detector.aggregateAnomalyScores(scores(body.scores(), "scores")));
  }

  @PostMapping("/critical")
  public CriticalResponse critical(@RequestBody CriticalRequest body) {
    List<AnomalyScore> critical = detector.identifyCriticalAnomalies(scores(body.anomalies(), "anomalies"));
    return new CriticalResponse(true, critical, critical.size());
  }

  @PostMapping("/trend")
  public TrendResponse trend(@RequestBody SeriesRequest body) {
    double[] values = values(body.values(), true);
    timestamps(body.timestamps(), values.length);
    int window = body.windowSize() == null ? DEFAULT_WINDOW : body.windowSize();
    if (window < 1) throw new InvalidRequestException("windowSize must be a positive integer");

    TrendResult trend = detector.detectTrendDeviation(values, window);
    log.info("Trend deviation detected: trend={} deviation={} significant={}",
        trend.trend().label(), trend.deviation(), trend.isSignificant());
    return new TrendResponse(true, trend);
  }

  @PostMapping("/timeline")
  public TimelineResponse timeline(@RequestBody TimelineRequest body) {
    List<AnomalyScore> scores = scores(body.scores(), "scores");
    Long start = body.timeRange() == null ? null : body.timeRange().start();
    Long end = body.timeRange() == null ? null : body.timeRange().end();
    if (start != null && end != null && start > end) {
      throw new InvalidRequestException("timeRange.start must not be after timeRange.end");
    }
    AnomalyTimeline timeline = detector.generateAnomalyTimeline(scores, start, end);
    return new TimelineResponse(true, timeline);
  }

  @PostMapping("/ingest")
  public IngestResponse ingest(@RequestBody IngestRequest body) {
    String metric = requireMetric(body.metric());
    if (body.value() == null) throw new InvalidRequestException("value is required");
    IngestResult r = streaming.ingest(metric, body.value(), body.timestamp());
    return new IngestResponse(true, r.metric(), r.historySize(), r.warmingUp(), r.anomaly(), r.alert());
  }

  @GetMapping("/history/{metric}")
  public SeriesHistoryResponse history(@PathVariable("metric") String metric) {
    double[] values = streaming.history(metric);
    return new SeriesHistoryResponse(true, metric, values, values.length);
  }

  private static void logPercentile(String label, PercentileDetection result) {
    if (result.anomaly() == null) {
      log.info("{} check: no value reached the threshold", label);
    } else {
      log.info("{} anomaly detected: index={} severity={} score={}", label,
          result.anomaly().index(), result.anomaly().severity().label(), result.anomaly().score());
    }
  }
}
