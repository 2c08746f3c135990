package com.vigil.anomaly.service;

import com.vigil.anomaly.history.MetricHistoryStore;
import com.vigil.anomaly.model.AnomalyAlert;
import com.vigil.anomaly.model.IngestResult;
import com.vigil.detection.AnomalyDetector;
import com.vigil.detection.model.AnomalyContext;
import com.vigil.detection.model.AnomalyScore;
import com.vigil.detection.model.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Scores single samples as they arrive against the bounded history of their series. The sample
 * is compared with the history that preceded it, then becomes part of that history.
 */
@Service
public class StreamingDetectionService {

  private static final Logger log = LoggerFactory.getLogger(StreamingDetectionService.class);

  private final MetricHistoryStore history;
  private final AnomalyDetector detector;
  private final AlertService alerts;
  private final Clock clock;
  private final int minSamples;
  private final Counter samplesIngested;
  private final Counter alertsFailed;

  public StreamingDetectionService(MetricHistoryStore history,
                                   AnomalyDetector detector,
                                   AlertService alerts,
                                   Clock clock,
                                   @Value("${vigil.history.min-samples:10}") int minSamples,
                                   MeterRegistry metrics) {
    this.history = history;
    this.detector = detector;
    this.alerts = alerts;
    this.clock = clock;
    this.minSamples = minSamples;
    this.samplesIngested = metrics.counter("vigil_ingest_samples_total");
    this.alertsFailed = metrics.counter("vigil_alerts_failed_total");
  }

  public IngestResult ingest(String metric, double value, Long timestamp) {
    double[] prior = history.append(metric, value);
    samplesIngested.increment();
    int size = Math.min(prior.length + 1, history.capacity());

    if (prior.length < minSamples) {
      log.debug("Ingest warming up: metric='{}' samples={} required={}", metric, prior.length, minSamples);
      return IngestResult.warmingUp(metric, size);
    }

    long ts = timestamp != null ? timestamp : clock.millis();
    AnomalyScore score = detector.scoreNextValue(prior, value, ts);
    AnomalyAlert alert = null;
    if (score.severity().atLeast(Severity.HIGH)) {
      try {
        alert = alerts.createCriticalAlert(metric, score, AnomalyContext.withTotalValues(size));
      } catch (RuntimeException e) {
        alertsFailed.increment();
        log.error("Failed to create alert for streamed sample: metric='{}' value={} error={}",
            metric, value, e.getMessage());
      }
    }
    return new IngestResult(metric, size, false, score, alert);
  }

  public double[] history(String metric) {
    return history.snapshot(metric);
  }
}
