package com.vigil.anomaly.service;

import com.vigil.anomaly.model.AnomalyAlert;
import com.vigil.anomaly.model.DetectionOutcome;
import com.vigil.detection.AnomalyDetector;
import com.vigil.detection.model.AnomalyContext;
import com.vigil.detection.model.AnomalyScore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Full-series detection followed by alerting on the high and critical results. Alert creations
 * run in parallel; one failing creation is logged and counted without affecting the others.
 */
@Service
public class AnomalyDetectionService {

  private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

  private final AnomalyDetector detector;
  private final AlertService alerts;
  private final Executor alertExecutor;
  private final MeterRegistry metrics;
  private final Counter anomaliesDetected;
  private final Counter alertsFailed;
  private final Timer detectionDuration;

  public AnomalyDetectionService(AnomalyDetector detector,
                                 AlertService alerts,
                                 @Qualifier("alertExecutor") Executor alertExecutor,
                                 MeterRegistry metrics) {
    this.detector = detector;
    this.alerts = alerts;
    this.alertExecutor = alertExecutor;
    this.metrics = metrics;
    this.anomaliesDetected = metrics.counter("vigil_anomalies_detected_total");
    this.alertsFailed = metrics.counter("vigil_alerts_failed_total");
    this.detectionDuration = metrics.timer("vigil_detection_duration_seconds");
  }

  public DetectionOutcome detectAndAlert(String metric, double[] values, long[] timestamps) {
    Timer.Sample sample = Timer.start(metrics);
    List<AnomalyScore> anomalies;
    try {
      anomalies = detector.detectAnomalies(metric, values, timestamps);
    } finally {
      sample.stop(detectionDuration);
    }
    anomaliesDetected.increment(anomalies.size());

    List<AnomalyScore> critical = detector.identifyCriticalAnomalies(anomalies);
    List<CompletableFuture<AnomalyAlert>> pending = new ArrayList<>(critical.size());
    for (AnomalyScore anomaly : critical) {
      pending.add(submit(metric, anomaly, values.length));
    }

    List<AnomalyAlert> created = new ArrayList<>(pending.size());
    int failed = 0;
    for (int i = 0; i < pending.size(); i++) {
      try {
        created.add(pending.get(i).join());
      } catch (CompletionException e) {
        failed++;
        alertsFailed.increment();
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        log.error("Failed to create alert for anomaly: metric='{}' index={} severity={} error={}",
            metric, critical.get(i).index(), critical.get(i).severity().label(), cause.getMessage());
      }
    }

    log.info("Anomalies detected: metric='{}' totalValues={} anomalyCount={} criticalCount={} alertCount={} failed={}",
        metric, values.length, anomalies.size(), critical.size(), created.size(), failed);
    return new DetectionOutcome(anomalies, created, failed);
  }

  private CompletableFuture<AnomalyAlert> submit(String metric, AnomalyScore anomaly, int totalValues) {
    try {
      return CompletableFuture.supplyAsync(
          () -> alerts.createCriticalAlert(metric, anomaly, AnomalyContext.withTotalValues(totalValues)),
          alertExecutor);
    } catch (RuntimeException rejected) {
      return CompletableFuture.failedFuture(rejected);
    }
  }
}
