package com.vigil.anomaly.controller;

import static com.vigil.anomaly.controller.RequestValidation.requireMetric;
import static com.vigil.anomaly.controller.RequestValidation.requireScore;
import static com.vigil.anomaly.controller.RequestValidation.resolver;
import static com.vigil.anomaly.controller.RequestValidation.severity;

import com.vigil.anomaly.model.AlertApi.AlertListResponse;
import com.vigil.anomaly.model.AlertApi.AlertResponse;
import com.vigil.anomaly.model.AlertApi.CreateAlertRequest;
import com.vigil.anomaly.model.AlertApi.ErrorResponse;
import com.vigil.anomaly.model.AlertApi.HistoryResponse;
import com.vigil.anomaly.model.AlertApi.ResolveRequest;
import com.vigil.anomaly.model.AlertApi.ResolveResponse;
import com.vigil.anomaly.model.AlertApi.StatsResponse;
import com.vigil.anomaly.model.AlertHistorySummary;
import com.vigil.anomaly.model.AnomalyAlert;
import com.vigil.anomaly.service.AlertService;
import com.vigil.anomaly.service.AlertStreamService;
import com.vigil.detection.model.AnomalyScore;
import com.vigil.detection.model.Severity;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/anomalies/alerts")
public class AlertController {

  static final Duration DEFAULT_HISTORY = Duration.ofHours(24);

  private final AlertService alerts;
  private final AlertStreamService stream;
  private final Clock clock;

  public AlertController(AlertService alerts, AlertStreamService stream, Clock clock) {
    this.alerts = alerts;
    this.stream = stream;
    this.clock = clock;
  }

  @PostMapping("/create")
  public ResponseEntity<AlertResponse> create(@RequestBody CreateAlertRequest body) {
    String metric = requireMetric(body.metric());
    AnomalyScore score = requireScore(body.anomalyScore(), "anomalyScore");
    AnomalyAlert alert = alerts.createCriticalAlert(metric, score, body.context());
    return ResponseEntity.status(HttpStatus.CREATED).body(new AlertResponse(true, alert));
  }

  @GetMapping
  public AlertListResponse recent(
      @RequestParam(name = "limit", defaultValue = "50") int limit,
      @RequestParam(name = "severity", required = false) String severityLabel
  ) {
    Severity severity = severity(severityLabel);
    List<AnomalyAlert> list = alerts.getRecentAlerts(limit, severity);
    return new AlertListResponse(true, list, list.size(), limit, severity == null ? null : severity.label());
  }

  @GetMapping("/history")
  public HistoryResponse history(
      @RequestParam(name = "startTime", required = false) Long startTime,
      @RequestParam(name = "endTime", required = false) Long endTime,
      @RequestParam(name = "severity", required = false) String severityLabel
  ) {
    long end = endTime != null ? endTime : clock.millis();
    long start = startTime != null ? startTime : end - DEFAULT_HISTORY.toMillis();
    if (start > end) throw new InvalidRequestException("startTime must not be after endTime");
    AlertHistorySummary summary = alerts.getAlertHistory(start, end, severity(severityLabel));
    return new HistoryResponse(true, summary);
  }

  @PostMapping("/{alertId}/resolve")
  public ResponseEntity<?> resolve(@PathVariable("alertId") String alertId,
                                   @RequestBody(required = false) ResolveRequest body) {
    String resolvedBy = resolver(body == null ? null : body.resolvedBy());
    if (!alerts.resolveAlert(alertId, resolvedBy)) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of("Alert not found"));
    }
    return ResponseEntity.ok(new ResolveResponse(true, "Alert resolved successfully", alertId));
  }

  @GetMapping("/stats")
  public StatsResponse stats(@RequestParam(name = "timeRange", defaultValue = "24h") String timeRange) {
    return new StatsResponse(true, alerts.getAlertStats(timeRange), timeRange);
  }

  @GetMapping(path = "/stream", produces = "text/event-stream")
  public SseEmitter streamAlerts(@RequestParam(name = "timeoutMs", defaultValue = "300000") long timeoutMs) {
    return stream.registerClient(timeoutMs);
  }
}
