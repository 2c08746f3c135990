package com.vigil.anomaly.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vigil.anomaly.entity.AnomalyAlertEntity;
import com.vigil.anomaly.model.AlertHistorySummary;
import com.vigil.anomaly.model.AlertStats;
import com.vigil.anomaly.model.AnomalyAlert;
import com.vigil.anomaly.publish.AlertEventPublisher;
import com.vigil.anomaly.repo.AnomalyAlertRepository;
import com.vigil.detection.model.AnomalyContext;
import com.vigil.detection.model.AnomalyScore;
import com.vigil.detection.model.DetectionMethod;
import com.vigil.detection.model.Severity;
import com.vigil.detection.model.TimeRange;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Owns the alert log: creation with duplicate suppression, queries, resolution and statistics.
 *
 * <p>A create request is suppressed when an unresolved alert with the same metric, severity and
 * message was created within the dedup window; the existing alert is returned instead. Alerts are
 * never deleted, and resolution sets {@code resolvedAt}/{@code resolvedBy} once.
 */
@Service
public class AlertService {

  private static final Logger log = LoggerFactory.getLogger(AlertService.class);

  static final int MAX_LIMIT = 500;
  private static final int LOCK_STRIPES = 64;

  private final AnomalyAlertRepository repo;
  private final ObjectMapper mapper;
  private final Clock clock;
  private final List<AlertEventPublisher> publishers;
  private final Duration dedupWindow;
  private final Object[] createLocks = new Object[LOCK_STRIPES];

  private final Counter alertsCreated;
  private final Counter alertsSuppressed;
  private final Counter alertsResolved;

  public AlertService(AnomalyAlertRepository repo,
                      ObjectMapper mapper,
                      Clock clock,
                      List<AlertEventPublisher> publishers,
                      @Value("${vigil.alerts.dedup-window:PT5M}") Duration dedupWindow,
                      MeterRegistry metrics) {
    this.repo = repo;
    this.mapper = mapper;
    this.clock = clock;
    this.publishers = List.copyOf(publishers);
    this.dedupWindow = dedupWindow;
    for (int i = 0; i < LOCK_STRIPES; i++) createLocks[i] = new Object();
    this.alertsCreated = metrics.counter("vigil_alerts_created_total");
    this.alertsSuppressed = metrics.counter("vigil_alerts_suppressed_total", "reason", "duplicate");
    this.alertsResolved = metrics.counter("vigil_alerts_resolved_total");
  }

  /**
   * Persists an alert for {@code score}. Callers decide whether the score warrants alerting.
   * Persistence failures are logged and rethrown.
   */
  public AnomalyAlert createCriticalAlert(String metric, AnomalyScore score, AnomalyContext context) {
    String message = alertMessage(metric, score);
    Instant now = clock.instant();

    AnomalyAlertEntity saved;
    try {
      // check-then-insert per metric; stripes bound the lock set
      synchronized (createLocks[Math.floorMod(metric.hashCode(), LOCK_STRIPES)]) {
        Optional<AnomalyAlertEntity> existing =
            repo.findFirstByMetricAndSeverityAndMessageAndResolvedAtIsNullAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(
                metric, score.severity(), message, now.minus(dedupWindow));
        if (existing.isPresent()) {
          alertsSuppressed.increment();
          log.info("Duplicate alert suppressed: metric='{}' severity={} existing={}",
              metric, score.severity().label(), existing.get().getId());
          return toAlert(existing.get());
        }
        saved = repo.save(toEntity(metric, score, context, message, now));
      }
    } catch (RuntimeException e) {
      log.error("Failed to create anomaly alert: metric='{}' severity={} error={}",
          metric, score.severity().label(), e.getMessage());
      throw e;
    }

    alertsCreated.increment();
    AnomalyAlert alert = toAlert(saved);
    if (alert.severity().atLeast(Severity.HIGH)) {
      log.warn("Critical anomaly alert created: id={} metric='{}' severity={} score={} method={}",
          alert.id(), metric, alert.severity().label(), String.format(Locale.ROOT, "%.2f", score.score()),
          methodTag(score));
    } else {
      log.info("Anomaly alert created: id={} metric='{}' severity={}", alert.id(), metric, alert.severity().label());
    }
    publish(alert, false);
    return alert;
  }

  public List<AnomalyAlert> getRecentAlerts(int limit, Severity severity) {
    PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, MAX_LIMIT)));
    try {
      List<AnomalyAlertEntity> rows = severity == null
          ? repo.findAllByOrderByCreatedAtDesc(page)
          : repo.findBySeverityOrderByCreatedAtDesc(severity, page);
      return rows.stream().map(this::toAlert).toList();
    } catch (RuntimeException e) {
      log.error("Failed to get recent alerts: limit={} severity={} error={}", limit, severity, e.getMessage());
      throw e;
    }
  }

  /** Inclusive on both ends; entries come newest first. */
  public AlertHistorySummary getAlertHistory(long startMillis, long endMillis, Severity severity) {
    Instant start = Instant.ofEpochMilli(startMillis);
    Instant end = Instant.ofEpochMilli(endMillis);
    try {
      List<AnomalyAlertEntity> rows = severity == null
          ? repo.findByCreatedAtBetweenOrderByCreatedAtDesc(start, end)
          : repo.findBySeverityAndCreatedAtBetweenOrderByCreatedAtDesc(severity, start, end);
      List<AnomalyAlert> entries = rows.stream().map(this::toAlert).toList();
      int critical = (int) entries.stream().filter(a -> a.severity() == Severity.CRITICAL).count();
      int high = (int) entries.stream().filter(a -> a.severity() == Severity.HIGH).count();
      return new AlertHistorySummary(entries.size(), critical, high, new TimeRange(startMillis, endMillis), entries);
    } catch (RuntimeException e) {
      log.error("Failed to get alert history: start={} end={} error={}", startMillis, endMillis, e.getMessage());
      throw e;
    }
  }

  /**
   * Returns false when no alert has {@code alertId}. Resolving twice keeps the first resolution.
   * The resolved event goes out once the transaction commits.
   */
  @Transactional
  public boolean resolveAlert(String alertId, String resolvedBy) {
    Optional<AnomalyAlertEntity> found;
    try {
      found = repo.findById(alertId);
    } catch (RuntimeException e) {
      log.error("Failed to resolve alert: id={} error={}", alertId, e.getMessage());
      throw e;
    }
    if (found.isEmpty()) {
      log.warn("Alert not found for resolution: id={}", alertId);
      return false;
    }
    AnomalyAlertEntity row = found.get();
    if (row.getResolvedAt() != null) {
      log.info("Alert already resolved: id={} at={} by={}", alertId, row.getResolvedAt(), row.getResolvedBy());
      return true;
    }
    row.setResolvedAt(clock.instant());
    row.setResolvedBy(resolvedBy);
    try {
      row = repo.save(row);
    } catch (RuntimeException e) {
      log.error("Failed to resolve alert: id={} metric='{}' error={}", alertId, row.getMetric(), e.getMessage());
      throw e;
    }
    alertsResolved.increment();
    log.info("Alert resolved: id={} metric='{}' by={}", alertId, row.getMetric(), resolvedBy);
    publishAfterCommit(toAlert(row));
    return true;
  }

  public AlertStats getAlertStats(String timeRangeLabel) {
    Instant end = clock.instant();
    Instant start = end.minus(AlertWindow.parse(timeRangeLabel));
    try {
      Map<Severity, Long> counts = new EnumMap<>(Severity.class);
      for (Severity s : Severity.values()) counts.put(s, 0L);
      for (Object[] row : repo.countBySeverityBetween(start, end)) {
        counts.put((Severity) row[0], ((Number) row[1]).longValue());
      }
      long total = counts.values().stream().mapToLong(Long::longValue).sum();
      long resolved = repo.countByCreatedAtBetweenAndResolvedAtIsNotNull(start, end);
      return new AlertStats(total,
          counts.get(Severity.CRITICAL), counts.get(Severity.HIGH), counts.get(Severity.MEDIUM), counts.get(Severity.LOW),
          resolved, total - resolved,
          new TimeRange(start.toEpochMilli(), end.toEpochMilli()));
    } catch (RuntimeException e) {
      log.error("Failed to get alert stats: timeRange={} error={}", timeRangeLabel, e.getMessage());
      throw e;
    }
  }

  static String alertMessage(String metric, AnomalyScore score) {
    return String.format(Locale.ROOT, "%s anomaly detected in %s - %s deviation: %.2f (score: %.2f)",
        score.severity().name(), metric, methodTag(score), Math.abs(score.deviation()), score.score());
  }

  private static String methodTag(AnomalyScore score) {
    return score.percentile() == null ? DetectionMethod.ZSCORE.tag() : score.percentile().tag();
  }

  private void publish(AnomalyAlert alert, boolean resolved) {
    for (AlertEventPublisher p : publishers) {
      try {
        if (resolved) p.alertResolved(alert);
        else p.alertCreated(alert);
      } catch (Exception e) {
        log.debug("Alert publisher {} failed (non-fatal): alert={} {}", p.getClass().getSimpleName(), alert.id(), e.getMessage());
      }
    }
  }

  // subscribers must never see a resolution that is rolled back
  private void publishAfterCommit(AnomalyAlert alert) {
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      publish(alert, true);
      return;
    }
    TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
      @Override
      public void afterCommit() {
        publish(alert, true);
      }
    });
  }

  private AnomalyAlertEntity toEntity(String metric, AnomalyScore score, AnomalyContext context, String message, Instant now) {
    AnomalyAlertEntity e = new AnomalyAlertEntity();
    e.setId(UUID.randomUUID().toString());
    e.setMetric(metric);
    e.setSeverity(score.severity());
    e.setMessage(message);
    e.setCreatedAt(now);
    e.setScoreIndex(score.index());
    e.setScoreValue(score.value());
    e.setScore(score.score());
    e.setDeviation(score.deviation());
    e.setMethod(score.percentile());
    e.setAnomalyFlag(score.isAnomaly());
    e.setScoreTimestamp(score.timestamp());
    e.setScoreMessage(score.message());
    e.setScoreContextJson(writeContext(score.context()));
    e.setContextJson(writeContext(context));
    return e;
  }

  private AnomalyAlert toAlert(AnomalyAlertEntity e) {
    AnomalyScore score = new AnomalyScore(
        e.getScoreIndex(),
        e.getScoreValue(),
        e.getScore(),
        e.getSeverity(),
        e.getDeviation(),
        e.getMethod(),
        e.isAnomalyFlag(),
        e.getScoreTimestamp(),
        e.getScoreMessage(),
        readContext(e.getScoreContextJson(), e.getId()));
    return new AnomalyAlert(e.getId(), e.getMetric(), e.getSeverity(), e.getMessage(), score,
        readContext(e.getContextJson(), e.getId()), e.getCreatedAt(), e.getResolvedAt(), e.getResolvedBy());
  }

  private String writeContext(AnomalyContext context) {
    if (context == null || context.isEmpty()) return null;
    try {
      return mapper.writeValueAsString(context);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize alert context", e);
    }
  }

  private AnomalyContext readContext(String json, String alertId) {
    if (json == null || json.isBlank()) return null;
    try {
      return mapper.readValue(json, AnomalyContext.class);
    } catch (JsonProcessingException e) {
      log.warn("Unreadable context on alert {}: {}", alertId, e.getMessage());
      return null;
    }
  }
}
