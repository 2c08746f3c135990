package com.vigil.anomaly.entity;

import com.vigil.detection.model.DetectionMethod;
import com.vigil.detection.model.Severity;
import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(
  name = "anomaly_alerts",
  indexes = {
    @Index(name = "idx_alerts_created_at", columnList = "createdAt DESC"),
    @Index(name = "idx_alerts_metric_created_at", columnList = "metric,createdAt DESC")
  }
)
public class AnomalyAlertEntity {
  @Id
  @Column(length = 36)
  private String id;

  @Column(nullable = false) private String metric;
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 16) private Severity severity;
  @Column(nullable = false, length = 512) private String message;
  @Column(nullable = false) private Instant createdAt;
  private Instant resolvedAt;
  private String resolvedBy;

  // originating score, flattened
  @Column(nullable = false) private int scoreIndex;
  @Column(nullable = false) private double scoreValue;
  @Column(nullable = false) private double score;
  @Column(nullable = false) private double deviation;
  @Enumerated(EnumType.STRING)
  @Column(length = 16) private DetectionMethod method;
  @Column(nullable = false) private boolean anomalyFlag;
  @Column(nullable = false) private long scoreTimestamp;
  @Column(columnDefinition = "text") private String scoreMessage;
  @Column(columnDefinition = "text") private String scoreContextJson;

  @Column(columnDefinition = "text") private String contextJson;

  public String getId() { return id; }
  public void setId(String id) { this.id = id; }
  public String getMetric() { return metric; }
  public void setMetric(String metric) { this.metric = metric; }
  public Severity getSeverity() { return severity; }
  public void setSeverity(Severity severity) { this.severity = severity; }
  public String getMessage() { return message; }
  public void setMessage(String message) { this.message = message; }
  public Instant getCreatedAt() { return createdAt; }
  public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
  public Instant getResolvedAt() { return resolvedAt; }
  public void setResolvedAt(Instant resolvedAt) { this.resolvedAt = resolvedAt; }
  public String getResolvedBy() { return resolvedBy; }
  public void setResolvedBy(String resolvedBy) { this.resolvedBy = resolvedBy; }
  public int getScoreIndex() { return scoreIndex; }
  public void setScoreIndex(int scoreIndex) { this.scoreIndex = scoreIndex; }
  public double getScoreValue() { return scoreValue; }
  public void setScoreValue(double scoreValue) { this.scoreValue = scoreValue; }
  public double getScore() { return score; }
  public void setScore(double score) { this.score = score; }
  public double getDeviation() { return deviation; }
  public void setDeviation(double deviation) { this.deviation = deviation; }
  public DetectionMethod getMethod() { return method; }
  public void setMethod(DetectionMethod method) { this.method = method; }
  public boolean isAnomalyFlag() { return anomalyFlag; }
  public void setAnomalyFlag(boolean anomalyFlag) { this.anomalyFlag = anomalyFlag; }
  public long getScoreTimestamp() { return scoreTimestamp; }
  public void setScoreTimestamp(long scoreTimestamp) { this.scoreTimestamp = scoreTimestamp; }
  public String getScoreMessage() { return scoreMessage; }
  public void setScoreMessage(String scoreMessage) { this.scoreMessage = scoreMessage; }
  public String getScoreContextJson() { return scoreContextJson; }
  public void setScoreContextJson(String scoreContextJson) { this.scoreContextJson = scoreContextJson; }
  public String getContextJson() { return contextJson; }
  public void setContextJson(String contextJson) { this.contextJson = contextJson; }
}
