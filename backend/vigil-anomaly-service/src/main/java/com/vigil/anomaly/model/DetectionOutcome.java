package com.vigil.anomaly.model;

import com.vigil.detection.model.AnomalyScore;
import java.util.List;

/** Anomalies found in one series plus the alerts raised for them; {@code failedAlerts} counts creations that threw. */
public record DetectionOutcome(List<AnomalyScore> anomalies, List<AnomalyAlert> alerts, int failedAlerts) {}
