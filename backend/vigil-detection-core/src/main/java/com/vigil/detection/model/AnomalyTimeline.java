package com.vigil.detection.model;

import java.util.List;

public record AnomalyTimeline(List<TimelineEntry> timeline, Summary summary, TimeRange range) {

  public record Summary(int totalAnomalies, int criticalAnomalies, int highAnomalies, double averageScore) {
    public static final Summary EMPTY = new Summary(0, 0, 0, 0.0);
  }
}
