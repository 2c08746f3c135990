package com.vigil.detection.model;

import java.util.List;
import java.util.Map;

public record AggregatedAnomalyResult(
    int totalCount,
    int criticalCount,
    int highCount,
    int mediumCount,
    int lowCount,
    Map<String, Integer> severityDistribution,
    double aggregatedScore,
    List<TimelineEntry> timeline
) {}
