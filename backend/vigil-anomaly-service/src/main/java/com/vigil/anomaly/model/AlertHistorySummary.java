package com.vigil.anomaly.model;

import com.vigil.detection.model.TimeRange;
import java.util.List;

public record AlertHistorySummary(
    int totalCount,
    int criticalCount,
    int highCount,
    TimeRange timeRange,
    List<AnomalyAlert> entries
) {}
