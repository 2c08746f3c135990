package com.vigil.anomaly.model;

import com.vigil.detection.model.TimeRange;

public record AlertStats(
    long total,
    long critical,
    long high,
    long medium,
    long low,
    long resolved,
    long unresolved,
    TimeRange window
) {}
