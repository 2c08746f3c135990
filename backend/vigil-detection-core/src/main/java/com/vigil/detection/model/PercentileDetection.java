package com.vigil.detection.model;

import com.vigil.detection.stats.PercentileSet;

/** Outcome of a percentile breach check; {@code anomaly} is null when nothing reached the threshold. */
public record PercentileDetection(AnomalyScore anomaly, PercentileSet percentiles) {}
