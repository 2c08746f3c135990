package com.vigil.detection.model;

public record TimelineEntry(long timestamp, double score, Severity severity) {}
