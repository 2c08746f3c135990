package com.vigil.detection;

import com.vigil.detection.model.AggregatedAnomalyResult;
import com.vigil.detection.model.AnomalyContext;
import com.vigil.detection.model.AnomalyScore;
import com.vigil.detection.model.AnomalyTimeline;
import com.vigil.detection.model.DetectionMethod;
import com.vigil.detection.model.PercentileDetection;
import com.vigil.detection.model.Severity;
import com.vigil.detection.model.TimeRange;
import com.vigil.detection.model.TimelineEntry;
import com.vigil.detection.model.Trend;
import com.vigil.detection.model.TrendResult;
import com.vigil.detection.stats.PercentileSet;
import com.vigil.detection.stats.Statistics;
import com.vigil.detection.stats.ZScoreScorer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Statistical anomaly classification over caller-supplied series.
 *
 * <p>Holds no mutable state; one instance can serve any number of threads. Degenerate input
 * (empty series, zero spread, no percentile breach) yields empty or null results rather than
 * exceptions.
 */
public class AnomalyDetector {

  private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

  static final long SYNTHETIC_SPACING_MS = 1000L;
  private static final double TREND_BAND = 0.1;

  private final Clock clock;

  public AnomalyDetector(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public AnomalyDetector() {
    this(Clock.systemUTC());
  }

  /**
   * Scores every point of {@code values} against the whole series and keeps the ones rated
   * medium or worse. {@code timestamps} may be null, in which case points are placed one second
   * apart ending at the current time.
   */
  public List<AnomalyScore> detectAnomalies(String metricName, double[] values, long[] timestamps) {
    Objects.requireNonNull(values, "values");
    if (values.length == 0) {
      log.warn("Anomaly detection skipped: empty values for metric='{}'", metricName);
      return List.of();
    }
    long now = clock.millis();
    double[] z = ZScoreScorer.calculateZScores(values);
    PercentileSet percentiles = Statistics.computePercentiles(values);

    List<AnomalyScore> out = new ArrayList<>();
    for (int i = 0; i < values.length; i++) {
      AnomalyScore s = AnomalyScore.of(i, values[i], z[i], timestampAt(timestamps, i, values.length, now),
          DetectionMethod.ZSCORE, AnomalyContext.withPercentiles(percentiles));
      if (s.isAnomaly()) out.add(s);
    }
    log.debug("Detection: metric='{}' points={} anomalies={}", metricName, values.length, out.size());
    return out;
  }

  public PercentileDetection detectP95Anomaly(double[] values, long[] timestamps) {
    return detectPercentileAnomaly(values, timestamps, DetectionMethod.P95);
  }

  public PercentileDetection detectP99Anomaly(double[] values, long[] timestamps) {
    return detectPercentileAnomaly(values, timestamps, DetectionMethod.P99);
  }

  /**
   * Reports the earliest point, in input order, that reaches the percentile threshold. This is
   * the first breach, not the largest one.
   */
  private PercentileDetection detectPercentileAnomaly(double[] values, long[] timestamps, DetectionMethod method) {
    Objects.requireNonNull(values, "values");
    if (values.length == 0) return new PercentileDetection(null, PercentileSet.EMPTY);

    PercentileSet percentiles = Statistics.computePercentiles(values);
    double threshold = method == DetectionMethod.P99 ? percentiles.p99() : percentiles.p95();
    int index = -1;
    for (int i = 0; i < values.length; i++) {
      if (values[i] >= threshold) {
        index = i;
        break;
      }
    }
    if (index < 0) return new PercentileDetection(null, percentiles);

    double value = values[index];
    double score = ZScoreScorer.scoreAgainstDistribution(values, value);
    long ts = timestampAt(timestamps, index, values.length, clock.millis());
    return new PercentileDetection(
        AnomalyScore.of(index, value, score, ts, method, AnomalyContext.withThreshold(threshold)),
        percentiles);
  }

  /**
   * Scores one incoming value against previously observed history. The returned index is the
   * position the value takes in the series, i.e. {@code history.length}.
   */
  public AnomalyScore scoreNextValue(double[] history, double value, long timestamp) {
    Objects.requireNonNull(history, "history");
    double score = ZScoreScorer.scoreAgainstDistribution(history, value);
    return AnomalyScore.of(history.length, value, score, timestamp, DetectionMethod.ZSCORE,
        AnomalyContext.withPercentiles(Statistics.computePercentiles(history)));
  }

  public AggregatedAnomalyResult aggregateAnomalyScores(List<AnomalyScore> scores) {
    Objects.requireNonNull(scores, "scores");
    Map<Severity, Integer> counts = new LinkedHashMap<>();
    for (Severity s : Severity.values()) counts.put(s, 0);

    double aggregated = 0.0;
    List<TimelineEntry> timeline = new ArrayList<>(scores.size());
    for (AnomalyScore s : scores) {
      counts.merge(s.severity(), 1, Integer::sum);
      aggregated += Math.abs(s.score());
      timeline.add(new TimelineEntry(s.timestamp(), s.score(), s.severity()));
    }
    timeline.sort(Comparator.comparingLong(TimelineEntry::timestamp));

    Map<String, Integer> distribution = new LinkedHashMap<>();
    counts.forEach((severity, n) -> distribution.put(severity.label(), n));
    return new AggregatedAnomalyResult(
        scores.size(),
        counts.get(Severity.CRITICAL),
        counts.get(Severity.HIGH),
        counts.get(Severity.MEDIUM),
        counts.get(Severity.LOW),
        distribution,
        aggregated,
        timeline);
  }

  /** Keeps high and critical scores only; medium ones pass {@code isAnomaly} but not this cut. */
  public List<AnomalyScore> identifyCriticalAnomalies(List<AnomalyScore> scores) {
    Objects.requireNonNull(scores, "scores");
    return scores.stream()
        .filter(s -> s.severity() != null && s.severity().atLeast(Severity.HIGH))
        .toList();
  }

  /**
   * Compares the last value of the trailing window with the window average. The band for both
   * the direction and the significance flag is 10% of the average.
   */
  public TrendResult detectTrendDeviation(double[] values, int windowSize) {
    Objects.requireNonNull(values, "values");
    if (values.length == 0) return TrendResult.stable(windowSize);

    int span = Math.max(1, Math.min(windowSize, values.length));
    double[] window = new double[span];
    System.arraycopy(values, values.length - span, window, 0, span);

    double average = Statistics.mean(window);
    double lastValue = window[span - 1];
    double deviation = lastValue - average;

    Trend trend = Trend.STABLE;
    if (deviation > TREND_BAND * average) {
      trend = Trend.INCREASING;
    } else if (deviation < -TREND_BAND * average) {
      trend = Trend.DECREASING;
    }
    boolean significant = Math.abs(deviation) > Math.abs(average) * TREND_BAND;
    return new TrendResult(trend, deviation, significant, windowSize, average, lastValue);
  }

  public AnomalyTimeline generateAnomalyTimeline(List<AnomalyScore> scores) {
    return generateAnomalyTimeline(scores, null, null);
  }

  public AnomalyTimeline generateAnomalyTimeline(List<AnomalyScore> scores, TimeRange range) {
    return range == null
        ? generateAnomalyTimeline(scores, null, null)
        : generateAnomalyTimeline(scores, range.start(), range.end());
  }

  /**
   * Builds a time-ordered view of the scores inside {@code [start, end]}. A missing bound is
   * taken from the earliest or latest score; with no scores both default to now.
   */
  public AnomalyTimeline generateAnomalyTimeline(List<AnomalyScore> scores, Long start, Long end) {
    Objects.requireNonNull(scores, "scores");
    if (scores.isEmpty()) {
      long now = clock.millis();
      return new AnomalyTimeline(List.of(), AnomalyTimeline.Summary.EMPTY,
          new TimeRange(start != null ? start : now, end != null ? end : now));
    }

    long from = start != null ? start : scores.stream().mapToLong(AnomalyScore::timestamp).min().getAsLong();
    long to = end != null ? end : scores.stream().mapToLong(AnomalyScore::timestamp).max().getAsLong();
    TimeRange range = new TimeRange(from, to);

    int critical = 0;
    int high = 0;
    double absSum = 0.0;
    List<TimelineEntry> timeline = new ArrayList<>();
    for (AnomalyScore s : scores) {
      if (!range.contains(s.timestamp())) continue;
      if (s.severity() == Severity.CRITICAL) critical++;
      if (s.severity() == Severity.HIGH) high++;
      absSum += Math.abs(s.score());
      timeline.add(new TimelineEntry(s.timestamp(), s.score(), s.severity()));
    }
    timeline.sort(Comparator.comparingLong(TimelineEntry::timestamp));

    double average = timeline.isEmpty() ? 0.0 : absSum / timeline.size();
    return new AnomalyTimeline(timeline,
        new AnomalyTimeline.Summary(timeline.size(), critical, high, average), range);
  }

  private static long timestampAt(long[] timestamps, int index, int length, long now) {
    if (timestamps == null) return now - (long) (length - index) * SYNTHETIC_SPACING_MS;
    return index < timestamps.length ? timestamps[index] : now;
  }
}
