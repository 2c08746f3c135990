package com.vigil.detection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.vigil.detection.model.AggregatedAnomalyResult;
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
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

public class AnomalyDetectorTest {

  private static final long NOW = 1_700_000_000_000L;
  private static final double EPS = 1e-9;

  private final AnomalyDetector detector =
      new AnomalyDetector(Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));

  private static double[] spike(int baseline, double outlier) {
    double[] values = new double[baseline + 1];
    Arrays.fill(values, 1.0);
    values[baseline] = outlier;
    return values;
  }

  private static AnomalyScore score(double s, long ts) {
    return AnomalyScore.of(0, s, s, ts, DetectionMethod.ZSCORE, null);
  }

  @Test
  void singleSpikeInTenPointsIsTheOnlyAnomaly() {
    List<AnomalyScore> out = detector.detectAnomalies("latency", spike(9, 100), null);

    assertEquals(1, out.size());
    AnomalyScore s = out.get(0);
    assertEquals(9, s.index());
    assertEquals(100.0, s.value());
    assertTrue(s.isAnomaly());
    // one outlier among n points scores sqrt(n - 1) under population spread
    assertEquals(3.0, s.score(), EPS);
    assertEquals(Severity.HIGH, s.severity());
    assertEquals(DetectionMethod.ZSCORE, s.percentile());
    assertEquals(s.score(), s.deviation());
    assertEquals(NOW - 1000L, s.timestamp());
    assertNotNull(s.context().getPercentileValues());
  }

  @Test
  void singleSpikeInTwentyPointsIsCritical() {
    List<AnomalyScore> out = detector.detectAnomalies("latency", spike(19, 100), null);

    assertEquals(1, out.size());
    assertEquals(19, out.get(0).index());
    assertEquals(Severity.CRITICAL, out.get(0).severity());
    assertEquals("CRITICAL anomaly detected (score: 4.36)", out.get(0).message());
  }

  @Test
  void suppliedTimestampsAreUsed() {
    long[] ts = new long[20];
    for (int i = 0; i < ts.length; i++) ts[i] = 5_000L + i;
    List<AnomalyScore> out = detector.detectAnomalies("latency", spike(19, 100), ts);
    assertEquals(5_019L, out.get(0).timestamp());
  }

  @Test
  void syntheticTimestampsAreOneSecondApart() {
    double[] values = spike(19, -100);
    List<AnomalyScore> out = detector.detectAnomalies("queue", values, null);
    assertEquals(NOW - 1000L, out.get(0).timestamp());
  }

  @Test
  void degenerateSeriesProduceNoAnomalies() {
    assertTrue(detector.detectAnomalies("m", new double[0], null).isEmpty());
    assertTrue(detector.detectAnomalies("m", new double[] { 5, 5, 5, 5, 5 }, null).isEmpty());
  }

  @Test
  void everyDetectedScoreHonoursTheAnomalyFlag() {
    Random rnd = new Random(7);
    double[] values = new double[300];
    for (int i = 0; i < values.length; i++) values[i] = rnd.nextGaussian() * 10 + 100;
    for (AnomalyScore s : detector.detectAnomalies("m", values, null)) {
      assertEquals(s.severity().atLeast(Severity.MEDIUM), s.isAnomaly());
      assertTrue(s.isAnomaly());
      assertEquals(Severity.fromScore(s.score()), s.severity());
    }
  }

  @Test
  void emptyPercentileQueryReturnsNullWithZeroes() {
    PercentileDetection p95 = detector.detectP95Anomaly(new double[0], null);
    assertNull(p95.anomaly());
    assertEquals(new PercentileSet(0, 0, 0, 0, 0), p95.percentiles());
    assertNull(detector.detectP99Anomaly(new double[0], null).anomaly());
  }

  @Test
  void percentileBreachReportsEarliestInInputOrder() {
    double[] values = { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16, 17, 18, 50, 20 };
    PercentileDetection result = detector.detectP95Anomaly(values, null);

    AnomalyScore a = result.anomaly();
    assertNotNull(a);
    // p95 = 20 + 0.05 * 30 = 21.5; index 18 (50) is the first value at or above it
    assertEquals(21.5, result.percentiles().p95(), EPS);
    assertEquals(18, a.index());
    assertEquals(50.0, a.value());
    assertEquals(DetectionMethod.P95, a.percentile());
    assertEquals(21.5, a.context().getThreshold(), EPS);
  }

  @Test
  void percentileBreachPrefersFirstOverLargest() {
    double[] values = { 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 90, 100 };
    PercentileDetection p99 = detector.detectP99Anomaly(values, null);
    // p99 = 90 * 0.21 + 100 * 0.79 = 97.9
    assertEquals(21, p99.anomaly().index());
    assertEquals(97.9, p99.anomaly().context().getThreshold(), EPS);

    PercentileDetection p95 = detector.detectP95Anomaly(values, null);
    assertEquals(20, p95.anomaly().index());
    assertEquals(90.0, p95.anomaly().value());
  }

  @Test
  void flatSeriesBreachesAtFirstElementWithZeroScore() {
    PercentileDetection p = detector.detectP95Anomaly(new double[] { 4, 4, 4 }, null);
    assertEquals(0, p.anomaly().index());
    assertEquals(0.0, p.anomaly().score());
    assertEquals(Severity.LOW, p.anomaly().severity());
    assertFalse(p.anomaly().isAnomaly());
  }

  @Test
  void aggregateCountsAndOrdersTimeline() {
    List<AnomalyScore> scores = List.of(
        score(4.0, 300), score(-3.2, 100), score(2.1, 200), score(0.5, 50), score(-3.9, 250));
    AggregatedAnomalyResult r = detector.aggregateAnomalyScores(scores);

    assertEquals(5, r.totalCount());
    assertEquals(2, r.criticalCount());
    assertEquals(1, r.highCount());
    assertEquals(1, r.mediumCount());
    assertEquals(1, r.lowCount());
    assertEquals(r.totalCount(), r.criticalCount() + r.highCount() + r.mediumCount() + r.lowCount());
    assertEquals(2, r.severityDistribution().get("critical"));
    assertEquals(4.0 + 3.2 + 2.1 + 0.5 + 3.9, r.aggregatedScore(), EPS);
    assertNonDecreasing(r.timeline());
  }

  @Test
  void aggregateOfNothingIsZero() {
    AggregatedAnomalyResult r = detector.aggregateAnomalyScores(List.of());
    assertEquals(0, r.totalCount());
    assertEquals(0.0, r.aggregatedScore());
    assertTrue(r.timeline().isEmpty());
    assertEquals(4, r.severityDistribution().size());
  }

  @Test
  void criticalFilterExcludesMedium() {
    List<AnomalyScore> scores = List.of(score(2.5, 1), score(3.1, 2), score(-3.6, 3), score(1.0, 4));
    List<AnomalyScore> critical = detector.identifyCriticalAnomalies(scores);

    assertEquals(2, critical.size());
    assertEquals(Severity.HIGH, critical.get(0).severity());
    assertEquals(Severity.CRITICAL, critical.get(1).severity());
    assertTrue(scores.get(0).isAnomaly());
  }

  @Test
  void trendOverTrailingWindow() {
    TrendResult t = detector.detectTrendDeviation(new double[] { 10, 10, 10, 10, 20 }, 5);
    assertEquals(12.0, t.average(), EPS);
    assertEquals(20.0, t.lastValue(), EPS);
    assertEquals(8.0, t.deviation(), EPS);
    assertEquals(Trend.INCREASING, t.trend());
    assertTrue(t.isSignificant());
    assertEquals(5, t.windowSize());
  }

  @Test
  void trendWindowIsClampedAndOnlyTrailingPointsCount() {
    TrendResult down = detector.detectTrendDeviation(new double[] { 1000, 10, 10, 10, 5 }, 4);
    assertEquals(8.75, down.average(), EPS);
    assertEquals(Trend.DECREASING, down.trend());

    TrendResult clamped = detector.detectTrendDeviation(new double[] { 10, 10.5 }, 10);
    assertEquals(Trend.STABLE, clamped.trend());
    assertFalse(clamped.isSignificant());
    assertEquals(10, clamped.windowSize());
  }

  @Test
  void trendOfEmptySeriesIsStable() {
    TrendResult t = detector.detectTrendDeviation(new double[0], 10);
    assertEquals(Trend.STABLE, t.trend());
    assertEquals(0.0, t.average());
    assertFalse(t.isSignificant());
  }

  @Test
  void timelineDerivesRangeFromScores() {
    List<AnomalyScore> scores = List.of(score(3.6, 400), score(2.2, 100), score(3.1, 250));
    AnomalyTimeline t = detector.generateAnomalyTimeline(scores);

    assertEquals(new TimeRange(100, 400), t.range());
    assertEquals(3, t.summary().totalAnomalies());
    assertEquals(1, t.summary().criticalAnomalies());
    assertEquals(1, t.summary().highAnomalies());
    assertEquals((3.6 + 2.2 + 3.1) / 3, t.summary().averageScore(), EPS);
    assertNonDecreasing(t.timeline());
  }

  @Test
  void timelineFiltersInclusiveRange() {
    List<AnomalyScore> scores = List.of(score(3.6, 400), score(2.2, 100), score(3.1, 250), score(4.0, 99));
    AnomalyTimeline t = detector.generateAnomalyTimeline(scores, new TimeRange(100, 250));

    assertEquals(2, t.timeline().size());
    assertEquals(100L, t.timeline().get(0).timestamp());
    assertEquals(250L, t.timeline().get(1).timestamp());
    assertEquals(0, t.summary().criticalAnomalies());
    assertEquals((2.2 + 3.1) / 2, t.summary().averageScore(), EPS);
  }

  @Test
  void emptyTimelineIsRootedAtNow() {
    AnomalyTimeline t = detector.generateAnomalyTimeline(new ArrayList<>());
    assertTrue(t.timeline().isEmpty());
    assertEquals(AnomalyTimeline.Summary.EMPTY, t.summary());
    assertEquals(new TimeRange(NOW, NOW), t.range());
  }

  @Test
  void nextValueIsScoredAgainstHistory() {
    double[] history = { 2, 4, 4, 4, 5, 5, 7, 9 };
    AnomalyScore s = detector.scoreNextValue(history, 13, 42L);
    assertEquals(8, s.index());
    assertEquals(4.0, s.score(), EPS);
    assertEquals(Severity.CRITICAL, s.severity());
    assertEquals(42L, s.timestamp());
  }

  private static void assertNonDecreasing(List<TimelineEntry> timeline) {
    for (int i = 1; i < timeline.size(); i++) {
      assertTrue(timeline.get(i - 1).timestamp() <= timeline.get(i).timestamp());
    }
  }
}
