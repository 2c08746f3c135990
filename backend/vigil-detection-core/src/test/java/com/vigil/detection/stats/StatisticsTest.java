package com.vigil.detection.stats;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class StatisticsTest {

  private static final double EPS = 1e-9;

  @Test
  void emptySeriesHasZeroPercentiles() {
    assertEquals(PercentileSet.EMPTY, Statistics.computePercentiles(new double[0]));
    assertEquals(new PercentileSet(0, 0, 0, 0, 0), Statistics.computePercentiles(new double[0]));
  }

  @Test
  void percentilesInterpolateLinearly() {
    PercentileSet p = Statistics.computePercentiles(new double[] { 5, 1, 4, 2, 3 });
    assertEquals(3.0, p.p50(), EPS);
    assertEquals(4.0, p.p75(), EPS);
    assertEquals(4.6, p.p90(), EPS);
    assertEquals(4.8, p.p95(), EPS);
    assertEquals(4.96, p.p99(), EPS);
  }

  @Test
  void singleValueIsEveryPercentile() {
    PercentileSet p = Statistics.computePercentiles(new double[] { 7 });
    assertEquals(new PercentileSet(7, 7, 7, 7, 7), p);
  }

  @Test
  void percentilesDoNotReorderInput() {
    double[] input = { 9, 3, 7, 1 };
    Statistics.computePercentiles(input);
    assertArrayEquals(new double[] { 9, 3, 7, 1 }, input);
  }

  @ParameterizedTest
  @ValueSource(longs = { 1L, 42L, 2024L, 77_777L })
  void percentilesAreMonotonic(long seed) {
    Random rnd = new Random(seed);
    double[] values = new double[1 + rnd.nextInt(200)];
    for (int i = 0; i < values.length; i++) values[i] = rnd.nextGaussian() * 50;
    PercentileSet p = Statistics.computePercentiles(values);
    assertTrue(p.p50() <= p.p75());
    assertTrue(p.p75() <= p.p90());
    assertTrue(p.p90() <= p.p95());
    assertTrue(p.p95() <= p.p99());
  }

  @Test
  void populationMoments() {
    double[] values = { 2, 4, 4, 4, 5, 5, 7, 9 };
    assertEquals(5.0, Statistics.mean(values), EPS);
    assertEquals(4.0, Statistics.variance(values), EPS);
    assertEquals(2.0, Statistics.stddev(values), EPS);
  }

  @Test
  void degenerateSpread() {
    assertEquals(0.0, Statistics.stddev(new double[0]));
    assertEquals(0.0, Statistics.stddev(new double[] { 5 }));
    assertEquals(0.0, Statistics.stddev(new double[] { 5, 5, 5, 5, 5 }));
    assertEquals(0.0, Statistics.variance(new double[] { 0.1, 0.1, 0.1, 0.1, 0.1, 0.1, 0.1, 0.1, 0.1, 0.1 }));
    assertEquals(0.0, Statistics.mean(new double[0]));
  }

  @Test
  void nullSeriesIsRejected() {
    assertThrows(NullPointerException.class, () -> Statistics.computePercentiles(null));
    assertThrows(NullPointerException.class, () -> Statistics.mean(null));
  }
}
