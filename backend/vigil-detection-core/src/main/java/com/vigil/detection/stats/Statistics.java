package com.vigil.detection.stats;

import java.util.Arrays;
import java.util.Objects;

/**
 * Moments and linearly interpolated quantiles over a finite series.
 *
 * <p>Quantiles follow the R-7 definition: for probability {@code q} over {@code n} sorted
 * values the position is {@code q * (n - 1)}, interpolated between the two neighbouring
 * order statistics.
 */
public final class Statistics {

  private Statistics() {}

  public static double mean(double[] values) {
    Objects.requireNonNull(values, "values");
    if (values.length == 0) return 0.0;
    double sum = 0.0;
    for (double v : values) sum += v;
    return sum / values.length;
  }

  public static double variance(double[] values) {
    Objects.requireNonNull(values, "values");
    int n = values.length;
    if (n < 2 || isConstant(values)) return 0.0;
    double mean = mean(values);
    double acc = 0.0;
    for (double v : values) {
      double d = v - mean;
      acc += d * d;
    }
    // population variance (n)
    return acc / n;
  }

  // a constant series has no spread even when its rounded mean leaves a residue (ten 0.1s)
  private static boolean isConstant(double[] values) {
    double first = values[0];
    for (double v : values) {
      if (v != first) return false;
    }
    return true;
  }

  public static double stddev(double[] values) {
    return Math.sqrt(variance(values));
  }

  public static PercentileSet computePercentiles(double[] values) {
    Objects.requireNonNull(values, "values");
    if (values.length == 0) return PercentileSet.EMPTY;
    double[] sorted = Arrays.copyOf(values, values.length);
    Arrays.sort(sorted);
    return new PercentileSet(
        quantile(sorted, 0.50),
        quantile(sorted, 0.75),
        quantile(sorted, 0.90),
        quantile(sorted, 0.95),
        quantile(sorted, 0.99));
  }

  /** {@code sorted} must be ascending and non-empty. */
  static double quantile(double[] sorted, double q) {
    double pos = q * (sorted.length - 1);
    int lower = (int) Math.floor(pos);
    int upper = (int) Math.ceil(pos);
    if (lower == upper) return sorted[lower];
    double weight = pos - lower;
    return sorted[lower] * (1 - weight) + sorted[upper] * weight;
  }
}
