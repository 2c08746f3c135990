package com.vigil.detection.stats;

import java.util.Objects;

/**
 * Standard scores against the population mean and standard deviation of a series. A series
 * with zero spread scores every value as {@code 0}.
 */
public final class ZScoreScorer {

  private ZScoreScorer() {}

  public static double[] calculateZScores(double[] series) {
    Objects.requireNonNull(series, "series");
    double[] out = new double[series.length];
    if (series.length == 0) return out;
    double mean = Statistics.mean(series);
    double std = Statistics.stddev(series);
    if (std == 0.0) return out;
    for (int i = 0; i < series.length; i++) {
      out[i] = (series[i] - mean) / std;
    }
    return out;
  }

  public static double scoreAgainstDistribution(double[] series, double value) {
    Objects.requireNonNull(series, "series");
    double std = Statistics.stddev(series);
    if (std == 0.0) return 0.0;
    return (value - Statistics.mean(series)) / std;
  }
}
