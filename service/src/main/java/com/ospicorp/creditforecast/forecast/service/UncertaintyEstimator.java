package com.ospicorp.creditforecast.forecast.service;

import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Symmetric bands around point forecasts. The spread is the population standard deviation of the
 * forecasts themselves scaled by a fixed factor: a dispersion proxy, not a calibrated predictive
 * interval.
 */
public final class UncertaintyEstimator {

  static final double Z_80 = 1.28;
  static final double Z_95 = 1.96;

  private final double scale;

  public UncertaintyEstimator(double scale) {
    this.scale = scale;
  }

  public Bands bands(double[] predictions) {
    int n = predictions.length;
    double spread = n == 0 ? 0d : new StandardDeviation(false).evaluate(predictions) * scale;

    double[] lower80 = new double[n];
    double[] upper80 = new double[n];
    double[] lower95 = new double[n];
    double[] upper95 = new double[n];
    for (int i = 0; i < n; i++) {
      double p = predictions[i];
      lower80[i] = Math.max(0d, p - Z_80 * spread);
      upper80[i] = Math.max(0d, p + Z_80 * spread);
      lower95[i] = Math.max(0d, p - Z_95 * spread);
      upper95[i] = Math.max(0d, p + Z_95 * spread);
    }
    return new Bands(lower80, upper80, lower95, upper95);
  }

  public record Bands(double[] lower80, double[] upper80, double[] lower95, double[] upper95) {}
}
