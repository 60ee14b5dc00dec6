package com.ospicorp.creditforecast.forecast.regression;

/**
 * A regressor created for a single series, fitted once and then used for any number of
 * predictions. Implementations are not thread-safe.
 */
public interface RegressionModel {

  void fit(double[][] x, double[] y);

  double[] predict(double[][] x);
}
