package com.ospicorp.creditforecast.forecast.regression;

import smile.data.DataFrame;
import smile.data.formula.Formula;
import smile.regression.DataFrameRegression;

/**
 * Adapts a Smile data-frame regressor to the matrix contract. Columns are named {@code x0..xn}
 * with the response in {@code y}.
 */
final class SmileRegressionModel implements RegressionModel {

  private static final String RESPONSE = "y";
  private static final Formula FORMULA = Formula.lhs(RESPONSE);

  private final Trainer trainer;
  private DataFrameRegression model;

  SmileRegressionModel(Trainer trainer) {
    this.trainer = trainer;
  }

  @FunctionalInterface
  interface Trainer {
    DataFrameRegression fit(Formula formula, DataFrame data, int predictors);
  }

  @Override
  public void fit(double[][] x, double[] y) {
    if (x.length == 0 || x.length != y.length) {
      throw new IllegalArgumentException("x and y must be non-empty and of equal length");
    }
    model = trainer.fit(FORMULA, frame(x, y), x[0].length);
  }

  @Override
  public double[] predict(double[][] x) {
    if (model == null) {
      throw new IllegalStateException("model has not been fitted");
    }
    double[] out = new double[x.length];
    if (x.length == 0) return out;
    // the response column is kept so the frame matches the training schema
    DataFrame frame = frame(x, new double[x.length]);
    for (int i = 0; i < x.length; i++) {
      out[i] = model.predict(frame.get(i));
    }
    return out;
  }

  private static DataFrame frame(double[][] x, double[] y) {
    int columns = x[0].length;
    String[] names = new String[columns + 1];
    for (int j = 0; j < columns; j++) {
      names[j] = "x" + j;
    }
    names[columns] = RESPONSE;
    double[][] data = new double[x.length][columns + 1];
    for (int i = 0; i < x.length; i++) {
      System.arraycopy(x[i], 0, data[i], 0, columns);
      data[i][columns] = y[i];
    }
    return DataFrame.of(data, names);
  }
}
