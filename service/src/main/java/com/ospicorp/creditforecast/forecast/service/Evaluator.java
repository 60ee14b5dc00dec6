package com.ospicorp.creditforecast.forecast.service;

import com.ospicorp.creditforecast.forecast.model.AccuracyMetrics;
import com.ospicorp.creditforecast.forecast.model.FeaturizedSeries;
import com.ospicorp.creditforecast.forecast.regression.RegressionModel;

/**
 * Holds out the trailing block of a featurized series, fits on everything before it and scores
 * the held-out block. Rows are never shuffled.
 */
public final class Evaluator {

  static final int MIN_TRAIN_ROWS = 2;
  private static final double EPSILON = Math.ulp(1d);

  private final int testSize;

  public Evaluator(int testSize) {
    this.testSize = testSize;
  }

  public Split split(FeaturizedSeries series) {
    int rows = series.size();
    int testRows = Math.min(testSize, rows / 4);
    int trainRows = rows - testRows;
    if (testRows == 0 || trainRows < MIN_TRAIN_ROWS) {
      throw new InsufficientDataException(InsufficientDataException.AFTER_FEATURES);
    }
    return new Split(series, trainRows);
  }

  /** Fits {@code model} on the training block and scores it on the trailing test block. */
  public Evaluation evaluate(FeaturizedSeries series, RegressionModel model) {
    Split split = split(series);
    model.fit(split.trainX(), split.trainY());
    double[] predicted = model.predict(split.testX());
    return new Evaluation(split, score(split.testY(), predicted));
  }

  public static AccuracyMetrics score(double[] actual, double[] predicted) {
    if (actual.length == 0 || actual.length != predicted.length) {
      throw new IllegalArgumentException("actual and predicted must be non-empty and aligned");
    }
    int n = actual.length;
    double mean = 0d;
    for (double v : actual) {
      mean += v;
    }
    mean /= n;

    double percentage = 0d;
    double sse = 0d;
    double sst = 0d;
    for (int i = 0; i < n; i++) {
      double error = actual[i] - predicted[i];
      percentage += Math.abs(error) / Math.max(Math.abs(actual[i]), EPSILON);
      sse += error * error;
      sst += (actual[i] - mean) * (actual[i] - mean);
    }

    double r2;
    if (sst == 0d) {
      r2 = sse == 0d ? 1d : 0d;
    } else {
      r2 = 1d - sse / sst;
    }
    return new AccuracyMetrics(percentage / n * 100d, Math.sqrt(sse / n), r2);
  }

  public record Split(FeaturizedSeries series, int trainRows) {

    public int testRows() {
      return series.size() - trainRows;
    }

    public double[][] trainX() {
      return series.matrix(0, trainRows);
    }

    public double[] trainY() {
      return series.targets(0, trainRows);
    }

    public double[][] testX() {
      return series.matrix(trainRows, series.size());
    }

    public double[] testY() {
      return series.targets(trainRows, series.size());
    }
  }

  public record Evaluation(Split split, AccuracyMetrics metrics) {}
}
