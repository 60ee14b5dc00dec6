package com.ospicorp.creditforecast.forecast.model;

import com.ospicorp.creditforecast.series.model.Observation;
import java.time.YearMonth;
import java.util.List;

/**
 * A series after feature derivation: the complete rows with their aligned targets, plus the raw
 * observations they came from (the forecaster seeds its buffer from those).
 */
public record FeaturizedSeries(
    List<Observation> observations,
    FeatureSchema schema,
    List<FeatureVector> rows,
    double[] targets
) {

  public int size() {
    return rows.size();
  }

  public int originalLength() {
    return observations.size();
  }

  public YearMonth lastPeriod() {
    return observations.get(observations.size() - 1).period();
  }

  public double[][] matrix(int fromIndex, int toIndex) {
    double[][] x = new double[toIndex - fromIndex][];
    for (int i = fromIndex; i < toIndex; i++) {
      x[i - fromIndex] = rows.get(i).values().clone();
    }
    return x;
  }

  public double[] targets(int fromIndex, int toIndex) {
    double[] y = new double[toIndex - fromIndex];
    System.arraycopy(targets, fromIndex, y, 0, y.length);
    return y;
  }
}
