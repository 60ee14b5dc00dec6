package com.ospicorp.creditforecast.forecast.service;

import com.ospicorp.creditforecast.forecast.model.FeatureSchema;
import com.ospicorp.creditforecast.forecast.model.FeatureVector;
import com.ospicorp.creditforecast.forecast.model.FeaturizedSeries;
import com.ospicorp.creditforecast.series.model.Observation;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Derives lag, rolling, calendar and trend features for each observation. Rows whose lag or
 * rolling features reach before the start of the series are dropped, never imputed.
 */
public final class FeatureEngine {

  private final FeatureSchema schema;
  private final int minObservations;
  private final int minFeatureRows;

  public FeatureEngine(FeatureSchema schema, int minObservations, int minFeatureRows) {
    this.schema = schema;
    this.minObservations = minObservations;
    this.minFeatureRows = minFeatureRows;
  }

  public FeatureSchema schema() {
    return schema;
  }

  public FeaturizedSeries featurize(List<Observation> observations) {
    if (observations == null || observations.size() < minObservations) {
      throw new InsufficientDataException(InsufficientDataException.RAW);
    }
    List<Integer> lags = schema.lags();
    List<Integer> windows = schema.windows();

    // rolling windows evict the oldest value once full
    List<DescriptiveStatistics> rolling = new ArrayList<>(windows.size());
    for (int window : windows) {
      rolling.add(new DescriptiveStatistics(window));
    }

    List<FeatureVector> rows = new ArrayList<>();
    List<Double> targets = new ArrayList<>();
    for (int t = 0; t < observations.size(); t++) {
      Observation current = observations.get(t);
      for (DescriptiveStatistics stats : rolling) {
        stats.addValue(current.value());
      }
      if (t < schema.warmup()) {
        continue;
      }

      double[] lagValues = new double[lags.size()];
      for (int i = 0; i < lags.size(); i++) {
        lagValues[i] = observations.get(t - lags.get(i)).value();
      }
      double[] means = new double[windows.size()];
      double[] stds = new double[windows.size()];
      for (int i = 0; i < windows.size(); i++) {
        DescriptiveStatistics stats = rolling.get(i);
        means[i] = stats.getMean();
        stds[i] = Math.sqrt(stats.getPopulationVariance());
      }
      rows.add(new FeatureVector(current.period(), t,
          schema.assemble(current.period(), t, lagValues, means, stds)));
      targets.add(current.value());
    }

    if (rows.size() < minFeatureRows) {
      throw new InsufficientDataException(InsufficientDataException.AFTER_FEATURES);
    }
    double[] y = new double[targets.size()];
    for (int i = 0; i < y.length; i++) {
      y[i] = targets.get(i);
    }
    return new FeaturizedSeries(List.copyOf(observations), schema, List.copyOf(rows), y);
  }
}
