package com.ospicorp.creditforecast.forecast.service;

import com.ospicorp.creditforecast.forecast.model.FeatureSchema;
import com.ospicorp.creditforecast.forecast.model.FeatureVector;
import com.ospicorp.creditforecast.forecast.model.FeaturizedSeries;
import com.ospicorp.creditforecast.forecast.model.ForecastStep;
import com.ospicorp.creditforecast.forecast.model.enums.FeedbackPolicy;
import com.ospicorp.creditforecast.forecast.regression.RegressionModel;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Simulates feature vectors for future periods one step at a time and predicts each with a
 * fitted model.
 *
 * <p>A buffer seeded with the trailing known values stands in for history: lag {@code k} reads
 * the value {@code k} positions from its end (the buffer mean when it is too short) and rolling
 * windows cover its trailing values. After each step the buffer grows by one value chosen by the
 * {@link FeedbackPolicy}. With {@code CARRY_FORWARD} that is the last known actual value, so the
 * simulated features do not follow the model's own trajectory.
 */
public final class RecursiveForecaster {

  private final FeatureSchema schema;
  private final FeedbackPolicy feedback;

  public RecursiveForecaster(FeatureSchema schema, FeedbackPolicy feedback) {
    this.schema = schema;
    this.feedback = feedback;
  }

  public List<ForecastStep> forecast(RegressionModel model, FeaturizedSeries series, int horizon) {
    if (horizon < 1) {
      throw new IllegalArgumentException("horizon must be positive");
    }
    List<Double> buffer = seed(series);
    YearMonth last = series.lastPeriod();
    List<ForecastStep> steps = new ArrayList<>(horizon);

    for (int h = 1; h <= horizon; h++) {
      YearMonth period = last.plusMonths(h);
      int trend = series.originalLength() + h - 1;
      FeatureVector vector = new FeatureVector(period, trend, simulate(buffer, period, trend));
      double prediction = model.predict(new double[][] {vector.values()})[0];
      steps.add(new ForecastStep(vector, prediction));

      buffer.add(switch (feedback) {
        case CARRY_FORWARD -> buffer.get(buffer.size() - 1);
        case PREDICTED -> Math.max(0d, prediction);
      });
    }
    return steps;
  }

  private List<Double> seed(FeaturizedSeries series) {
    var observations = series.observations();
    int from = Math.max(0, observations.size() - schema.bufferSize());
    List<Double> buffer = new ArrayList<>();
    for (int i = from; i < observations.size(); i++) {
      buffer.add(observations.get(i).value());
    }
    return buffer;
  }

  private double[] simulate(List<Double> buffer, YearMonth period, int trend) {
    List<Integer> lags = schema.lags();
    List<Integer> windows = schema.windows();

    double[] lagValues = new double[lags.size()];
    for (int i = 0; i < lags.size(); i++) {
      int index = buffer.size() - lags.get(i);
      lagValues[i] = index >= 0 ? buffer.get(index) : statistics(buffer, 0).getMean();
    }

    double[] means = new double[windows.size()];
    double[] stds = new double[windows.size()];
    for (int i = 0; i < windows.size(); i++) {
      DescriptiveStatistics window =
          statistics(buffer, Math.max(0, buffer.size() - windows.get(i)));
      means[i] = window.getMean();
      stds[i] = window.getN() > 1 ? Math.sqrt(window.getPopulationVariance()) : 0d;
    }
    return schema.assemble(period, trend, lagValues, means, stds);
  }

  private static DescriptiveStatistics statistics(List<Double> buffer, int fromIndex) {
    DescriptiveStatistics stats = new DescriptiveStatistics();
    for (int i = fromIndex; i < buffer.size(); i++) {
      stats.addValue(buffer.get(i));
    }
    return stats;
  }
}
