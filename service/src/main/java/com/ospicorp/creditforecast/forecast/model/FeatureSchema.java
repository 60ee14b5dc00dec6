package com.ospicorp.creditforecast.forecast.model;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Ordered feature columns shared by the feature engine and the recursive forecaster, so historic
 * and simulated vectors always line up column for column.
 */
public final class FeatureSchema {

  public static final String YEAR = "year";
  public static final String MONTH = "month";
  public static final String MONTH_SIN = "month_sin";
  public static final String MONTH_COS = "month_cos";
  public static final String TREND = "trend";

  private final List<Integer> lags;
  private final List<Integer> windows;
  private final List<String> columns;

  private FeatureSchema(List<Integer> lags, List<Integer> windows) {
    this.lags = lags;
    this.windows = windows;
    List<String> names = new ArrayList<>(List.of(YEAR, MONTH, MONTH_SIN, MONTH_COS, TREND));
    for (int lag : lags) {
      names.add(lagColumn(lag));
    }
    for (int window : windows) {
      names.add(rollingMeanColumn(window));
      names.add(rollingStdColumn(window));
    }
    this.columns = Collections.unmodifiableList(names);
  }

  public static FeatureSchema of(List<Integer> lags, List<Integer> windows) {
    if (lags.isEmpty() || windows.isEmpty()) {
      throw new IllegalArgumentException("at least one lag and one window are required");
    }
    for (int value : lags) {
      if (value < 1) throw new IllegalArgumentException("lag must be positive: " + value);
    }
    for (int value : windows) {
      if (value < 1) throw new IllegalArgumentException("window must be positive: " + value);
    }
    return new FeatureSchema(List.copyOf(new TreeSet<>(lags)), List.copyOf(new TreeSet<>(windows)));
  }

  public static String lagColumn(int lag) {
    return "lag_" + lag;
  }

  public static String rollingMeanColumn(int window) {
    return "rolling_mean_" + window;
  }

  public static String rollingStdColumn(int window) {
    return "rolling_std_" + window;
  }

  public List<String> columns() {
    return columns;
  }

  public int size() {
    return columns.size();
  }

  public int indexOf(String column) {
    int index = columns.indexOf(column);
    if (index < 0) {
      throw new IllegalArgumentException("Unknown feature column: " + column);
    }
    return index;
  }

  public List<Integer> lags() {
    return lags;
  }

  public List<Integer> windows() {
    return windows;
  }

  /** Index of the first observation whose lag and rolling features are all defined. */
  public int warmup() {
    return Math.max(lags.get(lags.size() - 1), windows.get(windows.size() - 1) - 1);
  }

  /** Number of trailing values the forecaster keeps to derive future lag and rolling features. */
  public int bufferSize() {
    return Math.max(lags.get(lags.size() - 1), windows.get(windows.size() - 1));
  }

  public double[] assemble(YearMonth period, int trend, double[] lagValues,
      double[] rollingMeans, double[] rollingStds) {
    double[] values = new double[columns.size()];
    int month = period.getMonthValue();
    values[0] = period.getYear();
    values[1] = month;
    values[2] = Math.sin(2d * Math.PI * month / 12d);
    values[3] = Math.cos(2d * Math.PI * month / 12d);
    values[4] = trend;
    int offset = 5;
    for (int i = 0; i < lags.size(); i++) {
      values[offset++] = lagValues[i];
    }
    for (int i = 0; i < windows.size(); i++) {
      values[offset++] = rollingMeans[i];
      values[offset++] = rollingStds[i];
    }
    return values;
  }
}
