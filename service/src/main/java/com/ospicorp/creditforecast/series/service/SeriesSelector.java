package com.ospicorp.creditforecast.series.service;

import com.ospicorp.creditforecast.series.model.AggregateDataset;
import com.ospicorp.creditforecast.series.model.AggregateRow;
import com.ospicorp.creditforecast.series.model.Observation;
import com.ospicorp.creditforecast.series.model.enums.AggregateView;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

public final class SeriesSelector {

  public static final String TOTAL = "total";
  static final int ANNUAL_PLACEHOLDER_MONTH = 6;

  private SeriesSelector() {
  }

  /**
   * Assembles one time-ordered series. The total prefers the monthly view and falls back to the
   * annual one; purpose series filter the by-purpose views the same way. Annual rows are placed at
   * mid-year. An unknown key yields an empty series.
   */
  public static List<Observation> select(AggregateDataset dataset, String seriesKey,
      Collection<String> purposes) {
    if (seriesKey == null) return List.of();
    String key = seriesKey.trim().toLowerCase(Locale.ROOT);

    if (TOTAL.equals(key)) {
      List<AggregateRow> rows = dataset.rows(AggregateView.MONTHLY);
      if (rows.isEmpty()) {
        rows = dataset.rows(AggregateView.ANNUAL);
      }
      return toObservations(rows);
    }
    if (!containsIgnoreCase(purposes, key)) return List.of();

    List<AggregateRow> rows = filterByPurpose(dataset.rows(AggregateView.MONTHLY_BY_PURPOSE), key);
    if (rows.isEmpty()) {
      rows = filterByPurpose(dataset.rows(AggregateView.ANNUAL_BY_PURPOSE), key);
    }
    return toObservations(rows);
  }

  private static List<AggregateRow> filterByPurpose(List<AggregateRow> rows, String key) {
    List<AggregateRow> out = new ArrayList<>();
    for (AggregateRow row : rows) {
      if (row.purpose() != null && row.purpose().trim().equalsIgnoreCase(key)) {
        out.add(row);
      }
    }
    return out;
  }

  // rows sharing a period are summed, matching the ETL's own group-by
  private static List<Observation> toObservations(List<AggregateRow> rows) {
    Map<YearMonth, Observation> byPeriod = new TreeMap<>();
    for (AggregateRow row : rows) {
      int month = row.month() != null ? row.month() : ANNUAL_PLACEHOLDER_MONTH;
      Observation observation = new Observation(YearMonth.of(row.year(), month), row.value(),
          row.contracts(), row.area());
      byPeriod.merge(observation.period(), observation, Observation::plus);
    }
    return new ArrayList<>(byPeriod.values());
  }

  private static boolean containsIgnoreCase(Collection<String> values, String key) {
    for (String value : values) {
      if (value != null && value.trim().equalsIgnoreCase(key)) {
        return true;
      }
    }
    return false;
  }
}
