package com.ospicorp.creditforecast.series.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.creditforecast.series.model.AggregateDataset;
import com.ospicorp.creditforecast.series.model.AggregateRow;
import com.ospicorp.creditforecast.series.model.Observation;
import com.ospicorp.creditforecast.series.model.enums.AggregateView;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SeriesSelectorTest {

  private static final List<String> PURPOSES = List.of("custeio", "investimento", "comercializacao");

  @Test
  void totalPrefersMonthlyView() {
    var dataset = new AggregateDataset(Map.of(
        AggregateView.MONTHLY, List.of(
            new AggregateRow(2020, 2, null, 20d, 2d, 5d),
            new AggregateRow(2020, 1, null, 10d, 1d, 4d)),
        AggregateView.ANNUAL, List.of(new AggregateRow(2020, null, null, 999d, 0d, 0d))));

    List<Observation> out = SeriesSelector.select(dataset, "total", PURPOSES);

    assertEquals(2, out.size());
    assertEquals(YearMonth.of(2020, 1), out.get(0).period());
    assertEquals(10d, out.get(0).value());
    assertEquals(1d, out.get(0).contracts());
    assertEquals(YearMonth.of(2020, 2), out.get(1).period());
  }

  @Test
  void totalFallsBackToAnnualAtMidYear() {
    var dataset = new AggregateDataset(Map.of(
        AggregateView.ANNUAL, List.of(
            new AggregateRow(2014, null, null, 2d, 0d, 0d),
            new AggregateRow(2013, null, null, 1d, 0d, 0d))));

    List<Observation> out = SeriesSelector.select(dataset, "TOTAL", PURPOSES);

    assertEquals(2, out.size());
    assertEquals(YearMonth.of(2013, 6), out.get(0).period());
    assertEquals(YearMonth.of(2014, 6), out.get(1).period());
  }

  @Test
  void purposeFilterIsCaseInsensitive() {
    var dataset = new AggregateDataset(Map.of(
        AggregateView.MONTHLY_BY_PURPOSE, List.of(
            new AggregateRow(2021, 3, "CUSTEIO", 30d, 0d, 0d),
            new AggregateRow(2021, 3, "INVESTIMENTO", 99d, 0d, 0d),
            new AggregateRow(2021, 1, "Custeio", 10d, 0d, 0d))));

    List<Observation> out = SeriesSelector.select(dataset, "custeio", PURPOSES);

    assertEquals(2, out.size());
    assertEquals(10d, out.get(0).value());
    assertEquals(30d, out.get(1).value());
  }

  @Test
  void purposeFallsBackToAnnualWhenMonthlyHasNoMatch() {
    var dataset = new AggregateDataset(Map.of(
        AggregateView.MONTHLY_BY_PURPOSE, List.of(
            new AggregateRow(2021, 3, "INVESTIMENTO", 99d, 0d, 0d)),
        AggregateView.ANNUAL_BY_PURPOSE, List.of(
            new AggregateRow(2020, null, "COMERCIALIZACAO", 7d, 0d, 0d),
            new AggregateRow(2020, null, "CUSTEIO", 8d, 0d, 0d))));

    List<Observation> out = SeriesSelector.select(dataset, "comercializacao", PURPOSES);

    assertEquals(1, out.size());
    assertEquals(YearMonth.of(2020, 6), out.get(0).period());
    assertEquals(7d, out.get(0).value());
  }

  @Test
  void unknownKeyYieldsEmptySeries() {
    var dataset = new AggregateDataset(Map.of(
        AggregateView.MONTHLY, List.of(new AggregateRow(2020, 1, null, 1d, 0d, 0d)),
        AggregateView.MONTHLY_BY_PURPOSE, List.of(new AggregateRow(2020, 1, "PRONAF", 1d, 0d, 0d))));

    assertTrue(SeriesSelector.select(dataset, "pronaf", PURPOSES).isEmpty());
    assertTrue(SeriesSelector.select(dataset, null, PURPOSES).isEmpty());
    assertTrue(SeriesSelector.select(AggregateDataset.empty(), "total", PURPOSES).isEmpty());
  }

  @Test
  void rowsSharingAPeriodAreSummed() {
    var dataset = new AggregateDataset(Map.of(
        AggregateView.MONTHLY_BY_PURPOSE, List.of(
            new AggregateRow(2022, 5, "custeio", 1.5d, 1d, 10d),
            new AggregateRow(2022, 5, "CUSTEIO", 2.5d, 2d, 20d))));

    List<Observation> out = SeriesSelector.select(dataset, "custeio", PURPOSES);

    assertEquals(1, out.size());
    assertEquals(4d, out.get(0).value());
    assertEquals(3d, out.get(0).contracts());
    assertEquals(30d, out.get(0).area());
  }
}
