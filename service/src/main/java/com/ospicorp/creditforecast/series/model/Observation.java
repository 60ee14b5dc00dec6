package com.ospicorp.creditforecast.series.model;

import java.time.YearMonth;

// Value object for one period of a series; annual rows carry a mid-year placeholder month
public record Observation(YearMonth period, double value, double contracts, double area) {

  public static Observation of(int year, int month, double value) {
    return new Observation(YearMonth.of(year, month), value, 0d, 0d);
  }

  public int year() {
    return period.getYear();
  }

  public int month() {
    return period.getMonthValue();
  }

  public Observation plus(Observation other) {
    return new Observation(period, value + other.value, contracts + other.contracts,
        area + other.area);
  }
}
