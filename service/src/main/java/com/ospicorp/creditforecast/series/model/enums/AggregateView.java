package com.ospicorp.creditforecast.series.model.enums;

/**
 * Views of the aggregated artifact the forecasting pipeline reads. Every other view the ETL
 * produces (products, municipalities, sankey, ...) is ignored.
 */
public enum AggregateView {
  MONTHLY("byMes", true, false),
  ANNUAL("byAno", false, false),
  MONTHLY_BY_PURPOSE("byFinalidadeMes", true, true),
  ANNUAL_BY_PURPOSE("byFinalidade", false, true);

  private final String key;
  private final boolean monthly;
  private final boolean byPurpose;

  AggregateView(String key, boolean monthly, boolean byPurpose) {
    this.key = key;
    this.monthly = monthly;
    this.byPurpose = byPurpose;
  }

  public String key() {
    return key;
  }

  public boolean monthly() {
    return monthly;
  }

  public boolean byPurpose() {
    return byPurpose;
  }
}
