package com.ospicorp.creditforecast.forecast.model;

import java.time.YearMonth;

// Feature values in FeatureSchema column order, keyed to one (observed or simulated) period
public record FeatureVector(YearMonth period, int trend, double[] values) {}
