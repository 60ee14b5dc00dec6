package com.ospicorp.creditforecast.forecast.model;

public record AccuracyMetrics(double mape, double rmse, double r2) {}
