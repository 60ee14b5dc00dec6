package com.ospicorp.creditforecast.forecast.model;

// Raw model output for one simulated period; flooring happens when the result is assembled
public record ForecastStep(FeatureVector features, double prediction) {}
