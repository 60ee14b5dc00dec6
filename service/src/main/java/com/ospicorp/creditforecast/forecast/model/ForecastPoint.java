package com.ospicorp.creditforecast.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ForecastPoint(
    int year,
    int month,
    double value,
    @JsonProperty("lower_80") double lower80,
    @JsonProperty("upper_80") double upper80,
    @JsonProperty("lower_95") double lower95,
    @JsonProperty("upper_95") double upper95
) {}
