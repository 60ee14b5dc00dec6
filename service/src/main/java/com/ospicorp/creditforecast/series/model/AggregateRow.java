package com.ospicorp.creditforecast.series.model;

// One row of an aggregate view after numeric coercion; month is null in annual views
public record AggregateRow(
    int year,
    Integer month,
    String purpose,
    double value,
    double contracts,
    double area
) {}
