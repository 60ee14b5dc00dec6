package com.ospicorp.creditforecast.forecast.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

// series key -> model kind -> result, in configured order
public final class ResultBundle {

  private final Map<String, Map<String, ForecastResult>> results = new LinkedHashMap<>();

  public void put(String seriesKey, String modelKind, ForecastResult result) {
    results.computeIfAbsent(seriesKey, key -> new LinkedHashMap<>()).put(modelKind, result);
  }

  public ForecastResult get(String seriesKey, String modelKind) {
    Map<String, ForecastResult> byModel = results.get(seriesKey);
    return byModel == null ? null : byModel.get(modelKind);
  }

  @JsonValue
  public Map<String, Map<String, ForecastResult>> asMap() {
    Map<String, Map<String, ForecastResult>> view = new LinkedHashMap<>();
    results.forEach((key, value) -> view.put(key, Collections.unmodifiableMap(value)));
    return Collections.unmodifiableMap(view);
  }
}
