package com.ospicorp.creditforecast.forecast.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * Outcome of one series and model pair: either predictions with metrics, or an error reason.
 * Metrics are mirrored at the top level because the dashboard reads both locations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"predictions", "metrics", "mape", "rmse", "r2", "error"})
public record ForecastResult(
    List<ForecastPoint> predictions,
    AccuracyMetrics metrics,
    String error
) {

  public ForecastResult {
    predictions = predictions == null ? null : List.copyOf(predictions);
  }

  public static ForecastResult of(List<ForecastPoint> predictions, AccuracyMetrics metrics) {
    return new ForecastResult(predictions, metrics, null);
  }

  public static ForecastResult failure(String reason) {
    return new ForecastResult(null, null, reason);
  }

  public boolean failed() {
    return error != null;
  }

  @JsonProperty("mape")
  public Double mape() {
    return metrics == null ? null : metrics.mape();
  }

  @JsonProperty("rmse")
  public Double rmse() {
    return metrics == null ? null : metrics.rmse();
  }

  @JsonProperty("r2")
  public Double r2() {
    return metrics == null ? null : metrics.r2();
  }
}
