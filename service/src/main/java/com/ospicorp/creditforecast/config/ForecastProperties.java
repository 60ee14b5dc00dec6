package com.ospicorp.creditforecast.config;

import com.ospicorp.creditforecast.forecast.model.enums.FeedbackPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.nio.file.Path;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Every knob of the forecasting pipeline, bound from the {@code forecast.*} namespace and passed
 * explicitly into the components that need it.
 */
@Validated
@ConfigurationProperties(prefix = "forecast")
public record ForecastProperties(
    @DefaultValue("data/aggregated.json") @NotBlank String input,
    @DefaultValue("data/forecasts.json") @NotBlank String output,
    @DefaultValue("24") @Min(1) int horizon,
    @DefaultValue("12") @Min(1) int testSize,
    @DefaultValue("24") @Min(1) int minObservations,
    @DefaultValue("12") @Min(2) int minFeatureRows,
    @DefaultValue("42") long seed,
    @DefaultValue({"total", "custeio", "investimento", "comercializacao"}) @NotEmpty
    List<String> series,
    @DefaultValue({"custeio", "investimento", "comercializacao"}) List<String> purposes,
    @DefaultValue({"gradientboost", "randomforest", "ridge"}) @NotEmpty List<String> models,
    @DefaultValue("1") @Min(1) int parallelism,
    @DefaultValue("carry-forward") @NotNull FeedbackPolicy feedback,
    @DefaultValue("0.15") @PositiveOrZero double intervalScale,
    @DefaultValue @Valid Features features,
    @DefaultValue @Valid Run run
) {

  public static final List<Integer> DEFAULT_LAGS = List.of(1, 2, 3, 6, 12);
  public static final List<Integer> DEFAULT_WINDOWS = List.of(3, 6, 12);

  public record Features(
      @DefaultValue({"1", "2", "3", "6", "12"}) @NotEmpty List<@Positive Integer> lags,
      @DefaultValue({"3", "6", "12"}) @NotEmpty List<@Positive Integer> windows
  ) {}

  public record Run(@DefaultValue("true") boolean enabled) {}

  public Path inputPath() {
    return Path.of(input);
  }

  public Path outputPath() {
    return Path.of(output);
  }

  public static ForecastProperties defaults() {
    return new ForecastProperties(
        "data/aggregated.json",
        "data/forecasts.json",
        24, 12, 24, 12, 42L,
        List.of("total", "custeio", "investimento", "comercializacao"),
        List.of("custeio", "investimento", "comercializacao"),
        List.of("gradientboost", "randomforest", "ridge"),
        1,
        FeedbackPolicy.CARRY_FORWARD,
        0.15d,
        new Features(DEFAULT_LAGS, DEFAULT_WINDOWS),
        new Run(true));
  }

  public ForecastProperties withFiles(String newInput, String newOutput) {
    return new ForecastProperties(newInput, newOutput, horizon, testSize, minObservations,
        minFeatureRows, seed, series, purposes, models, parallelism, feedback, intervalScale,
        features, run);
  }

  public ForecastProperties withHorizon(int newHorizon) {
    return new ForecastProperties(input, output, newHorizon, testSize, minObservations,
        minFeatureRows, seed, series, purposes, models, parallelism, feedback, intervalScale,
        features, run);
  }

  public ForecastProperties withModels(List<String> newModels) {
    return new ForecastProperties(input, output, horizon, testSize, minObservations,
        minFeatureRows, seed, series, purposes, newModels, parallelism, feedback, intervalScale,
        features, run);
  }

  public ForecastProperties withSeries(List<String> newSeries) {
    return new ForecastProperties(input, output, horizon, testSize, minObservations,
        minFeatureRows, seed, newSeries, purposes, models, parallelism, feedback, intervalScale,
        features, run);
  }

  public ForecastProperties withParallelism(int newParallelism) {
    return new ForecastProperties(input, output, horizon, testSize, minObservations,
        minFeatureRows, seed, series, purposes, models, newParallelism, feedback, intervalScale,
        features, run);
  }

  public ForecastProperties withFeedback(FeedbackPolicy newFeedback) {
    return new ForecastProperties(input, output, horizon, testSize, minObservations,
        minFeatureRows, seed, series, purposes, models, parallelism, newFeedback, intervalScale,
        features, run);
  }
}
