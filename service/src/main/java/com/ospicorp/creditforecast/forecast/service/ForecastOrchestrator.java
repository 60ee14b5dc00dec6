package com.ospicorp.creditforecast.forecast.service;

import com.ospicorp.creditforecast.config.ForecastProperties;
import com.ospicorp.creditforecast.forecast.model.FeatureSchema;
import com.ospicorp.creditforecast.forecast.model.FeaturizedSeries;
import com.ospicorp.creditforecast.forecast.model.ForecastPoint;
import com.ospicorp.creditforecast.forecast.model.ForecastResult;
import com.ospicorp.creditforecast.forecast.model.ForecastStep;
import com.ospicorp.creditforecast.forecast.model.ResultBundle;
import com.ospicorp.creditforecast.forecast.regression.ModelRegistry;
import com.ospicorp.creditforecast.forecast.regression.ModelUnavailableException;
import com.ospicorp.creditforecast.forecast.regression.RegressionBackend;
import com.ospicorp.creditforecast.forecast.regression.RegressionModel;
import com.ospicorp.creditforecast.series.model.AggregateDataset;
import com.ospicorp.creditforecast.series.model.Observation;
import com.ospicorp.creditforecast.series.service.SeriesSelector;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs every configured series against every configured model kind. Each pair is independent:
 * a pair that lacks data, names an unavailable model or fails outright is recorded as an error
 * marker and the others carry on.
 */
@Service
public class ForecastOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(ForecastOrchestrator.class);

  private final ForecastProperties properties;
  private final ModelRegistry registry;
  private final FeatureEngine featureEngine;
  private final Evaluator evaluator;
  private final RecursiveForecaster forecaster;
  private final UncertaintyEstimator uncertainty;

  public ForecastOrchestrator(ForecastProperties properties, ModelRegistry registry) {
    this.properties = properties;
    this.registry = registry;
    FeatureSchema schema = FeatureSchema.of(properties.features().lags(),
        properties.features().windows());
    this.featureEngine = new FeatureEngine(schema, properties.minObservations(),
        properties.minFeatureRows());
    this.evaluator = new Evaluator(properties.testSize());
    this.forecaster = new RecursiveForecaster(schema, properties.feedback());
    this.uncertainty = new UncertaintyEstimator(properties.intervalScale());
  }

  public ResultBundle run(AggregateDataset dataset) {
    Map<String, List<Observation>> seriesData = new LinkedHashMap<>();
    for (String seriesKey : properties.series()) {
      List<Observation> observations =
          SeriesSelector.select(dataset, seriesKey, properties.purposes());
      if (observations.isEmpty()) {
        log.warn("No data for series {}", seriesKey);
      } else {
        log.info("Series {}: {} data points", seriesKey, observations.size());
      }
      seriesData.put(seriesKey, observations);
    }

    List<Task> tasks = new ArrayList<>();
    seriesData.forEach((seriesKey, observations) -> {
      for (String model : properties.models()) {
        tasks.add(new Task(seriesKey, model, observations));
      }
    });

    List<ForecastResult> results = properties.parallelism() > 1
        ? runParallel(tasks)
        : tasks.stream().map(this::runTask).toList();

    // assembled on the calling thread, in grid order
    ResultBundle bundle = new ResultBundle();
    for (int i = 0; i < tasks.size(); i++) {
      bundle.put(tasks.get(i).seriesKey(), tasks.get(i).model(), results.get(i));
    }
    return bundle;
  }

  /**
   * Featurizes, fits, scores and forecasts one series with one model kind.
   *
   * @throws InsufficientDataException when the series is too short at any stage
   * @throws ModelUnavailableException when the model kind is unknown or its library is missing
   */
  public ForecastResult forecast(List<Observation> observations, String modelKind) {
    FeaturizedSeries series = featureEngine.featurize(observations);
    RegressionBackend backend = registry.resolve(modelKind);
    RegressionModel model = backend.create(properties.seed());

    Evaluator.Evaluation evaluation = evaluator.evaluate(series, model);
    List<ForecastStep> steps = forecaster.forecast(model, series, properties.horizon());

    double[] raw = new double[steps.size()];
    for (int i = 0; i < raw.length; i++) {
      raw[i] = steps.get(i).prediction();
    }
    UncertaintyEstimator.Bands bands = uncertainty.bands(raw);

    List<ForecastPoint> points = new ArrayList<>(steps.size());
    for (int i = 0; i < steps.size(); i++) {
      var period = steps.get(i).features().period();
      points.add(new ForecastPoint(
          period.getYear(),
          period.getMonthValue(),
          Math.max(0d, raw[i]),
          bands.lower80()[i],
          bands.upper80()[i],
          bands.lower95()[i],
          bands.upper95()[i]));
    }
    return ForecastResult.of(points, evaluation.metrics());
  }

  private List<ForecastResult> runParallel(List<Task> tasks) {
    ExecutorService pool = Executors.newFixedThreadPool(properties.parallelism());
    try {
      List<CompletableFuture<ForecastResult>> futures = new ArrayList<>(tasks.size());
      for (Task task : tasks) {
        futures.add(CompletableFuture.supplyAsync(() -> runTask(task), pool));
      }
      return futures.stream().map(CompletableFuture::join).toList();
    } finally {
      pool.shutdown();
    }
  }

  private ForecastResult runTask(Task task) {
    try {
      ForecastResult result = forecast(task.observations(), task.model());
      log.info("Series {} / {}: MAPE {}%, R2 {}", task.seriesKey(), task.model(),
          String.format("%.2f", result.mape()), String.format("%.3f", result.r2()));
      return result;
    } catch (InsufficientDataException | ModelUnavailableException ex) {
      log.warn("Series {} / {}: {}", task.seriesKey(), task.model(), ex.getMessage());
      return ForecastResult.failure(ex.getMessage());
    } catch (RuntimeException ex) {
      log.error("Series {} / {} failed: {}", task.seriesKey(), task.model(), ex.getMessage(), ex);
      return ForecastResult.failure("Forecast failed: " + ex.getMessage());
    }
  }

  private record Task(String seriesKey, String model, List<Observation> observations) {}
}
