package com.ospicorp.creditforecast.config;

import com.ospicorp.creditforecast.forecast.model.ResultBundle;
import com.ospicorp.creditforecast.forecast.regression.ModelRegistry;
import com.ospicorp.creditforecast.forecast.service.ForecastOrchestrator;
import com.ospicorp.creditforecast.forecast.service.ForecastResultWriter;
import com.ospicorp.creditforecast.series.model.AggregateDataset;
import com.ospicorp.creditforecast.series.service.AggregateLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Component
public class ForecastRunner implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(ForecastRunner.class);

  private final ForecastProperties properties;
  private final AggregateLoader loader;
  private final ModelRegistry registry;
  private final ForecastOrchestrator orchestrator;
  private final ForecastResultWriter writer;

  public ForecastRunner(ForecastProperties properties,
      AggregateLoader loader,
      ModelRegistry registry,
      ForecastOrchestrator orchestrator,
      ForecastResultWriter writer) {
    this.properties = properties;
    this.loader = loader;
    this.registry = registry;
    this.orchestrator = orchestrator;
    this.writer = writer;
  }

  @Override
  public void run(String... args) {
    if (!properties.run().enabled()) {
      log.info("Forecast run disabled via property forecast.run.enabled=false");
      return;
    }
    long startTime = System.currentTimeMillis();
    log.info("Loading aggregated data from {}", properties.inputPath().toAbsolutePath());
    AggregateDataset dataset = loader.load(properties.inputPath());

    log.info("Available models: {}", String.join(", ", registry.available()));
    log.info("Forecasting {} series x {} models, horizon {} months",
        properties.series().size(), properties.models().size(), properties.horizon());
    ResultBundle bundle = orchestrator.run(dataset);

    writer.write(bundle, properties.outputPath());
    log.info("Forecast run completed in {} ms", System.currentTimeMillis() - startTime);
  }
}
