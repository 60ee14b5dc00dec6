package com.ospicorp.creditforecast.forecast.regression;

/**
 * A model kind the pipeline can train. A backend whose library is missing from the runtime
 * reports itself unavailable instead of failing.
 */
public interface RegressionBackend {

  String name();

  boolean isAvailable();

  /** Creates an unfitted model with the backend's fixed hyperparameters. */
  RegressionModel create(long seed);
}
