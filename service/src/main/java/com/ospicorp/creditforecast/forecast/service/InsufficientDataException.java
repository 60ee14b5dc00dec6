package com.ospicorp.creditforecast.forecast.service;

/**
 * A series is too short to train and evaluate a model. Recorded as an error marker for the
 * series and model pair, never propagated past the orchestrator.
 */
public class InsufficientDataException extends RuntimeException {

  public static final String RAW = "Insufficient data";
  public static final String AFTER_FEATURES = "Insufficient data after feature creation";

  public InsufficientDataException(String reason) {
    super(reason);
  }
}
