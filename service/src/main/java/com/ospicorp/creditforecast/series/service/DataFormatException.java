package com.ospicorp.creditforecast.series.service;

/**
 * The aggregated artifact does not have the structure the pipeline expects. Fatal for the run:
 * there is no partial result to produce without the base dataset.
 */
public class DataFormatException extends RuntimeException {

  public DataFormatException(String message) {
    super(message);
  }

  public DataFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
