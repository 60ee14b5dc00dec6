package com.ospicorp.creditforecast.forecast.regression;

public class ModelUnavailableException extends RuntimeException {
  private final String modelKind;

  public ModelUnavailableException(String modelKind) {
    super(modelKind + " not available");
    this.modelKind = modelKind;
  }

  public String modelKind() {
    return modelKind;
  }
}
