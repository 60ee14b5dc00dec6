package com.ospicorp.creditforecast.forecast.model.enums;

/**
 * What the recursive forecaster appends to its value buffer after each simulated step.
 */
public enum FeedbackPolicy {
  /** Repeat the last known actual value; future features never see the model's own output. */
  CARRY_FORWARD,
  /** Feed each step's own floored prediction back into the lag and rolling features. */
  PREDICTED
}
