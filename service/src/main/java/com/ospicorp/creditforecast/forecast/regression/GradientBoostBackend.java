package com.ospicorp.creditforecast.forecast.regression;

import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;
import smile.base.cart.Loss;
import smile.math.MathEx;
import smile.regression.GradientTreeBoost;

/**
 * Least-squares gradient-boosted trees: 100 trees of depth 4, shrinkage 0.1, no row subsampling.
 */
@Component
public class GradientBoostBackend implements RegressionBackend {

  static final String NAME = "gradientboost";
  private static final int TREES = 100;
  private static final int MAX_DEPTH = 4;
  private static final int MAX_NODES = 16;
  private static final int NODE_SIZE = 3;
  private static final double SHRINKAGE = 0.1;
  private static final double SUBSAMPLE = 1.0;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean isAvailable() {
    return ClassUtils.isPresent("smile.regression.GradientTreeBoost",
        GradientBoostBackend.class.getClassLoader());
  }

  @Override
  public RegressionModel create(long seed) {
    return new SmileRegressionModel((formula, data, predictors) -> {
      MathEx.setSeed(seed);
      return GradientTreeBoost.fit(formula, data, Loss.ls(), TREES, MAX_DEPTH, MAX_NODES,
          NODE_SIZE, SHRINKAGE, SUBSAMPLE);
    });
  }
}
