package com.ospicorp.creditforecast.forecast.regression;

import java.util.stream.LongStream;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;
import smile.regression.RandomForest;

/**
 * Bagged regression trees: 100 trees of depth 6, a third of the features tried per split, one
 * seed per tree derived from the run seed.
 */
@Component
public class RandomForestBackend implements RegressionBackend {

  static final String NAME = "randomforest";
  private static final int TREES = 100;
  private static final int MAX_DEPTH = 6;
  private static final int MAX_NODES = 64;
  private static final int NODE_SIZE = 2;
  private static final double SUBSAMPLE = 1.0;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean isAvailable() {
    return ClassUtils.isPresent("smile.regression.RandomForest",
        RandomForestBackend.class.getClassLoader());
  }

  @Override
  public RegressionModel create(long seed) {
    return new SmileRegressionModel((formula, data, predictors) -> {
      int mtry = Math.max(1, predictors / 3);
      return RandomForest.fit(formula, data, TREES, mtry, MAX_DEPTH, MAX_NODES, NODE_SIZE,
          SUBSAMPLE, LongStream.range(seed, seed + TREES));
    });
  }
}
