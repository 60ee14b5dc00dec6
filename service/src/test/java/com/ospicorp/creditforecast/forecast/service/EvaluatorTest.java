package com.ospicorp.creditforecast.forecast.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ospicorp.creditforecast.config.ForecastProperties;
import com.ospicorp.creditforecast.forecast.model.AccuracyMetrics;
import com.ospicorp.creditforecast.forecast.model.FeatureSchema;
import com.ospicorp.creditforecast.forecast.model.FeaturizedSeries;
import com.ospicorp.creditforecast.forecast.regression.GradientBoostBackend;
import com.ospicorp.creditforecast.forecast.regression.RidgeBackend;
import com.ospicorp.creditforecast.support.FixedModel;
import com.ospicorp.creditforecast.support.SeriesFixtures;
import java.util.List;
import org.junit.jupiter.api.Test;

class EvaluatorTest {

  private final FeatureSchema schema =
      FeatureSchema.of(ForecastProperties.DEFAULT_LAGS, ForecastProperties.DEFAULT_WINDOWS);
  private final FeatureEngine engine = new FeatureEngine(schema, 24, 12);
  private final Evaluator evaluator = new Evaluator(12);

  @Test
  void testBlockIsTrailingQuarterCappedAtTestSize() {
    FeaturizedSeries shortSeries = engine.featurize(SeriesFixtures.monthly(2020, 1, 48, t -> t));
    FeaturizedSeries longSeries = engine.featurize(SeriesFixtures.monthly(2010, 1, 120, t -> t));

    assertThat(evaluator.split(shortSeries).testRows()).isEqualTo(9);
    assertThat(evaluator.split(shortSeries).trainRows()).isEqualTo(27);
    assertThat(evaluator.split(longSeries).testRows()).isEqualTo(12);
  }

  @Test
  void fitsOnLeadingBlockAndScoresTrailingBlockInOrder() {
    FeaturizedSeries series = engine.featurize(SeriesFixtures.monthly(2020, 1, 48, t -> 100d + t));
    FixedModel model = new FixedModel(n -> 0d);

    evaluator.evaluate(series, model);

    int trendColumn = schema.indexOf(FeatureSchema.TREND);
    assertThat(model.fittedX()).hasNumberOfRows(27);
    assertThat(model.fittedY()).startsWith(112d).endsWith(138d);
    assertThat(model.predictedRows()).hasSize(9);
    for (int i = 0; i < 9; i++) {
      assertThat(model.predictedRows().get(i)[trendColumn]).isEqualTo(39d + i);
    }
  }

  @Test
  void tinySeriesWithoutTestBlockIsInsufficient() {
    FeatureSchema small = FeatureSchema.of(List.of(1), List.of(1));
    FeaturizedSeries series = new FeatureEngine(small, 1, 1)
        .featurize(SeriesFixtures.monthly(2020, 1, 4, t -> t));

    assertThatThrownBy(() -> evaluator.split(series))
        .isInstanceOf(InsufficientDataException.class)
        .hasMessage("Insufficient data after feature creation");
  }

  @Test
  void scoreComputesPercentageErrorRmseAndR2() {
    AccuracyMetrics metrics = Evaluator.score(new double[] {100d, 200d}, new double[] {110d, 180d});

    assertThat(metrics.mape()).isCloseTo(10d, within(1e-9));
    assertThat(metrics.rmse()).isCloseTo(Math.sqrt(250d), within(1e-9));
    assertThat(metrics.r2()).isCloseTo(0.9d, within(1e-9));
  }

  @Test
  void scoreHandlesConstantActuals() {
    assertThat(Evaluator.score(new double[] {5d, 5d}, new double[] {5d, 5d}).r2()).isEqualTo(1d);
    assertThat(Evaluator.score(new double[] {5d, 5d}, new double[] {4d, 6d}).r2()).isEqualTo(0d);
    assertThat(Evaluator.score(new double[] {0d}, new double[] {1d}).mape()).isFinite();
  }

  @Test
  void sameInputAndSeedGiveIdenticalMetrics() {
    FeaturizedSeries series = engine.featurize(SeriesFixtures.seasonal(48, 7L));

    for (var backend : List.of(new RidgeBackend(), new GradientBoostBackend())) {
      AccuracyMetrics first = evaluator.evaluate(series, backend.create(42L)).metrics();
      AccuracyMetrics second = evaluator.evaluate(series, backend.create(42L)).metrics();
      assertThat(second).as(backend.name()).isEqualTo(first);
    }
  }
}
