package com.ospicorp.creditforecast.forecast.regression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.creditforecast.forecast.service.Evaluator;
import org.junit.jupiter.api.Test;

class RidgeBackendTest {

  private final RidgeBackend backend = new RidgeBackend();

  @Test
  void recoversLinearRelationIgnoringConstantColumns() {
    int n = 60;
    double[][] x = new double[n][];
    double[] y = new double[n];
    for (int i = 0; i < n; i++) {
      double a = i;
      double b = (i * 7) % 11;
      x[i] = new double[] {a, b, 42d};
      y[i] = 3d + 2d * a - b;
    }
    RegressionModel model = backend.create(42L);

    model.fit(x, y);
    double[] fitted = model.predict(x);

    assertThat(fitted).doesNotContain(Double.NaN);
    assertThat(Evaluator.score(y, fitted).r2()).isGreaterThan(0.99);
  }

  @Test
  void extrapolatesATrend() {
    double[][] x = new double[30][];
    double[] y = new double[30];
    for (int i = 0; i < 30; i++) {
      x[i] = new double[] {i};
      y[i] = 100d + 10d * i;
    }
    RegressionModel model = backend.create(42L);
    model.fit(x, y);

    double predicted = model.predict(new double[][] {{40d}})[0];

    assertThat(predicted).isGreaterThan(450d);
  }

  @Test
  void predictBeforeFitFails() {
    assertThatThrownBy(() -> backend.create(1L).predict(new double[][] {{1d}}))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void isAlwaysAvailable() {
    assertThat(backend.isAvailable()).isTrue();
    assertThat(backend.name()).isEqualTo("ridge");
  }
}
