package com.ospicorp.creditforecast.forecast.regression;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

/**
 * L2-penalized least squares on standardized features (alpha 1.0). Unlike the tree ensembles it
 * extrapolates a trend past the training range. Constant columns get a zero coefficient.
 */
@Component
public class RidgeBackend implements RegressionBackend {

  static final String NAME = "ridge";
  static final double ALPHA = 1.0;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean isAvailable() {
    return ClassUtils.isPresent("org.apache.commons.math3.linear.CholeskyDecomposition",
        RidgeBackend.class.getClassLoader());
  }

  @Override
  public RegressionModel create(long seed) {
    // closed form, nothing to seed
    return new RidgeModel(ALPHA);
  }

  static final class RidgeModel implements RegressionModel {
    private static final double CONSTANT_TOLERANCE = 1e-9;

    private final double alpha;
    private double[] means;
    private double[] scales;
    private double[] coefficients;
    private double intercept;

    RidgeModel(double alpha) {
      this.alpha = alpha;
    }

    @Override
    public void fit(double[][] x, double[] y) {
      if (x.length == 0 || x.length != y.length) {
        throw new IllegalArgumentException("x and y must be non-empty and of equal length");
      }
      int n = x.length;
      int p = x[0].length;
      means = new double[p];
      scales = new double[p];
      for (int j = 0; j < p; j++) {
        double sum = 0d;
        for (double[] row : x) {
          sum += row[j];
        }
        double mean = sum / n;
        double squares = 0d;
        for (double[] row : x) {
          squares += (row[j] - mean) * (row[j] - mean);
        }
        double sd = Math.sqrt(squares / n);
        means[j] = mean;
        scales[j] = sd <= CONSTANT_TOLERANCE * Math.max(1d, Math.abs(mean)) ? 0d : sd;
      }

      double yMean = 0d;
      for (double v : y) {
        yMean += v;
      }
      yMean /= n;

      RealMatrix z = new Array2DRowRealMatrix(standardize(x), false);
      RealVector centered = new ArrayRealVector(y).mapSubtract(yMean);
      RealMatrix zt = z.transpose();
      RealMatrix gram = zt.multiply(z)
          .add(MatrixUtils.createRealIdentityMatrix(p).scalarMultiply(alpha));
      RealVector beta = new CholeskyDecomposition(gram).getSolver()
          .solve(zt.operate(centered));

      coefficients = beta.toArray();
      intercept = yMean;
    }

    @Override
    public double[] predict(double[][] x) {
      if (coefficients == null) {
        throw new IllegalStateException("model has not been fitted");
      }
      double[][] z = standardize(x);
      double[] out = new double[x.length];
      for (int i = 0; i < z.length; i++) {
        double sum = intercept;
        for (int j = 0; j < coefficients.length; j++) {
          sum += coefficients[j] * z[i][j];
        }
        out[i] = sum;
      }
      return out;
    }

    private double[][] standardize(double[][] x) {
      double[][] z = new double[x.length][means.length];
      for (int i = 0; i < x.length; i++) {
        for (int j = 0; j < means.length; j++) {
          z[i][j] = scales[j] == 0d ? 0d : (x[i][j] - means[j]) / scales[j];
        }
      }
      return z;
    }
  }
}
