// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.tsalgebra.numeric;

import java.util.Arrays;
import java.util.logging.Logger;

import org.ejml.data.DenseMatrix64F;
import org.ejml.factory.LinearSolverFactory;
import org.ejml.interfaces.linsol.LinearSolver;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A {@link NumericFitter} that solves polynomial fits by ordinary least squares over a
 * Vandermonde matrix with EJML's QR based solver.
 *
 * <p>Keys are centred on their mean and scaled into [-1, 1] before the matrix is built.  When
 * there are fewer distinct keys than coefficients the degree is lowered so the system stays
 * determined.
 */
public class LeastSquaresFitter implements NumericFitter {

  private static final Logger LOG = Logger.getLogger(LeastSquaresFitter.class.getName());

  // Solvers report a quality of 0 for singular systems; anything this small is numerically so.
  private static final double MIN_QUALITY = 1e-12;

  @Override
  public Polynomial fit(double[] keys, double[] values, int order) {
    checkNotNull(keys);
    checkNotNull(values);
    checkArgument(keys.length == values.length,
        "Got %s keys but %s values", keys.length, values.length);
    checkArgument(keys.length > 0, "Cannot fit a polynomial to an empty set of points");
    checkArgument(order >= 0, "Polynomial order must be non-negative, got %s", order);

    int distinct = countDistinct(keys);
    int degree = Math.min(order, distinct - 1);
    if (degree < order) {
      LOG.warning(String.format("Only %d distinct keys, reducing polynomial order from %d to %d",
          distinct, order, degree));
    }

    double shift = mean(keys);
    double scale = 0;
    for (double key : keys) {
      scale = Math.max(scale, Math.abs(key - shift));
    }
    if (scale == 0) {
      scale = 1;
    }

    int numRows = keys.length;
    int numCols = degree + 1;
    DenseMatrix64F matrixA = new DenseMatrix64F(numRows, numCols);
    DenseMatrix64F matrixB = new DenseMatrix64F(numRows, 1);
    for (int i = 0; i < numRows; i++) {
      double t = (keys[i] - shift) / scale;
      double power = 1;
      for (int j = 0; j < numCols; j++) {
        matrixA.set(i, j, power);
        power *= t;
      }
      matrixB.set(i, 0, values[i]);
    }

    LinearSolver<DenseMatrix64F> solver = LinearSolverFactory.leastSquares(numRows, numCols);
    if (!solver.setA(matrixA) || solver.quality() <= MIN_QUALITY) {
      throw new ArithmeticException(
          String.format("Cannot fit a polynomial of order %d: the system is singular", degree));
    }
    DenseMatrix64F matrixX = new DenseMatrix64F(numCols, 1);
    solver.solve(matrixB, matrixX);

    double[] coefficients = Arrays.copyOf(matrixX.getData(), numCols);
    for (double coefficient : coefficients) {
      if (Double.isNaN(coefficient) || Double.isInfinite(coefficient)) {
        throw new ArithmeticException("Polynomial fit did not produce finite coefficients");
      }
    }
    return new Polynomial(coefficients, shift, scale);
  }

  @Override
  public double[] evaluate(Polynomial coefficients, double[] keys) {
    checkNotNull(coefficients);
    checkNotNull(keys);
    double[] result = new double[keys.length];
    for (int i = 0; i < keys.length; i++) {
      result[i] = coefficients.evaluate(keys[i]);
    }
    return result;
  }

  @Override
  public double[] convolve(double[] values, double[] weights) {
    checkNotNull(values);
    checkNotNull(weights);
    checkArgument(values.length > 0, "Cannot convolve an empty signal");
    checkArgument(weights.length > 0, "Cannot convolve with an empty kernel");

    double[] result = new double[values.length + weights.length - 1];
    for (int i = 0; i < values.length; i++) {
      for (int j = 0; j < weights.length; j++) {
        result[i + j] += values[i] * weights[j];
      }
    }
    return result;
  }

  private static int countDistinct(double[] keys) {
    double[] sorted = keys.clone();
    Arrays.sort(sorted);
    int distinct = 1;
    for (int i = 1; i < sorted.length; i++) {
      if (sorted[i] != sorted[i - 1]) {
        distinct++;
      }
    }
    return distinct;
  }

  private static double mean(double[] keys) {
    double sum = 0;
    for (double key : keys) {
      sum += key;
    }
    return sum / keys.length;
  }
}
