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

/**
 * Numeric routines series delegate to: polynomial least squares, polynomial evaluation and
 * discrete convolution.
 */
public interface NumericFitter {

  /**
   * Fits a polynomial of the given order to the points {@code (keys[i], values[i])}.
   *
   * @param keys The abscissae, at least one.
   * @param values The ordinates, the same length as {@code keys}.
   * @param order The polynomial order, 1 for a line up to 4 for a quartic.
   * @return The fitted polynomial.
   * @throws ArithmeticException if no polynomial can be fitted to the points.
   */
  Polynomial fit(double[] keys, double[] values, int order);

  /**
   * Evaluates a polynomial at every key.
   *
   * @param coefficients The polynomial to evaluate.
   * @param keys The points to evaluate at.
   * @return One value per key, in key order.
   */
  double[] evaluate(Polynomial coefficients, double[] keys);

  /**
   * Computes the full discrete convolution of {@code values} and {@code weights}.
   *
   * @param values The signal.
   * @param weights The kernel, at least one weight.
   * @return An array of length {@code values.length + weights.length - 1}.
   */
  double[] convolve(double[] values, double[] weights);
}
