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

import com.google.common.base.Joiner;
import com.google.common.primitives.Doubles;

import org.apache.commons.lang.builder.EqualsBuilder;
import org.apache.commons.lang.builder.HashCodeBuilder;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An immutable polynomial in a shifted and scaled variable {@code t = (x - shift) / scale}.
 * Coefficients are stored lowest degree first.
 *
 * <p>Fitting against large keys such as millisecond timestamps is badly conditioned, so fitters
 * work in the normalized variable and keep the transform alongside the coefficients.
 */
public final class Polynomial {
  private final double[] coefficients;
  private final double shift;
  private final double scale;

  /**
   * Creates a polynomial in a normalized variable.
   *
   * @param coefficients Coefficients of {@code t^0, t^1, ...}; at least one.
   * @param shift Subtracted from x before scaling.
   * @param scale Divides the shifted x; must be non-zero and finite.
   */
  public Polynomial(double[] coefficients, double shift, double scale) {
    checkNotNull(coefficients);
    checkArgument(coefficients.length > 0, "A polynomial needs at least one coefficient");
    checkArgument(scale != 0 && !Double.isInfinite(scale) && !Double.isNaN(scale),
        "Invalid scale: %s", scale);
    this.coefficients = coefficients.clone();
    this.shift = shift;
    this.scale = scale;
  }

  /**
   * Creates a polynomial in x itself.
   *
   * @param coefficients Coefficients of {@code x^0, x^1, ...}.
   * @return A new polynomial.
   */
  public static Polynomial of(double... coefficients) {
    return new Polynomial(coefficients, 0, 1);
  }

  public int getDegree() {
    return coefficients.length - 1;
  }

  public double[] getCoefficients() {
    return coefficients.clone();
  }

  public double getShift() {
    return shift;
  }

  public double getScale() {
    return scale;
  }

  /**
   * Evaluates the polynomial at {@code x} using Horner's scheme.
   */
  public double evaluate(double x) {
    double t = (x - shift) / scale;
    double result = 0;
    for (int i = coefficients.length - 1; i >= 0; i--) {
      result = result * t + coefficients[i];
    }
    return result;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) { return true; }
    if (!(o instanceof Polynomial)) { return false; }

    Polynomial that = (Polynomial) o;
    return new EqualsBuilder()
        .append(this.coefficients, that.coefficients)
        .append(this.shift, that.shift)
        .append(this.scale, that.scale)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(coefficients)
        .append(shift)
        .append(scale)
        .toHashCode();
  }

  @Override
  public String toString() {
    return String.format("Polynomial(coefficients=[%s], shift=%s, scale=%s)",
        Joiner.on(", ").join(Doubles.asList(coefficients)), shift, scale);
  }
}
