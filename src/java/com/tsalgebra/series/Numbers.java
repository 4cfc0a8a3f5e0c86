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

package com.tsalgebra.series;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.collect.Ordering;
import com.google.common.primitives.Longs;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Utilities for the two numeric representations used by series: {@code Long} for integral
 * numbers and {@code Double} for everything else.
 */
public final class Numbers {

  /**
   * Orders numbers by exact numeric value, so {@code 1} and {@code 1.0} are equal under this
   * ordering.  An integral number is never rounded to a double for comparison.  NaN sorts after
   * every other number and {@code -0.0} equals {@code 0.0}.
   */
  public static final Ordering<Number> ORDERING = new Ordering<Number>() {
    @Override public int compare(Number left, Number right) {
      boolean leftIntegral = isIntegral(left);
      boolean rightIntegral = isIntegral(right);
      if (leftIntegral && rightIntegral) {
        return Longs.compare(left.longValue(), right.longValue());
      }
      if (leftIntegral) {
        return compareExactly(left.longValue(), right.doubleValue());
      }
      if (rightIntegral) {
        return -compareExactly(right.longValue(), left.doubleValue());
      }
      double l = left.doubleValue();
      double r = right.doubleValue();
      return l == r ? 0 : Double.compare(l, r);
    }
  };

  private static final BigInteger MIN_LONG = BigInteger.valueOf(Long.MIN_VALUE);
  private static final BigInteger MAX_LONG = BigInteger.valueOf(Long.MAX_VALUE);

  private Numbers() {
    // utility
  }

  /**
   * Returns {@code true} if the number holds an integral value in the range of a long.
   *
   * @param number The number to check.
   * @return Whether the number would normalize to a {@code Long}.
   */
  public static boolean isIntegral(Number number) {
    checkNotNull(number);
    if (number instanceof Long || number instanceof Integer || number instanceof Short
        || number instanceof Byte || number instanceof AtomicLong
        || number instanceof AtomicInteger) {
      return true;
    }
    if (number instanceof BigInteger) {
      BigInteger big = (BigInteger) number;
      return big.compareTo(MIN_LONG) >= 0 && big.compareTo(MAX_LONG) <= 0;
    }
    return false;
  }

  /**
   * Converts a number to its canonical representation: a {@code Long} for integral numbers and a
   * {@code Double} for everything else.
   *
   * @param number The number to normalize.
   * @return The canonical form of {@code number}.
   */
  public static Number normalize(Number number) {
    checkNotNull(number);
    if (number instanceof Long || number instanceof Double) {
      return number;
    }
    if (isIntegral(number)) {
      return number.longValue();
    }
    return number.doubleValue();
  }

  /**
   * Rounds a number to {@code places} decimal places, half away from zero.  Integral numbers stay
   * integral; NaN and infinities are returned unchanged.
   *
   * @param number The number to round.
   * @param places Decimal places to keep, may be negative to round to tens, hundreds, etc.
   * @return The rounded number.
   */
  public static Number round(Number number, int places) {
    Number normalized = normalize(number);
    if (normalized instanceof Long) {
      if (places >= 0) {
        return normalized;
      }
      return BigDecimal.valueOf(normalized.longValue())
          .setScale(places, RoundingMode.HALF_UP)
          .longValueExact();
    }
    double value = normalized.doubleValue();
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return normalized;
    }
    return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
  }

  /**
   * Rounds a double to the nearest integral value, half away from zero.
   *
   * @throws ArithmeticException if the value is NaN, infinite or out of the range of a long.
   */
  public static long roundToLong(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new ArithmeticException("Cannot round " + value + " to an integer");
    }
    return BigDecimal.valueOf(value).setScale(0, RoundingMode.HALF_UP).longValueExact();
  }

  private static int compareExactly(long integral, double floating) {
    if (Double.isNaN(floating)) {
      return -1;
    }
    if (Double.isInfinite(floating)) {
      return floating > 0 ? -1 : 1;
    }
    return BigDecimal.valueOf(integral).compareTo(new BigDecimal(floating));
  }

  /**
   * Returns the absolute value of a number, keeping its representation.
   */
  public static Number abs(Number number) {
    Number normalized = normalize(number);
    if (normalized instanceof Long) {
      long value = normalized.longValue();
      if (value == Long.MIN_VALUE) {
        throw new ArithmeticException("overflow: abs(" + value + ")");
      }
      return Math.abs(value);
    }
    return Math.abs(normalized.doubleValue());
  }

  /**
   * Copies the double values of the given numbers into an array.
   */
  public static double[] toDoubleArray(Iterable<? extends Number> numbers) {
    int size = 0;
    for (Number ignored : numbers) {
      size++;
    }
    double[] array = new double[size];
    int i = 0;
    for (Number number : numbers) {
      array[i++] = number.doubleValue();
    }
    return array;
  }
}
