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

import com.google.common.math.LongMath;

/**
 * The binary arithmetic operators a series supports.  Integral operands produce integral results
 * except for {@link #DIVIDE}, which always produces a double, and {@link #POWER} with a negative
 * exponent.  Integral overflow raises an {@link ArithmeticException}.
 */
public enum Operator {
  ADD("+") {
    @Override long applyIntegral(long left, long right) {
      return LongMath.checkedAdd(left, right);
    }

    @Override double applyFloating(double left, double right) {
      return left + right;
    }
  },
  SUBTRACT("-") {
    @Override long applyIntegral(long left, long right) {
      return LongMath.checkedSubtract(left, right);
    }

    @Override double applyFloating(double left, double right) {
      return left - right;
    }
  },
  MULTIPLY("*") {
    @Override long applyIntegral(long left, long right) {
      return LongMath.checkedMultiply(left, right);
    }

    @Override double applyFloating(double left, double right) {
      return left * right;
    }
  },
  DIVIDE("/") {
    @Override boolean integralResult(long left, long right) {
      return false;
    }

    @Override long applyIntegral(long left, long right) {
      throw new UnsupportedOperationException("Division always produces a double");
    }

    @Override double applyFloating(double left, double right) {
      if (right == 0) {
        throw new ArithmeticException("division by zero");
      }
      return left / right;
    }
  },
  POWER("**") {
    @Override boolean integralResult(long left, long right) {
      return right >= 0 && right <= Integer.MAX_VALUE;
    }

    @Override long applyIntegral(long left, long right) {
      return LongMath.checkedPow(left, (int) right);
    }

    @Override double applyFloating(double left, double right) {
      return Math.pow(left, right);
    }
  };

  private final String symbol;

  Operator(String symbol) {
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }

  /**
   * Applies this operator to two numbers.
   *
   * @param left The left operand.
   * @param right The right operand.
   * @return The normalized result.
   * @throws ArithmeticException on integral overflow or division by zero.
   */
  public Number apply(Number left, Number right) {
    Number l = Numbers.normalize(left);
    Number r = Numbers.normalize(right);
    if (l instanceof Long && r instanceof Long
        && integralResult(l.longValue(), r.longValue())) {
      return applyIntegral(l.longValue(), r.longValue());
    }
    return applyFloating(l.doubleValue(), r.doubleValue());
  }

  boolean integralResult(long left, long right) {
    return true;
  }

  abstract long applyIntegral(long left, long right);

  abstract double applyFloating(double left, double right);
}
