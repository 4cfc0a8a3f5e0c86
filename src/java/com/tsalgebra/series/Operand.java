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

import javax.annotation.Nullable;

import com.google.common.base.Objects;
import com.google.common.base.Optional;

/**
 * The right-hand side of a binary series operation: either another series, aligned by key, or a
 * scalar broadcast across every point.
 */
public final class Operand {
  private final Optional<AbstractSeries<?>> series;
  private final Optional<Number> scalar;

  private Operand(Optional<AbstractSeries<?>> series, Optional<Number> scalar) {
    this.series = series;
    this.scalar = scalar;
  }

  /**
   * Returns {@code true} if this operand wraps a series.
   */
  public boolean isSeries() {
    return series.isPresent();
  }

  /**
   * Returns {@code true} if this operand wraps a scalar.
   */
  public boolean isScalar() {
    return scalar.isPresent();
  }

  /**
   * Returns the wrapped series.
   *
   * @throws IllegalStateException if this is a scalar operand.
   */
  public AbstractSeries<?> getSeries() {
    return series.get();
  }

  /**
   * Returns the wrapped scalar.
   *
   * @throws IllegalStateException if this is a series operand.
   */
  public Number getScalar() {
    return scalar.get();
  }

  /**
   * Can transform either kind of operand into a result.
   *
   * @param <T> The transformation result type.
   */
  public abstract static class Transformer<T> {

    /**
     * Maps a series operand to a result.
     *
     * @param series the series to map.
     * @return The mapped value.
     */
    public abstract T mapSeries(AbstractSeries<?> series);

    /**
     * Maps a scalar operand to a result.
     *
     * @param scalar the scalar to map.
     * @return The mapped value.
     */
    public abstract T mapScalar(Number scalar);
  }

  /**
   * Transforms this operand to a value regardless of its kind.
   *
   * @param transformer The transformer to apply.
   * @param <T> The type the transformer produces.
   * @return A value mapped by the transformer from this series or scalar.
   */
  public <T> T map(Transformer<T> transformer) {
    if (isSeries()) {
      return transformer.mapSeries(getSeries());
    } else {
      return transformer.mapScalar(getScalar());
    }
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (!(o instanceof Operand)) {
      return false;
    }
    Operand other = (Operand) o;
    return Objects.equal(series, other.series)
        && Objects.equal(scalar, other.scalar);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(series, scalar);
  }

  @Override
  public String toString() {
    if (isSeries()) {
      return String.format("Series(%s)", getSeries());
    } else {
      return String.format("Scalar(%s)", getScalar());
    }
  }

  /**
   * Creates a series operand.
   *
   * @param series The series to align against - may not be null.
   * @return An operand wrapping {@code series}.
   */
  public static Operand of(AbstractSeries<?> series) {
    return new Operand(Optional.<AbstractSeries<?>>of(series), Optional.<Number>absent());
  }

  /**
   * Creates a scalar operand.
   *
   * @param scalar The scalar to broadcast - may not be null.
   * @return An operand wrapping the normalized {@code scalar}.
   */
  public static Operand of(Number scalar) {
    return new Operand(Optional.<AbstractSeries<?>>absent(),
        Optional.of(Numbers.normalize(scalar)));
  }
}
