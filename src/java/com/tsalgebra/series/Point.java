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

import com.google.common.base.Function;
import com.google.common.collect.Ordering;

import org.apache.commons.lang.builder.EqualsBuilder;
import org.apache.commons.lang.builder.HashCodeBuilder;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An immutable (key, value) observation with value-equals semantics.  Both slots are normalized
 * on construction, see {@link Numbers#normalize(Number)}.
 */
public final class Point {

  /**
   * Orders points by key only.
   */
  public static final Ordering<Point> KEY_ORDERING =
      Numbers.ORDERING.onResultOf(key());

  private final Number key;
  private final Number value;

  private Point(Number key, Number value) {
    this.key = Numbers.normalize(checkNotNull(key, "key"));
    this.value = Numbers.normalize(checkNotNull(value, "value"));
  }

  public Number getKey() {
    return key;
  }

  public Number getValue() {
    return value;
  }

  /**
   * Returns a point with the same key and a new value.
   *
   * @param newValue The value to pair with this point's key.
   * @return A new point.
   */
  public Point withValue(Number newValue) {
    return new Point(key, newValue);
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) { return true; }
    if (!(o instanceof Point)) { return false; }

    Point that = (Point) o;
    return new EqualsBuilder()
        .append(this.key, that.key)
        .append(this.value, that.value)
        .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(key)
        .append(value)
        .toHashCode();
  }

  @Override
  public String toString() {
    return String.format("(%s, %s)", key, value);
  }

  /**
   * Creates a function that extracts the key of a point.
   *
   * @return A function that will extract the key of a point.
   */
  public static Function<Point, Number> key() {
    return new Function<Point, Number>() {
      @Override public Number apply(Point point) {
        return point.key;
      }
    };
  }

  /**
   * Creates a function that extracts the value of a point.
   *
   * @return A function that will extract the value of a point.
   */
  public static Function<Point, Number> value() {
    return new Function<Point, Number>() {
      @Override public Number apply(Point point) {
        return point.value;
      }
    };
  }

  /**
   * Convenience method to create a point.
   *
   * @param key The key, typically a position or a timestamp in milliseconds.
   * @param value The observed value.
   * @return A new point of [key, value].
   */
  public static Point of(Number key, Number value) {
    return new Point(key, value);
  }
}
