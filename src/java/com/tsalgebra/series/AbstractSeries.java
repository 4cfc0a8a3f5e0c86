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

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.SortedMap;

import com.google.common.base.Function;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import com.tsalgebra.numeric.NumericFitter;
import com.tsalgebra.numeric.Polynomial;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * A sequence of (key, value) points kept in ascending key order.
 *
 * <p>Operations that return a series return one of the receiver's own kind, so a time series
 * combined with anything stays a time series.  Methods named {@code *InPlace}, along with
 * {@link #round(int)} and {@link #abs()}, replace the receiver's points and return the receiver;
 * every other operation leaves both operands untouched.
 *
 * <p>Series are not thread safe.
 *
 * @param <S> The concrete series type.
 */
public abstract class AbstractSeries<S extends AbstractSeries<S>> implements Iterable<Point> {

  // Trend orders.
  public static final int LINEAR = 1;
  public static final int QUADRATIC = 2;
  public static final int CUBIC = 3;
  public static final int QUARTIC = 4;

  private ImmutableList<Point> points;

  /**
   * Creates a series from points in any order.  Points with equal keys keep their relative order.
   *
   * @param points The points of the series.
   */
  protected AbstractSeries(Iterable<Point> points) {
    this.points = sorted(points);
  }

  /**
   * Converts a key to value mapping into points.
   *
   * @param points Values by key.
   * @return One point per entry, in the map's iteration order.
   */
  protected static List<Point> pointsOf(Map<? extends Number, ? extends Number> points) {
    checkNotNull(points);
    List<Point> result = Lists.newArrayListWithCapacity(points.size());
    for (Map.Entry<? extends Number, ? extends Number> entry : points.entrySet()) {
      result.add(Point.of(entry.getKey(), entry.getValue()));
    }
    return result;
  }

  private static ImmutableList<Point> sorted(Iterable<Point> points) {
    checkNotNull(points);
    // Ordering.sortedCopy is a stable sort.
    return ImmutableList.copyOf(Point.KEY_ORDERING.sortedCopy(points));
  }

  /**
   * Returns this series as its concrete type.
   */
  protected abstract S self();

  /**
   * Creates a new series of this series' kind holding the given points.
   *
   * @param points Points for the new series.
   * @return A new series.
   */
  protected abstract S newSeries(List<Point> points);

  /**
   * Replaces the points of this series.
   *
   * @param newPoints The new points, re-sorted by key.
   */
  protected void replacePoints(List<Point> newPoints) {
    points = sorted(newPoints);
  }

  /**
   * Returns a snapshot of the points in ascending key order.
   */
  public ImmutableList<Point> points() {
    return points;
  }

  /**
   * Returns all keys in ascending order.
   */
  public ImmutableList<Number> keys() {
    return ImmutableList.copyOf(Lists.transform(points, Point.key()));
  }

  /**
   * Returns all values in ascending key order.
   */
  public ImmutableList<Number> values() {
    return ImmutableList.copyOf(Lists.transform(points, Point.value()));
  }

  protected double[] keyArray() {
    return Numbers.toDoubleArray(Lists.transform(points, Point.key()));
  }

  protected double[] valueArray() {
    return Numbers.toDoubleArray(Lists.transform(points, Point.value()));
  }

  public int size() {
    return points.size();
  }

  public boolean isEmpty() {
    return points.isEmpty();
  }

  /**
   * Returns the point at a position.
   *
   * @param index Position in ascending key order.
   * @return The point at {@code index}.
   * @throws IndexOutOfBoundsException if there is no such position.
   */
  public Point get(int index) {
    return points.get(index);
  }

  /**
   * Returns the points between two positions.
   *
   * @param fromIndex First position, inclusive.
   * @param toIndex Last position, exclusive.
   * @return The points in the range.
   */
  public ImmutableList<Point> slice(int fromIndex, int toIndex) {
    return points.subList(fromIndex, toIndex);
  }

  /**
   * Looks up the value stored under a key.
   *
   * @param key The key to look up.
   * @return The value at {@code key}.
   * @throws NoSuchElementException if the series has no point with that key.
   */
  public Number valueAt(Number key) {
    int index = indexOf(key);
    if (index < 0) {
      throw new NoSuchElementException("Key not found: " + key);
    }
    return points.get(index).getValue();
  }

  public boolean containsKey(Number key) {
    return indexOf(key) >= 0;
  }

  private int indexOf(Number key) {
    checkNotNull(key);
    return Collections.binarySearch(Lists.transform(points, Point.key()), key, Numbers.ORDERING);
  }

  @Override
  public Iterator<Point> iterator() {
    return points.iterator();
  }

  /**
   * Applies a function to every value.
   *
   * @param function The function to apply.
   * @return A new series with the same keys and the mapped values.
   */
  public S map(Function<? super Number, ? extends Number> function) {
    return newSeries(transformValues(function));
  }

  /**
   * Rounds every value to the nearest integer, in place.
   *
   * @return This series.
   */
  public S round() {
    return round(0);
  }

  /**
   * Rounds every value to {@code places} decimal places, half away from zero, in place.
   *
   * @param places Decimal places to keep.
   * @return This series.
   */
  public S round(final int places) {
    replacePoints(transformValues(new Function<Number, Number>() {
      @Override public Number apply(Number value) {
        return Numbers.round(value, places);
      }
    }));
    return self();
  }

  /**
   * Replaces every value with its absolute value, in place.
   *
   * @return This series.
   */
  public S abs() {
    replacePoints(transformValues(new Function<Number, Number>() {
      @Override public Number apply(Number value) {
        return Numbers.abs(value);
      }
    }));
    return self();
  }

  private List<Point> transformValues(Function<? super Number, ? extends Number> function) {
    checkNotNull(function);
    ImmutableList.Builder<Point> transformed = ImmutableList.builder();
    for (Point point : points) {
      transformed.add(point.withValue(function.apply(point.getValue())));
    }
    return transformed.build();
  }

  /**
   * Combines this series with an operand.  A series operand is inner joined on key: only keys
   * present in both series survive.  A scalar operand is applied to every value.
   *
   * @param operator The operator to apply.
   * @param operand The right hand side.
   * @return A new series holding the result.
   */
  public S combine(Operator operator, Operand operand) {
    return newSeries(compute(operator, operand));
  }

  /**
   * Same as {@link #combine(Operator, Operand)} but stores the result in this series.
   *
   * @param operator The operator to apply.
   * @param operand The right hand side.
   * @return This series.
   */
  public S combineInPlace(Operator operator, Operand operand) {
    replacePoints(compute(operator, operand));
    return self();
  }

  private List<Point> compute(final Operator operator, Operand operand) {
    checkNotNull(operator);
    checkNotNull(operand);

    return operand.map(new Operand.Transformer<List<Point>>() {
      @Override public List<Point> mapSeries(AbstractSeries<?> series) {
        SortedMap<Number, Number> lookup = Maps.newTreeMap(Numbers.ORDERING);
        for (Point point : series.points()) {
          lookup.put(point.getKey(), point.getValue());
        }
        ImmutableList.Builder<Point> joined = ImmutableList.builder();
        for (Point point : points) {
          Number right = lookup.get(point.getKey());
          if (right != null) {
            joined.add(point.withValue(operator.apply(point.getValue(), right)));
          }
        }
        return joined.build();
      }

      @Override public List<Point> mapScalar(Number scalar) {
        ImmutableList.Builder<Point> broadcast = ImmutableList.builder();
        for (Point point : points) {
          broadcast.add(point.withValue(operator.apply(point.getValue(), scalar)));
        }
        return broadcast.build();
      }
    });
  }

  public S plus(AbstractSeries<?> operand) {
    return combine(Operator.ADD, Operand.of(operand));
  }

  public S plus(Number operand) {
    return combine(Operator.ADD, Operand.of(operand));
  }

  public S minus(AbstractSeries<?> operand) {
    return combine(Operator.SUBTRACT, Operand.of(operand));
  }

  public S minus(Number operand) {
    return combine(Operator.SUBTRACT, Operand.of(operand));
  }

  public S times(AbstractSeries<?> operand) {
    return combine(Operator.MULTIPLY, Operand.of(operand));
  }

  public S times(Number operand) {
    return combine(Operator.MULTIPLY, Operand.of(operand));
  }

  public S dividedBy(AbstractSeries<?> operand) {
    return combine(Operator.DIVIDE, Operand.of(operand));
  }

  public S dividedBy(Number operand) {
    return combine(Operator.DIVIDE, Operand.of(operand));
  }

  public S pow(AbstractSeries<?> operand) {
    return combine(Operator.POWER, Operand.of(operand));
  }

  public S pow(Number operand) {
    return combine(Operator.POWER, Operand.of(operand));
  }

  public S plusInPlace(AbstractSeries<?> operand) {
    return combineInPlace(Operator.ADD, Operand.of(operand));
  }

  public S plusInPlace(Number operand) {
    return combineInPlace(Operator.ADD, Operand.of(operand));
  }

  public S minusInPlace(AbstractSeries<?> operand) {
    return combineInPlace(Operator.SUBTRACT, Operand.of(operand));
  }

  public S minusInPlace(Number operand) {
    return combineInPlace(Operator.SUBTRACT, Operand.of(operand));
  }

  public S timesInPlace(AbstractSeries<?> operand) {
    return combineInPlace(Operator.MULTIPLY, Operand.of(operand));
  }

  public S timesInPlace(Number operand) {
    return combineInPlace(Operator.MULTIPLY, Operand.of(operand));
  }

  public S dividedByInPlace(AbstractSeries<?> operand) {
    return combineInPlace(Operator.DIVIDE, Operand.of(operand));
  }

  public S dividedByInPlace(Number operand) {
    return combineInPlace(Operator.DIVIDE, Operand.of(operand));
  }

  public S powInPlace(AbstractSeries<?> operand) {
    return combineInPlace(Operator.POWER, Operand.of(operand));
  }

  public S powInPlace(Number operand) {
    return combineInPlace(Operator.POWER, Operand.of(operand));
  }

  /**
   * Fits a polynomial of the given order to the points of this series.
   *
   * @param fitter The numeric routines to fit with.
   * @param order The polynomial order, e.g. {@link #LINEAR}.
   * @return The fitted polynomial.
   * @throws ArithmeticException if the series is empty.
   */
  public Polynomial trendCoefficients(NumericFitter fitter, int order) {
    checkNotNull(fitter);
    checkArgument(order >= 0, "Trend order must be non-negative, got %s", order);
    if (points.isEmpty()) {
      throw new ArithmeticException("Cannot calculate the trend of an empty series");
    }
    return fitter.fit(keyArray(), valueArray(), order);
  }

  public S trend(NumericFitter fitter) {
    return trend(fitter, LINEAR);
  }

  public S trend(NumericFitter fitter, int order) {
    return trend(fitter, order, true);
  }

  public S trend(NumericFitter fitter, int order, boolean positive) {
    return trend(fitter, order, positive, false);
  }

  /**
   * Fits a polynomial trend and evaluates it at every key of this series.
   *
   * @param fitter The numeric routines to fit with.
   * @param order The polynomial order, e.g. {@link #LINEAR}.
   * @param positive Whether to clamp negative trend values to zero.
   * @param rounded Whether to truncate trend values to integers.
   * @return A new series with the same keys holding the trend values.
   * @throws ArithmeticException if the series is empty.
   */
  public S trend(NumericFitter fitter, int order, boolean positive, boolean rounded) {
    Polynomial coefficients = trendCoefficients(fitter, order);
    double[] fitted = fitter.evaluate(coefficients, keyArray());
    checkState(fitted.length == points.size(),
        "Expected %s trend values, got %s", points.size(), fitted.length);

    ImmutableList.Builder<Point> trend = ImmutableList.builder();
    for (int i = 0; i < fitted.length; i++) {
      double value = positive ? Math.max(fitted[i], 0) : fitted[i];
      Number result;
      if (rounded) {
        result = (long) value;
      } else {
        result = value;
      }
      trend.add(points.get(i).withValue(result));
    }
    return newSeries(trend.build());
  }

  public S movingAverage(NumericFitter fitter, int window) {
    return movingAverage(fitter, window, MovingAverageMethod.SIMPLE);
  }

  public S movingAverage(NumericFitter fitter, int window, MovingAverageMethod method) {
    return movingAverage(fitter, window, method, false);
  }

  /**
   * Computes a moving average.  Each average is keyed by the last point of its window, so the
   * result has {@code size() - window + 1} points.
   *
   * @param fitter The numeric routines to convolve with.
   * @param window Number of consecutive values per average.
   * @param method The weighting scheme.
   * @param rounded Whether to round averages to the nearest integer.
   * @return A new series holding the averages.
   * @throws ArithmeticException if the series has fewer than {@code window} points.
   */
  public S movingAverage(NumericFitter fitter, int window, MovingAverageMethod method,
      boolean rounded) {
    checkNotNull(fitter);
    checkNotNull(method);
    checkArgument(window >= 1, "Window must be positive, got %s", window);
    if (points.size() < window) {
      throw new ArithmeticException("Not enough points for moving average");
    }

    double[] convolved = fitter.convolve(valueArray(), method.weights(window));
    checkState(convolved.length == points.size() + window - 1,
        "Expected a full convolution of length %s, got %s", points.size() + window - 1,
        convolved.length);

    ImmutableList.Builder<Point> averages = ImmutableList.builder();
    for (int i = window - 1; i < points.size(); i++) {
      Number average;
      if (rounded) {
        average = Numbers.roundToLong(convolved[i]);
      } else {
        average = convolved[i];
      }
      averages.add(points.get(i).withValue(average));
    }
    return newSeries(averages.build());
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) { return true; }
    if (o == null || o.getClass() != getClass()) { return false; }

    return points.equals(((AbstractSeries<?>) o).points);
  }

  @Override
  public int hashCode() {
    return 31 * getClass().getName().hashCode() + points.hashCode();
  }

  @Override
  public String toString() {
    return String.format("%s(%s)", getClass().getSimpleName(), points);
  }
}
