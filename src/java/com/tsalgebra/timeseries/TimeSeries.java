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

package com.tsalgebra.timeseries;

import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.TimeZone;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.base.Function;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.math.LongMath;

import com.tsalgebra.forecast.Decomposer;
import com.tsalgebra.forecast.Decomposition;
import com.tsalgebra.forecast.ForecastMethod;
import com.tsalgebra.forecast.Forecaster;
import com.tsalgebra.forecast.ModelException;
import com.tsalgebra.forecast.SeasonalWindow;
import com.tsalgebra.series.AbstractSeries;
import com.tsalgebra.series.Point;
import com.tsalgebra.util.DateUtils;
import com.tsalgebra.util.Tables;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * A series keyed by timestamps in milliseconds since the epoch.
 *
 * <p>Keys are always stored as {@code Long}s.  A floating point key holding a whole number of
 * milliseconds, such as {@code 1000.0}, is converted on construction; any other key is rejected.
 *
 * <p>The {@link #interval() interval} of a time series is the gap between its first two
 * timestamps.  Gaps are not required to be uniform; the interval is only used to space
 * forecasted points.
 */
public final class TimeSeries extends AbstractSeries<TimeSeries> {

  private static final Logger LOG = Logger.getLogger(TimeSeries.class.getName());

  // Labels of the group returned by decompose().
  public static final String SEASONAL = "seasonal";
  public static final String TREND = "trend";
  public static final String RESIDUAL = "residual";

  // 2^63, the first double above every long.
  private static final double MAX_LONG_AS_DOUBLE = 0x1p63;

  private static final Function<Point, Long> TIMESTAMP = new Function<Point, Long>() {
    @Override public Long apply(Point point) {
      return point.getKey().longValue();
    }
  };

  /**
   * Creates a time series.
   *
   * @param points Points keyed by millisecond timestamps, in any order.
   * @throws IllegalArgumentException if a key is not a whole number of milliseconds in the range
   *     of a long.
   */
  public TimeSeries(Iterable<Point> points) {
    super(checkTimestamps(points));
  }

  public static TimeSeries of(Point... points) {
    return new TimeSeries(Arrays.asList(points));
  }

  public static TimeSeries of(Iterable<Point> points) {
    return new TimeSeries(points);
  }

  public static TimeSeries of(Map<? extends Number, ? extends Number> points) {
    return new TimeSeries(pointsOf(points));
  }

  private static ImmutableList<Point> checkTimestamps(Iterable<Point> points) {
    ImmutableList.Builder<Point> timestamped = ImmutableList.builder();
    for (Point point : checkNotNull(points)) {
      Number key = point.getKey();
      if (key instanceof Long) {
        timestamped.add(point);
      } else {
        double millis = key.doubleValue();
        checkArgument(millis == Math.rint(millis)
            && millis >= Long.MIN_VALUE && millis < MAX_LONG_AS_DOUBLE,
            "Time series keys must be millisecond timestamps, got %s", key);
        timestamped.add(Point.of((long) millis, point.getValue()));
      }
    }
    return timestamped.build();
  }

  @Override
  protected TimeSeries self() {
    return this;
  }

  @Override
  protected TimeSeries newSeries(List<Point> points) {
    return new TimeSeries(points);
  }

  /**
   * Returns all timestamps in ascending order.
   */
  public ImmutableList<Long> timestamps() {
    return ImmutableList.copyOf(Lists.transform(points(), TIMESTAMP));
  }

  /**
   * Returns the timestamps as dates, truncated to whole seconds.
   */
  public ImmutableList<Date> dates() {
    ImmutableList.Builder<Date> dates = ImmutableList.builder();
    for (long timestamp : timestamps()) {
      dates.add(DateUtils.toDate(timestamp));
    }
    return dates.build();
  }

  /**
   * Returns the gap between the first two timestamps, or absent if there are fewer than two
   * points.
   */
  public Optional<Long> interval() {
    if (size() < 2) {
      return Optional.absent();
    }
    return Optional.of(
        LongMath.checkedSubtract(get(1).getKey().longValue(), get(0).getKey().longValue()));
  }

  public TimeSeries forecast(Forecaster forecaster, int horizon) throws ModelException {
    return forecast(forecaster, horizon, ForecastMethod.ARIMA);
  }

  public TimeSeries forecast(Forecaster forecaster, int horizon, ForecastMethod method)
      throws ModelException {
    return forecast(forecaster, horizon, method, null);
  }

  /**
   * Forecasts points past the end of this series.  Forecasted points are spaced by
   * {@link #interval()} starting one interval after the last timestamp.
   *
   * @param forecaster The forecasting service.
   * @param horizon Number of points to forecast.
   * @param method The model to forecast with.
   * @param frequency Observations per seasonal period, if known.
   * @return A new time series holding only the forecasted points.
   * @throws ArithmeticException if the series has fewer than two points.
   * @throws IllegalArgumentException if the method is null or the horizon is not positive.
   * @throws ModelException if the forecaster fails.
   */
  public TimeSeries forecast(Forecaster forecaster, int horizon, ForecastMethod method,
      @Nullable Integer frequency) throws ModelException {
    checkForecastable();
    if (method == null) {
      throw new IllegalArgumentException("Unknown forecast method: null");
    }
    return doForecast(forecaster, horizon, method, frequency);
  }

  /**
   * Same as {@link #forecast(Forecaster, int, ForecastMethod, Integer)} with the method given by
   * name.
   *
   * @throws IllegalArgumentException if the method name is not recognized.
   */
  public TimeSeries forecast(Forecaster forecaster, int horizon, String method,
      @Nullable Integer frequency) throws ModelException {
    checkForecastable();
    return doForecast(forecaster, horizon, ForecastMethod.fromName(method), frequency);
  }

  private void checkForecastable() {
    if (size() <= 1) {
      throw new ArithmeticException("Cannot run forecast when len(series) <= 1");
    }
  }

  private TimeSeries doForecast(Forecaster forecaster, int horizon, ForecastMethod method,
      @Nullable Integer frequency) throws ModelException {
    checkNotNull(forecaster);
    checkArgument(horizon >= 1, "Forecast horizon must be positive, got %s", horizon);
    checkArgument(frequency == null || frequency >= 1,
        "Frequency must be positive, got %s", frequency);

    LOG.fine(String.format("Forecasting %d points from %d values with %s, frequency %s",
        horizon, size(), method.getName(), frequency));
    double[] forecasted = forecaster.forecast(valueArray(), frequency, method, horizon);
    checkState(forecasted != null && forecasted.length == horizon,
        "Forecaster returned %s values for a horizon of %s",
        forecasted == null ? null : forecasted.length, horizon);

    long interval = interval().get();
    long last = get(size() - 1).getKey().longValue();
    List<Point> points = Lists.newArrayListWithCapacity(horizon);
    for (int i = 1; i <= horizon; i++) {
      long timestamp = LongMath.checkedAdd(last, LongMath.checkedMultiply(i, interval));
      points.add(Point.of(timestamp, forecasted[i - 1]));
    }
    return new TimeSeries(points);
  }

  public TimeSeriesGroup decompose(Decomposer decomposer, int frequency) throws ModelException {
    return decompose(decomposer, frequency, null, false);
  }

  /**
   * Decomposes this series into seasonal, trend and residual components.
   *
   * @param decomposer The decomposition service.
   * @param frequency Observations per seasonal period.
   * @param window Seasonal smoothing window, defaults to {@code frequency}.
   * @param periodic Whether to smooth the seasonal component periodically, ignoring
   *     {@code window}.
   * @return A group labelled {@link #SEASONAL}, {@link #TREND} and {@link #RESIDUAL}, each keyed
   *     like this series.
   * @throws ModelException if the decomposer fails.
   */
  public TimeSeriesGroup decompose(Decomposer decomposer, int frequency,
      @Nullable Integer window, boolean periodic) throws ModelException {
    checkNotNull(decomposer);
    checkArgument(frequency >= 1, "Frequency must be positive, got %s", frequency);

    SeasonalWindow seasonalWindow;
    if (periodic) {
      seasonalWindow = SeasonalWindow.periodic();
    } else {
      seasonalWindow = SeasonalWindow.of(window == null ? frequency : window);
    }

    LOG.fine(String.format("Decomposing %d values, frequency %d, seasonal window %s",
        size(), frequency, seasonalWindow));
    Decomposition decomposition =
        decomposer.decompose(valueArray(), frequency, seasonalWindow);
    checkState(decomposition != null && decomposition.size() == size(),
        "Decomposer returned components of length %s for %s values",
        decomposition == null ? null : decomposition.size(), size());

    return TimeSeriesGroup.builder()
        .put(SEASONAL, withValues(decomposition.getSeasonal()))
        .put(TREND, withValues(decomposition.getTrend()))
        .put(RESIDUAL, withValues(decomposition.getResidual()))
        .build();
  }

  private TimeSeries withValues(double[] values) {
    List<Point> points = Lists.newArrayListWithCapacity(values.length);
    for (int i = 0; i < values.length; i++) {
      points.add(get(i).withValue(values[i]));
    }
    return new TimeSeries(points);
  }

  /**
   * Renders the series as a {@code Date} / {@code Value} table in the default time zone.
   */
  public String toTable() {
    return toTable(TimeZone.getDefault());
  }

  public String toTable(TimeZone timeZone) {
    List<String> dates = Lists.newArrayListWithCapacity(size());
    for (Date date : dates()) {
      dates.add(DateUtils.format(date, timeZone));
    }
    Map<String, List<?>> columns = Maps.newLinkedHashMap();
    columns.put("Date", dates);
    columns.put("Value", values());
    return Tables.format(columns);
  }
}
