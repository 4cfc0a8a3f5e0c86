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

import java.util.Date;
import java.util.TimeZone;

import com.google.common.base.Joiner;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.junit.Before;
import org.junit.Test;

import com.tsalgebra.forecast.Decomposer;
import com.tsalgebra.forecast.Decomposition;
import com.tsalgebra.forecast.ForecastMethod;
import com.tsalgebra.forecast.Forecaster;
import com.tsalgebra.forecast.ModelException;
import com.tsalgebra.forecast.SeasonalWindow;
import com.tsalgebra.numeric.LeastSquaresFitter;
import com.tsalgebra.series.Point;
import com.tsalgebra.testing.easymock.EasyMockTest;

import static org.easymock.EasyMock.aryEq;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.isNull;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

public class TimeSeriesTest extends EasyMockTest {

  // 2013-01-01 00:00:00 UTC
  private static final long START = 1356998400000L;
  private static final long DAY = 86400000L;
  private static final double DELTA = 1e-9;

  private Forecaster forecaster;
  private Decomposer decomposer;

  @Before
  public void setUp() {
    forecaster = createMock(Forecaster.class);
    decomposer = createMock(Decomposer.class);
  }

  private static TimeSeries daily(Number... values) {
    ImmutableList.Builder<Point> points = ImmutableList.builder();
    for (int i = 0; i < values.length; i++) {
      points.add(Point.of(START + i * DAY, values[i]));
    }
    return TimeSeries.of(points.build());
  }

  @Test
  public void testKeysMustBeTimestamps() {
    control.replay();

    try {
      TimeSeries.of(Point.of(START, 1), Point.of(1.5, 2));
      fail("Expected fractional key to be rejected");
    } catch (IllegalArgumentException e) {
      // expected
    }
    assertEquals(1, TimeSeries.of(Point.of(START, 1)).size());
  }

  @Test
  public void testWholeNumberKeysBecomeTimestamps() {
    control.replay();

    TimeSeries series = TimeSeries.of(ImmutableMap.of(2000.0, 2, 1000.0, 1));

    assertEquals(ImmutableList.of(1000L, 2000L), series.timestamps());
    assertEquals(TimeSeries.of(Point.of(1000, 1), Point.of(2000, 2)), series);
    assertEquals(Optional.of(1000L), series.interval());
  }

  @Test
  public void testNonFiniteKeysRejected() {
    control.replay();

    for (double key : new double[] {Double.NaN, Double.POSITIVE_INFINITY, 1e19}) {
      try {
        TimeSeries.of(Point.of(key, 1));
        fail("Expected key " + key + " to be rejected");
      } catch (IllegalArgumentException e) {
        // expected
      }
    }
  }

  @Test
  public void testTimestamps() {
    control.replay();

    TimeSeries series = TimeSeries.of(Point.of(START + DAY, 2), Point.of(START, 1));
    assertEquals(ImmutableList.of(START, START + DAY), series.timestamps());
  }

  @Test
  public void testDatesTruncateToSeconds() {
    control.replay();

    TimeSeries series = TimeSeries.of(Point.of(START + 999, 1), Point.of(-1, 0));
    assertEquals(ImmutableList.of(new Date(-1000), new Date(START)), series.dates());
  }

  @Test
  public void testInterval() {
    control.replay();

    assertEquals(Optional.of(DAY), daily(1, 2, 3).interval());
    assertEquals(Optional.of(3L), TimeSeries.of(Point.of(10, 0), Point.of(13, 0), Point.of(100, 0))
        .interval());
    assertFalse(daily(1).interval().isPresent());
    assertFalse(TimeSeries.of().interval().isPresent());
  }

  @Test
  public void testForecast() throws Exception {
    expect(forecaster.forecast(aryEq(new double[] {1, 2, 3}), isNull(),
        eq(ForecastMethod.ARIMA), eq(2)))
        .andReturn(new double[] {4, 5});
    control.replay();

    TimeSeries forecast = daily(1, 2, 3).forecast(forecaster, 2);

    assertEquals(
        TimeSeries.of(Point.of(START + 3 * DAY, 4.0), Point.of(START + 4 * DAY, 5.0)), forecast);
  }

  @Test
  public void testForecastByName() throws Exception {
    expect(forecaster.forecast(aryEq(new double[] {1, 2, 3, 4}), eq(Integer.valueOf(2)),
        eq(ForecastMethod.ETS), eq(1)))
        .andReturn(new double[] {5});
    control.replay();

    TimeSeries forecast = daily(1, 2, 3, 4).forecast(forecaster, 1, "ETS", 2);

    assertEquals(ImmutableList.<Number>of(5.0), forecast.values());
    assertEquals(ImmutableList.of(START + 4 * DAY), forecast.timestamps());
  }

  @Test(expected = ArithmeticException.class)
  public void testForecastNeedsTwoPoints() throws Exception {
    control.replay();

    daily(1).forecast(forecaster, 3, "no such method", null);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testForecastUnknownMethod() throws Exception {
    control.replay();

    daily(1, 2).forecast(forecaster, 3, "holt", null);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testForecastNullMethod() throws Exception {
    control.replay();

    daily(1, 2).forecast(forecaster, 3, (ForecastMethod) null, null);
  }

  @Test
  public void testForecastFailurePropagates() throws Exception {
    ModelException failure = new ModelException("did not converge");
    expect(forecaster.forecast(aryEq(new double[] {1, 2}), isNull(),
        eq(ForecastMethod.ARIMA), eq(1)))
        .andThrow(failure);
    control.replay();

    try {
      daily(1, 2).forecast(forecaster, 1);
      fail("Expected the forecaster failure to propagate");
    } catch (ModelException e) {
      assertSame(failure, e);
    }
  }

  @Test(expected = IllegalStateException.class)
  public void testForecastWrongLength() throws Exception {
    expect(forecaster.forecast(aryEq(new double[] {1, 2}), isNull(),
        eq(ForecastMethod.ARIMA), eq(2)))
        .andReturn(new double[] {3});
    control.replay();

    daily(1, 2).forecast(forecaster, 2);
  }

  @Test
  public void testDecompose() throws Exception {
    double[] seasonal = {1, -1, 1, -1, 1};
    double[] trend = {10, 11, 12, 13, 14};
    double[] residual = {0.5, 0, -0.5, 0.25, 0};
    expect(decomposer.decompose(aryEq(new double[] {11.5, 10, 12.5, 12.25, 15}), eq(2),
        eq(SeasonalWindow.of(2))))
        .andReturn(new Decomposition(seasonal, trend, residual));
    control.replay();

    TimeSeries series = daily(11.5, 10, 12.5, 12.25, 15);
    TimeSeriesGroup components = series.decompose(decomposer, 2);

    assertEquals(ImmutableSet.of(TimeSeries.SEASONAL, TimeSeries.TREND, TimeSeries.RESIDUAL),
        components.labels());
    assertEquals(series.timestamps(), ((TimeSeries) components.get(TimeSeries.TREND)).timestamps());

    TimeSeries rebuilt = ((TimeSeries) components.get(TimeSeries.TREND))
        .plus(components.get(TimeSeries.SEASONAL))
        .plus(components.get(TimeSeries.RESIDUAL));
    for (int i = 0; i < series.size(); i++) {
      assertEquals(series.get(i).getValue().doubleValue(),
          rebuilt.get(i).getValue().doubleValue(), DELTA);
    }
  }

  @Test
  public void testDecomposeWindow() throws Exception {
    double[] zeros = new double[3];
    Decomposition flat = new Decomposition(zeros, zeros, zeros);
    expect(decomposer.decompose(aryEq(new double[] {1, 2, 3}), eq(4), eq(SeasonalWindow.of(7))))
        .andReturn(flat);
    expect(decomposer.decompose(aryEq(new double[] {1, 2, 3}), eq(4),
        eq(SeasonalWindow.periodic())))
        .andReturn(flat);
    control.replay();

    TimeSeries series = daily(1, 2, 3);
    series.decompose(decomposer, 4, 7, false);
    series.decompose(decomposer, 4, 7, true);
  }

  @Test(expected = IllegalStateException.class)
  public void testDecomposeWrongLength() throws Exception {
    double[] two = new double[2];
    expect(decomposer.decompose(aryEq(new double[] {1, 2, 3}), eq(1), eq(SeasonalWindow.of(1))))
        .andReturn(new Decomposition(two, two, two));
    control.replay();

    daily(1, 2, 3).decompose(decomposer, 1);
  }

  @Test
  public void testOperationsKeepType() {
    control.replay();

    TimeSeries series = daily(1, 2, 3, 4);
    TimeSeries doubled = series.times(2);
    TimeSeries averaged = series.movingAverage(new LeastSquaresFitter(), 2);

    assertEquals(daily(2, 4, 6, 8), doubled);
    assertEquals(ImmutableList.of(START + DAY, START + 2 * DAY, START + 3 * DAY),
        averaged.timestamps());
    assertArrayEquals(new double[] {1.5, 2.5, 3.5},
        new double[] {
            averaged.get(0).getValue().doubleValue(),
            averaged.get(1).getValue().doubleValue(),
            averaged.get(2).getValue().doubleValue()},
        DELTA);
  }

  @Test
  public void testToTable() {
    control.replay();

    String expected = Joiner.on('\n').join(
        "Date                Value",
        "=================== =====",
        "2013-01-01 00:00:00 12   ",
        "2013-01-02 00:00:00 7.5  ");
    assertEquals(expected, daily(12, 7.5).toTable(TimeZone.getTimeZone("UTC")));
  }
}
