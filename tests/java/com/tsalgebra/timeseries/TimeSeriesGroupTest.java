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

import java.util.NoSuchElementException;
import java.util.TimeZone;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import org.junit.Before;
import org.junit.Test;

import com.tsalgebra.forecast.ForecastMethod;
import com.tsalgebra.forecast.Forecaster;
import com.tsalgebra.numeric.LeastSquaresFitter;
import com.tsalgebra.series.AbstractSeries;
import com.tsalgebra.series.Point;
import com.tsalgebra.series.Series;
import com.tsalgebra.testing.easymock.EasyMockTest;

import static org.easymock.EasyMock.aryEq;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.isNull;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TimeSeriesGroupTest extends EasyMockTest {

  // 2013-01-01 00:00:00 UTC
  private static final long START = 1356998400000L;
  private static final long HOUR = 3600000L;
  private static final double DELTA = 1e-6;

  private Forecaster forecaster;
  private TimeSeries visits;
  private TimeSeries errors;

  @Before
  public void setUp() {
    forecaster = createMock(Forecaster.class);
    visits = TimeSeries.of(Point.of(START, 10), Point.of(START + HOUR, 12),
        Point.of(START + 2 * HOUR, 14));
    errors = TimeSeries.of(Point.of(START + HOUR, -1.4), Point.of(START + 3 * HOUR, 2.6));
  }

  private TimeSeriesGroup group() {
    return TimeSeriesGroup.builder()
        .put("visits", visits)
        .put("errors", errors)
        .build();
  }

  @Test
  public void testLabelsKeepInsertionOrder() {
    control.replay();

    TimeSeriesGroup group = new TimeSeriesGroup(ImmutableMap.of("b", visits, "a", errors));
    assertEquals(ImmutableList.of("b", "a"), Lists.newArrayList(group));
    assertSame(visits, group.get("b"));
    assertEquals(2, group.size());
    assertTrue(group.contains("a"));
    assertFalse(new TimeSeriesGroup().contains("a"));
    assertTrue(new TimeSeriesGroup().isEmpty());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBuilderRejectsDuplicates() {
    control.replay();

    TimeSeriesGroup.builder().put("visits", visits).put("visits", errors);
  }

  @Test(expected = NoSuchElementException.class)
  public void testMissingLabel() {
    control.replay();

    group().get("latency");
  }

  @Test
  public void testReassignmentKeepsPosition() {
    control.replay();

    TimeSeriesGroup group = group();
    Series other = Series.of(Point.of(1, 1));
    group.put("visits", other);
    group.put("latency", visits);

    assertEquals(ImmutableSet.of("visits", "errors", "latency"), group.labels());
    assertEquals(ImmutableList.of("visits", "errors", "latency"),
        ImmutableList.copyOf(group.labels()));
    assertSame(other, group.get("visits"));
  }

  @Test
  public void testRemove() {
    control.replay();

    TimeSeriesGroup group = group();
    assertSame(errors, group.remove("errors"));
    assertEquals(ImmutableSet.of("visits"), group.labels());
    try {
      group.remove("errors");
      fail("Expected removing a missing label to fail");
    } catch (NoSuchElementException e) {
      // expected
    }
  }

  @Test
  public void testRename() {
    control.replay();

    TimeSeriesGroup group = group();
    group.rename("visits", "hits");

    assertEquals(ImmutableList.of("errors", "hits"), ImmutableList.copyOf(group.labels()));
    assertSame(visits, group.get("hits"));
    assertFalse(group.contains("visits"));
  }

  @Test
  public void testRenameMissingOrSameLabel() {
    control.replay();

    TimeSeriesGroup group = group();
    group.rename("latency", "visits");
    group.rename("visits", "visits");

    assertEquals(ImmutableList.of("visits", "errors"), ImmutableList.copyOf(group.labels()));
    assertSame(visits, group.get("visits"));
    assertSame(errors, group.get("errors"));
  }

  @Test
  public void testRenameReplacesTarget() {
    control.replay();

    TimeSeriesGroup group = group();
    group.rename(ImmutableMap.of("visits", "errors", "missing", "ignored"));

    assertEquals(ImmutableSet.of("errors"), group.labels());
    assertSame(visits, group.get("errors"));
  }

  @Test
  public void testTimestampsUnion() {
    control.replay();

    assertEquals(ImmutableList.<Number>of(START, START + HOUR, START + 2 * HOUR, START + 3 * HOUR),
        group().timestamps());
    assertEquals(ImmutableList.<Number>of(), new TimeSeriesGroup().timestamps());
  }

  @Test
  public void testTimestampsUnionOfThreeSeries() {
    control.replay();

    TimeSeriesGroup group = group();
    group.put("latency",
        TimeSeries.of(Point.of(START + 6 * HOUR, 5), Point.of(START + 5 * HOUR, 7)));

    assertEquals(ImmutableList.<Number>of(START, START + HOUR, START + 2 * HOUR, START + 3 * HOUR,
        START + 5 * HOUR, START + 6 * HOUR), group.timestamps());
  }

  @Test
  public void testTrend() {
    control.replay();

    TimeSeriesGroup group = group();
    TimeSeriesGroup trends = group.trend(new LeastSquaresFitter());

    assertEquals(group.labels(), trends.labels());
    AbstractSeries<?> visitsTrend = trends.get("visits");
    assertTrue(visitsTrend instanceof TimeSeries);
    assertEquals(10, visitsTrend.get(0).getValue().doubleValue(), DELTA);
    assertEquals(14, visitsTrend.get(2).getValue().doubleValue(), DELTA);
    // The members themselves are untouched.
    assertEquals(ImmutableList.<Number>of(10L, 12L, 14L), visits.values());
  }

  @Test
  public void testRoundAndAbsActInPlace() {
    control.replay();

    TimeSeriesGroup group = group();
    assertSame(group, group.round().abs());

    assertSame(errors, group.get("errors"));
    assertEquals(ImmutableList.<Number>of(1.0, 3.0), errors.values());
    assertEquals(ImmutableList.<Number>of(10L, 12L, 14L), visits.values());
  }

  @Test
  public void testForecast() throws Exception {
    expect(forecaster.forecast(aryEq(new double[] {10, 12, 14}), isNull(),
        eq(ForecastMethod.ARIMA), eq(1)))
        .andReturn(new double[] {16});
    expect(forecaster.forecast(aryEq(new double[] {-1.4, 2.6}), isNull(),
        eq(ForecastMethod.ARIMA), eq(1)))
        .andReturn(new double[] {6.6});
    control.replay();

    TimeSeriesGroup forecasts = group().forecast(forecaster, 1);

    assertEquals(ImmutableList.of("visits", "errors"), ImmutableList.copyOf(forecasts.labels()));
    assertEquals(TimeSeries.of(Point.of(START + 3 * HOUR, 16.0)), forecasts.get("visits"));
    assertEquals(TimeSeries.of(Point.of(START + 5 * HOUR, 6.6)), forecasts.get("errors"));
  }

  @Test
  public void testForecastByName() throws Exception {
    expect(forecaster.forecast(aryEq(new double[] {10, 12, 14}), eq(Integer.valueOf(24)),
        eq(ForecastMethod.ETS), eq(2)))
        .andReturn(new double[] {16, 18});
    control.replay();

    TimeSeriesGroup group = TimeSeriesGroup.builder().put("visits", visits).build();
    TimeSeriesGroup forecasts = group.forecast(forecaster, 2, "ets", 24);

    assertEquals(TimeSeries.of(Point.of(START + 3 * HOUR, 16.0), Point.of(START + 4 * HOUR, 18.0)),
        forecasts.get("visits"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyGroupRejectsUnknownMethod() throws Exception {
    control.replay();

    new TimeSeriesGroup().forecast(forecaster, 1, "holt", null);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyGroupRejectsNullMethod() throws Exception {
    control.replay();

    new TimeSeriesGroup().forecast(forecaster, 1, (ForecastMethod) null, null);
  }

  @Test
  public void testForecastRejectsPlainSeries() throws Exception {
    control.replay();

    TimeSeriesGroup group = group();
    group.put("positions", Series.of(Point.of(0.5, 1), Point.of(1.5, 2)));
    try {
      group.forecast(forecaster, 1, "arima", null);
      fail("Expected a plain series to be rejected");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("positions"));
    }
  }

  @Test
  public void testToTable() {
    control.replay();

    String expected = Joiner.on('\n').join(
        "Date                visits errors",
        "=================== ====== ======",
        "2013-01-01 00:00:00 10           ",
        "2013-01-01 01:00:00 12     -1.4  ",
        "2013-01-01 02:00:00 14           ",
        "2013-01-01 03:00:00        2.6   ");
    assertEquals(expected, group().toTable(TimeZone.getTimeZone("UTC")));
  }

  @Test
  public void testToString() {
    control.replay();

    TimeSeriesGroup group = TimeSeriesGroup.builder()
        .put("a", TimeSeries.of(Point.of(1000, 2)))
        .build();
    assertEquals("TimeSeriesGroup({a=TimeSeries([(1000, 2)])})", group.toString());
  }
}
