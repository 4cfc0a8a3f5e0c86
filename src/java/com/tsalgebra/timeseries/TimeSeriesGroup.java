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

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.SortedSet;
import java.util.TimeZone;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import com.tsalgebra.forecast.ForecastMethod;
import com.tsalgebra.forecast.Forecaster;
import com.tsalgebra.forecast.ModelException;
import com.tsalgebra.numeric.NumericFitter;
import com.tsalgebra.series.AbstractSeries;
import com.tsalgebra.series.Numbers;
import com.tsalgebra.util.DateUtils;
import com.tsalgebra.util.Tables;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A labelled group of series.  Labels are unique and iterate in insertion order; assigning to an
 * existing label keeps that label's position.
 *
 * <p>The group holds references, not copies: {@link #round()}, {@link #abs()} and
 * {@link #rename(String, String)} act on the member series themselves.
 */
public class TimeSeriesGroup implements Iterable<String> {

  private static final Logger LOG = Logger.getLogger(TimeSeriesGroup.class.getName());

  private final Map<String, AbstractSeries<?>> members = Maps.newLinkedHashMap();

  /**
   * Creates an empty group.
   */
  public TimeSeriesGroup() {
  }

  /**
   * Creates a group holding the given series, in the map's iteration order.
   *
   * @param members Series by label.
   */
  public TimeSeriesGroup(Map<String, ? extends AbstractSeries<?>> members) {
    checkNotNull(members);
    for (Map.Entry<String, ? extends AbstractSeries<?>> entry : members.entrySet()) {
      put(entry.getKey(), entry.getValue());
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds a group, rejecting repeated labels.
   */
  public static final class Builder {
    private final Map<String, AbstractSeries<?>> members = Maps.newLinkedHashMap();

    private Builder() {
    }

    public Builder put(String label, AbstractSeries<?> series) {
      checkNotNull(label);
      checkNotNull(series);
      checkArgument(!members.containsKey(label), "Duplicate label: %s", label);
      members.put(label, series);
      return this;
    }

    public TimeSeriesGroup build() {
      return new TimeSeriesGroup(members);
    }
  }

  /**
   * Returns the series with a label.
   *
   * @param label The label to look up.
   * @return The member series.
   * @throws NoSuchElementException if no series has the label.
   */
  public AbstractSeries<?> get(String label) {
    checkNotNull(label);
    AbstractSeries<?> series = members.get(label);
    if (series == null) {
      throw new NoSuchElementException("No series labelled " + label);
    }
    return series;
  }

  /**
   * Adds a series, replacing any series already under the label.
   *
   * @param label The label.
   * @param series The series to store.
   */
  public void put(String label, AbstractSeries<?> series) {
    checkNotNull(label);
    checkNotNull(series);
    members.put(label, series);
  }

  /**
   * Removes the series with a label.
   *
   * @param label The label to remove.
   * @return The removed series.
   * @throws NoSuchElementException if no series has the label.
   */
  public AbstractSeries<?> remove(String label) {
    checkNotNull(label);
    AbstractSeries<?> removed = members.remove(label);
    if (removed == null) {
      throw new NoSuchElementException("No series labelled " + label);
    }
    return removed;
  }

  public boolean contains(@Nullable String label) {
    return members.containsKey(label);
  }

  public ImmutableSet<String> labels() {
    return ImmutableSet.copyOf(members.keySet());
  }

  public int size() {
    return members.size();
  }

  public boolean isEmpty() {
    return members.isEmpty();
  }

  @Override
  public Iterator<String> iterator() {
    return labels().iterator();
  }

  /**
   * Returns the union of every member's keys, ascending and without duplicates.
   */
  public ImmutableList<Number> timestamps() {
    SortedSet<Number> union = Sets.newTreeSet(Numbers.ORDERING);
    for (AbstractSeries<?> series : members.values()) {
      union.addAll(series.keys());
    }
    return ImmutableList.copyOf(union);
  }

  public TimeSeriesGroup trend(NumericFitter fitter) {
    return trend(fitter, AbstractSeries.LINEAR);
  }

  public TimeSeriesGroup trend(NumericFitter fitter, int order) {
    return trend(fitter, order, true);
  }

  /**
   * Fits a trend to every member.
   *
   * @see AbstractSeries#trend(NumericFitter, int, boolean)
   * @return A new group with the same labels holding the trends.
   */
  public TimeSeriesGroup trend(NumericFitter fitter, int order, boolean positive) {
    Builder trends = builder();
    for (Map.Entry<String, AbstractSeries<?>> entry : members.entrySet()) {
      trends.put(entry.getKey(), entry.getValue().trend(fitter, order, positive));
    }
    return trends.build();
  }

  public TimeSeriesGroup forecast(Forecaster forecaster, int horizon) throws ModelException {
    return forecast(forecaster, horizon, ForecastMethod.ARIMA);
  }

  public TimeSeriesGroup forecast(Forecaster forecaster, int horizon, ForecastMethod method)
      throws ModelException {
    return forecast(forecaster, horizon, method, null);
  }

  /**
   * Forecasts every member.  Either every member is forecast or, on the first failure, the
   * exception propagates and no group is returned.
   *
   * @see TimeSeries#forecast(Forecaster, int, ForecastMethod, Integer)
   * @return A new group with the same labels holding the forecasts.
   * @throws IllegalArgumentException if the method is null or a member is not a
   *     {@link TimeSeries}.
   */
  public TimeSeriesGroup forecast(Forecaster forecaster, int horizon, ForecastMethod method,
      @Nullable Integer frequency) throws ModelException {
    checkNotNull(forecaster);
    checkArgument(method != null, "Unknown forecast method: null");
    Map<String, TimeSeries> timeSeries = checkTimeSeries();
    LOG.fine(String.format("Forecasting %d series", timeSeries.size()));
    Builder forecasts = builder();
    for (Map.Entry<String, TimeSeries> entry : timeSeries.entrySet()) {
      forecasts.put(entry.getKey(),
          entry.getValue().forecast(forecaster, horizon, method, frequency));
    }
    return forecasts.build();
  }

  /**
   * Same as {@link #forecast(Forecaster, int, ForecastMethod, Integer)} with the method given by
   * name.
   *
   * @throws IllegalArgumentException if the method name is not recognized, even for an empty
   *     group.
   */
  public TimeSeriesGroup forecast(Forecaster forecaster, int horizon, String method,
      @Nullable Integer frequency) throws ModelException {
    return forecast(forecaster, horizon, ForecastMethod.fromName(method), frequency);
  }

  private Map<String, TimeSeries> checkTimeSeries() {
    Map<String, TimeSeries> timeSeries = Maps.newLinkedHashMap();
    for (Map.Entry<String, AbstractSeries<?>> entry : members.entrySet()) {
      checkArgument(entry.getValue() instanceof TimeSeries,
          "Cannot forecast %s: not a time series", entry.getKey());
      timeSeries.put(entry.getKey(), (TimeSeries) entry.getValue());
    }
    return timeSeries;
  }

  /**
   * Rounds every member to whole numbers, in place.
   *
   * @return This group.
   */
  public TimeSeriesGroup round() {
    return round(0);
  }

  public TimeSeriesGroup round(int places) {
    for (AbstractSeries<?> series : members.values()) {
      series.round(places);
    }
    return this;
  }

  /**
   * Replaces every member's values with their absolute values, in place.
   *
   * @return This group.
   */
  public TimeSeriesGroup abs() {
    for (AbstractSeries<?> series : members.values()) {
      series.abs();
    }
    return this;
  }

  /**
   * Moves a series to a new label, replacing any series already there.  Does nothing if there is
   * no series labelled {@code from}.
   *
   * @param from The current label.
   * @param to The new label.
   */
  public void rename(String from, String to) {
    checkNotNull(from);
    checkNotNull(to);
    if (!members.containsKey(from)) {
      LOG.fine("Not renaming missing series " + from);
      return;
    }
    if (from.equals(to)) {
      return;
    }
    members.put(to, members.get(from));
    members.remove(from);
  }

  /**
   * Applies {@link #rename(String, String)} to each entry, in the map's iteration order.
   *
   * @param labels New labels by current label.
   */
  public void rename(Map<String, String> labels) {
    checkNotNull(labels);
    for (Map.Entry<String, String> entry : labels.entrySet()) {
      rename(entry.getKey(), entry.getValue());
    }
  }

  /**
   * Renders the group as a table with a {@code Date} column over {@link #timestamps()} and one
   * column per member, in the default time zone.
   */
  public String toTable() {
    return toTable(TimeZone.getDefault());
  }

  public String toTable(TimeZone timeZone) {
    List<Number> timestamps = timestamps();
    Map<String, List<?>> columns = Maps.newLinkedHashMap();

    List<String> dates = Lists.newArrayListWithCapacity(timestamps.size());
    for (Number timestamp : timestamps) {
      dates.add(DateUtils.format(DateUtils.toDate(timestamp.longValue()), timeZone));
    }
    columns.put("Date", dates);

    for (Map.Entry<String, AbstractSeries<?>> entry : members.entrySet()) {
      AbstractSeries<?> series = entry.getValue();
      List<Object> cells = Lists.newArrayListWithCapacity(timestamps.size());
      for (Number timestamp : timestamps) {
        cells.add(series.containsKey(timestamp) ? series.valueAt(timestamp) : "");
      }
      columns.put(entry.getKey(), cells);
    }
    return Tables.format(columns);
  }

  @Override
  public String toString() {
    return String.format("TimeSeriesGroup(%s)", members);
  }
}
