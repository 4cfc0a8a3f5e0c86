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

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * A general series of numeric (key, value) points.
 */
public final class Series extends AbstractSeries<Series> {

  public Series(Iterable<Point> points) {
    super(points);
  }

  public static Series of(Point... points) {
    return new Series(Arrays.asList(points));
  }

  public static Series of(Iterable<Point> points) {
    return new Series(points);
  }

  public static Series of(Map<? extends Number, ? extends Number> points) {
    return new Series(pointsOf(points));
  }

  @Override
  protected Series self() {
    return this;
  }

  @Override
  protected Series newSeries(List<Point> points) {
    return new Series(points);
  }
}
