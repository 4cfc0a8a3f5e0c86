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

package com.tsalgebra.forecast;

import com.google.common.base.Objects;
import com.google.common.base.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The span of the seasonal smoother used by a {@link Decomposer}: either a fixed number of
 * observations or periodic, in which case the seasonal component is the same every period.
 */
public final class SeasonalWindow {
  private static final SeasonalWindow PERIODIC = new SeasonalWindow(Optional.<Integer>absent());

  private final Optional<Integer> span;

  private SeasonalWindow(Optional<Integer> span) {
    this.span = span;
  }

  public static SeasonalWindow periodic() {
    return PERIODIC;
  }

  /**
   * Creates a window spanning a fixed number of observations.
   *
   * @param span The window span, at least 1.
   * @return A non-periodic window.
   */
  public static SeasonalWindow of(int span) {
    checkArgument(span >= 1, "Seasonal window must be positive, got %s", span);
    return new SeasonalWindow(Optional.of(span));
  }

  public boolean isPeriodic() {
    return !span.isPresent();
  }

  /**
   * Returns the span of a non-periodic window.
   *
   * @throws IllegalStateException if the window is periodic.
   */
  public int getSpan() {
    return span.get();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SeasonalWindow && Objects.equal(span, ((SeasonalWindow) o).span);
  }

  @Override
  public int hashCode() {
    return span.hashCode();
  }

  @Override
  public String toString() {
    return isPeriodic() ? "periodic" : String.valueOf(getSpan());
  }
}
