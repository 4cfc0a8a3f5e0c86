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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Weighting schemes for {@link AbstractSeries#movingAverage}.
 */
public enum MovingAverageMethod {
  /**
   * Unweighted mean of the window.
   */
  SIMPLE {
    @Override public double[] weights(int window) {
      checkArgument(window >= 1, "Window must be positive, got %s", window);
      double[] weights = new double[window];
      Arrays.fill(weights, 1.0 / window);
      return weights;
    }
  };

  /**
   * Returns the convolution kernel for a window of the given size.
   *
   * @param window Number of consecutive values averaged.
   * @return {@code window} weights summing to one.
   */
  public abstract double[] weights(int window);
}
