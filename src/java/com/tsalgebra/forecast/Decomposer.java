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

/**
 * A seasonal decomposition service, typically STL (seasonal-trend decomposition by loess).
 */
public interface Decomposer {

  /**
   * Splits values into seasonal, trend and residual components.
   *
   * @param values The observed values, oldest first.
   * @param frequency Number of observations per seasonal period.
   * @param window The seasonal smoothing window.
   * @return Components each as long as {@code values}.
   * @throws ModelException if the values cannot be decomposed.
   */
  Decomposition decompose(double[] values, int frequency, SeasonalWindow window)
      throws ModelException;
}
