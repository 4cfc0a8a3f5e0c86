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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The seasonal, trend and residual components of a decomposed series, index aligned with the
 * values that were decomposed.
 */
public final class Decomposition {
  private final double[] seasonal;
  private final double[] trend;
  private final double[] residual;

  public Decomposition(double[] seasonal, double[] trend, double[] residual) {
    checkNotNull(seasonal);
    checkNotNull(trend);
    checkNotNull(residual);
    checkArgument(seasonal.length == trend.length && trend.length == residual.length,
        "Components differ in length: %s, %s, %s", seasonal.length, trend.length,
        residual.length);
    this.seasonal = seasonal.clone();
    this.trend = trend.clone();
    this.residual = residual.clone();
  }

  public double[] getSeasonal() {
    return seasonal.clone();
  }

  public double[] getTrend() {
    return trend.clone();
  }

  public double[] getResidual() {
    return residual.clone();
  }

  public int size() {
    return seasonal.length;
  }
}
