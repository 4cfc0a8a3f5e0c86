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

import javax.annotation.Nullable;

/**
 * A statistical forecasting service.
 */
public interface Forecaster {

  /**
   * Fits a model to the values and forecasts past their end.
   *
   * @param values The observed values, oldest first.
   * @param frequency Number of observations per seasonal period, if known.
   * @param method The model to fit.
   * @param horizon Number of steps to forecast.
   * @return {@code horizon} point forecasts (the forecast mean), nearest first.
   * @throws ModelException if the model cannot be fit.
   */
  double[] forecast(double[] values, @Nullable Integer frequency, ForecastMethod method,
      int horizon) throws ModelException;
}
