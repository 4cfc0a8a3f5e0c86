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
 * The forecasting models a {@link Forecaster} can be asked to fit.
 */
public enum ForecastMethod {
  /**
   * Automatically selected autoregressive integrated moving average model.
   */
  ARIMA("arima"),

  /**
   * Exponential smoothing state space model.
   */
  ETS("ets");

  private final String name;

  ForecastMethod(String name) {
    this.name = name;
  }

  /**
   * Returns the lower case name of the method, as accepted by {@link #fromName(String)}.
   */
  public String getName() {
    return name;
  }

  /**
   * Looks up a method by name, ignoring case.
   *
   * @param name The method name, {@code "arima"} or {@code "ets"}.
   * @return The matching method.
   * @throws IllegalArgumentException if the name is null or not a known method.
   */
  public static ForecastMethod fromName(@Nullable String name) {
    if (name != null) {
      for (ForecastMethod method : values()) {
        if (method.name.equalsIgnoreCase(name.trim())) {
          return method;
        }
      }
    }
    throw new IllegalArgumentException("Unknown forecast method: " + name);
  }
}
