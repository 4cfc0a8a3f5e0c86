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

package com.tsalgebra.inject;

import com.google.inject.AbstractModule;
import com.google.inject.Singleton;

import com.tsalgebra.forecast.Decomposer;
import com.tsalgebra.forecast.Forecaster;
import com.tsalgebra.numeric.LeastSquaresFitter;
import com.tsalgebra.numeric.NumericFitter;

/**
 * Binding module for the collaborators series operations delegate to.
 *
 * Bindings provided by this module:
 * <ul>
 *   <li>{@code NumericFitter} - least squares fitting and convolution.
 * </ul>
 *
 * Bindings required by this module:
 * <ul>
 *   <li>{@code Forecaster} - statistical forecasting service.
 *   <li>{@code Decomposer} - seasonal decomposition service.
 * </ul>
 */
public class TimeSeriesModule extends AbstractModule {

  @Override
  protected void configure() {
    requireBinding(Forecaster.class);
    requireBinding(Decomposer.class);

    bind(NumericFitter.class).to(LeastSquaresFitter.class).in(Singleton.class);
  }
}
