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

package com.tsalgebra.util;

import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.TimeZone;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Utilities for converting millisecond timestamps to java {@link Date}s.
 */
public final class DateUtils {

  private static final String DISPLAY_PATTERN = "yyyy-MM-dd HH:mm:ss";

  /**
   * Converts milliseconds since the epoch to whole seconds, rounding towards negative infinity.
   */
  public static long toUnixTime(long millisSinceEpoch) {
    return Math.floorDiv(millisSinceEpoch, TimeUnit.SECONDS.toMillis(1));
  }

  /**
   * Converts a millisecond timestamp to a date with the sub-second part dropped.
   *
   * @param millisSinceEpoch The timestamp.
   * @return The date at the start of the timestamp's second.
   */
  public static Date toDate(long millisSinceEpoch) {
    return new Date(TimeUnit.SECONDS.toMillis(toUnixTime(millisSinceEpoch)));
  }

  /**
   * Formats a date as {@code yyyy-MM-dd HH:mm:ss} in the given time zone.
   */
  public static String format(Date date, TimeZone timeZone) {
    checkNotNull(date);
    checkNotNull(timeZone);
    SimpleDateFormat format = new SimpleDateFormat(DISPLAY_PATTERN);
    format.setTimeZone(timeZone);
    return format.format(date);
  }

  private DateUtils() {
    // utility
  }
}
