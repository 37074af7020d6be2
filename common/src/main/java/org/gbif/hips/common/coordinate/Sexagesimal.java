/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.gbif.hips.common.coordinate;

import java.util.Locale;

/**
 * Formats decimal degrees in the letter suffixed sexagesimal form read by {@link CoordinateParser}.
 */
public class Sexagesimal {
  // values are rounded to tenths of a second before being split so seconds never print as 60.0
  private static final long TENTHS_PER_MINUTE = 600;
  private static final long TENTHS_PER_UNIT = 36000;

  private Sexagesimal() {}

  /**
   * Right ascension as hours, minutes and seconds, e.g. {@code 00h42m44.3s}.
   */
  public static String toHms(double raDeg) {
    long tenths = Math.round(raDeg / 15.0 * TENTHS_PER_UNIT) % (24 * TENTHS_PER_UNIT);
    if (tenths < 0) {
      tenths += 24 * TENTHS_PER_UNIT;
    }
    return String.format(Locale.ROOT, "%02dh%s", tenths / TENTHS_PER_UNIT, minutesAndSeconds(tenths));
  }

  /**
   * Declination as signed degrees, minutes and seconds, e.g. {@code +41d16m7.3s}.
   */
  public static String toDms(double decDeg) {
    long tenths = Math.round(Math.abs(decDeg) * TENTHS_PER_UNIT);
    return String.format(Locale.ROOT, "%s%02dd%s", decDeg < 0 ? "-" : "+", tenths / TENTHS_PER_UNIT,
                         minutesAndSeconds(tenths));
  }

  private static String minutesAndSeconds(long tenths) {
    long withinUnit = tenths % TENTHS_PER_UNIT;
    return String.format(Locale.ROOT, "%02dm%.1fs", withinUnit / TENTHS_PER_MINUTE,
                         (withinUnit % TENTHS_PER_MINUTE) / 10.0);
  }
}
