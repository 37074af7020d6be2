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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.primitives.Doubles;

/**
 * Parses free text right ascension and declination into a {@link SkyPosition}.
 * <p/>
 * Supported forms are decimal numbers, colon separated sexagesimal ({@code 00:42:44.3}, {@code +41:16:09}) and letter
 * suffixed sexagesimal ({@code 0h42m44.3s}, {@code -5d23m28s}).
 * <p/>
 * Parsing never throws. Text that cannot be read is parsed as far as a leading number goes, or as 0.0 when there is
 * no number at all, and a warning is logged.
 */
public class CoordinateParser {
  private static final Logger LOG = LoggerFactory.getLogger(CoordinateParser.class);

  public static final String DEFAULT_NAME = "Custom Target";
  public static final String DEFAULT_DESCRIPTION = "User-defined coordinates";

  private static final Pattern COLON = Pattern.compile(":");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern HMS = Pattern.compile(
    "(\\d+(?:\\.\\d+)?)h(?:(\\d+(?:\\.\\d+)?)m)?(?:(\\d+(?:\\.\\d+)?)s)?", Pattern.CASE_INSENSITIVE);
  private static final Pattern DMS = Pattern.compile(
    "(\\d+(?:\\.\\d+)?)[d°](?:(\\d+(?:\\.\\d+)?)['m])?(?:(\\d+(?:\\.\\d+)?)(?:s|\"|''))?", Pattern.CASE_INSENSITIVE);
  private static final Pattern LEADING_NUMBER = Pattern.compile("^[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");

  // a plain number up to this value is read as hours of right ascension
  private static final double MAX_RA_HOURS = 24.0;

  private CoordinateParser() {}

  public static SkyPosition parse(String raText, String decText) {
    return parse(raText, decText, DEFAULT_NAME);
  }

  public static SkyPosition parse(String raText, String decText, String name) {
    return new SkyPosition(parseRa(raText), parseDec(decText), Strings.isNullOrEmpty(name) ? DEFAULT_NAME : name,
                           DEFAULT_DESCRIPTION);
  }

  /**
   * @return the right ascension in degrees, normalised into [0,360)
   */
  public static double parseRa(String text) {
    return finite(raDegrees(Strings.nullToEmpty(text).trim()), text);
  }

  private static double raDegrees(String clean) {
    if (clean.contains(":")) {
      double[] parts = sexagesimalParts(COLON.split(clean), clean);
      if (parts != null) {
        return normaliseRa(toDecimal(parts) * 15.0);
      }
    }

    String compact = WHITESPACE.matcher(clean).replaceAll("");
    if (compact.toLowerCase().contains("h")) {
      Matcher m = HMS.matcher(compact);
      if (m.find()) {
        return normaliseRa(toDecimal(groups(m)) * 15.0);
      }
    }

    // an explicit degree marker means the value is not in hours
    if (compact.toLowerCase().contains("d") || compact.contains("°")) {
      Matcher m = DMS.matcher(compact);
      if (m.find()) {
        return normaliseRa(toDecimal(groups(m)));
      }
    }

    double value = leadingNumber(clean);
    return normaliseRa(value <= MAX_RA_HOURS ? value * 15.0 : value);
  }

  /**
   * @return the declination in degrees
   */
  public static double parseDec(String text) {
    String clean = Strings.nullToEmpty(text).trim();
    boolean negative = clean.startsWith("-");
    if (negative || clean.startsWith("+")) {
      clean = clean.substring(1).trim();
    }

    double magnitude = finite(decMagnitude(clean), text);
    return negative ? -magnitude : magnitude;
  }

  private static double decMagnitude(String clean) {
    if (clean.contains(":")) {
      double[] parts = sexagesimalParts(COLON.split(clean), clean);
      if (parts != null) {
        return toDecimal(parts);
      }
    }

    String compact = WHITESPACE.matcher(clean).replaceAll("");
    if (compact.toLowerCase().contains("d") || compact.contains("°")) {
      Matcher m = DMS.matcher(compact);
      if (m.find()) {
        return toDecimal(groups(m));
      }
    }

    return leadingNumber(clean);
  }

  /**
   * Reads the whole field as a number when possible, otherwise as much of a leading number as there is. Values that
   * are not finite, such as NaN or an overflowing exponent, are never returned.
   * @return the parsed value or 0.0 if the text holds no finite number at all
   */
  @VisibleForTesting
  static double leadingNumber(String text) {
    String clean = Strings.nullToEmpty(text).trim();
    Double whole = Doubles.tryParse(clean);
    if (whole != null && Double.isFinite(whole)) {
      return whole;
    }
    Matcher m = LEADING_NUMBER.matcher(clean);
    if (m.find()) {
      double leading = Double.parseDouble(m.group());
      if (Double.isFinite(leading)) {
        LOG.warn("Malformed coordinate [{}], using leading number {}", text, m.group());
        return leading;
      }
    }
    LOG.warn("Malformed coordinate [{}], using 0.0", text);
    return 0.0;
  }

  private static double finite(double value, String text) {
    if (Double.isFinite(value)) {
      return value;
    }
    LOG.warn("Coordinate [{}] is out of range, using 0.0", text);
    return 0.0;
  }

  /**
   * @return hours (or degrees), minutes and seconds, or null if there are fewer than two fields
   */
  private static double[] sexagesimalParts(String[] fields, String source) {
    if (fields.length < 2) {
      LOG.warn("Incomplete sexagesimal coordinate [{}]", source);
      return null;
    }
    return new double[] {
      leadingNumber(fields[0]),
      leadingNumber(fields[1]),
      fields.length > 2 ? leadingNumber(fields[2]) : 0.0
    };
  }

  private static double[] groups(Matcher m) {
    return new double[] {
      Double.parseDouble(m.group(1)),
      m.group(2) == null ? 0.0 : Double.parseDouble(m.group(2)),
      m.group(3) == null ? 0.0 : Double.parseDouble(m.group(3))
    };
  }

  private static double toDecimal(double[] parts) {
    return parts[0] + parts[1] / 60.0 + parts[2] / 3600.0;
  }

  @VisibleForTesting
  static double normaliseRa(double raDeg) {
    double ra = raDeg % 360.0;
    return ra < 0 ? ra + 360.0 : ra;
  }
}
