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

import org.junit.Test;

import com.google.common.base.Strings;

import static org.junit.Assert.*;

public class CoordinateParserTest {
  private static final double EPSILON = 1e-6;

  @Test
  public void testDecimalRa() {
    assertEquals(83.8221, CoordinateParser.parseRa("83.8221"), EPSILON);
    assertEquals(202.4696, CoordinateParser.parseRa(" 202.4696 "), EPSILON);
    // small plain numbers are hours
    assertEquals(160.2705, CoordinateParser.parseRa("10.6847"), EPSILON);
    assertEquals(0.0, CoordinateParser.parseRa("24"), EPSILON);
  }

  @Test
  public void testSexagesimalRa() {
    double m31 = (42 / 60.0 + 44.3 / 3600.0) * 15.0;
    assertEquals(m31, CoordinateParser.parseRa("00:42:44.3"), EPSILON);
    assertEquals(m31, CoordinateParser.parseRa("0h42m44.3s"), EPSILON);
    assertEquals(m31, CoordinateParser.parseRa("0h 42m 44.3s"), EPSILON);
    assertEquals(15.0 * 5.5, CoordinateParser.parseRa("5:30"), EPSILON);
  }

  @Test
  public void testDegreeMarkedRa() {
    assertEquals(10.5, CoordinateParser.parseRa("10d30m"), EPSILON);
    assertEquals(12.25, CoordinateParser.parseRa("12°15'"), EPSILON);
  }

  @Test
  public void testDec() {
    assertEquals(41.269167, CoordinateParser.parseDec("+41:16:09"), EPSILON);
    assertEquals(-(5 + 23 / 60.0 + 28 / 3600.0), CoordinateParser.parseDec("-5d23m28s"), EPSILON);
    assertEquals(-0.5, CoordinateParser.parseDec("-00:30:00"), EPSILON);
    assertEquals(-16.7161, CoordinateParser.parseDec("-16.7161"), EPSILON);
    assertEquals(89.2641, CoordinateParser.parseDec("89.2641"), EPSILON);
  }

  @Test
  public void testMalformedIsPermissive() {
    assertEquals(0.0, CoordinateParser.parseDec("abc"), EPSILON);
    assertEquals(0.0, CoordinateParser.parseRa(""), EPSILON);
    assertEquals(0.0, CoordinateParser.parseRa(null), EPSILON);
    assertEquals(12.5, CoordinateParser.parseDec("12.5xyz"), EPSILON);
    assertEquals(187.5, CoordinateParser.parseRa("12.5xyz"), EPSILON);
    assertEquals(-3.0, CoordinateParser.parseDec("-3:zz"), EPSILON);
  }

  @Test
  public void testNonFiniteTextIsZero() {
    SkyPosition p = CoordinateParser.parse("NaN", "Infinity");
    assertEquals(0.0, p.getRaDeg(), 0.0);
    assertEquals(0.0, p.getDecDeg(), 0.0);

    p = CoordinateParser.parse("1e400", "-1e400");
    assertEquals(0.0, p.getRaDeg(), 0.0);
    assertEquals(0.0, p.getDecDeg(), 0.0);

    assertEquals(0.0, CoordinateParser.parseDec("-Infinity"), 0.0);
    assertEquals(0.0, CoordinateParser.parseRa(Strings.repeat("9", 400) + "h"), 0.0);
    assertEquals(0.0, CoordinateParser.leadingNumber("NaN"), 0.0);
    assertEquals(0.0, CoordinateParser.leadingNumber("1e400 degrees"), 0.0);
    assertEquals(2.5, CoordinateParser.leadingNumber("2.5e"), EPSILON);
  }

  @Test
  public void testLeadingNumber() {
    assertEquals(1.5, CoordinateParser.leadingNumber("1.5"), EPSILON);
    assertEquals(-2.0, CoordinateParser.leadingNumber("-2 degrees"), EPSILON);
    assertEquals(0.0, CoordinateParser.leadingNumber("none"), EPSILON);
  }

  @Test
  public void testNormaliseRa() {
    assertEquals(0.0, CoordinateParser.normaliseRa(360.0), EPSILON);
    assertEquals(350.0, CoordinateParser.normaliseRa(-10.0), EPSILON);
    assertEquals(10.0, CoordinateParser.normaliseRa(370.0), EPSILON);
  }

  @Test
  public void testParse() {
    SkyPosition p = CoordinateParser.parse("00:42:44.3", "+41:16:09", "M31");
    assertEquals("M31", p.getName());
    assertEquals(CoordinateParser.DEFAULT_DESCRIPTION, p.getDescription());
    assertEquals(41.269167, p.getDecDeg(), EPSILON);

    SkyPosition unnamed = CoordinateParser.parse("100", "-20");
    assertEquals(CoordinateParser.DEFAULT_NAME, unnamed.getName());
    assertEquals(100.0, unnamed.getRaDeg(), EPSILON);
    assertEquals(-20.0, unnamed.getDecDeg(), EPSILON);
  }
}
