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

import static java.lang.Math.atan2;
import static java.lang.Math.cos;
import static java.lang.Math.sin;
import static java.lang.Math.sqrt;

/**
 * Great circle distances between sky positions.
 */
public class AngularDistance {

  private AngularDistance() {}

  /**
   * Haversine distance between two positions.
   * @return the angular separation in radians
   */
  public static double haversine(SkyPosition p1, SkyPosition p2) {
    double dec1 = p1.decRadians();
    double dec2 = p2.decRadians();
    double dRa = p2.raRadians() - p1.raRadians();
    double dDec = dec2 - dec1;

    double a = sin(dDec / 2) * sin(dDec / 2) + cos(dec1) * cos(dec2) * sin(dRa / 2) * sin(dRa / 2);
    return 2 * atan2(sqrt(a), sqrt(1 - a));
  }

  /**
   * Haversine distance between two positions in arc seconds.
   */
  public static double arcsec(SkyPosition p1, SkyPosition p2) {
    return Math.toDegrees(haversine(p1, p2)) * 3600.0;
  }
}
