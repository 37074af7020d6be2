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

import java.io.Serializable;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * An immutable equatorial position on the sky, in decimal degrees, with a name and free text description.
 * <p/>
 * Right ascension is expected in [0,360) and declination in [-90,90].
 */
@Data
@AllArgsConstructor
public class SkyPosition implements Serializable {
  private static final long serialVersionUID = -2301475518370651129L;

  /**
   * The position returned when a pixel cannot be converted to a coordinate. Callers must check for it with
   * {@link #isError()}, it is never signalled by an exception.
   */
  public static final SkyPosition ERROR = new SkyPosition(0, 0, "Error", "HEALPix conversion failed");

  private final double raDeg;
  private final double decDeg;
  private final String name;
  private final String description;

  public static SkyPosition of(double raDeg, double decDeg, String name) {
    return new SkyPosition(raDeg, decDeg, name, "");
  }

  public boolean isError() {
    return ERROR.equals(this);
  }

  public double raRadians() {
    return Math.toRadians(raDeg);
  }

  public double decRadians() {
    return Math.toRadians(decDeg);
  }
}
