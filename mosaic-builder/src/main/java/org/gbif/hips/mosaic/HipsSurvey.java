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
package org.gbif.hips.mosaic;

/**
 * Well known HiPS surveys served from the CDS mirror, with the image format of their tiles and the deepest order
 * they provide.
 */
public enum HipsSurvey {
  DSS2_COLOR ("DSS2 Color", "http://alasky.u-strasbg.fr/DSS/DSSColor", "jpg", 11),
  DSS2_RED ("DSS2 Red", "http://alasky.u-strasbg.fr/DSS/DSS2-red", "jpg", 11),
  TWOMASS_COLOR ("2MASS Color", "http://alasky.u-strasbg.fr/2MASS/Color", "jpg", 9),
  TWOMASS_J ("2MASS J", "http://alasky.u-strasbg.fr/2MASS/J", "jpg", 9),
  GAIA_DR3 ("Gaia DR3", "http://alasky.u-strasbg.fr/Gaia/Gaia-DR3", "png", 13),
  SDSS_DR12 ("SDSS DR12", "http://alasky.u-strasbg.fr/SDSS/DR12/color", "jpg", 12),
  MELLINGER ("Mellinger", "http://alasky.u-strasbg.fr/Mellinger/Mellinger_color", "jpg", 8);

  private final String label;
  private final String baseUrl;
  private final String format;
  private final int maxOrder;

  HipsSurvey(String label, String baseUrl, String format, int maxOrder) {
    this.label = label;
    this.baseUrl = baseUrl;
    this.format = format;
    this.maxOrder = maxOrder;
  }

  public String getLabel() {
    return label;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public String getFormat() {
    return format;
  }

  public int getMaxOrder() {
    return maxOrder;
  }

  public boolean supportsOrder(int order) {
    return order >= 0 && order <= maxOrder;
  }

  @Override
  public String toString() {
    return String.format("%s (%s tiles to order %d)", label, format, maxOrder);
  }
}
