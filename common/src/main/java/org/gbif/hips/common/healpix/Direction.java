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
package org.gbif.hips.common.healpix;

/**
 * Compass directions on the sky, with the cell each occupies in a 3×3 grid (row 0 north, column 0 west).
 */
public enum Direction {
  NW (0, 0),
  N (0, 1),
  NE (0, 2),
  W (1, 0),
  E (1, 2),
  SW (2, 0),
  S (2, 1),
  SE (2, 2);

  // one axis must exceed the other by this factor for the offset to count as purely vertical or horizontal
  static final double DOMINANCE = 2.0;

  private final int row;
  private final int col;

  Direction(int row, int col) {
    this.row = row;
    this.col = col;
  }

  public int getRow() {
    return row;
  }

  public int getCol() {
    return col;
  }

  /**
   * Classifies an angular offset from a pixel centre to a neighbour centre.
   * @param dRa offset in right ascension, already scaled by the cosine of the declination, positive to the east
   * @param dDec offset in declination, positive to the north
   */
  public static Direction classify(double dRa, double dDec) {
    double absRa = Math.abs(dRa);
    double absDec = Math.abs(dDec);
    if (absDec > DOMINANCE * absRa) {
      return dDec > 0 ? N : S;
    }
    if (absRa > DOMINANCE * absDec) {
      return dRa > 0 ? E : W;
    }
    if (dDec > 0) {
      return dRa > 0 ? NE : NW;
    }
    return dRa > 0 ? SE : SW;
  }

  @Override
  public String toString() {
    return String.format("%s at row %d column %d", this.name(), row, col);
  }
}
