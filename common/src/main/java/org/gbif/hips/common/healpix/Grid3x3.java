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

import java.io.Serializable;
import java.util.Arrays;

import com.google.common.base.Preconditions;

/**
 * Nine pixels of one order arranged as they lie on the sky: row 0 is north, column 0 is west and the centre cell
 * holds the pixel the grid was built around.
 */
public class Grid3x3 implements Serializable {
  private static final long serialVersionUID = -7630251874937751209L;
  public static final int SIZE = 3;

  private final int order;
  private final long[][] pixels;

  public Grid3x3(int order, long[][] pixels) {
    Preconditions.checkArgument(pixels.length == SIZE, "A grid needs 3 rows");
    this.order = order;
    this.pixels = new long[SIZE][];
    for (int row = 0; row < SIZE; row++) {
      Preconditions.checkArgument(pixels[row].length == SIZE, "A grid needs 3 columns");
      this.pixels[row] = Arrays.copyOf(pixels[row], SIZE);
    }
  }

  public int getOrder() {
    return order;
  }

  public long get(int row, int col) {
    return pixels[row][col];
  }

  public long center() {
    return pixels[1][1];
  }

  /**
   * @return a copy of the cells
   */
  public long[][] toArray() {
    long[][] copy = new long[SIZE][];
    for (int row = 0; row < SIZE; row++) {
      copy[row] = Arrays.copyOf(pixels[row], SIZE);
    }
    return copy;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Grid3x3 that = (Grid3x3) o;
    return order == that.order && Arrays.deepEquals(pixels, that.pixels);
  }

  @Override
  public int hashCode() {
    return 31 * order + Arrays.deepHashCode(pixels);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Order ").append(order);
    for (long[] row : pixels) {
      sb.append(String.format("%n  %12d %12d %12d", row[0], row[1], row[2]));
    }
    return sb.toString();
  }
}
