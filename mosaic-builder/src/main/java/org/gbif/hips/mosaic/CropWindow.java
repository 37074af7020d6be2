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

import java.io.Serializable;

import com.google.common.base.Preconditions;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A square window within a raster.
 */
@Data
@AllArgsConstructor
public class CropWindow implements Serializable {
  private static final long serialVersionUID = -3587203716591290431L;

  private final int x;
  private final int y;
  private final int size;

  /**
   * Centres a square window of the requested size on a point, shrinking it to fit a smaller raster and sliding it
   * back inside the raster where it would cross an edge. The window is never scaled or padded, so the point is only
   * off centre when it lies within half a window of the raster's edge.
   *
   * @param width raster width
   * @param height raster height
   * @param center the point to centre on, which must lie within the raster
   * @param requestedSize the preferred edge length
   */
  public static CropWindow centeredOn(int width, int height, RasterPoint center, int requestedSize) {
    Preconditions.checkArgument(width > 0 && height > 0, "Raster must not be empty");
    Preconditions.checkArgument(requestedSize > 0, "Crop size must be positive");
    int size = Math.min(requestedSize, Math.min(width, height));
    int x = clamp(center.getX() - size / 2, 0, width - size);
    int y = clamp(center.getY() - size / 2, 0, height - size);
    return new CropWindow(x, y, size);
  }

  static int clamp(int value, int min, int max) {
    return Math.max(min, Math.min(max, value));
  }

  public boolean contains(RasterPoint p) {
    return p.getX() >= x && p.getX() < x + size && p.getY() >= y && p.getY() < y + size;
  }

  /**
   * @return the point in the coordinates of the cropped raster
   */
  public RasterPoint toLocal(RasterPoint p) {
    return new RasterPoint(p.getX() - x, p.getY() - y);
  }
}
