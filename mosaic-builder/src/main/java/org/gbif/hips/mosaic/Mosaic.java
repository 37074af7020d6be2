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

import org.gbif.hips.common.coordinate.SkyPosition;

import java.awt.image.BufferedImage;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A mosaic cropped so the target lies at its centre. The image is not modified after creation; overlays are drawn
 * on a copy when the mosaic is written.
 */
@Getter
@ToString(exclude = "image")
@AllArgsConstructor
public class Mosaic {
  private final SkyPosition target;
  private final BufferedImage image;
  private final int rawWidth;
  private final int rawHeight;
  // target location in the uncropped mosaic
  private final RasterPoint targetPixel;
  private final CropWindow crop;
  private final Tile anchorTile;
  private final int tilesUsed;

  public int getWidth() {
    return image.getWidth();
  }

  public int getHeight() {
    return image.getHeight();
  }

  /**
   * @return where the target lies in the cropped image
   */
  public RasterPoint targetInImage() {
    return crop.toLocal(targetPixel);
  }

  public boolean isPartial() {
    return tilesUsed < 9;
  }
}
