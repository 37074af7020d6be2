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
import java.io.File;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * One cell of a planned 3×3 tile grid. The position and addresses are fixed when planned, the image is set once
 * the tile has been fetched or found in the local cache.
 */
@Getter
@ToString(exclude = "image")
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Tile {
  private final int gridX;
  private final int gridY;
  private final int order;
  private final long pixel;
  private final SkyPosition skyCoordinates;
  private final String sourceUrl;
  private final String localPath;
  private BufferedImage image;
  private boolean downloaded;

  public Tile(int gridX, int gridY, int order, long pixel, SkyPosition skyCoordinates, String sourceUrl,
              String localPath) {
    this(gridX, gridY, order, pixel, skyCoordinates, sourceUrl, localPath, null, false);
  }

  public File getLocalFile() {
    return new File(localPath);
  }

  public boolean hasData() {
    return image != null;
  }

  /**
   * Sets the image of the tile, marking it as downloaded when there is one.
   */
  public void setImage(BufferedImage image) {
    this.image = image;
    this.downloaded = image != null;
  }

  /**
   * @return the image size as WxH, or 0x0 when there is no image
   */
  public String imageSize() {
    return image == null ? "0x0" : image.getWidth() + "x" + image.getHeight();
  }

  public boolean isCenter() {
    return gridX == 1 && gridY == 1;
  }
}
