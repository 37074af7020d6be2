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

import org.gbif.hips.common.coordinate.AngularDistance;
import org.gbif.hips.common.coordinate.SkyPosition;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

/**
 * Stitches the tiles of a plan into a single raster and crops it so the target coordinate is at the centre.
 * <p/>
 * Tiles are pasted at their grid cell without reprojection. The target is then located relative to the centre of
 * the tile nearest to it on the sky, treating the sky as flat over that short distance, and the crop window is
 * centred on the result.
 */
public class MosaicAssembler {
  private static final Logger LOG = LoggerFactory.getLogger(MosaicAssembler.class);

  public static final int DEFAULT_TILE_SIZE = 512;
  public static final int DEFAULT_CROP_SIZE = 1200;
  public static final double DEFAULT_ARCSEC_PER_PIXEL = 1.61;

  private final int tileSize;
  private final int cropSize;
  private final double arcsecPerPixel;

  public MosaicAssembler() {
    this(DEFAULT_TILE_SIZE, DEFAULT_CROP_SIZE, DEFAULT_ARCSEC_PER_PIXEL);
  }

  public MosaicAssembler(int tileSize, int cropSize, double arcsecPerPixel) {
    Preconditions.checkArgument(tileSize > 0, "Tile size must be positive");
    Preconditions.checkArgument(cropSize > 0, "Crop size must be positive");
    Preconditions.checkArgument(arcsecPerPixel > 0, "Pixel scale must be positive");
    this.tileSize = tileSize;
    this.cropSize = cropSize;
    this.arcsecPerPixel = arcsecPerPixel;
  }

  public Optional<Mosaic> assemble(TilePlan plan) {
    return assemble(plan.getTiles(), plan.getTarget());
  }

  /**
   * @return the mosaic, or empty if none of the tiles has any data
   */
  public Optional<Mosaic> assemble(List<Tile> tiles, SkyPosition target) {
    Preconditions.checkArgument(!tiles.isEmpty(), "No tiles to assemble");
    int withData = (int) tiles.stream().filter(Tile::hasData).count();
    if (withData == 0) {
      LOG.warn("No tile data for {}, abandoning the mosaic", target.getName());
      return Optional.empty();
    }
    if (withData < tiles.size()) {
      LOG.warn("Only {} of {} tiles available for {}, the mosaic will have gaps", withData, tiles.size(),
               target.getName());
    }

    BufferedImage raw = compose(tiles);
    Tile anchor = containingTile(tiles, target);
    RasterPoint targetPixel = targetPixel(anchor, target);
    CropWindow window = CropWindow.centeredOn(raw.getWidth(), raw.getHeight(), targetPixel, cropSize);
    LOG.debug("Target {} at raw pixel {} anchored on tile ({},{}), cropping {}", target.getName(), targetPixel,
              anchor.getGridX(), anchor.getGridY(), window);
    if (!window.toLocal(targetPixel).equals(new RasterPoint(window.getSize() / 2, window.getSize() / 2))) {
      LOG.info("Target {} is near the mosaic edge and is off centre at {}", target.getName(),
               window.toLocal(targetPixel));
    }

    return Optional.of(new Mosaic(target, crop(raw, window), raw.getWidth(), raw.getHeight(), targetPixel, window,
                                  anchor, withData));
  }

  /**
   * Pastes every tile with data into its grid cell of a black canvas three tiles square.
   */
  @VisibleForTesting
  BufferedImage compose(List<Tile> tiles) {
    BufferedImage canvas = new BufferedImage(3 * tileSize, 3 * tileSize, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = canvas.createGraphics();
    try {
      for (Tile tile : tiles) {
        if (!tile.hasData()) {
          continue;
        }
        BufferedImage image = tile.getImage();
        if (image.getWidth() != tileSize || image.getHeight() != tileSize) {
          LOG.warn("Tile pixel {} is {} rather than {}x{}", tile.getPixel(), tile.imageSize(), tileSize, tileSize);
        }
        g.drawImage(image, tile.getGridX() * tileSize, tile.getGridY() * tileSize, null);
      }
    } finally {
      g.dispose();
    }
    return canvas;
  }

  /**
   * @return the tile whose centre is nearest the target, the first one listed when several are equally near
   */
  public static Tile containingTile(List<Tile> tiles, SkyPosition target) {
    Tile nearest = null;
    double best = Double.MAX_VALUE;
    for (Tile tile : tiles) {
      double d = AngularDistance.haversine(target, tile.getSkyCoordinates());
      if (d < best) {
        best = d;
        nearest = tile;
      }
    }
    return nearest;
  }

  /**
   * Locates the target in the uncropped mosaic from its offset to the centre of the anchor tile, clamped to lie
   * within the mosaic.
   */
  public RasterPoint targetPixel(Tile anchor, SkyPosition target) {
    double[] offset = offsetPixels(anchor.getSkyCoordinates(), target);
    int half = tileSize / 2;
    long x = anchor.getGridX() * tileSize + half + roundHalfAwayFromZero(offset[0]);
    long y = anchor.getGridY() * tileSize + half + roundHalfAwayFromZero(offset[1]);
    int max = 3 * tileSize - 1;
    return new RasterPoint((int) Math.max(0, Math.min(max, x)), (int) Math.max(0, Math.min(max, y)));
  }

  /**
   * The offset of the target from a tile centre in image pixels, with x increasing with right ascension and y
   * increasing southwards. The right ascension offset is taken the short way round and scaled by the cosine of the
   * target's declination.
   *
   * @return x and y offsets
   */
  public double[] offsetPixels(SkyPosition tileCentre, SkyPosition target) {
    double dRa = target.getRaDeg() - tileCentre.getRaDeg();
    if (dRa > 180.0) {
      dRa -= 360.0;
    } else if (dRa < -180.0) {
      dRa += 360.0;
    }
    double offsetRaArcsec = dRa * 3600.0 * Math.cos(target.decRadians());
    double offsetDecArcsec = (target.getDecDeg() - tileCentre.getDecDeg()) * 3600.0;
    return new double[] {offsetRaArcsec / arcsecPerPixel, -offsetDecArcsec / arcsecPerPixel};
  }

  /**
   * Copies the window out of the raster so the result does not share its data.
   */
  @VisibleForTesting
  static BufferedImage crop(BufferedImage raw, CropWindow window) {
    BufferedImage out = new BufferedImage(window.getSize(), window.getSize(), BufferedImage.TYPE_INT_RGB);
    Graphics2D g = out.createGraphics();
    try {
      g.drawImage(raw.getSubimage(window.getX(), window.getY(), window.getSize(), window.getSize()), 0, 0, null);
    } finally {
      g.dispose();
    }
    return out;
  }

  @VisibleForTesting
  static long roundHalfAwayFromZero(double v) {
    return v < 0 ? -Math.round(-v) : Math.round(v);
  }

  public int getTileSize() {
    return tileSize;
  }

  public int getCropSize() {
    return cropSize;
  }

  public double getArcsecPerPixel() {
    return arcsecPerPixel;
  }
}
