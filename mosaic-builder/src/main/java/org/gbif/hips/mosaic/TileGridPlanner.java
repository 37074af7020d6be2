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
import org.gbif.hips.common.healpix.Grid3x3;
import org.gbif.hips.common.healpix.GridBuilder;
import org.gbif.hips.common.healpix.Healpix;

import java.io.File;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * Plans the 3×3 block of HiPS tiles surrounding a target. Planning does no I/O, it only works out which tiles are
 * needed and where they live on the server and on disk.
 */
public class TileGridPlanner {
  private static final Logger LOG = LoggerFactory.getLogger(TileGridPlanner.class);

  public static final int DEFAULT_ORDER = 8;

  // HiPS servers bucket tiles into directories of this many pixels
  private static final long DIR_BUCKET = 10000;

  private final String baseUrl;
  private final String format;
  private final File outputDirectory;
  private final GridBuilder gridBuilder;

  public TileGridPlanner(String baseUrl, String format, File outputDirectory) {
    this(baseUrl, format, outputDirectory, new GridBuilder());
  }

  public TileGridPlanner(String baseUrl, String format, File outputDirectory, GridBuilder gridBuilder) {
    this.baseUrl = Preconditions.checkNotNull(baseUrl, "A base URL is required");
    this.format = Preconditions.checkNotNull(format, "A tile format is required");
    this.outputDirectory = Preconditions.checkNotNull(outputDirectory, "An output directory is required");
    this.gridBuilder = gridBuilder;
  }

  public TilePlan planGrid(SkyPosition target) {
    return planGrid(target, DEFAULT_ORDER);
  }

  /**
   * @throws IllegalArgumentException if the target cannot be located at the order
   */
  public TilePlan planGrid(SkyPosition target, int order) {
    long centerPixel = Healpix.coordinateToPixel(target, order);
    Preconditions.checkArgument(centerPixel >= 0, "Cannot locate %s at order %s", target, order);
    LOG.info("Planning tiles for {} at RA {} Dec {}, centre pixel {} at order {}", target.getName(),
             target.getRaDeg(), target.getDecDeg(), centerPixel, order);

    Grid3x3 grid = gridBuilder.build3x3(centerPixel, order);
    List<Tile> tiles = Lists.newArrayListWithCapacity(9);
    for (int row = 0; row < 3; row++) {
      for (int col = 0; col < 3; col++) {
        long pixel = grid.get(row, col);
        SkyPosition centre = Healpix.pixelToCoordinate(pixel, order);
        Tile tile = new Tile(col, row, order, pixel, centre, tileUrl(baseUrl, order, pixel, format),
                             localPath(outputDirectory, pixel, format));
        tiles.add(tile);

        LOG.debug("Tile ({},{}) pixel {} at RA {} Dec {} is {} arcsec from the target{}", col, row, pixel,
                  centre.getRaDeg(), centre.getDecDeg(), String.format("%.1f", AngularDistance.arcsec(target, centre)),
                  tile.isCenter() ? " [centre]" : "");
      }
    }
    return new TilePlan(target, centerPixel, grid, tiles);
  }

  /**
   * The HiPS address of a tile: {@code {baseUrl}/Norder{order}/Dir{dir}/Npix{pixel}.{ext}}.
   */
  public static String tileUrl(String baseUrl, int order, long pixel, String format) {
    return String.format("%s/Norder%d/Dir%d/Npix%d.%s", baseUrl, order, directory(pixel), pixel, format);
  }

  @VisibleForTesting
  static long directory(long pixel) {
    return (pixel / DIR_BUCKET) * DIR_BUCKET;
  }

  @VisibleForTesting
  static String localPath(File outputDirectory, long pixel, String format) {
    return new File(outputDirectory, String.format("tile_pixel%d.%s", pixel, format)).getPath();
  }
}
