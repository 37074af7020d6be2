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
import org.gbif.hips.common.healpix.Grid3x3;

import java.util.List;

import com.google.common.collect.ImmutableList;

import lombok.Getter;
import lombok.ToString;

/**
 * The nine tiles around a target, in row major order from the north west corner.
 */
@Getter
@ToString
public class TilePlan {
  private final SkyPosition target;
  private final long centerPixel;
  private final Grid3x3 grid;
  private final List<Tile> tiles;

  public TilePlan(SkyPosition target, long centerPixel, Grid3x3 grid, List<Tile> tiles) {
    this.target = target;
    this.centerPixel = centerPixel;
    this.grid = grid;
    this.tiles = ImmutableList.copyOf(tiles);
  }

  public int getOrder() {
    return grid.getOrder();
  }

  public Tile tileAt(int gridX, int gridY) {
    return tiles.get(gridY * 3 + gridX);
  }

  public Tile centerTile() {
    return tileAt(1, 1);
  }

  public int tilesWithData() {
    return (int) tiles.stream().filter(Tile::hasData).count();
  }
}
