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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Lays the neighbours of a pixel out as a 3×3 grid.
 * <p/>
 * A direction without a neighbour is filled with the centre pixel. At the few face corners with only seven
 * neighbours this repeats the centre tile in the grid, which callers accept in preference to a hole.
 */
public class GridBuilder {
  private static final Logger LOG = LoggerFactory.getLogger(GridBuilder.class);

  private final NeighborResolver resolver;

  public GridBuilder() {
    this(new HealpixNeighborResolver());
  }

  public GridBuilder(NeighborResolver resolver) {
    this.resolver = Preconditions.checkNotNull(resolver, "A neighbour resolver is required");
  }

  public Grid3x3 build3x3(long centerPixel, int order) {
    NeighborSet neighbors = resolver.directionalNeighbors(centerPixel, order);

    long[][] cells = new long[Grid3x3.SIZE][Grid3x3.SIZE];
    cells[1][1] = centerPixel;
    for (Direction d : Direction.values()) {
      if (!neighbors.contains(d)) {
        LOG.debug("No {} neighbour for pixel {} at order {}, using the centre pixel", d.name(), centerPixel, order);
      }
      cells[d.getRow()][d.getCol()] = neighbors.getOrDefault(d, centerPixel);
    }

    Grid3x3 grid = new Grid3x3(order, cells);
    LOG.debug("Grid around pixel {}: {}", centerPixel, grid);
    return grid;
  }
}
