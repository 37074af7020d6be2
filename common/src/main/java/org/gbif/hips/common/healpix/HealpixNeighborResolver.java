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

import org.gbif.hips.common.coordinate.SkyPosition;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;

/**
 * Resolves neighbours with the native HEALPix query and tags each with the compass direction of its centre as seen
 * from the centre of the queried pixel.
 * <p/>
 * The native neighbour order is relative to the axes of the base face, which are rotated against north and east
 * differently on each face, so the direction is inferred from the offset between pixel centres instead.
 */
public class HealpixNeighborResolver implements NeighborResolver {
  private static final Logger LOG = LoggerFactory.getLogger(HealpixNeighborResolver.class);

  /**
   * @return the neighbours in native order, omitting those that do not exist
   */
  public List<Neighbor> neighbors(long pixel, int order) {
    long[] raw = Healpix.neighbours(pixel, order);
    if (raw == null) {
      return ImmutableList.of();
    }
    SkyPosition center = Healpix.pixelToCoordinate(pixel, order);

    ImmutableList.Builder<Neighbor> result = ImmutableList.builder();
    for (int i = 0; i < raw.length; i++) {
      if (raw[i] < 0) {
        LOG.debug("Pixel {} at order {} has no neighbour at native index {}", pixel, order, i);
        continue;
      }
      SkyPosition neighbor = Healpix.pixelToCoordinate(raw[i], order);
      result.add(new Neighbor(raw[i], i, direction(center, neighbor)));
    }
    return result.build();
  }

  @Override
  public NeighborSet directionalNeighbors(long pixel, int order) {
    Map<Direction, Long> byDirection = new EnumMap<>(Direction.class);
    for (Neighbor n : neighbors(pixel, order)) {
      Long existing = byDirection.putIfAbsent(n.getDirection(), n.getPixel());
      if (existing != null) {
        LOG.debug("Pixels {} and {} both lie {} of {}, keeping {}", existing, n.getPixel(), n.getDirection().name(),
                  pixel, existing);
      }
    }
    return new NeighborSet(order, pixel, byDirection);
  }

  /**
   * The direction from one position to another, with the right ascension difference taken the short way round and
   * scaled by the cosine of the first position's declination.
   */
  @VisibleForTesting
  static Direction direction(SkyPosition from, SkyPosition to) {
    double dRa = wrap(to.getRaDeg() - from.getRaDeg()) * Math.cos(from.decRadians());
    double dDec = to.getDecDeg() - from.getDecDeg();
    return Direction.classify(dRa, dDec);
  }

  /**
   * Wraps a difference in degrees into (-180, 180].
   */
  @VisibleForTesting
  static double wrap(double deltaDeg) {
    double d = deltaDeg % 360.0;
    if (d > 180.0) {
      d -= 360.0;
    } else if (d <= -180.0) {
      d += 360.0;
    }
    return d;
  }
}
