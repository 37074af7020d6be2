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

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.Test;

import static org.junit.Assert.*;

public class HealpixNeighborResolverTest {
  private static final Direction[] NATIVE_ORDER = {
    Direction.SW, Direction.W, Direction.NW, Direction.N, Direction.NE, Direction.E, Direction.SE, Direction.S
  };

  private final HealpixNeighborResolver resolver = new HealpixNeighborResolver();

  @Test
  public void testEquatorialDirectionsFollowNativeOrder() {
    long pixel = Healpix.coordinateToPixel(SkyPosition.of(100.0, 10.0, "equatorial"), 8);
    List<Neighbor> neighbors = resolver.neighbors(pixel, 8);
    assertEquals(8, neighbors.size());
    for (Neighbor n : neighbors) {
      assertEquals("Neighbour at native index " + n.getRawIndex(), NATIVE_ORDER[n.getRawIndex()], n.getDirection());
    }
  }

  @Test
  public void testM31HasAllDirections() {
    long pixel = Healpix.coordinateToPixel(SkyPosition.of(10.6847, 41.2687, "M31"), 8);
    NeighborSet set = resolver.directionalNeighbors(pixel, 8);
    assertEquals(8, set.size());
    assertEquals(pixel, set.getCenter());
    assertEquals(8, new HashSet<>(set.asMap().values()).size());
    for (Direction d : Direction.values()) {
      assertTrue("Missing " + d.name(), set.get(d).isPresent());
    }
  }

  @Test
  public void testMissingNeighbourIsOmitted() {
    List<Neighbor> neighbors = resolver.neighbors(1, 1);
    assertEquals(7, neighbors.size());
    for (Neighbor n : neighbors) {
      assertNotEquals(5, n.getRawIndex());
      assertTrue(n.getPixel() >= 0);
    }
    assertTrue(resolver.directionalNeighbors(1, 1).size() <= 7);
  }

  @Test
  public void testInvalidPixel() {
    assertTrue(resolver.neighbors(-5, 3).isEmpty());
    assertEquals(0, resolver.directionalNeighbors(Healpix.npix(3), 3).size());
  }

  @Test
  public void testDirectionAcrossZeroRa() {
    SkyPosition west = SkyPosition.of(359.9, 0.0, "west");
    SkyPosition east = SkyPosition.of(0.1, 0.0, "east");
    assertEquals(Direction.E, HealpixNeighborResolver.direction(west, east));
    assertEquals(Direction.W, HealpixNeighborResolver.direction(east, west));
  }

  @Test
  public void testWrap() {
    assertEquals(-0.2, HealpixNeighborResolver.wrap(359.8), 1e-9);
    assertEquals(0.2, HealpixNeighborResolver.wrap(-359.8), 1e-9);
    assertEquals(180.0, HealpixNeighborResolver.wrap(-180.0), 1e-9);
    assertEquals(45.0, HealpixNeighborResolver.wrap(45.0), 1e-9);
  }

  @Test
  public void testNeighbourNeverEqualsCentre() {
    int order = 6;
    for (long pixel = 0; pixel < Healpix.npix(order); pixel += 37) {
      Set<Long> pixels = new HashSet<>(resolver.directionalNeighbors(pixel, order).asMap().values());
      assertFalse(pixels.contains(pixel));
    }
  }
}
