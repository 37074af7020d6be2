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

import java.awt.Color;
import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;

import org.junit.Test;

import static org.junit.Assert.*;

public class TileTest {

  private static Tile tile() {
    return new Tile(1, 1, 8, 42, SkyPosition.of(10, 20, "HEALPix_42"), "url", "tiles/tile_pixel42.jpg");
  }

  @Test
  public void testDownloadedFollowsImage() {
    Tile tile = tile();
    assertFalse(tile.isDownloaded());
    assertFalse(tile.hasData());
    assertEquals("0x0", tile.imageSize());

    tile.setImage(TestImages.flat(16, Color.RED));
    assertTrue(tile.isDownloaded());
    assertEquals("16x16", tile.imageSize());

    tile.setImage(null);
    assertFalse(tile.isDownloaded());
    assertFalse(tile.hasData());
  }

  @Test
  public void testStateOnlyThroughSetImage() {
    // no public constructor may take the image or the downloaded flag
    for (Constructor<?> c : Tile.class.getDeclaredConstructors()) {
      if (Modifier.isPublic(c.getModifiers())) {
        assertEquals(7, c.getParameterCount());
      }
    }
  }
}
