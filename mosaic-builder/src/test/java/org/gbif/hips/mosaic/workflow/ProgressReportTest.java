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
package org.gbif.hips.mosaic.workflow;

import org.gbif.hips.common.coordinate.SkyPosition;
import org.gbif.hips.mosaic.TestImages;
import org.gbif.hips.mosaic.Tile;
import org.gbif.hips.mosaic.TilePlan;
import org.gbif.hips.mosaic.TileGridPlanner;

import java.awt.Color;
import java.io.File;
import java.io.StringWriter;
import java.time.LocalDateTime;

import org.junit.Test;

import static org.junit.Assert.*;

public class ProgressReportTest {

  @Test
  public void testSafeName() {
    assertEquals("m31_andromeda", ProgressReport.safeName("M31 (Andromeda)"));
    assertEquals("custom_target", ProgressReport.safeName("Custom Target"));
    assertEquals(new File("out", "m42_centered_report.txt"), ProgressReport.reportFile(new File("out"), "M42"));
    assertEquals(new File("out", "m42_centered_mosaic.png"), MosaicWriter.mosaicFile(new File("out"), "M42"));
  }

  @Test
  public void testRow() {
    Tile tile = new Tile(2, 0, 8, 12345, SkyPosition.of(10.5, -20.25, "HEALPix_12345"), "url", "tiles/t.jpg");
    assertEquals("2,0,12345,10.500000,-20.250000,NO,0x0,tiles/t.jpg", ProgressReport.row(tile));
    tile.setImage(TestImages.flat(512, Color.BLACK));
    assertEquals("2,0,12345,10.500000,-20.250000,YES,512x512,tiles/t.jpg", ProgressReport.row(tile));
  }

  @Test
  public void testReport() throws Exception {
    SkyPosition m31 = SkyPosition.of(10.6847, 41.2687, "M31");
    TilePlan plan = new TileGridPlanner("http://localhost/hips", "jpg", new File("tiles")).planGrid(m31);
    TestImages.fill(plan.getTiles(), 512, Color.GRAY);
    plan.centerTile().setImage(null);

    StringWriter out = new StringWriter();
    ProgressReport.write(out, m31, plan.getTiles(), LocalDateTime.of(2024, 1, 2, 3, 4, 5));
    String[] lines = out.toString().split("\\R");

    assertEquals("M31 Coordinate-Centered Mosaic Report", lines[0]);
    assertEquals("Generated: 2024-01-02T03:04:05", lines[1]);
    assertTrue(out.toString().contains("Target coordinates: RA 10.684700°, Dec 41.268700°"));
    assertTrue(out.toString().contains("Custom Target: M31"));

    int header = -1;
    for (int i = 0; i < lines.length; i++) {
      if (lines[i].equals(ProgressReport.HEADER)) {
        header = i;
      }
    }
    assertTrue(header > 0);
    assertEquals(header + 10, lines.length);
    assertTrue(lines[header + 5].startsWith("1,1," + plan.centerTile().getPixel() + ","));
    assertTrue(lines[header + 5].contains(",NO,0x0,"));
    assertTrue(lines[header + 1].contains(",YES,512x512,"));
  }
}
