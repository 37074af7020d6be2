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

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

import javax.imageio.ImageIO;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.beust.jcommander.JCommander;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

import static org.junit.Assert.*;

public class SurveyDownloaderTest {
  private static final double DELTA = 1e-9;

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private static DownloaderParams params(String... args) {
    DownloaderParams params = new DownloaderParams();
    JCommander.newBuilder().addObject(params).build().parse(args);
    return params;
  }

  @Test
  public void testGridPositions() {
    List<SkyPosition> grid = SurveyDownloader.gridPositions(202.47, 60.0, 3, 1.0);
    assertEquals(9, grid.size());
    assertEquals(202.47, grid.get(4).getRaDeg(), DELTA);
    assertEquals(60.0, grid.get(4).getDecDeg(), DELTA);
    assertEquals("grid_1_1", grid.get(4).getName());

    // a degree on the sky is two degrees of right ascension at dec 60
    assertEquals(200.47, grid.get(0).getRaDeg(), 1e-6);
    assertEquals(59.0, grid.get(0).getDecDeg(), DELTA);
    assertEquals(204.47, grid.get(8).getRaDeg(), 1e-6);
    assertEquals("grid_2_0", grid.get(2).getName());
  }

  @Test
  public void testGridEdges() {
    List<SkyPosition> wrapped = SurveyDownloader.gridPositions(0.5, 0.0, 3, 1.0);
    assertEquals(359.5, wrapped.get(0).getRaDeg(), 1e-9);
    assertEquals(1.5, wrapped.get(2).getRaDeg(), 1e-9);

    List<SkyPosition> polar = SurveyDownloader.gridPositions(37.95, 89.5, 3, 1.0);
    assertEquals(90.0, polar.get(8).getDecDeg(), DELTA);
    assertEquals(88.5, polar.get(0).getDecDeg(), DELTA);
  }

  @Test
  public void testQueue() {
    assertEquals(SurveyDownloader.TARGETS, SurveyDownloader.queue(params()));
    assertEquals(8, SurveyDownloader.queue(params("-mode", "targets")).size());

    List<SkyPosition> single = SurveyDownloader.queue(params("-mode", "single", "-ra", "202.47", "-dec", "47.2",
                                                             "-name", "M51"));
    assertEquals(ImmutableList.of(SkyPosition.of(202.47, 47.2, "M51")), single);

    assertEquals(25, SurveyDownloader.queue(params("-mode", "GRID", "-ra", "10", "-dec", "20", "-gridSize", "5"))
      .size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSingleNeedsCoordinates() {
    SurveyDownloader.queue(params("-mode", "single", "-ra", "202.47"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownMode() {
    SurveyDownloader.queue(params("-mode", "spiral"));
  }

  @Test
  public void testMetadata() {
    StringWriter out = new StringWriter();
    SurveyDownloader.writeMetadata(out, ImmutableList.of(SkyPosition.of(202.4696, 47.1952, "M51")), params(),
                                   "DSS2_COLOR");
    String[] lines = out.toString().split("\\R");
    assertEquals(2, lines.length);
    assertEquals(SurveyDownloader.METADATA_HEADER, lines[0]);
    assertEquals("M51.png,202.469600,47.195200,13h29m52.7s,+47d11m42.7s,1.0240,0.6827,1.20,3072,2048,DSS2_COLOR",
                 lines[1]);
  }

  @Test
  public void testFitToFrame() {
    BufferedImage framed = SurveyDownloader.fitToFrame(TestImages.flat(100, Color.WHITE), 300, 200);
    assertEquals(300, framed.getWidth());
    assertEquals(200, framed.getHeight());
    // letterboxed left and right
    assertEquals(Color.BLACK.getRGB(), framed.getRGB(10, 100));
    assertEquals(Color.WHITE.getRGB(), framed.getRGB(150, 100));
    assertEquals(Color.BLACK.getRGB(), framed.getRGB(290, 100));
  }

  @Test
  public void testDownload() throws Exception {
    MosaicConfiguration config = MosaicConfiguration.builder()
      .baseUrl("http://localhost/hips")
      .tileSize(64)
      .cropSize(100)
      .arcsecPerPixel(12.88)
      .outputDirectory(folder.getRoot().getPath())
      .settleDelayMs(0)
      .reuseDelayMs(0)
      .writeOutputs(false)
      .build();
    DownloaderParams params = params("-frameWidth", "150", "-frameHeight", "100", "-pauseMs", "0");
    List<SkyPosition> queue = ImmutableList.of(SkyPosition.of(10.6847, 41.2687, "M31"),
                                               SkyPosition.of(83.8221, -5.3911, "M42"));

    try (MosaicCreator creator = new MosaicCreator(config, new StubTileFetcher(64))) {
      List<SkyPosition> produced = new SurveyDownloader(config, creator, params).download(queue);
      assertEquals(queue, produced);
    }

    BufferedImage m31 = ImageIO.read(new File(folder.getRoot(), "M31.png"));
    assertEquals(150, m31.getWidth());
    assertEquals(100, m31.getHeight());
    assertTrue(new File(folder.getRoot(), "M42.png").isFile());

    List<String> metadata = Files.readLines(new File(folder.getRoot(), SurveyDownloader.METADATA_FILE),
                                            StandardCharsets.UTF_8);
    assertEquals(3, metadata.size());
    assertTrue(metadata.get(1).startsWith("M31.png,10.684700,41.268700,"));
    assertTrue(metadata.get(2).endsWith(",150,100,DSS2_COLOR"));
  }
}
