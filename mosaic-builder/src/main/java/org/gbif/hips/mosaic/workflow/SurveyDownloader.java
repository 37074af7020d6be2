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

import org.gbif.hips.common.coordinate.Sexagesimal;
import org.gbif.hips.common.coordinate.SkyPosition;
import org.gbif.hips.mosaic.Mosaic;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import javax.imageio.ImageIO;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.io.Files;

import lombok.extern.slf4j.Slf4j;

/**
 * Builds a set of mosaics fitted to a camera frame, for use as plate solver test images, with a metadata CSV
 * describing each one.
 * Usage: SurveyDownloader -mode single -ra 202.47 -dec 47.20 -name M51
 *        SurveyDownloader -mode grid -ra 202.47 -dec 47.20 -gridSize 5 -spacing 0.5
 *        SurveyDownloader -mode targets
 */
@Slf4j
public class SurveyDownloader {

  static final String METADATA_FILE = "test_metadata.csv";
  static final String METADATA_HEADER =
    "Filename,RA_deg,Dec_deg,RA_HMS,Dec_DMS,FOV_width,FOV_height,Pixel_scale,Image_width,Image_height,Survey";

  static final List<SkyPosition> TARGETS = ImmutableList.of(
    SkyPosition.of(10.6847, 41.2687, "M31_Andromeda"),
    SkyPosition.of(83.8221, -5.3911, "M42_Orion"),
    SkyPosition.of(202.4696, 47.1952, "M51_Whirlpool"),
    SkyPosition.of(148.8884, 69.0653, "M81_Bodes"),
    SkyPosition.of(37.9546, 89.2641, "Polaris"),
    SkyPosition.of(279.2346, 38.7837, "Vega"),
    SkyPosition.of(101.2872, -16.7161, "Sirius"),
    SkyPosition.of(88.7929, 7.4070, "Betelgeuse"));

  private final MosaicConfiguration config;
  private final MosaicCreator creator;
  private final DownloaderParams params;

  public SurveyDownloader(MosaicConfiguration config, MosaicCreator creator, DownloaderParams params) {
    this.config = config;
    this.creator = creator;
    this.params = params;
  }

  public static void main(String[] args) throws Exception {
    DownloaderParams params = new DownloaderParams();
    JCommander jc = JCommander.newBuilder().addObject(params).programName("SurveyDownloader").build();
    try {
      jc.parse(args);
    } catch (ParameterException e) {
      log.error("Invalid arguments: {}", e.getMessage());
      jc.usage();
      throw e;
    }
    if (params.isHelp()) {
      jc.usage();
      return;
    }

    MosaicConfiguration config = MosaicConfiguration.build(params.getConf());
    if (params.getOutputDirectory() != null) {
      config.setOutputDirectory(params.getOutputDirectory());
    }
    List<SkyPosition> queue = queue(params);
    log.info("Creating {} images from {} in {}", queue.size(), config.getSurvey().getLabel(),
             config.getOutputDir().getAbsolutePath());

    try (MosaicCreator creator = new MosaicCreator(config)) {
      List<SkyPosition> produced = new SurveyDownloader(config, creator, params).download(queue);
      log.info("All downloads complete, {} of {} images in {}", produced.size(), queue.size(),
               config.getOutputDir().getAbsolutePath());
    }
  }

  /**
   * Creates and saves an image for each position in turn, then writes the metadata of those that succeeded.
   * @return the positions for which an image was saved
   */
  public List<SkyPosition> download(List<SkyPosition> queue)
    throws IOException, InterruptedException, ExecutionException {
    List<SkyPosition> produced = Lists.newArrayList();
    for (int i = 0; i < queue.size(); i++) {
      SkyPosition pos = queue.get(i);
      log.info("[{}/{}] {} at RA {} Dec {}", i + 1, queue.size(), pos.getName(), pos.getRaDeg(), pos.getDecDeg());

      String raText = Sexagesimal.toHms(pos.getRaDeg());
      String decText = Sexagesimal.toDms(pos.getDecDeg());
      log.debug("Converted coordinates to {} {}", raText, decText);
      creator.setCustomCoordinates(raText, decText, pos.getName());
      MosaicResult result = creator.createCustomMosaic(pos).get();

      if (result.getMosaic().isPresent()) {
        Mosaic mosaic = result.getMosaic().get();
        File file = new File(config.getOutputDir(), pos.getName() + ".png");
        BufferedImage framed = fitToFrame(mosaic.getImage(), params.getFrameWidth(), params.getFrameHeight());
        Files.createParentDirs(file);
        if (ImageIO.write(framed, "PNG", file)) {
          log.info("Saved {} ({}x{})", file, framed.getWidth(), framed.getHeight());
          produced.add(pos);
        } else {
          log.warn("No PNG writer available for {}", file);
        }
      } else {
        log.warn("Failed to generate an image for {}: {}", pos.getName(), result.getMessage());
      }

      if (i < queue.size() - 1 && params.getPauseMs() > 0) {
        TimeUnit.MILLISECONDS.sleep(params.getPauseMs());
      }
    }

    File metadata = new File(config.getOutputDir(), METADATA_FILE);
    Files.createParentDirs(metadata);
    try (Writer out = Files.newWriter(metadata, StandardCharsets.UTF_8)) {
      writeMetadata(out, produced, params, config.getSurvey().name());
    }
    log.info("Metadata file created: {}", metadata);
    return produced;
  }

  @VisibleForTesting
  static List<SkyPosition> queue(DownloaderParams params) {
    switch (params.getMode().toLowerCase(Locale.ROOT)) {
      case "single":
        Preconditions.checkArgument(params.getRa() != null && params.getDec() != null,
                                    "RA and Dec are required in single mode, e.g. -ra 202.47 -dec 47.20");
        return ImmutableList.of(SkyPosition.of(params.getRa(), params.getDec(), params.getName()));
      case "grid":
        Preconditions.checkArgument(params.getRa() != null && params.getDec() != null,
                                    "RA and Dec of the centre are required in grid mode, e.g. -ra 202.47 -dec 47.20");
        return gridPositions(params.getRa(), params.getDec(), params.getGridSize(), params.getSpacing());
      case "targets":
        return TARGETS;
      default:
        throw new IllegalArgumentException("Unknown mode " + params.getMode() + ", use single, grid or targets");
    }
  }

  /**
   * A square of positions around a centre. Right ascension steps are widened by the declination so the positions
   * are evenly spaced on the sky.
   */
  @VisibleForTesting
  static List<SkyPosition> gridPositions(double centerRa, double centerDec, int gridSize, double spacingDeg) {
    Preconditions.checkArgument(gridSize > 0, "Grid size must be positive");
    List<SkyPosition> positions = Lists.newArrayListWithCapacity(gridSize * gridSize);
    for (int y = 0; y < gridSize; y++) {
      for (int x = 0; x < gridSize; x++) {
        double offsetX = (x - gridSize / 2) * spacingDeg;
        double offsetY = (y - gridSize / 2) * spacingDeg;

        double ra = (centerRa + offsetX / Math.cos(Math.toRadians(centerDec))) % 360.0;
        if (ra < 0) {
          ra += 360.0;
        }
        double dec = Math.max(-90.0, Math.min(90.0, centerDec + offsetY));
        positions.add(SkyPosition.of(ra, dec, String.format("grid_%d_%d", x, y)));
      }
    }
    return positions;
  }

  /**
   * Scales the image to fit the frame keeping its aspect ratio and centres it on a black background.
   */
  @VisibleForTesting
  static BufferedImage fitToFrame(BufferedImage image, int width, int height) {
    double scale = Math.min((double) width / image.getWidth(), (double) height / image.getHeight());
    int w = (int) Math.round(image.getWidth() * scale);
    int h = (int) Math.round(image.getHeight() * scale);

    BufferedImage frame = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = frame.createGraphics();
    try {
      g.setColor(Color.BLACK);
      g.fillRect(0, 0, width, height);
      g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
      g.drawImage(image, (width - w) / 2, (height - h) / 2, w, h, null);
    } finally {
      g.dispose();
    }
    return frame;
  }

  @VisibleForTesting
  static void writeMetadata(Writer writer, List<SkyPosition> positions, DownloaderParams params, String survey) {
    double fovWidth = params.getPixelScale() * params.getFrameWidth() / 3600.0;
    double fovHeight = params.getPixelScale() * params.getFrameHeight() / 3600.0;
    PrintWriter out = new PrintWriter(writer);
    out.println(METADATA_HEADER);
    for (SkyPosition pos : positions) {
      out.println(String.format(Locale.ROOT, "%s.png,%.6f,%.6f,%s,%s,%.4f,%.4f,%.2f,%d,%d,%s", pos.getName(),
                                pos.getRaDeg(), pos.getDecDeg(), Sexagesimal.toHms(pos.getRaDeg()),
                                Sexagesimal.toDms(pos.getDecDeg()), fovWidth, fovHeight, params.getPixelScale(),
                                params.getFrameWidth(), params.getFrameHeight(), survey));
    }
    out.flush();
  }
}
