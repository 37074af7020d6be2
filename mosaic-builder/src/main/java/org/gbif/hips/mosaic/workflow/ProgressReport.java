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
import org.gbif.hips.mosaic.Tile;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.Files;

/**
 * Writes the per mosaic text report listing each tile of the grid and whether it was available.
 */
public class ProgressReport {
  private static final Logger LOG = LoggerFactory.getLogger(ProgressReport.class);

  static final String HEADER = "Grid_X,Grid_Y,HEALPix_Pixel,Tile_RA,Tile_Dec,Downloaded,ImageSize,Filename";

  private ProgressReport() {}

  /**
   * The name used for output files: lower case, spaces as underscores and no parentheses.
   */
  public static String safeName(String name) {
    return name.toLowerCase(Locale.ROOT).replace(" ", "_").replace("(", "").replace(")", "");
  }

  public static File reportFile(File directory, String name) {
    return new File(directory, safeName(name) + "_centered_report.txt");
  }

  public static File write(File directory, SkyPosition target, List<Tile> tiles) throws IOException {
    File file = reportFile(directory, target.getName());
    try {
      Files.createParentDirs(file);
      try (Writer out = Files.newWriter(file, StandardCharsets.UTF_8)) {
        write(out, target, tiles, LocalDateTime.now());
      }
      LOG.info("Report written to {}", file);
      return file;
    } catch (IOException e) {
      LOG.error("Unable to write the report {}", file);
      throw e; // deliberate log and throw to keep logs together
    }
  }

  @VisibleForTesting
  static void write(Writer writer, SkyPosition target, List<Tile> tiles, LocalDateTime generated) throws IOException {
    PrintWriter out = new PrintWriter(writer);
    out.printf("%s Coordinate-Centered Mosaic Report%n", target.getName());
    out.printf("Generated: %s%n%n", generated.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
    out.printf(Locale.ROOT, "Target coordinates: RA %.6f°, Dec %.6f°%n", target.getRaDeg(), target.getDecDeg());
    out.printf("Target placed at the mosaic centre%n%n");
    out.printf("Custom Target: %s%n%n", target.getName());
    out.printf("3x3 Tile Grid Used:%n");
    out.println(HEADER);
    for (Tile tile : tiles) {
      out.println(row(tile));
    }
    out.flush();
    if (out.checkError()) {
      throw new IOException("Failed writing report for " + target.getName());
    }
  }

  @VisibleForTesting
  static String row(Tile tile) {
    return String.format(Locale.ROOT, "%d,%d,%d,%.6f,%.6f,%s,%s,%s", tile.getGridX(), tile.getGridY(),
                         tile.getPixel(), tile.getSkyCoordinates().getRaDeg(), tile.getSkyCoordinates().getDecDeg(),
                         tile.isDownloaded() ? "YES" : "NO", tile.imageSize(), tile.getLocalPath());
  }
}
