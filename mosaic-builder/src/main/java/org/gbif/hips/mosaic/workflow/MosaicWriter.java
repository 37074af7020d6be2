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

import org.gbif.hips.mosaic.Mosaic;
import org.gbif.hips.mosaic.RasterPoint;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.Locale;

import javax.imageio.ImageIO;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.Files;

import lombok.extern.slf4j.Slf4j;

/**
 * Saves a mosaic as PNG with a crosshair and labels marking the target.
 */
@Slf4j
public class MosaicWriter {
  private static final int CROSSHAIR = 30;
  private static final int LABEL_OFFSET = 40;

  private MosaicWriter() {}

  public static File mosaicFile(File directory, String name) {
    return new File(directory, ProgressReport.safeName(name) + "_centered_mosaic.png");
  }

  public static File write(File directory, Mosaic mosaic) throws IOException {
    File file = mosaicFile(directory, mosaic.getTarget().getName());
    try {
      Files.createParentDirs(file);
      if (!ImageIO.write(decorate(mosaic), "PNG", file)) {
        throw new IOException("No PNG writer available");
      }
      log.info("Mosaic {}x{} written to {}", mosaic.getWidth(), mosaic.getHeight(), file);
      return file;
    } catch (IOException e) {
      log.error("Unable to write the mosaic {}", file);
      throw e; // deliberate log and throw to keep logs together
    }
  }

  /**
   * Draws the overlay on a copy of the mosaic image.
   */
  @VisibleForTesting
  static BufferedImage decorate(Mosaic mosaic) {
    BufferedImage source = mosaic.getImage();
    BufferedImage copy = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
    Graphics2D g = copy.createGraphics();
    try {
      g.drawImage(source, 0, 0, null);

      RasterPoint c = mosaic.targetInImage();
      g.setColor(Color.YELLOW);
      g.setStroke(new BasicStroke(3));
      g.drawLine(c.getX() - CROSSHAIR, c.getY(), c.getX() + CROSSHAIR, c.getY());
      g.drawLine(c.getX(), c.getY() - CROSSHAIR, c.getX(), c.getY() + CROSSHAIR);

      g.setStroke(new BasicStroke(1));
      g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 14));
      g.drawString(mosaic.getTarget().getName(), c.getX() + LABEL_OFFSET, c.getY() - 20);
      g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 10));
      g.drawString(String.format(Locale.ROOT, "RA:%.4f° Dec:%.4f°", mosaic.getTarget().getRaDeg(),
                                 mosaic.getTarget().getDecDeg()), c.getX() + LABEL_OFFSET, c.getY() - 5);
      g.drawString("COORDINATE CENTERED", c.getX() + LABEL_OFFSET, c.getY() + 10);
    } finally {
      g.dispose();
    }
    return copy;
  }
}
