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

import org.gbif.hips.common.healpix.Healpix;
import org.gbif.hips.mosaic.HipsSurvey;
import org.gbif.hips.mosaic.MosaicAssembler;
import org.gbif.hips.mosaic.TileGridPlanner;
import org.gbif.hips.mosaic.fetch.TileCache;

import java.io.File;
import java.io.IOException;
import java.net.URL;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.io.Resources;

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.slf4j.Slf4j;

@Data
@Builder
@Jacksonized
@Slf4j
public class MosaicConfiguration {

  @Builder.Default
  private HipsSurvey survey = HipsSurvey.DSS2_COLOR;
  // overrides of the survey's own address and tile format
  private String baseUrl;
  private String format;
  @Builder.Default
  private int order = TileGridPlanner.DEFAULT_ORDER;
  @Builder.Default
  private int tileSize = MosaicAssembler.DEFAULT_TILE_SIZE;
  @Builder.Default
  private int cropSize = MosaicAssembler.DEFAULT_CROP_SIZE;
  @Builder.Default
  private double arcsecPerPixel = MosaicAssembler.DEFAULT_ARCSEC_PER_PIXEL;
  @Builder.Default
  private String outputDirectory = "mosaic_output";
  @Builder.Default
  private int fetchTimeoutMs = 15000;
  @Builder.Default
  private long settleDelayMs = 500;
  @Builder.Default
  private long reuseDelayMs = 100;
  @Builder.Default
  private int minCachedBytes = TileCache.DEFAULT_MIN_BYTES;
  @Builder.Default
  private String userAgent = "hips-mosaic/0.1";
  @Builder.Default
  private boolean writeOutputs = true;

  /**
   * Reads the configuration from a file path, or failing that from the classpath, e.g. "/default.yml".
   */
  public static MosaicConfiguration build(String filename) throws IOException {
    File file = new File(filename);
    URL conf = file.isFile() ? file.toURI().toURL() : Resources.getResource(filename.replaceFirst("^/", ""));
    log.info("Reading from {}", conf);
    MosaicConfiguration config = new ObjectMapper(new YAMLFactory()).readValue(conf, MosaicConfiguration.class);
    config.validate();
    return config;
  }

  /**
   * @throws IllegalArgumentException if a setting is unusable
   */
  public void validate() {
    Preconditions.checkArgument(Healpix.isValidOrder(order), "Order %s is outside 0-%s", order, Healpix.MAX_ORDER);
    Preconditions.checkArgument(tileSize > 0, "Tile size must be positive");
    Preconditions.checkArgument(cropSize > 0, "Crop size must be positive");
    Preconditions.checkArgument(arcsecPerPixel > 0, "Pixel scale must be positive");
    Preconditions.checkArgument(fetchTimeoutMs > 0, "Fetch timeout must be positive");
    Preconditions.checkArgument(settleDelayMs >= 0 && reuseDelayMs >= 0, "Delays must not be negative");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(outputDirectory), "An output directory is required");
    if (Strings.isNullOrEmpty(baseUrl) && !survey.supportsOrder(order)) {
      log.warn("{} only goes to order {}, tiles at order {} will be missing", survey.getLabel(),
               survey.getMaxOrder(), order);
    }
  }

  public String getEffectiveBaseUrl() {
    return Strings.isNullOrEmpty(baseUrl) ? survey.getBaseUrl() : baseUrl;
  }

  public String getEffectiveFormat() {
    return Strings.isNullOrEmpty(format) ? survey.getFormat() : format;
  }

  public File getOutputDir() {
    return new File(outputDirectory);
  }
}
