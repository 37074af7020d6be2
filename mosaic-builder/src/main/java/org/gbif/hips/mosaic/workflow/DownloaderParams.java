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

import com.beust.jcommander.Parameter;

import lombok.Getter;
import lombok.Setter;

/**
 * Command line parameters of the {@link SurveyDownloader}.
 */
@Getter
@Setter
public class DownloaderParams {

  @Parameter(names = "-mode", description = "Download mode: single, grid or targets")
  private String mode = "targets";

  @Parameter(names = "-ra", description = "Right ascension in degrees, the grid centre in grid mode")
  private Double ra;

  @Parameter(names = "-dec", description = "Declination in degrees, the grid centre in grid mode")
  private Double dec;

  @Parameter(names = "-name", description = "Name of the target in single mode")
  private String name = "test_image";

  @Parameter(names = "-gridSize", description = "Number of positions along each side of the grid")
  private int gridSize = 3;

  @Parameter(names = "-spacing", description = "Grid spacing in degrees")
  private double spacing = 1.0;

  @Parameter(names = "-conf", description = "Path to the configuration file, or a classpath resource")
  private String conf = "default.yml";

  @Parameter(names = "-outputDirectory", description = "Overrides the output directory of the configuration")
  private String outputDirectory;

  @Parameter(names = "-frameWidth", description = "Width in pixels of the camera frame images are fitted to")
  private int frameWidth = 3072;

  @Parameter(names = "-frameHeight", description = "Height in pixels of the camera frame images are fitted to")
  private int frameHeight = 2048;

  @Parameter(names = "-pixelScale", description = "Camera pixel scale in arcsec per pixel, for the metadata")
  private double pixelScale = 1.2;

  @Parameter(names = "-pauseMs", description = "Pause between targets in milliseconds")
  private long pauseMs = 1000;

  @Parameter(names = {"-help", "-h"}, help = true, description = "Show usage")
  private boolean help;
}
