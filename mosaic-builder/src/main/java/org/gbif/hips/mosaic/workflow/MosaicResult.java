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
import org.gbif.hips.mosaic.Mosaic;
import org.gbif.hips.mosaic.Tile;

import java.io.File;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

import lombok.Getter;
import lombok.ToString;

/**
 * The outcome of one workflow run. A failed run has no mosaic but still lists the tiles it attempted.
 */
@ToString
public class MosaicResult {
  @Getter
  private final WorkflowState state;
  @Getter
  private final SkyPosition target;
  private final Mosaic mosaic;
  @Getter
  private final List<Tile> tiles;
  @Getter
  private final String message;
  private final File reportFile;
  private final File mosaicFile;

  MosaicResult(WorkflowState state, SkyPosition target, Mosaic mosaic, List<Tile> tiles, String message,
               File reportFile, File mosaicFile) {
    this.state = state;
    this.target = target;
    this.mosaic = mosaic;
    this.tiles = ImmutableList.copyOf(tiles);
    this.message = message;
    this.reportFile = reportFile;
    this.mosaicFile = mosaicFile;
  }

  static MosaicResult failed(SkyPosition target, List<Tile> tiles, String message) {
    return new MosaicResult(WorkflowState.FAILED, target, null, tiles, message, null, null);
  }

  public boolean isSuccess() {
    return state == WorkflowState.DONE;
  }

  public Optional<Mosaic> getMosaic() {
    return Optional.ofNullable(mosaic);
  }

  public Optional<File> getReportFile() {
    return Optional.ofNullable(reportFile);
  }

  public Optional<File> getMosaicFile() {
    return Optional.ofNullable(mosaicFile);
  }

  public int tilesDownloaded() {
    return (int) tiles.stream().filter(Tile::isDownloaded).count();
  }
}
