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
import org.gbif.hips.mosaic.MosaicAssembler;
import org.gbif.hips.mosaic.Tile;
import org.gbif.hips.mosaic.TileGridPlanner;
import org.gbif.hips.mosaic.TilePlan;
import org.gbif.hips.mosaic.fetch.FetchResult;
import org.gbif.hips.mosaic.fetch.TileCache;
import org.gbif.hips.mosaic.fetch.TileFetcher;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import javax.imageio.ImageIO;

import com.google.common.base.Preconditions;

import lombok.extern.slf4j.Slf4j;

/**
 * Creates one mosaic centred on a target: plans the tile grid, fetches the tiles strictly one after another with a
 * pause after each, then assembles and optionally writes the mosaic and its report.
 * <p/>
 * A workflow runs once and owns its tiles. Every planned tile is attempted exactly once unless the workflow is
 * cancelled, in which case the remaining tiles stay empty and the mosaic is assembled from what was fetched.
 */
@Slf4j
public class MosaicWorkflow {

  private final MosaicConfiguration config;
  private final TileFetcher fetcher;
  private final TileCache cache;
  private final TileGridPlanner planner;
  private final MosaicAssembler assembler;
  private final SkyPosition target;

  private volatile WorkflowState state = WorkflowState.NEW;
  private volatile int currentTile = -1;
  private volatile boolean cancelled;

  public MosaicWorkflow(MosaicConfiguration config, TileFetcher fetcher, SkyPosition target) {
    this.config = Preconditions.checkNotNull(config, "Configuration is required");
    this.fetcher = Preconditions.checkNotNull(fetcher, "A tile fetcher is required");
    this.target = Preconditions.checkNotNull(target, "A target is required");
    this.cache = new TileCache(config.getMinCachedBytes());
    this.planner = new TileGridPlanner(config.getEffectiveBaseUrl(), config.getEffectiveFormat(),
                                       config.getOutputDir());
    this.assembler = new MosaicAssembler(config.getTileSize(), config.getCropSize(), config.getArcsecPerPixel());
  }

  public MosaicResult run() {
    Preconditions.checkState(state == WorkflowState.NEW, "Workflow has already run");

    transition(WorkflowState.PLANNING);
    TilePlan plan;
    try {
      plan = planner.planGrid(target, config.getOrder());
    } catch (IllegalArgumentException e) {
      log.warn("Unable to plan tiles for {}: {}", target.getName(), e.getMessage());
      transition(WorkflowState.FAILED);
      return MosaicResult.failed(target, Collections.emptyList(), e.getMessage());
    }

    List<Tile> tiles = plan.getTiles();
    for (int i = 0; i < tiles.size() && !cancelled; i++) {
      currentTile = i;
      transition(WorkflowState.FETCHING);
      acquire(tiles.get(i), i, tiles.size());
    }
    if (cancelled) {
      log.info("Cancelled after {} of {} tiles for {}", currentTile + 1, tiles.size(), target.getName());
    }

    transition(WorkflowState.ASSEMBLING);
    Optional<Mosaic> mosaic = assembler.assemble(plan);
    WorkflowState outcome = mosaic.isPresent() ? WorkflowState.DONE : WorkflowState.FAILED;
    String message = mosaic.isPresent()
      ? String.format("Mosaic of %d tiles centred on %s", plan.tilesWithData(), target.getName())
      : "No tile data available for " + target.getName();

    File reportFile = null;
    File mosaicFile = null;
    if (config.isWriteOutputs()) {
      try {
        reportFile = ProgressReport.write(config.getOutputDir(), target, tiles);
        if (mosaic.isPresent()) {
          mosaicFile = MosaicWriter.write(config.getOutputDir(), mosaic.get());
        }
      } catch (IOException e) {
        message = message + ", outputs not written: " + e.getMessage();
      }
    }

    transition(outcome);
    log.info("{}: {}", outcome, message);
    return new MosaicResult(outcome, target, mosaic.orElse(null), tiles, message, reportFile, mosaicFile);
  }

  /**
   * Stops fetching after the tile in progress. The workflow still assembles whatever it has.
   */
  public void cancel() {
    cancelled = true;
  }

  public boolean isCancelled() {
    return cancelled;
  }

  public WorkflowState getState() {
    return state;
  }

  /**
   * @return the index of the tile being fetched or last fetched, -1 before fetching starts
   */
  public int getCurrentTile() {
    return currentTile;
  }

  private void acquire(Tile tile, int index, int total) {
    Optional<BufferedImage> cached = cache.load(tile.getLocalFile());
    if (cached.isPresent()) {
      tile.setImage(cached.get());
      log.debug("[{}/{}] Reusing {} for pixel {}", index + 1, total, tile.getLocalPath(), tile.getPixel());
      pause(config.getReuseDelayMs());
      return;
    }

    log.debug("[{}/{}] Fetching {}", index + 1, total, tile.getSourceUrl());
    FetchResult result;
    try {
      result = fetcher.fetch(tile.getSourceUrl());
    } catch (RuntimeException e) {
      log.warn("Tile fetcher failed on {}", tile.getSourceUrl(), e);
      result = FetchResult.networkError(e.getMessage());
    }

    if (result.isSuccess()) {
      BufferedImage image = decode(result.getData());
      if (image == null) {
        log.warn("Tile {} from {} is not a readable image", tile.getPixel(), tile.getSourceUrl());
      } else {
        tile.setImage(image);
        try {
          cache.store(tile.getLocalFile(), result.getData());
        } catch (IOException e) {
          log.warn("Unable to cache tile {} at {}", tile.getPixel(), tile.getLocalPath(), e);
        }
      }
    } else {
      log.warn("Tile {} failed with {} ({})", tile.getPixel(), result.getFailure(), result.getMessage());
    }
    pause(config.getSettleDelayMs());
  }

  private static BufferedImage decode(byte[] data) {
    try {
      return ImageIO.read(new ByteArrayInputStream(data));
    } catch (IOException e) {
      log.debug("Unable to decode tile", e);
      return null;
    }
  }

  private void pause(long ms) {
    if (ms <= 0) {
      return;
    }
    try {
      TimeUnit.MILLISECONDS.sleep(ms);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.info("Interrupted while fetching tiles for {}, cancelling", target.getName());
      cancelled = true;
    }
  }

  private void transition(WorkflowState next) {
    log.debug("{} -> {}", state, next);
    state = next;
  }
}
