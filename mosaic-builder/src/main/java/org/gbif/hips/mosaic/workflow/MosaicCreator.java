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

import org.gbif.hips.common.coordinate.CoordinateParser;
import org.gbif.hips.common.coordinate.SkyPosition;
import org.gbif.hips.mosaic.Mosaic;
import org.gbif.hips.mosaic.fetch.HttpTileFetcher;
import org.gbif.hips.mosaic.fetch.TileFetcher;

import java.io.Closeable;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for creating coordinate centred mosaics. Requests are queued on a single worker thread so only one
 * mosaic is ever being built; completion is signalled through the returned future and to any registered listeners,
 * once per request whether it succeeded or failed.
 */
@Slf4j
public class MosaicCreator implements Closeable {

  private final MosaicConfiguration config;
  private final TileFetcher fetcher;
  private final ExecutorService executor;
  private final List<Consumer<MosaicResult>> listeners = new CopyOnWriteArrayList<>();

  private volatile SkyPosition customTarget;
  private volatile Mosaic lastMosaic;
  private volatile MosaicWorkflow running;
  private volatile boolean closed;

  public MosaicCreator(MosaicConfiguration config) {
    this(config, new HttpTileFetcher(config.getFetchTimeoutMs(), config.getUserAgent()));
  }

  public MosaicCreator(MosaicConfiguration config, TileFetcher fetcher) {
    config.validate();
    this.config = config;
    this.fetcher = Preconditions.checkNotNull(fetcher, "A tile fetcher is required");
    this.executor = Executors.newSingleThreadExecutor(
      new ThreadFactoryBuilder().setNameFormat("mosaic-creator-%d").setDaemon(true).build());
  }

  /**
   * Parses and remembers the target typed by a user. Unreadable text is parsed as far as possible.
   */
  public SkyPosition setCustomCoordinates(String raText, String decText, String name) {
    customTarget = CoordinateParser.parse(raText, decText, name);
    log.info("Custom target {} at RA {} Dec {}", customTarget.getName(), customTarget.getRaDeg(),
             customTarget.getDecDeg());
    return customTarget;
  }

  public Optional<SkyPosition> getCustomTarget() {
    return Optional.ofNullable(customTarget);
  }

  /**
   * Creates a mosaic around the target last set with {@link #setCustomCoordinates(String, String, String)}.
   */
  public CompletableFuture<MosaicResult> createCustomMosaic() {
    SkyPosition target = customTarget;
    Preconditions.checkState(target != null, "No custom coordinates have been set");
    return createCustomMosaic(target);
  }

  public CompletableFuture<MosaicResult> createCustomMosaic(SkyPosition target) {
    Preconditions.checkNotNull(target, "A target is required");
    Preconditions.checkState(!closed, "Mosaic creator is closed");
    return CompletableFuture.supplyAsync(() -> runWorkflow(target), executor);
  }

  public void addCompletionListener(Consumer<MosaicResult> listener) {
    listeners.add(Preconditions.checkNotNull(listener));
  }

  public void removeCompletionListener(Consumer<MosaicResult> listener) {
    listeners.remove(listener);
  }

  /**
   * @return the most recent successfully assembled mosaic
   */
  public Optional<Mosaic> getLastGeneratedMosaic() {
    return Optional.ofNullable(lastMosaic);
  }

  /**
   * Cancels the mosaic currently being built, which completes from the tiles fetched so far.
   */
  public void cancel() {
    MosaicWorkflow workflow = running;
    if (workflow != null) {
      workflow.cancel();
    }
  }

  /**
   * Cancels the running mosaic and refuses new requests. Requests still queued complete as failed, so every
   * returned future completes and listeners hear about every request.
   */
  @Override
  public void close() {
    closed = true;
    cancel();
    executor.shutdown();
  }

  private MosaicResult runWorkflow(SkyPosition target) {
    MosaicResult result;
    if (closed) {
      log.info("Mosaic creator closed before {} started", target.getName());
      result = MosaicResult.failed(target, Collections.emptyList(), "Mosaic creator closed");
    } else {
      MosaicWorkflow workflow = new MosaicWorkflow(config, fetcher, target);
      running = workflow;
      try {
        // closed after the check above
        if (closed) {
          workflow.cancel();
        }
        result = workflow.run();
      } catch (RuntimeException e) {
        log.error("Mosaic creation for {} failed", target.getName(), e);
        result = MosaicResult.failed(target, Collections.emptyList(), "Unexpected error: " + e.getMessage());
      } finally {
        running = null;
      }
    }

    result.getMosaic().ifPresent(m -> lastMosaic = m);
    for (Consumer<MosaicResult> listener : listeners) {
      try {
        listener.accept(result);
      } catch (RuntimeException e) {
        log.warn("Completion listener failed for {}", target.getName(), e);
      }
    }
    return result;
  }
}
