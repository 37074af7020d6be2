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

import org.gbif.hips.mosaic.TestImages;
import org.gbif.hips.mosaic.fetch.FetchResult;
import org.gbif.hips.mosaic.fetch.TileFetcher;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import com.google.common.collect.ImmutableSet;

/**
 * Serves a noise JPEG for every URL, except those it is told to fail with a 404.
 */
class StubTileFetcher implements TileFetcher {
  private final byte[] tile;
  private final Set<String> failing;
  final List<String> requested = new CopyOnWriteArrayList<>();

  StubTileFetcher(int tileSize, String... failing) {
    try {
      this.tile = TestImages.encode(TestImages.noise(tileSize, 7), "jpg");
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    this.failing = ImmutableSet.copyOf(failing);
  }

  @Override
  public FetchResult fetch(String url) {
    requested.add(url);
    return failing.contains(url) ? FetchResult.httpStatus(404) : FetchResult.success(tile);
  }
}
