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
package org.gbif.hips.common.healpix;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import lombok.Getter;
import lombok.ToString;

/**
 * The neighbours of a pixel keyed by direction. Directions without a neighbour are simply absent.
 */
@ToString
public class NeighborSet {
  @Getter
  private final int order;
  @Getter
  private final long center;
  private final Map<Direction, Long> neighbors;

  public NeighborSet(int order, long center, Map<Direction, Long> neighbors) {
    this.order = order;
    this.center = center;
    this.neighbors = neighbors.isEmpty()
      ? Collections.emptyMap()
      : Collections.unmodifiableMap(new EnumMap<>(neighbors));
  }

  public Optional<Long> get(Direction direction) {
    return Optional.ofNullable(neighbors.get(direction));
  }

  /**
   * @return the neighbour in the direction, or the fallback when there is none
   */
  public long getOrDefault(Direction direction, long fallback) {
    Long pixel = neighbors.get(direction);
    return pixel == null ? fallback : pixel;
  }

  public boolean contains(Direction direction) {
    return neighbors.containsKey(direction);
  }

  public int size() {
    return neighbors.size();
  }

  public Map<Direction, Long> asMap() {
    return neighbors;
  }
}
