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

/**
 * Finds the neighbours of a pixel by compass direction.
 */
public interface NeighborResolver {

  /**
   * @return the neighbours of the pixel by direction; never null, possibly with fewer than eight entries
   */
  NeighborSet directionalNeighbors(long pixel, int order);
}
