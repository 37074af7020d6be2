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

import java.io.Serializable;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A neighbouring pixel, its index in the native neighbour list, and the direction in which it lies.
 */
@Data
@AllArgsConstructor
public class Neighbor implements Serializable {
  private static final long serialVersionUID = 4185204437722389461L;

  private final long pixel;
  private final int rawIndex;
  private final Direction direction;
}
