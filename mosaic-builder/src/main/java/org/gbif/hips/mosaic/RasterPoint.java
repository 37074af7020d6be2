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
package org.gbif.hips.mosaic;

import java.io.Serializable;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A pixel position in a raster, with y increasing downwards.
 */
@Data
@AllArgsConstructor
public class RasterPoint implements Serializable {
  private static final long serialVersionUID = 6043164839015571296L;

  private final int x;
  private final int y;
}
