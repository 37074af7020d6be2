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
package org.gbif.hips.mosaic.fetch;

import com.google.common.base.Preconditions;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * The outcome of fetching one tile: either its bytes or the reason it could not be fetched.
 */
@Getter
@ToString(exclude = "data")
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FetchResult {

  public enum Failure {
    NETWORK_ERROR,
    TIMEOUT,
    HTTP_STATUS
  }

  private final byte[] data;
  private final Failure failure;
  // zero unless the failure is an HTTP status
  private final int statusCode;
  private final String message;

  public static FetchResult success(byte[] data) {
    Preconditions.checkNotNull(data, "Fetched data must not be null");
    return new FetchResult(data, null, 0, null);
  }

  public static FetchResult networkError(String message) {
    return new FetchResult(null, Failure.NETWORK_ERROR, 0, message);
  }

  public static FetchResult timeout(String message) {
    return new FetchResult(null, Failure.TIMEOUT, 0, message);
  }

  public static FetchResult httpStatus(int statusCode) {
    return new FetchResult(null, Failure.HTTP_STATUS, statusCode, "HTTP " + statusCode);
  }

  public boolean isSuccess() {
    return failure == null;
  }
}
