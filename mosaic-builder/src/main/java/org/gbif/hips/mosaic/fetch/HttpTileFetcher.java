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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URL;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import lombok.extern.slf4j.Slf4j;

/**
 * Fetches tiles over HTTP with a single GET per tile and no retries.
 * <p/>
 * The timeout bounds the whole fetch, from connecting to the last byte of the body. A connection still open when it
 * expires is disconnected and the fetch reported as timed out.
 */
@Slf4j
public class HttpTileFetcher implements TileFetcher {

  private static final ScheduledExecutorService WATCHDOG = Executors.newSingleThreadScheduledExecutor(
    new ThreadFactoryBuilder().setNameFormat("tile-fetch-watchdog-%d").setDaemon(true).build());

  private final int timeoutMs;
  private final String userAgent;

  public HttpTileFetcher(int timeoutMs, String userAgent) {
    Preconditions.checkArgument(timeoutMs > 0, "Timeout must be positive");
    this.timeoutMs = timeoutMs;
    this.userAgent = userAgent;
  }

  @Override
  public FetchResult fetch(String url) {
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
    HttpURLConnection conn;
    try {
      conn = (HttpURLConnection) new URL(url).openConnection();
    } catch (IOException e) {
      log.debug("Unable to open {}", url, e);
      return FetchResult.networkError(e.getMessage());
    }

    ScheduledFuture<?> watchdog = WATCHDOG.schedule(conn::disconnect, timeoutMs, TimeUnit.MILLISECONDS);
    try {
      conn.setRequestMethod("GET");
      conn.setConnectTimeout(timeoutMs);
      conn.setReadTimeout(timeoutMs);
      conn.setRequestProperty("User-Agent", userAgent);
      conn.setRequestProperty("Accept", "image/*");

      int status = conn.getResponseCode();
      if (status < 200 || status >= 300) {
        log.debug("{} returned HTTP {}", url, status);
        return FetchResult.httpStatus(status);
      }
      try (InputStream in = conn.getInputStream()) {
        byte[] data = read(in, deadline);
        log.debug("Fetched {} bytes from {}", data.length, url);
        return FetchResult.success(data);
      }
    } catch (SocketTimeoutException e) {
      log.debug("Timed out after {}ms fetching {}", timeoutMs, url);
      return FetchResult.timeout(e.getMessage());
    } catch (IOException e) {
      if (expired(deadline)) {
        log.debug("Timed out after {}ms fetching {}", timeoutMs, url);
        return FetchResult.timeout("Fetch exceeded " + timeoutMs + "ms");
      }
      log.debug("Unable to fetch {}", url, e);
      return FetchResult.networkError(e.getMessage());
    } finally {
      watchdog.cancel(false);
      conn.disconnect();
    }
  }

  private byte[] read(InputStream in, long deadline) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] buffer = new byte[8192];
    int n;
    while ((n = in.read(buffer)) != -1) {
      if (expired(deadline)) {
        throw new SocketTimeoutException("Fetch exceeded " + timeoutMs + "ms");
      }
      out.write(buffer, 0, n);
    }
    return out.toByteArray();
  }

  private static boolean expired(long deadline) {
    return System.nanoTime() - deadline >= 0;
  }
}
