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

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.sun.net.httpserver.HttpServer;

import static org.junit.Assert.*;

public class HttpTileFetcherTest {
  private static final byte[] TILE = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 1, 2, 3};

  private final ExecutorService handlers = Executors.newCachedThreadPool();
  private HttpServer server;
  private String base;
  private volatile String accept;

  @Before
  public void start() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/hips/Norder8/Dir0/Npix1.jpg", exchange -> {
      accept = exchange.getRequestHeaders().getFirst("Accept");
      exchange.sendResponseHeaders(200, TILE.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(TILE);
      }
    });
    server.createContext("/hips/Norder8/Dir0/Npix2.jpg", exchange -> {
      exchange.sendResponseHeaders(404, -1);
      exchange.close();
    });
    // a body of ten small chunks, one every 300ms
    server.createContext("/hips/Norder8/Dir0/Npix3.jpg", exchange -> {
      exchange.sendResponseHeaders(200, 0);
      try (OutputStream out = exchange.getResponseBody()) {
        for (int i = 0; i < 10; i++) {
          out.write(TILE);
          out.flush();
          Thread.sleep(300);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    });
    server.setExecutor(handlers);
    server.start();
    base = "http://127.0.0.1:" + server.getAddress().getPort() + "/hips";
  }

  @After
  public void stop() {
    server.stop(0);
    handlers.shutdownNow();
  }

  @Test
  public void testSuccess() {
    FetchResult result = new HttpTileFetcher(2000, "test").fetch(base + "/Norder8/Dir0/Npix1.jpg");
    assertTrue(result.isSuccess());
    assertArrayEquals(TILE, result.getData());
    assertEquals("image/*", accept);
  }

  @Test
  public void testHttpStatus() {
    FetchResult result = new HttpTileFetcher(2000, "test").fetch(base + "/Norder8/Dir0/Npix2.jpg");
    assertFalse(result.isSuccess());
    assertEquals(FetchResult.Failure.HTTP_STATUS, result.getFailure());
    assertEquals(404, result.getStatusCode());
    assertNull(result.getData());
  }

  @Test
  public void testSlowBodyTimesOut() {
    long start = System.nanoTime();
    FetchResult result = new HttpTileFetcher(1000, "test").fetch(base + "/Norder8/Dir0/Npix3.jpg");
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertFalse(result.isSuccess());
    assertEquals(FetchResult.Failure.TIMEOUT, result.getFailure());
    assertNull(result.getData());
    assertTrue("Fetch took " + elapsedMs + "ms", elapsedMs < 2500);
  }

  @Test
  public void testNetworkError() throws IOException {
    int port;
    try (ServerSocket socket = new ServerSocket(0)) {
      port = socket.getLocalPort();
    }
    FetchResult result = new HttpTileFetcher(2000, "test").fetch("http://127.0.0.1:" + port + "/hips/Npix1.jpg");
    assertFalse(result.isSuccess());
    assertEquals(FetchResult.Failure.NETWORK_ERROR, result.getFailure());
  }

  @Test
  public void testMalformedUrl() {
    FetchResult result = new HttpTileFetcher(2000, "test").fetch("not a url");
    assertEquals(FetchResult.Failure.NETWORK_ERROR, result.getFailure());
  }
}
