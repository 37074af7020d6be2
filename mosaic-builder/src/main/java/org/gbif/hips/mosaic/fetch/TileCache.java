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

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.ByteStreams;
import com.google.common.io.Files;

/**
 * Tiles kept on local disk, one file per pixel. A file is only reused if it is large enough, starts with a JPEG or PNG
 * signature and decodes; anything else is fetched again and overwritten.
 */
public class TileCache {
  private static final Logger LOG = LoggerFactory.getLogger(TileCache.class);

  public static final int DEFAULT_MIN_BYTES = 1024;

  private static final byte[] JPEG_MAGIC = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
  private static final byte[] PNG_MAGIC = {(byte) 0x89, (byte) 0x50, (byte) 0x4E};

  private final int minBytes;

  public TileCache() {
    this(DEFAULT_MIN_BYTES);
  }

  public TileCache(int minBytes) {
    this.minBytes = minBytes;
  }

  /**
   * @return the cached image, or empty if there is no usable copy
   */
  public Optional<BufferedImage> load(File file) {
    if (!file.isFile() || file.length() < minBytes) {
      return Optional.empty();
    }
    try {
      byte[] header = new byte[3];
      try (InputStream in = new FileInputStream(file)) {
        if (ByteStreams.read(in, header, 0, header.length) < header.length || !hasImageSignature(header)) {
          LOG.debug("Ignoring {} which is not a JPEG or PNG", file);
          return Optional.empty();
        }
      }
      return Optional.ofNullable(ImageIO.read(file));

    } catch (IOException e) {
      LOG.warn("Unable to read cached tile {}", file, e);
      return Optional.empty();
    }
  }

  /**
   * Writes the fetched bytes unchanged, creating the directory as needed.
   */
  public void store(File file, byte[] data) throws IOException {
    Files.createParentDirs(file);
    Files.write(data, file);
    LOG.debug("Cached {} bytes at {}", data.length, file);
  }

  @VisibleForTesting
  static boolean hasImageSignature(byte[] header) {
    return startsWith(header, JPEG_MAGIC) || startsWith(header, PNG_MAGIC);
  }

  private static boolean startsWith(byte[] data, byte[] prefix) {
    if (data.length < prefix.length) {
      return false;
    }
    for (int i = 0; i < prefix.length; i++) {
      if (data[i] != prefix[i]) {
        return false;
      }
    }
    return true;
  }

  public int getMinBytes() {
    return minBytes;
  }
}
