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

import org.gbif.hips.common.coordinate.SkyPosition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;

import static java.lang.Math.PI;
import static java.lang.Math.acos;
import static java.lang.Math.atan2;
import static java.lang.Math.cos;
import static java.lang.Math.sin;
import static java.lang.Math.sqrt;
import static java.lang.Math.toDegrees;

/**
 * The HEALPix equal area, iso-latitude pixelization of the sphere in the NESTED scheme.
 * <p/>
 * HiPS tile servers address their tiles by NESTED pixel number, so these conversions follow the reference HEALPix C++
 * implementation step for step (including the {@code sin θ} branch close to the poles) in order that the pixel numbers
 * embedded in tile URLs are identical.
 * <p/>
 * Notes:
 * <ul>
 *   <li>At order {@code k} there are 12 base faces, each split into {@code nside × nside} pixels where
 *   {@code nside = 2^k}.</li>
 *   <li>Within a face a pixel is addressed by {@code (ix, iy)}; the NESTED number interleaves the bits of ix and iy
 *   below the face number.</li>
 *   <li>Failures are reported with sentinels ({@code -1} or {@link SkyPosition#ERROR}) rather than exceptions.</li>
 * </ul>
 *
 * This class is threadsafe.
 */
public class Healpix {
  private static final Logger LOG = LoggerFactory.getLogger(Healpix.class);

  /** Highest order whose pixel numbers fit in a long. */
  public static final int MAX_ORDER = 29;

  /** Returned by {@link #coordinateToPixel(SkyPosition, int)} when no pixel can be computed. */
  public static final long INVALID_PIXEL = -1;

  private static final double HALF_PI = PI / 2;
  private static final double INV_HALF_PI = 2 / PI;
  private static final double TWO_THIRDS = 2.0 / 3.0;

  // ring number (in units of nside) of the southern corner of each face, and its phi offset (in units of pi/4)
  private static final int[] JRLL = {2, 2, 2, 2, 3, 3, 3, 3, 4, 4, 4, 4};
  private static final int[] JPLL = {1, 3, 5, 7, 0, 2, 4, 6, 1, 3, 5, 7};

  // offsets of the native neighbour order: SW, W, NW, N, NE, E, SE, S
  private static final int[] X_OFFSET = {-1, -1, 0, 1, 1, 1, 0, -1};
  private static final int[] Y_OFFSET = {0, 1, 1, 1, 0, -1, -1, -1};

  // face reached when stepping off a face, indexed by [direction][face]; -1 means no face there
  private static final int[][] FACE_ARRAY = {
    {8, 9, 10, 11, -1, -1, -1, -1, 10, 11, 8, 9},  // S
    {5, 6, 7, 4, 8, 9, 10, 11, 9, 10, 11, 8},      // SE
    {-1, -1, -1, -1, 5, 6, 7, 4, -1, -1, -1, -1},  // E
    {4, 5, 6, 7, 11, 8, 9, 10, 11, 8, 9, 10},      // SW
    {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11},        // centre
    {1, 2, 3, 0, 0, 1, 2, 3, 5, 6, 7, 4},          // NE
    {-1, -1, -1, -1, 7, 4, 5, 6, -1, -1, -1, -1},  // W
    {3, 0, 1, 2, 3, 0, 1, 2, 4, 5, 6, 7},          // NW
    {2, 3, 0, 1, -1, -1, -1, -1, 0, 1, 2, 3}       // N
  };

  // coordinate flips needed on the new face, indexed by [direction][face row]: 1 flips x, 2 flips y, 4 swaps x and y
  private static final int[][] SWAP_ARRAY = {
    {0, 0, 3},  // S
    {0, 0, 6},  // SE
    {0, 0, 0},  // E
    {0, 0, 5},  // SW
    {0, 0, 0},  // centre
    {5, 0, 0},  // NE
    {0, 0, 0},  // W
    {6, 0, 0},  // NW
    {3, 0, 0}   // N
  };

  private Healpix() {}

  public static boolean isValidOrder(int order) {
    return order >= 0 && order <= MAX_ORDER;
  }

  public static boolean isValidPixel(long pixel, int order) {
    return isValidOrder(order) && pixel >= 0 && pixel < npix(order);
  }

  public static long nside(int order) {
    return 1L << order;
  }

  public static long npix(int order) {
    return 12L << (2 * order);
  }

  /**
   * The approximate linear size of a pixel, being the square root of its area.
   */
  public static double pixelSizeDegrees(int order) {
    double nside = nside(order);
    return toDegrees(sqrt(4 * PI / (12 * nside * nside)));
  }

  /**
   * The angular scale of a HiPS tile image whose width in image pixels spans one HEALPix pixel at the given order.
   * An order 8 tile of 512 pixels gives 1.61 arcsec per image pixel.
   */
  public static double arcsecPerPixel(int order, int tileWidth) {
    return pixelSizeDegrees(order) * 3600.0 / tileWidth;
  }

  /**
   * Locates the NESTED pixel containing the position.
   * @return the pixel number, or {@link #INVALID_PIXEL} for an invalid order or a non finite coordinate
   */
  public static long coordinateToPixel(SkyPosition position, int order) {
    if (!isValidOrder(order)) {
      LOG.warn("Invalid HEALPix order {}", order);
      return INVALID_PIXEL;
    }
    if (!Double.isFinite(position.getRaDeg()) || !Double.isFinite(position.getDecDeg())) {
      LOG.warn("Cannot locate non finite position {}", position);
      return INVALID_PIXEL;
    }

    double theta = (90.0 - position.getDecDeg()) * PI / 180.0;
    double phi = position.getRaDeg() * PI / 180.0;
    boolean nearPole = theta < 0.01 || theta > 3.14159 - 0.01;
    return locToPixel(cos(theta), phi, sin(theta), nearPole, order);
  }

  /**
   * The centre of the NESTED pixel.
   * @return the centre, or {@link SkyPosition#ERROR} if the pixel does not exist at the order
   */
  public static SkyPosition pixelToCoordinate(long pixel, int order) {
    if (!isValidPixel(pixel, order)) {
      LOG.warn("Pixel {} is not valid at order {}", pixel, order);
      return SkyPosition.ERROR;
    }

    long nside = nside(order);
    long npix = npix(order);
    double fact2 = 4.0 / npix;
    double fact1 = (nside << 1) * fact2;

    int face = (int) (pixel >>> (2 * order));
    long local = pixel & ((1L << (2 * order)) - 1);
    long ix = compressBits(local);
    long iy = compressBits(local >>> 1);

    long jr = ((long) JRLL[face] << order) - ix - iy - 1;

    long nr;
    double z;
    double sth = 0;
    boolean haveSth = false;
    if (jr < nside) {
      nr = jr;
      double tmp = (nr * nr) * fact2;
      z = 1 - tmp;
      if (z > 0.99) {
        sth = sqrt(tmp * (2.0 - tmp));
        haveSth = true;
      }
    } else if (jr > 3 * nside) {
      nr = nside * 4 - jr;
      double tmp = (nr * nr) * fact2;
      z = tmp - 1;
      if (z < -0.99) {
        sth = sqrt(tmp * (2.0 - tmp));
        haveSth = true;
      }
    } else {
      nr = nside;
      z = (2 * nside - jr) * fact1;
    }

    long tmp = JPLL[face] * nr + ix - iy;
    if (tmp < 0) {
      tmp += 8 * nr;
    }
    double phi = (nr == nside) ? 0.75 * HALF_PI * tmp * fact1 : (0.5 * HALF_PI * tmp) / nr;
    double theta = haveSth ? atan2(sth, z) : acos(z);

    return new SkyPosition(phi * 180.0 / PI, 90.0 - theta * 180.0 / PI, "HEALPix_" + pixel,
                           "Order " + order + " pixel " + pixel);
  }

  /**
   * Returns the eight neighbours of the pixel in the native order SW, W, NW, N, NE, E, SE, S where those directions
   * are relative to the face's own axes. Entries are -1 where the pixel sits on one of the 8 face corners having only
   * seven neighbours.
   * @return the neighbours, or null for an invalid pixel
   */
  public static long[] neighbours(long pixel, int order) {
    if (!isValidPixel(pixel, order)) {
      LOG.warn("Pixel {} is not valid at order {}", pixel, order);
      return null;
    }

    long nside = nside(order);
    int face = (int) (pixel >>> (2 * order));
    long local = pixel & ((1L << (2 * order)) - 1);
    long ix = compressBits(local);
    long iy = compressBits(local >>> 1);

    long[] result = new long[8];
    long nsm1 = nside - 1;
    if (ix > 0 && ix < nsm1 && iy > 0 && iy < nsm1) {
      // interior pixels never leave the face
      for (int m = 0; m < 8; m++) {
        result[m] = xyfToNest(ix + X_OFFSET[m], iy + Y_OFFSET[m], face, order);
      }
      return result;
    }

    for (int i = 0; i < 8; i++) {
      long x = ix + X_OFFSET[i];
      long y = iy + Y_OFFSET[i];
      int nbnum = 4;
      if (x < 0) {
        x += nside;
        nbnum -= 1;
      } else if (x >= nside) {
        x -= nside;
        nbnum += 1;
      }
      if (y < 0) {
        y += nside;
        nbnum -= 3;
      } else if (y >= nside) {
        y -= nside;
        nbnum += 3;
      }

      int f = FACE_ARRAY[nbnum][face];
      if (f >= 0) {
        int bits = SWAP_ARRAY[nbnum][face >> 2];
        if ((bits & 1) != 0) {
          x = nside - x - 1;
        }
        if ((bits & 2) != 0) {
          y = nside - y - 1;
        }
        if ((bits & 4) != 0) {
          long t = x;
          x = y;
          y = t;
        }
        result[i] = xyfToNest(x, y, f, order);
      } else {
        result[i] = INVALID_PIXEL;
      }
    }
    return result;
  }

  private static long locToPixel(double z, double phi, double sth, boolean haveSth, int order) {
    long nside = nside(order);
    double za = Math.abs(z);
    double tt = fmodulo(phi * INV_HALF_PI, 4.0); // in [0,4)

    if (za <= TWO_THIRDS) {
      // equatorial region
      double temp1 = nside * (0.5 + tt);
      double temp2 = nside * (z * 0.75);
      long jp = (long) (temp1 - temp2); // index of ascending edge line
      long jm = (long) (temp1 + temp2); // index of descending edge line
      long ifp = jp >> order;
      long ifm = jm >> order;
      int face = (int) ((ifp == ifm) ? (ifp | 4) : ((ifp < ifm) ? ifp : (ifm + 8)));
      long ix = jm & (nside - 1);
      long iy = nside - (jp & (nside - 1)) - 1;
      return xyfToNest(ix, iy, face, order);
    }

    // polar caps
    int ntt = Math.min(3, (int) tt);
    double tp = tt - ntt;
    double tmp = (za < 0.99 || !haveSth) ? nside * sqrt(3 * (1 - za)) : nside * sth / sqrt((1.0 + za) / 3.0);

    long jp = (long) (tp * tmp);
    long jm = (long) ((1.0 - tp) * tmp);
    // for points too close to the boundary
    jp = Math.min(jp, nside - 1);
    jm = Math.min(jm, nside - 1);
    return z >= 0
      ? xyfToNest(nside - jm - 1, nside - jp - 1, ntt, order)
      : xyfToNest(jp, jm, ntt + 8, order);
  }

  @VisibleForTesting
  static long xyfToNest(long ix, long iy, int face, int order) {
    return ((long) face << (2 * order)) + spreadBits(ix) + (spreadBits(iy) << 1);
  }

  /**
   * Spreads the low 32 bits of v to the even bit positions.
   */
  @VisibleForTesting
  static long spreadBits(long v) {
    v = (v | (v << 16)) & 0x0000FFFF0000FFFFL;
    v = (v | (v << 8)) & 0x00FF00FF00FF00FFL;
    v = (v | (v << 4)) & 0x0F0F0F0F0F0F0F0FL;
    v = (v | (v << 2)) & 0x3333333333333333L;
    v = (v | (v << 1)) & 0x5555555555555555L;
    return v;
  }

  /**
   * Inverse of {@link #spreadBits(long)}, collecting the even bits of v.
   */
  @VisibleForTesting
  static long compressBits(long v) {
    v &= 0x5555555555555555L;
    v = (v | (v >>> 1)) & 0x3333333333333333L;
    v = (v | (v >>> 2)) & 0x0F0F0F0F0F0F0F0FL;
    v = (v | (v >>> 4)) & 0x00FF00FF00FF00FFL;
    v = (v | (v >>> 8)) & 0x0000FFFF0000FFFFL;
    v = (v | (v >>> 16)) & 0x00000000FFFFFFFFL;
    return v;
  }

  private static double fmodulo(double v1, double v2) {
    if (v1 >= 0) {
      return (v1 < v2) ? v1 : v1 % v2;
    }
    double tmp = v1 % v2 + v2;
    return (tmp == v2) ? 0.0 : tmp;
  }
}
