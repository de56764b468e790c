/*
 * Copyright 2005 Google Inc.
 *
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
package com.spherecells.geometry;

import org.jspecify.annotations.Nullable;

/**
 * Conversions between the coordinate systems used by the cell decomposition.
 *
 * <ul>
 *   <li>(face, i, j): leaf-cell coordinates, with i and j in [0, 2**30).
 *   <li>(face, s, t): cell-space coordinates in [0,1]x[0,1].
 *   <li>(face, si, ti): discrete cell-space coordinates, {@code s = si / MAX_SITI}. Cell centers
 *       and vertices have integer (si, ti) values.
 *   <li>(face, u, v): cube-space coordinates in [-1,1]x[-1,1].
 *   <li>(x, y, z): direction vectors in 3-space.
 * </ul>
 *
 * <p>The (s,t) to (u,v) mapping is the quadratic projection, which keeps cell areas within a
 * factor of about 2.1 of each other at any given level while staying cheap to evaluate.
 */
public final strictfp class S2Projections {
  /** The maximum value of an si- or ti-coordinate, one past the largest valid value. */
  public static final long MAX_SITI = 1L << (S2CellId.MAX_LEVEL + 1);

  /** The (u, v, w) axes of each face, w being the face normal. */
  private static final S2Point[][] FACE_UVW_AXES = {
    {S2Point.Y_POS, S2Point.Z_POS, S2Point.X_POS},
    {S2Point.X_NEG, S2Point.Z_POS, S2Point.Y_POS},
    {S2Point.X_NEG, S2Point.Y_NEG, S2Point.Z_POS},
    {S2Point.Z_NEG, S2Point.Y_NEG, S2Point.X_NEG},
    {S2Point.Z_NEG, S2Point.X_POS, S2Point.Y_NEG},
    {S2Point.Y_POS, S2Point.X_POS, S2Point.Z_NEG}
  };

  private S2Projections() {}

  /** Converts an s- or t-value in [0,1] to the corresponding u- or v-value in [-1,1]. */
  public static double stToUV(double s) {
    if (s >= 0.5) {
      return (1 / 3.) * (4 * s * s - 1);
    } else {
      return (1 / 3.) * (1 - 4 * (1 - s) * (1 - s));
    }
  }

  /**
   * The inverse of {@link #stToUV(double)}. Note that {@code uvToST(stToUV(x)) == x} does not
   * always hold exactly because of rounding.
   */
  public static double uvToST(double u) {
    if (u >= 0) {
      return 0.5 * Math.sqrt(1 + 3 * u);
    } else {
      return 1 - 0.5 * Math.sqrt(1 - 3 * u);
    }
  }

  /**
   * Returns the i- or j-index of the leaf cell containing the given s- or t-value, clamped to the
   * range of valid leaf cell indices.
   */
  public static int stToIj(double s) {
    return Math.max(
        0, Math.min(S2CellId.MAX_SIZE - 1, (int) Math.round(S2CellId.MAX_SIZE * s - 0.5)));
  }

  /**
   * Returns the minimum s- or t-value of the leaf cell with the given i- or j-index. The argument
   * may be up to {@code MAX_SIZE}, one past the last valid index.
   */
  public static double ijToStMin(int i) {
    // assert i >= 0 && i <= S2CellId.MAX_SIZE;
    return (1.0 / S2CellId.MAX_SIZE) * i;
  }

  /** Returns the s- or t-value corresponding to the given si- or ti-value. */
  public static double siTiToSt(long si) {
    // assert si >= 0 && si <= MAX_SITI;
    return (1.0 / MAX_SITI) * si;
  }

  /** Returns the nearest si- or ti-value to the given s- or t-value. */
  public static long stToSiTi(double s) {
    return Math.round(s * MAX_SITI);
  }

  /**
   * Converts (face, u, v) coordinates to a direction vector, not necessarily of unit length. The
   * face must be in 0..5.
   */
  public static S2Point faceUvToXyz(int face, double u, double v) {
    switch (face) {
      case 0:
        return new S2Point(1, u, v);
      case 1:
        return new S2Point(-u, 1, v);
      case 2:
        return new S2Point(-u, -v, 1);
      case 3:
        return new S2Point(-1, -v, -u);
      case 4:
        return new S2Point(v, -1, -u);
      default:
        return new S2Point(v, u, -1);
    }
  }

  public static S2Point faceUvToXyz(int face, R2Vector uv) {
    return faceUvToXyz(face, uv.x(), uv.y());
  }

  /** Converts (face, si, ti) coordinates to a direction vector, not necessarily unit length. */
  public static S2Point faceSiTiToXyz(int face, long si, long ti) {
    double u = stToUV(siTiToSt(si));
    double v = stToUV(siTiToSt(ti));
    return faceUvToXyz(face, u, v);
  }

  /** Returns the face containing the given direction vector. */
  public static int xyzToFace(S2Point p) {
    return xyzToFace(p.x, p.y, p.z);
  }

  static int xyzToFace(double x, double y, double z) {
    int face = S2Point.largestAbsComponent(x, y, z);
    double component;
    switch (face) {
      case 0:
        component = x;
        break;
      case 1:
        component = y;
        break;
      default:
        component = z;
        break;
    }
    return component < 0 ? face + 3 : face;
  }

  /**
   * Returns the (u,v) coordinates of {@code p} on the given face, which must be a face whose
   * normal has a positive dot product with {@code p}. The result may lie outside [-1,1].
   */
  public static R2Vector validFaceXyzToUv(int face, S2Point p) {
    switch (face) {
      case 0:
        return new R2Vector(p.y / p.x, p.z / p.x);
      case 1:
        return new R2Vector(-p.x / p.y, p.z / p.y);
      case 2:
        return new R2Vector(-p.x / p.z, -p.y / p.z);
      case 3:
        return new R2Vector(p.z / p.x, p.y / p.x);
      case 4:
        return new R2Vector(p.z / p.y, -p.x / p.y);
      default:
        return new R2Vector(-p.y / p.z, -p.x / p.z);
    }
  }

  /**
   * Returns the (u,v) coordinates of {@code p} on the given face, or null if {@code p} does not
   * lie in the hemisphere centered on that face's normal.
   */
  public static @Nullable R2Vector faceXyzToUv(int face, S2Point p) {
    if (face < 3) {
      if (p.get(face) <= 0) {
        return null;
      }
    } else {
      if (p.get(face - 3) >= 0) {
        return null;
      }
    }
    return validFaceXyzToUv(face, p);
  }

  /**
   * Returns the right-handed normal (not necessarily unit length) for an edge in the direction of
   * the positive v-axis at the given u-value on the given face.
   */
  public static S2Point getUNorm(int face, double u) {
    switch (face) {
      case 0:
        return new S2Point(u, -1, 0);
      case 1:
        return new S2Point(1, u, 0);
      case 2:
        return new S2Point(1, 0, u);
      case 3:
        return new S2Point(-u, 0, 1);
      case 4:
        return new S2Point(0, -u, 1);
      default:
        return new S2Point(0, -1, -u);
    }
  }

  /**
   * Returns the right-handed normal (not necessarily unit length) for an edge in the direction of
   * the positive u-axis at the given v-value on the given face.
   */
  public static S2Point getVNorm(int face, double v) {
    switch (face) {
      case 0:
        return new S2Point(-v, 0, 1);
      case 1:
        return new S2Point(0, -v, 1);
      case 2:
        return new S2Point(0, -1, -v);
      case 3:
        return new S2Point(v, -1, 0);
      case 4:
        return new S2Point(1, v, 0);
      default:
        return new S2Point(1, 0, v);
    }
  }

  public static S2Point getUAxis(int face) {
    return FACE_UVW_AXES[face][0];
  }

  public static S2Point getVAxis(int face) {
    return FACE_UVW_AXES[face][1];
  }

  /** Returns the unit-length normal of the given face. */
  public static S2Point getNorm(int face) {
    return FACE_UVW_AXES[face][2];
  }
}
