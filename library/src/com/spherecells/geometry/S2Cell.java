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

import com.google.common.collect.ImmutableList;
import java.util.Collection;

/**
 * An S2Cell is an {@link S2CellId} together with its face, orientation and (u,v) bounds, which
 * makes geometric queries against the cell cheap.
 */
public final strictfp class S2Cell implements S2Region {
  /**
   * The minimum latitude of the two polar face cells, reached at their vertices, less the maximum
   * error of the computation.
   */
  private static final double POLE_MIN_LAT = Math.asin(Math.sqrt(1. / 3)) - 0.5 * S2.DBL_EPSILON;

  private final S2CellId cellId;
  private final int face;
  private final int level;
  private final int orientation;
  private final double uMin;
  private final double uMax;
  private final double vMin;
  private final double vMax;

  public S2Cell(S2CellId id) {
    S2CellId.FaceIJ fij = id.toFaceIJOrientation();
    this.cellId = id;
    this.face = fij.face;
    this.level = id.level();
    this.orientation = fij.orientation;
    int size = S2CellId.getSizeIJ(level);
    int iLo = fij.i & -size;
    int jLo = fij.j & -size;
    this.uMin = S2Projections.stToUV(S2Projections.ijToStMin(iLo));
    this.uMax = S2Projections.stToUV(S2Projections.ijToStMin(iLo + size));
    this.vMin = S2Projections.stToUV(S2Projections.ijToStMin(jLo));
    this.vMax = S2Projections.stToUV(S2Projections.ijToStMin(jLo + size));
  }

  private S2Cell(
      S2CellId cellId,
      int face,
      int level,
      int orientation,
      double uMin,
      double uMax,
      double vMin,
      double vMax) {
    this.cellId = cellId;
    this.face = face;
    this.level = level;
    this.orientation = orientation;
    this.uMin = uMin;
    this.uMax = uMax;
    this.vMin = vMin;
    this.vMax = vMax;
  }

  /** Returns the cell containing the given point. */
  public S2Cell(S2Point p) {
    this(S2CellId.fromPoint(p));
  }

  public static S2Cell fromFace(int face) {
    return new S2Cell(S2CellId.fromFace(face));
  }

  public static S2Cell fromFacePosLevel(int face, long pos, int level) {
    return new S2Cell(S2CellId.fromFacePosLevel(face, pos, level));
  }

  public S2CellId id() {
    return cellId;
  }

  public int face() {
    return face;
  }

  public int level() {
    return level;
  }

  public int orientation() {
    return orientation;
  }

  public boolean isLeaf() {
    return level == S2CellId.MAX_LEVEL;
  }

  public R1Interval getBoundU() {
    return new R1Interval(uMin, uMax);
  }

  public R1Interval getBoundV() {
    return new R1Interval(vMin, vMax);
  }

  /**
   * Returns the k-th vertex of the cell (k = 0,1,2,3) in counter-clockwise order: lower left,
   * lower right, upper right, upper left in the (u,v) plane. Not necessarily unit length.
   */
  public S2Point getVertexRaw(int k) {
    return S2Projections.faceUvToXyz(
        face, ((k >> 1) ^ (k & 1)) == 0 ? uMin : uMax, (k >> 1) == 0 ? vMin : vMax);
  }

  public S2Point getVertex(int k) {
    return getVertexRaw(k).normalize();
  }

  /**
   * Returns the inward-facing normal of the great circle through the edge from vertex k to vertex
   * k+1 (mod 4). Not necessarily unit length.
   */
  public S2Point getEdgeRaw(int k) {
    switch (k & 3) {
      case 0:
        return S2Projections.getVNorm(face, vMin);
      case 1:
        return S2Projections.getUNorm(face, uMax);
      case 2:
        return S2Projections.getVNorm(face, vMax).neg();
      default:
        return S2Projections.getUNorm(face, uMin).neg();
    }
  }

  /** Returns the point where the cell is subdivided into its children. */
  public S2Point getCenter() {
    return getCenterRaw().normalize();
  }

  public S2Point getCenterRaw() {
    return cellId.toPointRaw();
  }

  public R2Vector getCenterUV() {
    return cellId.getCenterUV();
  }

  /** Returns the four children of this cell in Hilbert order, or an empty list for a leaf cell. */
  public ImmutableList<S2Cell> subdivide() {
    if (isLeaf()) {
      return ImmutableList.of();
    }
    R2Vector mid = getCenterUV();
    ImmutableList.Builder<S2Cell> children = ImmutableList.builder();
    S2CellId id = cellId.childBegin();
    for (int pos = 0; pos < 4; ++pos, id = id.next()) {
      // Bit 1 of the IJ-index selects the u half and bit 0 the v half.
      int ij = S2.posToIJ(orientation, pos);
      boolean upperU = (ij & 2) != 0;
      boolean upperV = (ij & 1) != 0;
      children.add(
          new S2Cell(
              id,
              face,
              level + 1,
              orientation ^ S2.posToOrientation(pos),
              upperU ? mid.x() : uMin,
              upperU ? uMax : mid.x(),
              upperV ? mid.y() : vMin,
              upperV ? vMax : mid.y()));
    }
    return children.build();
  }

  /** Returns the average area in steradians of cells at the given level. */
  public static double averageArea(int level) {
    return Math.scalb(4 * Math.PI / 6, -2 * level);
  }

  public double averageArea() {
    return averageArea(level);
  }

  /**
   * Returns the approximate area of this cell, accurate to within 3% for all levels and 0.1% from
   * level 5 down.
   */
  public double approxArea() {
    // All cells at the first two levels have the same area.
    if (level < 2) {
      return averageArea(level);
    }
    // Half the cross product of the diagonals is the area projected onto the cell's tangent
    // plane. The cap-to-disc area ratio 2 / (1 + sqrt(1 - r*r)) then corrects for curvature.
    double flatArea =
        0.5
            * getVertex(2)
                .sub(getVertex(0))
                .crossProd(getVertex(3).sub(getVertex(1)))
                .norm();
    return flatArea * 2 / (1 + Math.sqrt(1 - Math.min(S2.M_1_PI * flatArea, 1.0)));
  }

  @Override
  public S2Cap getCapBound() {
    // The (u,v) center is close to the center of the minimal bounding cap and cheap to compute.
    S2Point center = S2Projections.faceUvToXyz(face, getCenterUV()).normalize();
    S2Cap cap = S2Cap.fromAxisHeight(center, 0);
    for (int k = 0; k < 4; ++k) {
      cap = cap.addPoint(getVertex(k));
    }
    return cap;
  }

  @Override
  public S2LatLngRect getRectBound() {
    if (level > 0) {
      // Below level 0 the latitude extremes are attained at one pair of diagonally opposite
      // vertices and the longitude extremes at the other pair. (i, j) picks the corner with the
      // largest absolute latitude.
      double u = uMin + uMax;
      double v = vMin + vMax;
      int i = (S2Projections.getUAxis(face).z == 0 ? (u < 0) : (u > 0)) ? 1 : 0;
      int j = (S2Projections.getVAxis(face).z == 0 ? (v < 0) : (v > 0)) ? 1 : 0;
      R1Interval lat =
          R1Interval.fromPointPair(
              S2LatLng.latitude(getPoint(i, j)).radians(),
              S2LatLng.latitude(getPoint(1 - i, 1 - j)).radians());
      S1Interval lng =
          S1Interval.fromPointPair(
              S2LatLng.longitude(getPoint(i, 1 - j)).radians(),
              S2LatLng.longitude(getPoint(1 - i, j)).radians());
      // Normalizing the vertices can move a contained point's latitude or longitude past these
      // bounds by up to 2 * DBL_EPSILON.
      return new S2LatLngRect(lat, lng)
          .expanded(2 * S2.DBL_EPSILON, 2 * S2.DBL_EPSILON)
          .polarClosure();
    }

    S2LatLngRect bound;
    switch (face) {
      case 0:
        bound =
            new S2LatLngRect(
                new R1Interval(-S2.M_PI_4, S2.M_PI_4), new S1Interval(-S2.M_PI_4, S2.M_PI_4));
        break;
      case 1:
        bound =
            new S2LatLngRect(
                new R1Interval(-S2.M_PI_4, S2.M_PI_4), new S1Interval(S2.M_PI_4, 3 * S2.M_PI_4));
        break;
      case 2:
        bound = new S2LatLngRect(new R1Interval(POLE_MIN_LAT, S2.M_PI_2), S1Interval.full());
        break;
      case 3:
        bound =
            new S2LatLngRect(
                new R1Interval(-S2.M_PI_4, S2.M_PI_4),
                new S1Interval(3 * S2.M_PI_4, -3 * S2.M_PI_4));
        break;
      case 4:
        bound =
            new S2LatLngRect(
                new R1Interval(-S2.M_PI_4, S2.M_PI_4), new S1Interval(-3 * S2.M_PI_4, -S2.M_PI_4));
        break;
      default:
        bound = new S2LatLngRect(new R1Interval(-S2.M_PI_2, -POLE_MIN_LAT), S1Interval.full());
        break;
    }
    // Latitude is computed with rounding error; longitude comes from a single atan2 call, which
    // is monotonic.
    return bound.expanded(S2.DBL_EPSILON, 0);
  }

  @Override
  public void getCellUnionBound(Collection<S2CellId> results) {
    results.add(cellId);
  }

  @Override
  public boolean mayIntersect(S2Cell cell) {
    return cellId.intersects(cell.cellId);
  }

  @Override
  public boolean contains(S2Cell cell) {
    return cellId.contains(cell.cellId);
  }

  /**
   * Returns true if the cell contains {@code p}, which need not be unit length. Points on an edge
   * shared with a neighboring cell are contained by both cells.
   */
  @Override
  public boolean contains(S2Point p) {
    // faceXyzToUv rather than xyzToFace, since a point on a face boundary belongs to both faces.
    R2Vector uv = S2Projections.faceXyzToUv(face, p);
    if (uv == null) {
      return false;
    }
    return uv.x() >= uMin && uv.x() <= uMax && uv.y() >= vMin && uv.y() <= vMax;
  }

  private S2Point getPoint(int i, int j) {
    return S2Projections.faceUvToXyz(face, i == 0 ? uMin : uMax, j == 0 ? vMin : vMax);
  }

  @Override
  public boolean equals(Object that) {
    if (that instanceof S2Cell) {
      S2Cell other = (S2Cell) that;
      return face == other.face
          && level == other.level
          && orientation == other.orientation
          && cellId.equals(other.cellId);
    }
    return false;
  }

  @Override
  public int hashCode() {
    int value = 17;
    value = 37 * (37 * (37 * value + face) + orientation) + level;
    return 37 * value + cellId.hashCode();
  }

  @Override
  public String toString() {
    return "[" + face + ", " + level + ", " + orientation + ", " + cellId + "]";
  }
}
