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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.UnmodifiableIterator;
import com.google.common.primitives.UnsignedLongs;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.Immutable;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * An S2CellId is a 64-bit unsigned integer that uniquely identifies a cell in the hierarchical
 * decomposition of the sphere. The six faces of a cube are the cells at level 0, and each cell is
 * subdivided into four children down to {@link #MAX_LEVEL}.
 *
 * <p>The id is laid out as follows:
 *
 * <pre>
 *   id = [face][child]^k 1 0^(2 * (MAX_LEVEL - k))
 * </pre>
 *
 * where the face takes 3 bits, each child position takes 2 bits, and k is the level. The lowest
 * set bit therefore marks the level of the cell, and a cell's descendants occupy the contiguous
 * range of ids between {@link #rangeMin()} and {@link #rangeMax()}.
 *
 * <p>Within a face the children are visited in the order of a Hilbert curve, so cells that are
 * close together in id order are close together on the sphere. Ids are ordered as unsigned
 * integers, which puts every face-5 cell after every face-0 cell.
 */
@Immutable
@CheckReturnValue
public final strictfp class S2CellId implements Comparable<S2CellId> {
  public static final int FACE_BITS = 3;
  public static final int NUM_FACES = 6;
  public static final int MAX_LEVEL = 30; // Valid levels: 0..MAX_LEVEL
  public static final int POS_BITS = 2 * MAX_LEVEL + 1;
  public static final int MAX_SIZE = 1 << MAX_LEVEL;

  // LOOKUP_POS maps 4 bits of i, 4 bits of j and 2 orientation bits to 8 bits of Hilbert curve
  // position plus the 2 bits of the subcell's orientation. LOOKUP_IJ is its inverse.
  private static final int LOOKUP_BITS = 4;
  private static final int LOOKUP_MASK = (1 << LOOKUP_BITS) - 1;
  private static final int ORIENTATION_MASK = S2.SWAP_MASK | S2.INVERT_MASK;
  private static final int[] LOOKUP_POS = new int[1 << (2 * LOOKUP_BITS + 2)];
  private static final int[] LOOKUP_IJ = new int[1 << (2 * LOOKUP_BITS + 2)];

  /** Offset that wraps the Hilbert curve from the last face back to the first. */
  private static final long WRAP_OFFSET = ((long) NUM_FACES) << POS_BITS;

  static {
    for (int orientation = 0; orientation <= ORIENTATION_MASK; orientation++) {
      initLookupCell(0, 0, 0, orientation, 0, orientation);
    }
  }

  private final long id;

  public S2CellId(long id) {
    this.id = id;
  }

  /** Returns an invalid cell id, equal to zero. */
  public static S2CellId none() {
    return new S2CellId(0);
  }

  /** Returns an invalid cell id that orders after every valid cell id. */
  public static S2CellId sentinel() {
    return new S2CellId(-1L);
  }

  /** Returns the level 0 cell for the given face (0..5). */
  public static S2CellId fromFace(int face) {
    return new S2CellId((((long) face) << POS_BITS) + lowestOnBitForLevel(0));
  }

  /**
   * Returns the cell at the given level that contains the given Hilbert curve position on the
   * given face. The position is an unsigned value of {@link #POS_BITS} bits.
   */
  public static S2CellId fromFacePosLevel(int face, long pos, int level) {
    return new S2CellId((((long) face) << POS_BITS) + (pos | 1)).parent(level);
  }

  /** Returns the leaf cell containing the given direction vector, which need not be unit length. */
  public static S2CellId fromPoint(S2Point p) {
    int face = S2Projections.xyzToFace(p);
    R2Vector uv = S2Projections.validFaceXyzToUv(face, p);
    int i = S2Projections.stToIj(S2Projections.uvToST(uv.x()));
    int j = S2Projections.stToIj(S2Projections.uvToST(uv.y()));
    return fromFaceIJ(face, i, j);
  }

  /** Returns the leaf cell containing the given latitude and longitude. */
  public static S2CellId fromLatLng(S2LatLng ll) {
    return fromPoint(ll.toPoint());
  }

  /** Returns the leaf cell with the given face (0..5) and leaf coordinates i, j (0..2**30-1). */
  public static S2CellId fromFaceIJ(int face, int i, int j) {
    // Faces alternate in handedness, so odd faces start with their axes swapped.
    int bits = face & S2.SWAP_MASK;
    long pos = 0;
    for (int k = 7; k >= 0; --k) {
      bits += ((i >> (k * LOOKUP_BITS)) & LOOKUP_MASK) << (LOOKUP_BITS + 2);
      bits += ((j >> (k * LOOKUP_BITS)) & LOOKUP_MASK) << 2;
      bits = LOOKUP_POS[bits];
      pos |= ((long) (bits >> 2)) << (k * 2 * LOOKUP_BITS);
      bits &= ORIENTATION_MASK;
    }
    return new S2CellId((((long) face) << POS_BITS) + (pos << 1) + 1);
  }

  /** The face, leaf (i,j) coordinates, and Hilbert curve orientation of a cell. */
  public static final class FaceIJ {
    public final int face;
    public final int i;
    public final int j;
    public final int orientation;

    FaceIJ(int face, int i, int j, int orientation) {
      this.face = face;
      this.i = i;
      this.j = j;
      this.orientation = orientation;
    }
  }

  /**
   * Returns the face and (i,j) coordinates of a leaf cell next to the center of this cell, along
   * with the orientation of the Hilbert curve within this cell.
   */
  public FaceIJ toFaceIJOrientation() {
    int face = face();
    int bits = face & S2.SWAP_MASK;
    int i = 0;
    int j = 0;
    for (int k = 7; k >= 0; --k) {
      // The top group holds only the 2 remaining levels below the face bits.
      int nbits = (k == 7) ? (MAX_LEVEL - 7 * LOOKUP_BITS) : LOOKUP_BITS;
      bits += ((int) (id >>> (k * 2 * LOOKUP_BITS + 1)) & ((1 << (2 * nbits)) - 1)) << 2;
      bits = LOOKUP_IJ[bits];
      i += (bits >> (LOOKUP_BITS + 2)) << (k * LOOKUP_BITS);
      j += ((bits >> 2) & LOOKUP_MASK) << (k * LOOKUP_BITS);
      bits &= ORIENTATION_MASK;
    }
    // The trailing "10 00 00 ..." of a non-leaf id was decoded as real positions. The "10" leaves
    // the orientation alone and each "00" flips the swap bit, so an odd number of "00" groups must
    // be undone.
    if ((lowestOnBit() & 0x1111111111111110L) != 0) {
      bits ^= S2.SWAP_MASK;
    }
    return new FaceIJ(face, i, j, bits);
  }

  /** Discrete (si,ti) coordinates of a cell center. */
  static final class FaceSiTi {
    final int face;
    final long si;
    final long ti;

    FaceSiTi(int face, long si, long ti) {
      this.face = face;
      this.si = si;
      this.ti = ti;
    }
  }

  /** Returns the (face, si, ti) coordinates of the center of this cell. */
  FaceSiTi getCenterSiTi() {
    // toFaceIJOrientation() returns one of the two leaf cells nearest the center. For a cell of
    // size s >= 2 with lower-left corner (imin, jmin), that is (imin + s/2, jmin + s/2) or
    // (imin + s/2 - 1, jmin + s/2 - 1); the low bit of i tells them apart.
    FaceIJ fij = toFaceIJOrientation();
    int delta = isLeaf() ? 1 : (((fij.i ^ (((int) id) >>> 2)) & 1) != 0) ? 2 : 0;
    return new FaceSiTi(fij.face, 2L * fij.i + delta, 2L * fij.j + delta);
  }

  /**
   * Returns the center of the cell in (u,v) coordinates. This is the point where the cell is
   * subdivided into its children, which is generally not the midpoint of its (u,v) rectangle.
   */
  public R2Vector getCenterUV() {
    FaceSiTi center = getCenterSiTi();
    return new R2Vector(
        S2Projections.stToUV(S2Projections.siTiToSt(center.si)),
        S2Projections.stToUV(S2Projections.siTiToSt(center.ti)));
  }

  /** Returns the direction vector of the cell center, not necessarily of unit length. */
  public S2Point toPointRaw() {
    FaceSiTi center = getCenterSiTi();
    return S2Projections.faceSiTiToXyz(center.face, center.si, center.ti);
  }

  /** Returns the unit-length direction vector of the cell center. */
  public S2Point toPoint() {
    return toPointRaw().normalize();
  }

  public S2LatLng toLatLng() {
    return new S2LatLng(toPointRaw());
  }

  /** The raw 64-bit id. */
  public long id() {
    return id;
  }

  /** Returns true if this id has a valid face and a level marker bit at an even position. */
  public boolean isValid() {
    return face() < NUM_FACES && ((lowestOnBit() & 0x1555555555555555L) != 0);
  }

  /** The cube face of this cell, 0..5 for valid ids. */
  public int face() {
    return (int) (id >>> POS_BITS);
  }

  /** The Hilbert curve position of the cell center on its face. */
  public long pos() {
    return id & (-1L >>> FACE_BITS);
  }

  public int level() {
    if (isLeaf()) {
      return MAX_LEVEL;
    }
    return MAX_LEVEL - (Long.numberOfTrailingZeros(id) >> 1);
  }

  /** Returns the edge length of cells at the given level in (i,j) space. */
  public static int getSizeIJ(int level) {
    return 1 << (MAX_LEVEL - level);
  }

  public boolean isLeaf() {
    return ((int) id & 1) != 0;
  }

  public boolean isFace() {
    return (id & (lowestOnBitForLevel(0) - 1)) == 0;
  }

  /**
   * Returns the position (0..3) of this cell's ancestor at the given level within its own parent.
   * The level must be in 1..level().
   */
  public int childPosition(int level) {
    return (int) (id >>> (2 * (MAX_LEVEL - level) + 1)) & 3;
  }

  /** Returns the first leaf cell contained by this cell. */
  public S2CellId rangeMin() {
    return new S2CellId(id - (lowestOnBit() - 1));
  }

  /** Returns the last leaf cell contained by this cell. */
  public S2CellId rangeMax() {
    return new S2CellId(id + (lowestOnBit() - 1));
  }

  /** Returns true if {@code other} is this cell or one of its descendants. */
  public boolean contains(S2CellId other) {
    // assert isValid() && other.isValid();
    return other.greaterOrEquals(rangeMin()) && other.lessOrEquals(rangeMax());
  }

  /** Returns true if the leaf ranges of the two cells overlap. */
  public boolean intersects(S2CellId other) {
    // assert isValid() && other.isValid();
    return other.rangeMin().lessOrEquals(rangeMax())
        && other.rangeMax().greaterOrEquals(rangeMin());
  }

  /** Returns the parent of this cell. Requires level() > 0. */
  public S2CellId parent() {
    // assert isValid() && level() > 0;
    long newLsb = lowestOnBit() << 2;
    return new S2CellId((id & -newLsb) | newLsb);
  }

  /** Returns the ancestor of this cell at the given level, which must be at most level(). */
  public S2CellId parent(int level) {
    // assert isValid() && level >= 0 && level <= this.level();
    long newLsb = lowestOnBitForLevel(level);
    return new S2CellId((id & -newLsb) | newLsb);
  }

  /** Returns the child at the given Hilbert position (0..3). Undefined for leaf cells. */
  public S2CellId child(int position) {
    // assert isValid() && !isLeaf();
    long newLsb = lowestOnBit() >>> 2;
    return new S2CellId(id + (2 * position + 1 - 4) * newLsb);
  }

  /** Returns the four children of this cell in Hilbert order, or nothing for a leaf cell. */
  public Iterable<S2CellId> children() {
    if (isLeaf()) {
      return ImmutableList.of();
    }
    return childrenAtLevel(level() + 1);
  }

  /** Returns all descendants of this cell at the given level, in Hilbert order. */
  public Iterable<S2CellId> childrenAtLevel(final int level) {
    Preconditions.checkState(isValid(), "Invalid cell id %s", id);
    Preconditions.checkArgument(
        level >= this.level() && level <= MAX_LEVEL, "Level %s out of range", level);
    return new Iterable<S2CellId>() {
      @Override
      public Iterator<S2CellId> iterator() {
        return new UnmodifiableIterator<S2CellId>() {
          private S2CellId next = childBegin(level);
          private final long end = childEnd(level).id();

          @Override
          public boolean hasNext() {
            return next.id() != end;
          }

          @Override
          public S2CellId next() {
            if (!hasNext()) {
              throw new NoSuchElementException();
            }
            S2CellId result = next;
            next = next.next();
            return result;
          }
        };
      }
    };
  }

  // Children are traversed with the pattern
  //
  //   for (S2CellId c = id.childBegin(); !c.equals(id.childEnd()); c = c.next()) { ... }
  //
  // childEnd() is exclusive and may not be a valid cell id.

  /** Returns the first child of this cell in Hilbert order. */
  public S2CellId childBegin() {
    // assert isValid() && level() < MAX_LEVEL;
    long oldLsb = lowestOnBit();
    return new S2CellId(id - oldLsb + (oldLsb >>> 2));
  }

  /** Returns the first descendant at the given level, which must be at least level(). */
  public S2CellId childBegin(int level) {
    // assert isValid() && level >= this.level() && level <= MAX_LEVEL;
    return new S2CellId(id - lowestOnBit() + lowestOnBitForLevel(level));
  }

  /** Returns the cell following the last child of this cell. May be invalid. */
  public S2CellId childEnd() {
    // assert isValid() && level() < MAX_LEVEL;
    long oldLsb = lowestOnBit();
    return new S2CellId(id + oldLsb + (oldLsb >>> 2));
  }

  /** Returns the cell following the last descendant at the given level. May be invalid. */
  public S2CellId childEnd(int level) {
    // assert isValid() && level >= this.level() && level <= MAX_LEVEL;
    return new S2CellId(id + lowestOnBit() + lowestOnBitForLevel(level));
  }

  /** Returns the next cell at the same level. Crosses faces but does not wrap after face 5. */
  public S2CellId next() {
    return new S2CellId(id + (lowestOnBit() << 1));
  }

  /** Returns the previous cell at the same level. Crosses faces but does not wrap before face 0. */
  public S2CellId prev() {
    return new S2CellId(id - (lowestOnBit() << 1));
  }

  /** Like {@link #next()}, but wraps from the last face to the first. */
  public S2CellId nextWrap() {
    S2CellId n = next();
    if (UnsignedLongs.compare(n.id, WRAP_OFFSET) < 0) {
      return n;
    }
    return new S2CellId(n.id - WRAP_OFFSET);
  }

  /** Like {@link #prev()}, but wraps from the first face to the last. */
  public S2CellId prevWrap() {
    S2CellId p = prev();
    if (UnsignedLongs.compare(p.id, WRAP_OFFSET) < 0) {
      return p;
    }
    return new S2CellId(p.id + WRAP_OFFSET);
  }

  /** Returns the first cell at the given level across all six faces. */
  public static S2CellId begin(int level) {
    return fromFace(0).childBegin(level);
  }

  /** Returns the cell following the last cell at the given level. Not a valid cell id. */
  public static S2CellId end(int level) {
    return fromFace(5).childEnd(level);
  }

  /**
   * Returns the lowest set bit of the id, {@code 1L << (2 * (MAX_LEVEL - level()))}. A smaller
   * value means a deeper level.
   */
  public long lowestOnBit() {
    return id & -id;
  }

  /** Returns the lowest set bit of any cell id at the given level. */
  public static long lowestOnBitForLevel(int level) {
    return 1L << (2 * (MAX_LEVEL - level));
  }

  public boolean lessThan(S2CellId x) {
    return compareTo(x) < 0;
  }

  public boolean greaterThan(S2CellId x) {
    return compareTo(x) > 0;
  }

  public boolean lessOrEquals(S2CellId x) {
    return compareTo(x) <= 0;
  }

  public boolean greaterOrEquals(S2CellId x) {
    return compareTo(x) >= 0;
  }

  /** Orders ids as unsigned 64-bit integers. */
  @Override
  public int compareTo(S2CellId that) {
    return UnsignedLongs.compare(id, that.id);
  }

  @Override
  public boolean equals(Object that) {
    if (!(that instanceof S2CellId)) {
      return false;
    }
    return id == ((S2CellId) that).id;
  }

  @Override
  public int hashCode() {
    return (int) ((id >>> 32) + id);
  }

  @Override
  public String toString() {
    return "(face=" + face() + ", pos=" + Long.toHexString(pos()) + ", level=" + level() + ")";
  }

  private static void initLookupCell(
      int level, int i, int j, int origOrientation, int pos, int orientation) {
    if (level == LOOKUP_BITS) {
      int ij = (i << LOOKUP_BITS) + j;
      LOOKUP_POS[(ij << 2) + origOrientation] = (pos << 2) + orientation;
      LOOKUP_IJ[(pos << 2) + origOrientation] = (ij << 2) + orientation;
      return;
    }
    level++;
    i <<= 1;
    j <<= 1;
    pos <<= 2;
    for (int subPos = 0; subPos < 4; subPos++) {
      int ij = S2.posToIJ(orientation, subPos);
      initLookupCell(
          level,
          i + (ij >>> 1),
          j + (ij & 1),
          origOrientation,
          pos + subPos,
          orientation ^ S2.posToOrientation(subPos));
    }
  }
}
