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

/**
 * Constants and small lookup tables shared by the cell decomposition classes.
 *
 * <p>The Hilbert curve tables describe how the four children of a cell are ordered. A cell
 * orientation is a combination of {@link #SWAP_MASK} and {@link #INVERT_MASK}: if SWAP_MASK is set
 * the canonical traversal order is flipped around the diagonal (i and j are exchanged), and if
 * INVERT_MASK is set the traversal is rotated by 180 degrees (the bits of i and j are inverted).
 */
public final strictfp class S2 {
  public static final double M_PI = Math.PI;
  public static final double M_1_PI = 1.0 / Math.PI;
  public static final double M_PI_2 = Math.PI / 2.0;
  public static final double M_PI_4 = Math.PI / 4.0;

  /** The smallest floating-point value {@code x} such that {@code (1 + x != 1)}. */
  public static final double DBL_EPSILON = Math.ulp(1.0);

  public static final int SWAP_MASK = 0x01;
  public static final int INVERT_MASK = 0x02;

  /** Orientation adjustment applied to a child at each Hilbert traversal position. */
  private static final int[] POS_TO_ORIENTATION = {SWAP_MASK, 0, 0, INVERT_MASK | SWAP_MASK};

  /**
   * IJ-index of the child at each traversal position, for each parent orientation. The IJ-index
   * packs the child's i offset in bit 1 and its j offset in bit 0.
   */
  private static final int[][] POS_TO_IJ = {
    {0, 1, 3, 2}, // canonical order: (0,0), (0,1), (1,1), (1,0)
    {0, 2, 3, 1}, // axes swapped: (0,0), (1,0), (1,1), (0,1)
    {3, 2, 0, 1}, // bits inverted: (1,1), (1,0), (0,0), (0,1)
    {3, 1, 0, 2}, // swapped & inverted: (1,1), (0,1), (0,0), (1,0)
  };

  /** Inverse of {@link #POS_TO_IJ}. */
  private static final int[][] IJ_TO_POS = {
    {0, 1, 3, 2},
    {0, 3, 1, 2},
    {2, 3, 1, 0},
    {2, 1, 3, 0},
  };

  private S2() {}

  /**
   * Returns the XOR mask that converts a parent orientation into the orientation of its child at
   * the given traversal position (0..3).
   *
   * @throws IllegalArgumentException if position is out of range
   */
  public static int posToOrientation(int position) {
    Preconditions.checkArgument(0 <= position && position < 4, "Invalid position %s", position);
    return POS_TO_ORIENTATION[position];
  }

  /**
   * Returns the IJ-index of the child at the given traversal position (0..3) of a cell with the
   * given orientation (0..3).
   */
  public static int posToIJ(int orientation, int position) {
    return POS_TO_IJ[orientation][position];
  }

  /** Returns the traversal position of the child with the given IJ-index. Inverse of posToIJ. */
  public static int ijToPos(int orientation, int ijIndex) {
    return IJ_TO_POS[orientation][ijIndex];
  }
}
