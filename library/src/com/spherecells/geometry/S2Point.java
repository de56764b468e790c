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

import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.Immutable;

/**
 * An S2Point represents a point on the unit sphere as a 3D vector. Usually points are normalized
 * to be unit length, but some methods do not require this.
 */
@Immutable
@CheckReturnValue
public final strictfp class S2Point implements Comparable<S2Point> {
  /** Origin of the coordinate system, [0,0,0]. */
  public static final S2Point ORIGIN = new S2Point(0, 0, 0);

  public static final S2Point X_POS = new S2Point(1, 0, 0);
  public static final S2Point X_NEG = new S2Point(-1, 0, 0);
  public static final S2Point Y_POS = new S2Point(0, 1, 0);
  public static final S2Point Y_NEG = new S2Point(0, -1, 0);
  public static final S2Point Z_POS = new S2Point(0, 0, 1);
  public static final S2Point Z_NEG = new S2Point(0, 0, -1);

  final double x;
  final double y;
  final double z;

  public S2Point(double x, double y, double z) {
    this.x = x;
    this.y = y;
    this.z = z;
  }

  public double getX() {
    return x;
  }

  public double getY() {
    return y;
  }

  public double getZ() {
    return z;
  }

  /** Returns the coordinate along the given axis (0, 1 or 2). */
  public double get(int axis) {
    switch (axis) {
      case 0:
        return x;
      case 1:
        return y;
      case 2:
        return z;
      default:
        throw new IllegalArgumentException("Invalid axis " + axis);
    }
  }

  public S2Point add(S2Point p) {
    return new S2Point(x + p.x, y + p.y, z + p.z);
  }

  public S2Point sub(S2Point p) {
    return new S2Point(x - p.x, y - p.y, z - p.z);
  }

  public S2Point mul(double m) {
    return new S2Point(m * x, m * y, m * z);
  }

  public S2Point neg() {
    return new S2Point(-x, -y, -z);
  }

  public double norm2() {
    return x * x + y * y + z * z;
  }

  public double norm() {
    return Math.sqrt(norm2());
  }

  /** Returns a unit-length copy of this point, or the origin if this point is the origin. */
  public S2Point normalize() {
    double n = norm();
    if (n != 0) {
      n = 1.0 / n;
    }
    return mul(n);
  }

  public double dotProd(S2Point o) {
    return x * o.x + y * o.y + z * o.z;
  }

  public S2Point crossProd(S2Point o) {
    return new S2Point(y * o.z - z * o.y, z * o.x - x * o.z, x * o.y - y * o.x);
  }

  /** Returns the angle between this vector and {@code va} in radians, in the range [0, Pi]. */
  public double angle(S2Point va) {
    return Math.atan2(crossProd(va).norm(), dotProd(va));
  }

  /** Returns the index of the component with the largest absolute value (0, 1 or 2). */
  public int largestAbsComponent() {
    return largestAbsComponent(x, y, z);
  }

  static int largestAbsComponent(double x, double y, double z) {
    double absX = Math.abs(x);
    double absY = Math.abs(y);
    double absZ = Math.abs(z);
    if (absX > absY) {
      return absX > absZ ? 0 : 2;
    } else {
      return absY > absZ ? 1 : 2;
    }
  }

  /** Returns true if the two points have identical coordinates. */
  public boolean equalsPoint(S2Point o) {
    return x == o.x && y == o.y && z == o.z;
  }

  /** Returns true if each coordinate differs from {@code that} by at most {@code margin}. */
  public boolean aequal(S2Point that, double margin) {
    return Math.abs(x - that.x) < margin
        && Math.abs(y - that.y) < margin
        && Math.abs(z - that.z) < margin;
  }

  @Override
  public boolean equals(Object that) {
    return that instanceof S2Point && equalsPoint((S2Point) that);
  }

  @Override
  public int hashCode() {
    long value = 17;
    value += 37 * value + Double.doubleToLongBits(Math.abs(x));
    value += 37 * value + Double.doubleToLongBits(Math.abs(y));
    value += 37 * value + Double.doubleToLongBits(Math.abs(z));
    return (int) (value ^ (value >>> 32));
  }

  /** Lexicographic order on (x, y, z). */
  @Override
  public int compareTo(S2Point other) {
    if (x != other.x) {
      return x < other.x ? -1 : 1;
    }
    if (y != other.y) {
      return y < other.y ? -1 : 1;
    }
    if (z != other.z) {
      return z < other.z ? -1 : 1;
    }
    return 0;
  }

  @Override
  public String toString() {
    return "(" + x + ", " + y + ", " + z + ")";
  }
}
