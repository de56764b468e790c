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

import static java.lang.Math.PI;
import static java.lang.Math.asin;
import static java.lang.Math.max;
import static java.lang.Math.min;
import static java.lang.Math.sin;
import static java.lang.Math.sqrt;

import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.Immutable;

/**
 * An S2Cap represents a disc-shaped region on the sphere: the portion of the sphere cut off by a
 * plane. The cap is closed, i.e. it contains its boundary.
 *
 * <p>A cap is stored as its axis (a unit-length center point) and its height, the distance from
 * the center point to the cutoff plane along the axis. A height of 0 is a single point, 1 is a
 * hemisphere and 2 is the whole sphere. Negative heights represent the empty cap.
 */
@Immutable
@CheckReturnValue
public final strictfp class S2Cap {
  /** Multiplier that rounds a non-negative value up by one ulp. */
  private static final double ROUND_UP = 1.0 + 1.0 / (1L << 52);

  private static final double EMPTY_HEIGHT = -1;
  private static final double FULL_HEIGHT = 2;

  private final S2Point axis;
  private final double height;

  private S2Cap(S2Point axis, double height) {
    this.axis = axis;
    this.height = height;
  }

  /** Creates a cap from a unit-length axis and a height. */
  public static S2Cap fromAxisHeight(S2Point axis, double height) {
    return new S2Cap(axis, height);
  }

  /** Creates a cap from a unit-length axis and an opening angle, clamped to [0, Pi]. */
  public static S2Cap fromAxisAngle(S2Point axis, S1Angle angle) {
    double d = sin(0.5 * min(angle.radians(), PI));
    return new S2Cap(axis, 2 * d * d);
  }

  /** Creates a cap from a unit-length axis and an area in steradians, between 0 and 4 * Pi. */
  public static S2Cap fromAxisArea(S2Point axis, double area) {
    return new S2Cap(axis, area / (2 * PI));
  }

  public static S2Cap empty() {
    return new S2Cap(S2Point.X_POS, EMPTY_HEIGHT);
  }

  public static S2Cap full() {
    return new S2Cap(S2Point.X_POS, FULL_HEIGHT);
  }

  public S2Point axis() {
    return axis;
  }

  public double height() {
    return height;
  }

  public double area() {
    return 2 * PI * max(0.0, height);
  }

  /** Returns the opening angle of the cap, or a negative angle for the empty cap. */
  public S1Angle angle() {
    if (isEmpty()) {
      return S1Angle.radians(-1);
    }
    return S1Angle.radians(2 * asin(sqrt(0.5 * height)));
  }

  /** Returns true if the axis is unit length and the height is at most 2. */
  public boolean isValid() {
    return Math.abs(axis.norm2() - 1) <= 5 * S2.DBL_EPSILON && height <= FULL_HEIGHT;
  }

  public boolean isEmpty() {
    return height < 0;
  }

  public boolean isFull() {
    return height >= FULL_HEIGHT;
  }

  /**
   * Returns the complement of the interior of the cap. The complement of a single point cap is
   * full, the same as the complement of the empty cap.
   */
  public S2Cap complement() {
    if (isFull()) {
      return empty();
    }
    if (isEmpty()) {
      return full();
    }
    return new S2Cap(axis.neg(), FULL_HEIGHT - height);
  }

  /** Returns true if this cap contains every point of {@code other}. */
  public boolean contains(S2Cap other) {
    if (isFull() || other.isEmpty()) {
      return true;
    }
    return angle().radians() >= axis.angle(other.axis) + other.angle().radians();
  }

  /** Returns true if the two caps have any points in common. */
  public boolean intersects(S2Cap other) {
    if (isEmpty() || other.isEmpty()) {
      return false;
    }
    return angle().radians() + other.angle().radians() >= axis.angle(other.axis);
  }

  /** Returns true if the cap contains the unit-length point {@code p}. */
  public boolean contains(S2Point p) {
    return axis.sub(p).norm2() <= 2 * height;
  }

  /** Returns true if the interior of the cap (the cap minus its boundary) contains {@code p}. */
  public boolean interiorContains(S2Point p) {
    return isFull() || axis.sub(p).norm2() < 2 * height;
  }

  /**
   * Returns the smallest cap with the same axis that also contains the unit-length point {@code p}.
   * An empty cap becomes the single point {@code p}.
   */
  public S2Cap addPoint(S2Point p) {
    if (isEmpty()) {
      return new S2Cap(p, 0);
    }
    // Round up so that contains(p) holds for the result.
    double dist2 = axis.sub(p).norm2();
    return new S2Cap(axis, max(height, ROUND_UP * 0.5 * dist2));
  }

  /**
   * Returns the smallest cap with the same axis that also contains {@code other}. An empty cap
   * becomes {@code other}.
   */
  public S2Cap addCap(S2Cap other) {
    if (isEmpty()) {
      return other;
    }
    if (other.isEmpty()) {
      return this;
    }
    double angle = axis.angle(other.axis) + other.angle().radians();
    if (angle >= PI) {
      return new S2Cap(axis, FULL_HEIGHT);
    }
    double d = sin(0.5 * angle);
    return new S2Cap(axis, max(height, ROUND_UP * 2 * d * d));
  }

  /** Returns true if the axes and heights agree to within {@code maxError}. */
  public boolean approxEquals(S2Cap other, double maxError) {
    return (axis.aequal(other.axis, maxError) && Math.abs(height - other.height) <= maxError)
        || (isEmpty() && other.height <= maxError)
        || (other.isEmpty() && height <= maxError)
        || (isFull() && other.height >= 2 - maxError)
        || (other.isFull() && height >= 2 - maxError);
  }

  public boolean approxEquals(S2Cap other) {
    return approxEquals(other, 1e-14);
  }

  /** Two caps are equal if they have the same axis and height, or are both empty or both full. */
  @Override
  public boolean equals(Object that) {
    if (!(that instanceof S2Cap)) {
      return false;
    }
    S2Cap other = (S2Cap) that;
    return (axis.equalsPoint(other.axis) && height == other.height)
        || (isEmpty() && other.isEmpty())
        || (isFull() && other.isFull());
  }

  @Override
  public int hashCode() {
    if (isFull()) {
      return 17;
    } else if (isEmpty()) {
      return 37;
    }
    int result = 17;
    result = 37 * result + axis.hashCode();
    long heightBits = Double.doubleToLongBits(height);
    result = 37 * result + (int) ((heightBits >>> 32) ^ heightBits);
    return result;
  }

  @Override
  public String toString() {
    return "[Point = " + axis + " Height = " + height + "]";
  }
}
