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
import static java.lang.Math.abs;

import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.Immutable;

/**
 * An S1Interval represents a closed interval on a unit circle (also known as a 1-dimensional
 * sphere). It is capable of representing the empty interval (containing no points), the full
 * interval (containing all points), and zero-length intervals (containing a single point).
 *
 * <p>Points are represented by the angle they make with the positive x-axis in the range [-Pi,
 * Pi]. An interval is represented by its lower and upper bounds (both inclusive, since the
 * interval is closed). The lower bound may be greater than the upper bound, in which case the
 * interval is "inverted" (i.e. it passes through the point (-1, 0)).
 *
 * <p>Note that the point (-1, 0) has two valid representations, Pi and -Pi. The normalized
 * representation of this point internally is Pi, so that endpoints of normal intervals are in the
 * range (-Pi, Pi]. However, we take advantage of the point -Pi to construct two special intervals:
 * the full() interval is [-Pi, Pi], and the empty() interval is [Pi, -Pi].
 */
@Immutable
@CheckReturnValue
public final strictfp class S1Interval {
  private static final S1Interval EMPTY = new S1Interval(PI, -PI, true);
  private static final S1Interval FULL = new S1Interval(-PI, PI, true);

  private final double lo;
  private final double hi;

  /**
   * Both endpoints must be in the range -Pi to Pi inclusive. The value -Pi is converted internally
   * to Pi except for the full() and empty() intervals.
   */
  public S1Interval(double lo, double hi) {
    this(lo, hi, false);
  }

  private S1Interval(double lo, double hi, boolean checked) {
    double newLo = lo;
    double newHi = hi;
    if (!checked) {
      if (lo == -PI && hi != PI) {
        newLo = PI;
      }
      if (hi == -PI && lo != PI) {
        newHi = PI;
      }
    }
    this.lo = newLo;
    this.hi = newHi;
  }

  public static S1Interval empty() {
    return EMPTY;
  }

  public static S1Interval full() {
    return FULL;
  }

  /** Convenience method to construct an interval containing a single point. */
  public static S1Interval fromPoint(double radians) {
    if (radians == -PI) {
      radians = PI;
    }
    return new S1Interval(radians, radians, true);
  }

  /**
   * Convenience method to construct the minimal interval containing the two given points. This is
   * equivalent to starting with an empty interval and calling addPoint() twice, but it is more
   * efficient.
   */
  public static S1Interval fromPointPair(double p1, double p2) {
    // assert abs(p1) <= PI && abs(p2) <= PI;
    if (p1 == -PI) {
      p1 = PI;
    }
    if (p2 == -PI) {
      p2 = PI;
    }
    if (positiveDistance(p1, p2) <= PI) {
      return new S1Interval(p1, p2, true);
    } else {
      return new S1Interval(p2, p1, true);
    }
  }

  public double lo() {
    return lo;
  }

  public double hi() {
    return hi;
  }

  /**
   * An interval is valid if neither bound exceeds Pi in absolute value, and the value -Pi appears
   * only in the empty() and full() intervals.
   */
  public boolean isValid() {
    return abs(lo) <= PI
        && abs(hi) <= PI
        && !(lo == -PI && hi != PI)
        && !(hi == -PI && lo != PI);
  }

  /** Returns true if the interval contains all points on the unit circle. */
  public boolean isFull() {
    return hi - lo == 2 * PI;
  }

  /** Returns true if the interval is empty, i.e. it contains no points. */
  public boolean isEmpty() {
    return lo - hi == 2 * PI;
  }

  /** Returns true if {@code lo() > hi()}. (This is true for empty intervals.) */
  public boolean isInverted() {
    return lo > hi;
  }

  /**
   * Returns the midpoint of the interval. For full and empty intervals, the result is arbitrary.
   */
  public double getCenter() {
    double center = 0.5 * (lo + hi);
    if (!isInverted()) {
      return center;
    }
    // Return the center in the range (-Pi, Pi].
    return (center <= 0) ? (center + PI) : (center - PI);
  }

  /** Returns the length of the interval. The length of an empty interval is negative. */
  public double getLength() {
    double length = hi - lo;
    if (length >= 0) {
      return length;
    }
    length += 2 * PI;
    return (length > 0) ? length : -1;
  }

  /** Returns true if the interval (which is closed) contains the point {@code p}. */
  public boolean contains(double p) {
    // assert abs(p) <= PI;
    if (p == -PI) {
      p = PI;
    }
    return fastContains(p);
  }

  /**
   * Returns true if the interval contains the point {@code p}, skipping the normalization of
   * {@code p} from -Pi to Pi.
   */
  public boolean fastContains(double p) {
    if (isInverted()) {
      return (p >= lo || p <= hi) && !isEmpty();
    } else {
      return p >= lo && p <= hi;
    }
  }

  /**
   * Returns true if the interval contains the interval {@code y}. Works for empty, full, and
   * singleton intervals.
   */
  public boolean contains(S1Interval y) {
    if (isInverted()) {
      if (y.isInverted()) {
        return y.lo >= lo && y.hi <= hi;
      }
      return (y.lo >= lo || y.hi <= hi) && !isEmpty();
    } else {
      if (y.isInverted()) {
        return isFull() || y.isEmpty();
      }
      return y.lo >= lo && y.hi <= hi;
    }
  }

  /**
   * Returns true if the two intervals contain any points in common. Note that the point +/-Pi has
   * two representations, so the intervals [-Pi,-3] and [2,Pi] intersect, for example.
   */
  public boolean intersects(S1Interval y) {
    if (isEmpty() || y.isEmpty()) {
      return false;
    }
    if (isInverted()) {
      // Every non-empty inverted interval contains Pi.
      return y.isInverted() || y.lo <= hi || y.hi >= lo;
    } else {
      if (y.isInverted()) {
        return y.lo <= hi || y.hi >= lo;
      }
      return y.lo <= hi && y.hi >= lo;
    }
  }

  /**
   * Returns the interval expanded by the minimum amount necessary so that it contains the point
   * {@code p} (an angle in the range [-Pi, Pi]).
   */
  public S1Interval addPoint(double p) {
    // assert abs(p) <= PI;
    if (p == -PI) {
      p = PI;
    }
    if (fastContains(p)) {
      return this;
    }
    if (isEmpty()) {
      return fromPoint(p);
    }
    double dlo = positiveDistance(p, lo);
    double dhi = positiveDistance(hi, p);
    // Adding a point can never turn a non-full interval into a full one.
    return dlo < dhi ? new S1Interval(p, hi) : new S1Interval(lo, p);
  }

  /**
   * Returns a new interval that has been expanded on each side by the distance {@code margin}. If
   * {@code margin} is negative, the interval shrinks on each side instead. The result may be empty
   * or full. Any expansion of a full interval remains full, and any expansion of an empty interval
   * remains empty.
   */
  public S1Interval expanded(double margin) {
    if (margin >= 0) {
      if (isEmpty()) {
        return this;
      }
      // Allow a 1-bit rounding error when computing each endpoint.
      if (getLength() + 2 * margin + 2 * S2.DBL_EPSILON >= 2 * PI) {
        return FULL;
      }
    } else {
      if (isFull()) {
        return this;
      }
      if (getLength() + 2 * margin - 2 * S2.DBL_EPSILON <= 0) {
        return EMPTY;
      }
    }
    double newLo = Platform.IEEEremainder(lo - margin, 2 * PI);
    double newHi = Platform.IEEEremainder(hi + margin, 2 * PI);
    if (newLo <= -PI) {
      newLo = PI;
    }
    return new S1Interval(newLo, newHi);
  }

  /** Returns the smallest interval that contains this interval and the interval {@code y}. */
  public S1Interval union(S1Interval y) {
    if (y.isEmpty()) {
      return this;
    }
    if (fastContains(y.lo)) {
      if (fastContains(y.hi)) {
        // Either this interval contains y, or the union of the two intervals is full.
        return contains(y) ? this : FULL;
      }
      return new S1Interval(lo, y.hi, true);
    }
    if (fastContains(y.hi)) {
      return new S1Interval(y.lo, hi, true);
    }
    // This interval contains neither endpoint of y. Either y contains all of this interval, or
    // the two intervals are disjoint.
    if (isEmpty() || y.fastContains(lo)) {
      return y;
    }
    // Check which pair of endpoints are closer together.
    double dlo = positiveDistance(y.hi, lo);
    double dhi = positiveDistance(hi, y.lo);
    return dlo < dhi ? new S1Interval(y.lo, hi, true) : new S1Interval(lo, y.hi, true);
  }

  @Override
  public boolean equals(Object that) {
    if (that instanceof S1Interval) {
      S1Interval y = (S1Interval) that;
      return lo == y.lo && hi == y.hi;
    }
    return false;
  }

  @Override
  public int hashCode() {
    long value = 17;
    value = 37 * value + Double.doubleToLongBits(lo);
    value = 37 * value + Double.doubleToLongBits(hi);
    return (int) ((value >>> 32) ^ value);
  }

  @Override
  public String toString() {
    return "[" + lo + ", " + hi + "]";
  }

  /**
   * Computes the distance from {@code a} to {@code b} in the range [0, 2*Pi). This is equivalent to
   * {@code drem(b - a - PI, 2 * PI) + PI}, except that it is more numerically stable (it does not
   * lose precision for very small positive distances).
   */
  public static double positiveDistance(double a, double b) {
    double d = b - a;
    if (d >= 0) {
      return d;
    }
    // If b == Pi and a == (-Pi + eps), the result should be approximately 2*Pi and not zero.
    return (b + PI) - (a - PI);
  }
}
