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
 * A closed interval [lo, hi] on the real line. Cells use it for their u and v extents, and latitude
 * ranges use it for their bounds. Any interval with lo > hi is empty; lo == hi holds one point.
 */
@Immutable
@CheckReturnValue
public final strictfp class R1Interval {
  private static final R1Interval EMPTY = new R1Interval(1, 0);

  private final double lo;
  private final double hi;

  /** Creates [lo, hi], which is empty when lo > hi. */
  public R1Interval(double lo, double hi) {
    this.lo = lo;
    this.hi = hi;
  }

  /** Returns the canonical empty interval, [1, 0]. */
  public static R1Interval empty() {
    return EMPTY;
  }

  /** Returns [p, p]. */
  public static R1Interval fromPoint(double p) {
    return new R1Interval(p, p);
  }

  /** Returns the smallest interval containing both points, which may be given in either order. */
  public static R1Interval fromPointPair(double p1, double p2) {
    return p1 <= p2 ? new R1Interval(p1, p2) : new R1Interval(p2, p1);
  }

  public double lo() {
    return lo;
  }

  public double hi() {
    return hi;
  }

  /** Returns true if no point lies in the interval. */
  public boolean isEmpty() {
    return lo > hi;
  }

  /** Returns the midpoint. Meaningless for an empty interval. */
  public double getCenter() {
    return 0.5 * (lo + hi);
  }

  /** Returns hi - lo, which is negative for an empty interval. */
  public double getLength() {
    return hi - lo;
  }

  public boolean contains(double p) {
    return p >= lo && p <= hi;
  }

  public boolean interiorContains(double p) {
    return p > lo && p < hi;
  }

  /** Returns true if every point of {@code y} lies in this interval. Holds for any empty y. */
  public boolean contains(R1Interval y) {
    return y.isEmpty() || (lo <= y.lo && y.hi <= hi);
  }

  /** Returns true if the two intervals share at least one point. */
  public boolean intersects(R1Interval y) {
    if (lo <= y.lo) {
      return y.lo <= hi && y.lo <= y.hi;
    } else {
      return lo <= y.hi && lo <= hi;
    }
  }

  /** Returns the smallest interval containing this one and {@code p}. */
  public R1Interval addPoint(double p) {
    if (isEmpty()) {
      return fromPoint(p);
    } else if (p < lo) {
      return new R1Interval(p, hi);
    } else if (p > hi) {
      return new R1Interval(lo, p);
    } else {
      return this;
    }
  }

  /** Returns [lo - margin, hi + margin]. An empty interval stays empty. */
  public R1Interval expanded(double margin) {
    return isEmpty() ? this : new R1Interval(lo - margin, hi + margin);
  }

  /** Returns the smallest interval containing both intervals. */
  public R1Interval union(R1Interval y) {
    if (isEmpty()) {
      return y;
    }
    if (y.isEmpty()) {
      return this;
    }
    return new R1Interval(Math.min(lo, y.lo), Math.max(hi, y.hi));
  }

  /** Returns the points common to both intervals, possibly as an empty interval. */
  public R1Interval intersection(R1Interval y) {
    return new R1Interval(Math.max(lo, y.lo), Math.min(hi, y.hi));
  }

  /** Two intervals are equal if they have the same endpoints or are both empty. */
  @Override
  public boolean equals(Object that) {
    if (that instanceof R1Interval) {
      R1Interval y = (R1Interval) that;
      return (lo == y.lo && hi == y.hi) || (isEmpty() && y.isEmpty());
    }
    return false;
  }

  @Override
  public int hashCode() {
    if (isEmpty()) {
      return 17;
    }
    long value = 17;
    value = 37 * value + Double.doubleToLongBits(lo);
    value = 37 * value + Double.doubleToLongBits(hi);
    return (int) (value ^ (value >>> 32));
  }

  /**
   * Returns true if each endpoint of {@code y} is within {@code maxError} of the matching endpoint
   * here. An empty interval matches any interval no longer than {@code 2 * maxError}.
   */
  public boolean approxEquals(R1Interval y, double maxError) {
    if (isEmpty()) {
      return y.getLength() <= 2 * maxError;
    }
    if (y.isEmpty()) {
      return getLength() <= 2 * maxError;
    }
    return Math.abs(y.lo - lo) <= maxError && Math.abs(y.hi - hi) <= maxError;
  }

  @Override
  public String toString() {
    return "[" + lo + ", " + hi + "]";
  }
}
