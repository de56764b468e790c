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

/** A one-dimensional angle, stored in radians. */
@Immutable
@CheckReturnValue
public final strictfp class S1Angle implements Comparable<S1Angle> {
  private final double radians;

  private S1Angle(double radians) {
    this.radians = radians;
  }

  /** Returns a new S1Angle specified in radians. */
  public static S1Angle radians(double radians) {
    return new S1Angle(radians);
  }

  /**
   * Returns a new S1Angle converted from degrees. Note that {@code degrees(x).degrees() == x} may
   * not hold due to inexact arithmetic.
   */
  public static S1Angle degrees(double degrees) {
    return new S1Angle(degrees * (Math.PI / 180));
  }

  public double radians() {
    return radians;
  }

  public double degrees() {
    return radians * (180 / Math.PI);
  }

  @Override
  public int compareTo(S1Angle that) {
    return Double.compare(radians, that.radians);
  }

  @Override
  public boolean equals(Object that) {
    return that instanceof S1Angle && radians == ((S1Angle) that).radians;
  }

  @Override
  public int hashCode() {
    long value = Double.doubleToLongBits(radians);
    return (int) (value ^ (value >>> 32));
  }

  @Override
  public String toString() {
    return degrees() + "d";
  }
}
