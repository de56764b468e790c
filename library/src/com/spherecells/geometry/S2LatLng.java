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

import static java.lang.Math.atan2;
import static java.lang.Math.sqrt;

import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.Immutable;

/**
 * A point on the unit sphere as a pair of latitude and longitude, in radians. Used to bound cells
 * and cell unions by latitude-longitude rectangles.
 */
@Immutable
@CheckReturnValue
public final strictfp class S2LatLng {

  private final double latRadians;
  private final double lngRadians;

  private S2LatLng(double latRadians, double lngRadians) {
    this.latRadians = latRadians;
    this.lngRadians = lngRadians;
  }

  public S2LatLng(S1Angle lat, S1Angle lng) {
    this(lat.radians(), lng.radians());
  }

  /**
   * Converts a direction vector (not necessarily unit length) to an S2LatLng. Latitude and
   * longitude are already normalized.
   */
  public S2LatLng(S2Point p) {
    // atan2 rather than asin for latitude since the input is not necessarily unit length, and
    // atan2 is much more accurate near the poles. atan2(0, 0) is defined to be zero.
    this(latitudeRadians(p), longitudeRadians(p));
  }

  public static S2LatLng fromRadians(double latRadians, double lngRadians) {
    return new S2LatLng(latRadians, lngRadians);
  }

  public static S2LatLng fromDegrees(double latDegrees, double lngDegrees) {
    return new S2LatLng(S1Angle.degrees(latDegrees), S1Angle.degrees(lngDegrees));
  }

  /** Returns the latitude of the given point, which need not be unit length. */
  public static S1Angle latitude(S2Point p) {
    return S1Angle.radians(latitudeRadians(p));
  }

  /** Returns the longitude of the given point, which need not be unit length. */
  public static S1Angle longitude(S2Point p) {
    return S1Angle.radians(longitudeRadians(p));
  }

  private static double latitudeRadians(S2Point p) {
    return atan2(p.z, sqrt(p.x * p.x + p.y * p.y));
  }

  private static double longitudeRadians(S2Point p) {
    return atan2(p.y, p.x);
  }

  public S1Angle lat() {
    return S1Angle.radians(latRadians);
  }

  public double latRadians() {
    return latRadians;
  }

  public double latDegrees() {
    return Math.toDegrees(latRadians);
  }

  public S1Angle lng() {
    return S1Angle.radians(lngRadians);
  }

  public double lngRadians() {
    return lngRadians;
  }

  public double lngDegrees() {
    return Math.toDegrees(lngRadians);
  }

  /**
   * Returns true if the latitude is between -90 and 90 degrees inclusive and the longitude is
   * between -180 and 180 degrees inclusive.
   */
  public boolean isValid() {
    return Math.abs(latRadians) <= S2.M_PI_2 && Math.abs(lngRadians) <= S2.M_PI;
  }

  /**
   * Returns a new S2LatLng based on this instance for which {@link #isValid()} will be {@code
   * true}. Latitude is clipped to [-90,90] and longitude is normalized to [-180,180]. A valid
   * instance is returned with the same coordinates.
   */
  public S2LatLng normalized() {
    // IEEEremainder(x, 2 * Pi) reduces its argument to the range [-Pi, Pi] inclusive.
    return new S2LatLng(
        Math.max(-S2.M_PI_2, Math.min(S2.M_PI_2, latRadians)),
        Platform.IEEEremainder(lngRadians, 2 * S2.M_PI));
  }

  /** Converts this lat/lng to a unit-length point. The lat/lng need not be valid. */
  public S2Point toPoint() {
    double phi = latRadians;
    double theta = lngRadians;
    double cosphi = Math.cos(phi);
    return new S2Point(Math.cos(theta) * cosphi, Math.sin(theta) * cosphi, Math.sin(phi));
  }

  /**
   * Returns the surface distance to the given point, assuming a constant radius of 1. Uses the
   * Haversine formula, which is numerically stable for small distances but loses accuracy for
   * nearly antipodal points. Both points must be valid.
   */
  public S1Angle getDistance(S2LatLng o) {
    double lat1 = latRadians;
    double lat2 = o.latRadians;
    double lng1 = lngRadians;
    double lng2 = o.lngRadians;
    double dlat = Math.sin(0.5 * (lat2 - lat1));
    double dlng = Math.sin(0.5 * (lng2 - lng1));
    double x = dlat * dlat + dlng * dlng * Math.cos(lat1) * Math.cos(lat2);
    return S1Angle.radians(2 * Math.asin(Math.sqrt(Math.min(1.0, x))));
  }

  /**
   * Returns true if both the latitude and longitude of the given point are within {@code
   * maxError} radians of this point.
   */
  public boolean approxEquals(S2LatLng o, double maxError) {
    return Math.abs(latRadians - o.latRadians) < maxError
        && Math.abs(lngRadians - o.lngRadians) < maxError;
  }

  public boolean approxEquals(S2LatLng o) {
    return approxEquals(o, 1e-9);
  }

  @Override
  public boolean equals(Object that) {
    if (that instanceof S2LatLng) {
      S2LatLng o = (S2LatLng) that;
      return latRadians == o.latRadians && lngRadians == o.lngRadians;
    }
    return false;
  }

  @Override
  public int hashCode() {
    long value = 17;
    value += 37 * value + Double.doubleToLongBits(latRadians);
    value += 37 * value + Double.doubleToLongBits(lngRadians);
    return (int) (value ^ (value >>> 32));
  }

  @Override
  public String toString() {
    return "(" + latRadians + ", " + lngRadians + ")";
  }
}
