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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.Immutable;

/**
 * An S2LatLngRect represents a closed latitude-longitude rectangle. It is capable of representing
 * the empty and full rectangles as well as single points.
 *
 * <p>The latitude interval is bounded by [-Pi/2, Pi/2]. The longitude interval is an {@link
 * S1Interval}, so it may wrap around the 180 degree meridian. Both intervals are empty or neither
 * is.
 */
@Immutable
@CheckReturnValue
public final strictfp class S2LatLngRect {
  private final R1Interval lat;
  private final S1Interval lng;

  /** Creates a rectangle from its lower-left and upper-right corners. */
  public S2LatLngRect(S2LatLng lo, S2LatLng hi) {
    this(
        new R1Interval(lo.latRadians(), hi.latRadians()),
        new S1Interval(lo.lngRadians(), hi.lngRadians()));
  }

  public S2LatLngRect(R1Interval lat, S1Interval lng) {
    this.lat = lat;
    this.lng = lng;
  }

  public static S2LatLngRect empty() {
    return new S2LatLngRect(R1Interval.empty(), S1Interval.empty());
  }

  public static S2LatLngRect full() {
    return new S2LatLngRect(fullLat(), S1Interval.full());
  }

  /** The full allowable range of latitudes, [-Pi/2, Pi/2]. */
  public static R1Interval fullLat() {
    return new R1Interval(-S2.M_PI_2, S2.M_PI_2);
  }

  public static S1Interval fullLng() {
    return S1Interval.full();
  }

  /** Returns a rectangle containing a single normalized point. */
  public static S2LatLngRect fromPoint(S2LatLng p) {
    return new S2LatLngRect(p, p);
  }

  /**
   * Returns the smallest rectangle containing both normalized points. The longitude span is the
   * shorter way around the circle.
   */
  public static S2LatLngRect fromPointPair(S2LatLng p1, S2LatLng p2) {
    return new S2LatLngRect(
        R1Interval.fromPointPair(p1.latRadians(), p2.latRadians()),
        S1Interval.fromPointPair(p1.lngRadians(), p2.lngRadians()));
  }

  public R1Interval lat() {
    return lat;
  }

  public S1Interval lng() {
    return lng;
  }

  public S2LatLng lo() {
    return S2LatLng.fromRadians(lat.lo(), lng.lo());
  }

  public S2LatLng hi() {
    return S2LatLng.fromRadians(lat.hi(), lng.hi());
  }

  /**
   * Returns true if the latitude range lies within [-Pi/2, Pi/2], the longitude interval is valid,
   * and the two intervals agree on emptiness.
   */
  public boolean isValid() {
    return Math.abs(lat.lo()) <= S2.M_PI_2
        && Math.abs(lat.hi()) <= S2.M_PI_2
        && lng.isValid()
        && lat.isEmpty() == lng.isEmpty();
  }

  public boolean isEmpty() {
    return lat.isEmpty();
  }

  public boolean isFull() {
    return lat.equals(fullLat()) && lng.isFull();
  }

  public boolean isPoint() {
    return lat.lo() == lat.hi() && lng.lo() == lng.hi();
  }

  /**
   * Returns the k-th vertex of the rectangle (k = 0,1,2,3) in counter-clockwise order, starting
   * with the lower-left corner.
   */
  public S2LatLng getVertex(int k) {
    switch (k & 3) {
      case 0:
        return S2LatLng.fromRadians(lat.lo(), lng.lo());
      case 1:
        return S2LatLng.fromRadians(lat.lo(), lng.hi());
      case 2:
        return S2LatLng.fromRadians(lat.hi(), lng.hi());
      default:
        return S2LatLng.fromRadians(lat.hi(), lng.lo());
    }
  }

  /** Returns the center of the rectangle in latitude-longitude space. */
  public S2LatLng getCenter() {
    return S2LatLng.fromRadians(lat.getCenter(), lng.getCenter());
  }

  /** Returns the latitude and longitude extents. Empty rectangles have negative extents. */
  public S2LatLng getSize() {
    return S2LatLng.fromRadians(lat.getLength(), lng.getLength());
  }

  /** Returns the surface area of the rectangle on the unit sphere. */
  public double area() {
    if (isEmpty()) {
      return 0;
    }
    return lng.getLength() * (Math.sin(lat.hi()) - Math.sin(lat.lo()));
  }

  /** Returns true if the rectangle contains the given normalized point. */
  public boolean contains(S2LatLng ll) {
    return lat.contains(ll.latRadians()) && lng.contains(ll.lngRadians());
  }

  public boolean contains(S2Point p) {
    return contains(new S2LatLng(p));
  }

  /** Returns true if this rectangle contains every point of {@code other}. */
  public boolean contains(S2LatLngRect other) {
    return lat.contains(other.lat) && lng.contains(other.lng);
  }

  /** Returns true if the two rectangles have any points in common. */
  public boolean intersects(S2LatLngRect other) {
    return lat.intersects(other.lat) && lng.intersects(other.lng);
  }

  /** Returns the smallest rectangle containing this one and the given point. */
  public S2LatLngRect addPoint(S2LatLng ll) {
    return new S2LatLngRect(lat.addPoint(ll.latRadians()), lng.addPoint(ll.lngRadians()));
  }

  public S2LatLngRect addPoint(S2Point p) {
    return addPoint(new S2LatLng(p));
  }

  /**
   * Returns a rectangle grown by {@code margin.lat()} in latitude and {@code margin.lng()} in
   * longitude. Latitudes are clamped to [-Pi/2, Pi/2] and longitudes wrap. The empty rectangle
   * stays empty.
   */
  public S2LatLngRect expanded(S2LatLng margin) {
    return expanded(margin.latRadians(), margin.lngRadians());
  }

  /** As {@link #expanded(S2LatLng)}, with the margins given in radians. */
  public S2LatLngRect expanded(double latMargin, double lngMargin) {
    Preconditions.checkArgument(latMargin >= 0 && lngMargin >= 0, "Negative margin");
    if (isEmpty()) {
      return this;
    }
    return new S2LatLngRect(
        lat.expanded(latMargin).intersection(fullLat()), lng.expanded(lngMargin));
  }

  /**
   * If the rectangle touches either pole, returns it with the full longitude range so that it
   * contains every representation of the pole. Otherwise returns this rectangle.
   */
  public S2LatLngRect polarClosure() {
    if (lat.lo() == -S2.M_PI_2 || lat.hi() == S2.M_PI_2) {
      return new S2LatLngRect(lat, S1Interval.full());
    }
    return this;
  }

  /** Returns the smallest rectangle containing both this rectangle and {@code other}. */
  public S2LatLngRect union(S2LatLngRect other) {
    return new S2LatLngRect(lat.union(other.lat), lng.union(other.lng));
  }

  /** Returns true if the latitude and longitude bounds agree to within {@code maxError}. */
  public boolean approxEquals(S2LatLngRect other, double maxError) {
    return lat.approxEquals(other.lat, maxError)
        && Math.abs(lng.lo() - other.lng.lo()) <= maxError
        && Math.abs(lng.hi() - other.lng.hi()) <= maxError;
  }

  public boolean approxEquals(S2LatLngRect other) {
    return approxEquals(other, 1e-15);
  }

  @Override
  public boolean equals(Object that) {
    if (!(that instanceof S2LatLngRect)) {
      return false;
    }
    S2LatLngRect other = (S2LatLngRect) that;
    return lat.equals(other.lat) && lng.equals(other.lng);
  }

  @Override
  public int hashCode() {
    int value = 17;
    value = 37 * value + lat.hashCode();
    return 37 * value + lng.hashCode();
  }

  @Override
  public String toString() {
    return "[Lo=" + lo() + ", Hi=" + hi() + "]";
  }

  /**
   * Accumulates a rectangle through a sequence of updates, without creating an intermediate
   * {@link S2LatLngRect} at each step.
   */
  public static final strictfp class Builder {
    private R1Interval lat;
    private S1Interval lng;

    public Builder(R1Interval lat, S1Interval lng) {
      this.lat = lat;
      this.lng = lng;
    }

    /** Returns a builder initialized to the empty rectangle. */
    public static Builder empty() {
      return new Builder(R1Interval.empty(), S1Interval.empty());
    }

    public R1Interval lat() {
      return lat;
    }

    public S1Interval lng() {
      return lng;
    }

    public boolean isEmpty() {
      return lat.isEmpty();
    }

    @CanIgnoreReturnValue
    public Builder setFull() {
      lat = fullLat();
      lng = S1Interval.full();
      return this;
    }

    /** Grows the rectangle by the minimum amount needed to contain the given point. */
    @CanIgnoreReturnValue
    public Builder addPoint(S2LatLng ll) {
      lat = lat.addPoint(ll.latRadians());
      lng = lng.addPoint(ll.lngRadians());
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addPoint(S2Point p) {
      return addPoint(new S2LatLng(p));
    }

    /** Grows the rectangle to the smallest one that also contains {@code other}. */
    @CanIgnoreReturnValue
    public Builder union(S2LatLngRect other) {
      lat = lat.union(other.lat());
      lng = lng.union(other.lng());
      return this;
    }

    @CanIgnoreReturnValue
    public Builder expanded(S2LatLng margin) {
      if (!isEmpty()) {
        lat = lat.expanded(margin.latRadians()).intersection(fullLat());
        lng = lng.expanded(margin.lngRadians());
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder polarClosure() {
      if (lat.lo() == -S2.M_PI_2 || lat.hi() == S2.M_PI_2) {
        lng = S1Interval.full();
      }
      return this;
    }

    /** Returns the rectangle built so far. */
    public S2LatLngRect build() {
      return new S2LatLngRect(lat, lng);
    }
  }
}
