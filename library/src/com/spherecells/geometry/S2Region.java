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

import java.util.Collection;

/**
 * An S2Region represents a two-dimensional region over the unit sphere.
 *
 * <p>The interface is restricted to the methods needed to approximate a region by simpler ones:
 * bounding shapes, a small cell covering, and conservative cell and point tests.
 */
public interface S2Region {

  /** Returns a bounding spherical cap. */
  S2Cap getCapBound();

  /** Returns a bounding latitude-longitude rectangle. */
  S2LatLngRect getRectBound();

  /**
   * Adds a small collection of cells to {@code results} whose union covers the region. The cells
   * are not necessarily sorted or normalized.
   */
  void getCellUnionBound(Collection<S2CellId> results);

  /**
   * If this method returns true, the region completely contains the given cell. Otherwise, either
   * the region does not contain the cell or the containment relationship could not be determined.
   */
  boolean contains(S2Cell cell);

  /** Returns true if and only if the given point is contained by the region. */
  boolean contains(S2Point p);

  /**
   * If this method returns false, the region does not intersect the given cell. Otherwise, either
   * the region intersects the cell, or the intersection relationship could not be determined.
   */
  boolean mayIntersect(S2Cell cell);
}
