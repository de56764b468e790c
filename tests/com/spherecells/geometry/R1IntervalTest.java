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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link R1Interval}. */
@RunWith(JUnit4.class)
public strictfp class R1IntervalTest extends GeometryTestCase {

  /**
   * Checks the containment and intersection relations of {@code x} and {@code y}, along with their
   * union and intersection.
   */
  private static void checkIntervalOps(
      R1Interval x,
      R1Interval y,
      boolean contains,
      boolean intersects,
      R1Interval union,
      R1Interval intersection) {
    assertEquals(contains, x.contains(y));
    assertEquals(intersects, x.intersects(y));
    assertEquals(union, x.union(y));
    assertEquals(intersection, x.intersection(y));
    assertEquals(x.contains(y), x.union(y).equals(x));
    assertEquals(x.intersects(y), !x.intersection(y).isEmpty());
  }

  @Test
  public void testBasic() {
    R1Interval unit = new R1Interval(0, 1);
    R1Interval negunit = new R1Interval(-1, 0);
    assertEquals(0.0, unit.lo(), 0);
    assertEquals(1.0, unit.hi(), 0);
    assertEquals(-1.0, negunit.lo(), 0);
    assertEquals(0.0, negunit.hi(), 0);

    R1Interval half = new R1Interval(0.5, 0.5);
    assertFalse(unit.isEmpty());
    assertFalse(half.isEmpty());
    R1Interval empty = R1Interval.empty();
    assertTrue(empty.isEmpty());
    assertTrue(empty.getLength() < 0);

    assertEquals(0.5, unit.getCenter(), 0);
    assertEquals(0.5, half.getCenter(), 0);
    assertEquals(1.0, negunit.getLength(), 0);
    assertEquals(0.0, half.getLength(), 0);

    assertTrue(unit.contains(0.5));
    assertTrue(unit.interiorContains(0.5));
    assertTrue(unit.contains(0));
    assertFalse(unit.interiorContains(0));
    assertTrue(unit.contains(1));
    assertFalse(unit.interiorContains(1));

    checkIntervalOps(empty, empty, true, false, empty, empty);
    checkIntervalOps(empty, unit, false, false, unit, empty);
    checkIntervalOps(unit, half, true, true, unit, half);
    checkIntervalOps(unit, unit, true, true, unit, unit);
    checkIntervalOps(unit, empty, true, false, unit, empty);
    checkIntervalOps(unit, negunit, false, true, new R1Interval(-1, 1), new R1Interval(0, 0));
    checkIntervalOps(negunit, unit, false, true, new R1Interval(-1, 1), new R1Interval(0, 0));
    checkIntervalOps(unit, new R1Interval(0, 0.5), true, true, unit, new R1Interval(0, 0.5));
    checkIntervalOps(half, new R1Interval(0, 0.5), false, true, new R1Interval(0, 0.5), half);
  }

  @Test
  public void testAddPointAndFromPointPair() {
    R1Interval r = R1Interval.empty().addPoint(5);
    assertEquals(5.0, r.lo(), 0);
    assertEquals(5.0, r.hi(), 0);
    r = r.addPoint(-1);
    assertEquals(-1.0, r.lo(), 0);
    assertEquals(5.0, r.hi(), 0);
    r = r.addPoint(0);
    assertEquals(new R1Interval(-1, 5), r);

    assertEquals(new R1Interval(4, 4), R1Interval.fromPointPair(4, 4));
    assertEquals(new R1Interval(-2, -1), R1Interval.fromPointPair(-1, -2));
    assertEquals(new R1Interval(-5, 3), R1Interval.fromPointPair(-5, 3));
    assertEquals(R1Interval.fromPoint(7), R1Interval.fromPointPair(7, 7));
  }

  @Test
  public void testExpanded() {
    R1Interval empty = R1Interval.empty();
    R1Interval unit = new R1Interval(0, 1);
    assertTrue(empty.expanded(0.45).isEmpty());
    assertEquals(new R1Interval(-0.5, 1.5), unit.expanded(0.5));
    assertTrue(unit.expanded(-0.6).isEmpty());
  }

  @Test
  public void testEqualsAndApproxEquals() {
    assertEquals(R1Interval.empty(), new R1Interval(3, 2));
    assertEquals(R1Interval.empty().hashCode(), new R1Interval(3, 2).hashCode());
    assertFalse(new R1Interval(0, 1).equals(new R1Interval(0, 2)));

    double lo = 4 * S2.DBL_EPSILON;
    double hi = 6 * S2.DBL_EPSILON;
    R1Interval empty = R1Interval.empty();
    assertTrue(empty.approxEquals(empty, 1e-15));
    assertTrue(new R1Interval(0, 0).approxEquals(empty, 1e-15));
    assertTrue(empty.approxEquals(new R1Interval(1, 1), 1e-15));
    assertTrue(new R1Interval(1, 1 + 2 * lo).approxEquals(empty, lo));
    assertFalse(new R1Interval(1, 1 + 2 * hi).approxEquals(empty, lo));
    assertTrue(new R1Interval(1, 5).approxEquals(new R1Interval(1 + 1e-16, 5 - 1e-15), 1e-15));
    assertFalse(new R1Interval(1, 5).approxEquals(new R1Interval(1 - 1e-13, 5), 1e-15));
  }
}
