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
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link S2Point}. */
@RunWith(JUnit4.class)
public strictfp class S2PointTest extends GeometryTestCase {

  @Test
  public void testAccessors() {
    S2Point p = new S2Point(1, -2, 3);
    assertEquals(1.0, p.getX(), 0);
    assertEquals(-2.0, p.getY(), 0);
    assertEquals(3.0, p.getZ(), 0);
    assertEquals(1.0, p.get(0), 0);
    assertEquals(-2.0, p.get(1), 0);
    assertEquals(3.0, p.get(2), 0);
    assertThrows(IllegalArgumentException.class, () -> p.get(3));
  }

  @Test
  public void testArithmetic() {
    S2Point a = new S2Point(1, 2, 3);
    S2Point b = new S2Point(-1, 0, 2);
    assertEquals(new S2Point(0, 2, 5), a.add(b));
    assertEquals(new S2Point(2, 2, 1), a.sub(b));
    assertEquals(new S2Point(2, 4, 6), a.mul(2));
    assertEquals(new S2Point(-1, -2, -3), a.neg());
    assertEquals(14.0, a.norm2(), 0);
    assertEquals(5.0, a.dotProd(b), 0);
    assertEquals(new S2Point(4, -5, 2), a.crossProd(b));
    assertEquals(S2Point.Z_POS, S2Point.X_POS.crossProd(S2Point.Y_POS));
  }

  @Test
  public void testNormalize() {
    for (int i = 0; i < 100; ++i) {
      S2Point p = data.getRandomPoint().mul(data.uniform(0.1, 10));
      assertDoubleNear(1, p.normalize().norm(), 1e-15);
    }
    assertEquals(S2Point.ORIGIN, S2Point.ORIGIN.normalize());
  }

  @Test
  public void testAngle() {
    assertEquals(0.0, S2Point.X_POS.angle(S2Point.X_POS), 0);
    assertDoubleNear(S2.M_PI_2, S2Point.X_POS.angle(S2Point.Y_NEG));
    assertDoubleNear(Math.PI, S2Point.Z_POS.angle(S2Point.Z_NEG));
    // The points need not be unit length.
    assertDoubleNear(S2.M_PI_4, new S2Point(2, 0, 0).angle(new S2Point(1, 1, 0)));
  }

  @Test
  public void testLargestAbsComponent() {
    assertEquals(0, new S2Point(-5, 1, 2).largestAbsComponent());
    assertEquals(1, new S2Point(0.1, -0.2, 0.15).largestAbsComponent());
    assertEquals(2, new S2Point(1, 1, -1.5).largestAbsComponent());
  }

  @Test
  public void testEqualsAndOrdering() {
    assertEquals(new S2Point(0.0, 1, 0), new S2Point(-0.0, 1, 0));
    assertEquals(new S2Point(0.0, 1, 0).hashCode(), new S2Point(-0.0, 1, 0).hashCode());
    assertFalse(S2Point.X_POS.equals(S2Point.Y_POS));
    assertTrue(S2Point.X_POS.aequal(new S2Point(1 + 1e-16, 1e-16, 0), 1e-15));
    assertFalse(S2Point.X_POS.aequal(new S2Point(1, 1e-14, 0), 1e-15));

    List<S2Point> points = new ArrayList<>(ImmutableList.of(
        new S2Point(1, 0, 0), new S2Point(0, 2, 0), new S2Point(0, 1, 5), new S2Point(0, 1, 4)));
    Collections.sort(points);
    assertEquals(
        ImmutableList.of(
            new S2Point(0, 1, 4), new S2Point(0, 1, 5), new S2Point(0, 2, 0), new S2Point(1, 0, 0)),
        points);
    assertEquals("(1.0, 0.0, 0.0)", S2Point.X_POS.toString());
  }
}
