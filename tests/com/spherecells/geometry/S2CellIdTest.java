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

import static com.google.common.truth.Truth.assertThat;
import static com.spherecells.geometry.S2CellId.MAX_LEVEL;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.spherecells.geometry.S2CellId.FaceIJ;
import com.spherecells.geometry.S2CellId.FaceSiTi;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link S2CellId}. */
@RunWith(JUnit4.class)
public strictfp class S2CellIdTest extends GeometryTestCase {
  // Derivatives of the maximum edge and diagonal length of a cell under the quadratic projection.
  private static final double MAX_EDGE_DERIV = 1.704897179199218452;
  private static final double MAX_DIAG_DERIV = 2.438654594434021032;

  private static S2CellId getCellId(double latDegrees, double lngDegrees) {
    return S2CellId.fromLatLng(S2LatLng.fromDegrees(latDegrees, lngDegrees));
  }

  @Test
  public void testNone() {
    S2CellId id = S2CellId.none();
    assertEquals(0, id.id());
    assertFalse(id.isValid());
    assertFalse(S2CellId.sentinel().isValid());
  }

  @Test
  public void testFaceDefinitions() {
    assertEquals(0, getCellId(0, 0).face());
    assertEquals(1, getCellId(0, 90).face());
    assertEquals(2, getCellId(90, 0).face());
    assertEquals(3, getCellId(0, 180).face());
    assertEquals(4, getCellId(0, -90).face());
    assertEquals(5, getCellId(-90, 0).face());
  }

  @Test
  public void testFromFace() {
    for (int face = 0; face < 6; ++face) {
      S2CellId id = S2CellId.fromFace(face);
      assertEquals(id, S2CellId.fromFacePosLevel(face, 0, 0));
      assertTrue(id.isFace());
      assertEquals(0, id.level());
      assertEquals(1L << (2 * MAX_LEVEL), id.lowestOnBit());
    }
  }

  @Test
  public void testParentChildRelationships() {
    S2CellId id = S2CellId.fromFacePosLevel(3, 0x12345678, MAX_LEVEL - 4);
    assertTrue(id.isValid());
    assertEquals(3, id.face());
    assertEquals(0x12345700, id.pos());
    assertEquals(MAX_LEVEL - 4, id.level());
    assertFalse(id.isLeaf());

    assertEquals(0x12345610, id.childBegin(id.level() + 2).pos());
    assertEquals(0x12345640, id.childBegin().pos());
    assertEquals(0x12345400, id.parent().pos());
    assertEquals(0x12345000, id.parent(id.level() - 2).pos());

    // Children are ordered around their parent.
    assertTrue(id.childBegin().lessThan(id));
    assertTrue(id.childEnd().greaterThan(id));
    assertEquals(id.childEnd(), id.childBegin().next().next().next().next());
    assertEquals(id.rangeMin(), id.childBegin(MAX_LEVEL));
    assertEquals(id.rangeMax().next(), id.childEnd(MAX_LEVEL));

    // A cell is represented by the position of its center along the curve.
    assertEquals(2 * id.id(), id.rangeMin().id() + id.rangeMax().id());

    for (int pos = 0; pos < 4; ++pos) {
      assertEquals(id, id.child(pos).parent());
      assertEquals(pos, id.child(pos).childPosition(id.level() + 1));
    }
  }

  @Test
  public void testChildren() {
    S2CellId id = S2CellId.fromFacePosLevel(2, 0x0abcdef0L, 7);
    assertThat(id.children()).containsExactly(id.child(0), id.child(1), id.child(2), id.child(3))
        .inOrder();
    assertThat(id.childrenAtLevel(id.level())).containsExactly(id);
    assertThat(id.childrenAtLevel(id.level() + 2)).hasSize(16);
    assertThat(id.childBegin(MAX_LEVEL).children()).isEmpty();

    assertThrows(IllegalArgumentException.class, () -> id.childrenAtLevel(id.level() - 1));
    assertThrows(IllegalArgumentException.class, () -> id.childrenAtLevel(MAX_LEVEL + 1));
    assertThrows(IllegalStateException.class, () -> S2CellId.none().childrenAtLevel(3));
  }

  @Test
  public void testCenterSiTi() {
    S2CellId id = S2CellId.fromFacePosLevel(3, 0x12345678, MAX_LEVEL);
    // The (si, ti) coordinates of the center end in a 1 followed by (30 - level) 0s.
    FaceSiTi center = id.getCenterSiTi();
    assertEquals(1 << 0, center.si & 1);
    assertEquals(1 << 0, center.ti & 1);

    center = id.parent(MAX_LEVEL - 1).getCenterSiTi();
    assertEquals(1 << 1, center.si & 3);
    assertEquals(1 << 1, center.ti & 3);

    center = id.parent(MAX_LEVEL - 2).getCenterSiTi();
    assertEquals(1 << 2, center.si & 7);
    assertEquals(1 << 2, center.ti & 7);

    center = id.parent(MAX_LEVEL - 10).getCenterSiTi();
    assertEquals(1 << 10, center.si & ((1 << 11) - 1));
    assertEquals(1 << 10, center.ti & ((1 << 11) - 1));

    center = id.parent(MAX_LEVEL - 20).getCenterSiTi();
    assertEquals(1 << 20, center.si & ((1 << 21) - 1));
    assertEquals(1 << 20, center.ti & ((1 << 21) - 1));

    center = id.parent(0).getCenterSiTi();
    assertEquals(1L << 30, center.si & ((1L << 31) - 1));
    assertEquals(1L << 30, center.ti & ((1L << 31) - 1));
    assertEquals(3, center.face);
  }

  @Test
  public void testWrapping() {
    assertEquals(S2CellId.end(0).prev(), S2CellId.begin(0).prevWrap());
    assertEquals(
        S2CellId.fromFacePosLevel(5, ~0L >>> S2CellId.FACE_BITS, MAX_LEVEL),
        S2CellId.begin(MAX_LEVEL).prevWrap());
    assertEquals(S2CellId.begin(4), S2CellId.end(4).prev().nextWrap());
    assertEquals(
        S2CellId.fromFacePosLevel(0, 0, MAX_LEVEL), S2CellId.end(MAX_LEVEL).prev().nextWrap());
    assertEquals(S2CellId.fromFace(5), S2CellId.fromFace(0).prevWrap());
    assertEquals(S2CellId.fromFace(1), S2CellId.fromFace(0).nextWrap());
  }

  @Test
  public void testUnsignedOrdering() {
    // Faces 4 and 5 set the sign bit, yet still sort after faces 0 to 3.
    assertTrue(S2CellId.fromFace(4).id() < 0);
    assertTrue(S2CellId.fromFace(3).lessThan(S2CellId.fromFace(4)));
    assertTrue(S2CellId.fromFace(5).greaterThan(S2CellId.fromFace(0)));
    assertTrue(S2CellId.sentinel().greaterThan(S2CellId.end(MAX_LEVEL).prev()));
    assertTrue(S2CellId.none().lessThan(S2CellId.begin(MAX_LEVEL)));
    assertTrue(S2CellId.fromFace(2).lessOrEquals(S2CellId.fromFace(2)));
    assertTrue(S2CellId.fromFace(2).greaterOrEquals(S2CellId.fromFace(2)));

    List<S2CellId> ids =
        Lists.newArrayList(S2CellId.fromFace(5), S2CellId.fromFace(1), S2CellId.fromFace(4));
    Collections.sort(ids);
    assertEquals(
        ImmutableList.of(S2CellId.fromFace(1), S2CellId.fromFace(4), S2CellId.fromFace(5)), ids);
  }

  @Test
  public void testInverses() {
    // Random leaf cells convert to lat/lngs and back.
    for (int i = 0; i < 20000; ++i) {
      S2CellId id = data.getRandomCellId(MAX_LEVEL);
      assertTrue(id.isLeaf());
      assertEquals(MAX_LEVEL, id.level());
      S2LatLng center = id.toLatLng();
      assertEquals(id.id(), S2CellId.fromLatLng(center).id());
    }
  }

  @Test
  public void testFaceIJRoundTrip() {
    for (int iter = 0; iter < 1000; ++iter) {
      S2CellId id = data.getRandomCellId(MAX_LEVEL);
      FaceIJ fij = id.toFaceIJOrientation();
      assertEquals(id, S2CellId.fromFaceIJ(fij.face, fij.i, fij.j));
    }
  }

  private static final int MAX_EXPAND_LEVEL = 3;

  private static void expandCell(
      S2CellId parent, List<S2CellId> cells, Map<S2CellId, S2CellId> parentMap) {
    cells.add(parent);
    if (parent.level() == MAX_EXPAND_LEVEL) {
      return;
    }
    FaceIJ fij = parent.toFaceIJOrientation();
    assertEquals(parent.face(), fij.face);

    for (int pos = 0; pos < 4; pos++) {
      S2CellId child = parent.child(pos);
      assertEquals(parent.level() + 1, child.level());
      assertFalse(child.isLeaf());
      FaceIJ cfij = child.toFaceIJOrientation();
      assertEquals(fij.face, cfij.face);
      assertEquals(fij.orientation ^ S2.posToOrientation(pos), cfij.orientation);
      parentMap.put(child, parent);
      expandCell(child, cells, parentMap);
    }
  }

  @Test
  public void testContainment() {
    Map<S2CellId, S2CellId> parentMap = Maps.newHashMap();
    List<S2CellId> cells = Lists.newArrayList();
    for (int face = 0; face < 6; ++face) {
      expandCell(S2CellId.fromFace(face), cells, parentMap);
    }
    for (S2CellId ci : cells) {
      for (S2CellId cj : cells) {
        boolean contained = true;
        for (S2CellId id = cj; !id.equals(ci); id = parentMap.get(id)) {
          if (!parentMap.containsKey(id)) {
            contained = false;
            break;
          }
        }
        assertEquals(contained, ci.contains(cj));
        assertEquals(
            contained, cj.greaterOrEquals(ci.rangeMin()) && cj.lessOrEquals(ci.rangeMax()));
        assertEquals(ci.contains(cj) || cj.contains(ci), ci.intersects(cj));
      }
    }
  }

  private static final int MAX_WALK_LEVEL = 8;

  /** Sequentially increasing cell ids form a continuous path over the sphere. */
  @Test
  public void testContinuity() {
    double maxDist = Math.scalb(MAX_EDGE_DERIV, -MAX_WALK_LEVEL);
    S2CellId end = S2CellId.end(MAX_WALK_LEVEL);
    for (S2CellId id = S2CellId.begin(MAX_WALK_LEVEL); !id.equals(end); id = id.next()) {
      assertTrue(id.toPointRaw().angle(id.nextWrap().toPointRaw()) <= maxDist);
      assertEquals(id, id.nextWrap().prevWrap());

      // toPointRaw() returns the center of each cell in (s,t) coordinates.
      S2Point p = id.toPointRaw();
      int face = S2Projections.xyzToFace(p);
      R2Vector uv = S2Projections.validFaceXyzToUv(face, p);
      double cellSize = 1.0 / (1 << MAX_WALK_LEVEL);
      assertEquals(0.0, drem(S2Projections.uvToST(uv.x()), 0.5 * cellSize), 1e-15);
      assertEquals(0.0, drem(S2Projections.uvToST(uv.y()), 0.5 * cellSize), 1e-15);
    }
  }

  private static double drem(double num, double dem) {
    return num - Math.round(num / dem) * dem;
  }

  /** Random points are represented to within half a leaf cell diagonal. */
  @Test
  public void testCoverage() {
    double maxDist = 0.5 * Math.scalb(MAX_DIAG_DERIV, -MAX_LEVEL);
    for (int i = 0; i < 100000; ++i) {
      S2Point p = data.getRandomPoint();
      S2Point q = S2CellId.fromPoint(p).toPointRaw();
      assertTrue(p.angle(q) <= maxDist);
    }
  }

  @Test
  public void testLowestOnBit() {
    for (int level = 0; level <= MAX_LEVEL; ++level) {
      S2CellId id = data.getRandomCellId(level);
      assertEquals(S2CellId.lowestOnBitForLevel(level), id.lowestOnBit());
      assertEquals(level, id.level());
      assertEquals(1 << (MAX_LEVEL - level), S2CellId.getSizeIJ(level));
    }
  }

  @Test
  public void testToString() {
    assertEquals("(face=3, pos=1000000000000000, level=0)", S2CellId.fromFace(3).toString());
    assertEquals(
        "(face=3, pos=12345700, level=26)",
        S2CellId.fromFacePosLevel(3, 0x12345678, MAX_LEVEL - 4).toString());
  }
}
