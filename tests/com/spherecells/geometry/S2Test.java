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
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public strictfp class S2Test {

  @Test
  public void testTraversalTablesAreInverses() {
    for (int orientation = 0; orientation < 4; ++orientation) {
      for (int pos = 0; pos < 4; ++pos) {
        assertEquals(pos, S2.ijToPos(orientation, S2.posToIJ(orientation, pos)));
        assertEquals(pos, S2.posToIJ(orientation, S2.ijToPos(orientation, pos)));
      }
    }
  }

  @Test
  public void testCanonicalOrder() {
    // With no swap and no inversion the curve visits (0,0), (0,1), (1,1), (1,0).
    assertEquals(0, S2.posToIJ(0, 0));
    assertEquals(1, S2.posToIJ(0, 1));
    assertEquals(3, S2.posToIJ(0, 2));
    assertEquals(2, S2.posToIJ(0, 3));
  }

  @Test
  public void testPosToOrientation() {
    assertEquals(S2.SWAP_MASK, S2.posToOrientation(0));
    assertEquals(0, S2.posToOrientation(1));
    assertEquals(0, S2.posToOrientation(2));
    assertEquals(S2.INVERT_MASK | S2.SWAP_MASK, S2.posToOrientation(3));
    assertThrows(IllegalArgumentException.class, () -> S2.posToOrientation(4));
  }
}
