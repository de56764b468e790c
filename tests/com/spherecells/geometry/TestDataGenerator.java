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
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Random cell ids and points for tests. The generator is seeded with a fixed value, so every test
 * run sees the same sequence.
 */
public strictfp class TestDataGenerator {
  private static final long SEED = 123455;

  private final Random rand = new Random(SEED);

  /** Returns a random unit-length point. */
  public S2Point getRandomPoint() {
    S2Point p;
    do {
      p = new S2Point(uniform(-1, 1), uniform(-1, 1), uniform(-1, 1));
    } while (p.norm2() <= 1e-6);
    return p.normalize();
  }

  /**
   * Returns a random cell id at the given level. Ids are uniform over the curve positions of the
   * chosen face, which makes them only roughly uniform over the sphere.
   */
  public S2CellId getRandomCellId(int level) {
    int face = random(S2CellId.NUM_FACES);
    // All POS_BITS bits, so positions span the whole face rather than its first half.
    long pos = rand.nextLong() & ((1L << S2CellId.POS_BITS) - 1);
    return S2CellId.fromFacePosLevel(face, pos, level);
  }

  /** Returns a random cell id at a random level. */
  public S2CellId getRandomCellId() {
    return getRandomCellId(random(S2CellId.MAX_LEVEL + 1));
  }

  /**
   * Returns {@code count} random cell ids, each at a level drawn from {@code minLevel} to {@code
   * maxLevel} inclusive. The ids are neither sorted nor distinct.
   */
  public List<S2CellId> getRandomCellIds(int count, int minLevel, int maxLevel) {
    Preconditions.checkArgument(0 <= minLevel && minLevel <= maxLevel);
    Preconditions.checkArgument(maxLevel <= S2CellId.MAX_LEVEL);
    List<S2CellId> ids = new ArrayList<>(count);
    for (int i = 0; i < count; ++i) {
      ids.add(getRandomCellId(minLevel + random(maxLevel - minLevel + 1)));
    }
    return ids;
  }

  /** Returns a double drawn uniformly from [min, max). */
  public double uniform(double min, double max) {
    Preconditions.checkArgument(min <= max);
    return min + rand.nextDouble() * (max - min);
  }

  /** Returns true with probability 1/n. */
  public boolean oneIn(int n) {
    return random(n) == 0;
  }

  /** Returns an int drawn uniformly from [0, n). Returns 0 when n is 0. */
  public int random(int n) {
    return n == 0 ? 0 : rand.nextInt(n);
  }
}
