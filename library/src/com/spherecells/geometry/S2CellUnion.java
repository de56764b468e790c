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
import com.google.common.collect.Iterables;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An S2CellUnion is a region consisting of cells of various sizes. Typically a cell union is used
 * to approximate some other shape. There is a tradeoff between the accuracy of the approximation
 * and how many cells are used. Unlike polygons, cells have a fixed hierarchical structure. This
 * makes them more suitable for optimizations based on preprocessing.
 *
 * <p>A union is <i>normalized</i> when its cell ids are sorted, no cell contains another, and no
 * four cells are the children of a common parent. {@link #normalize()} produces this canonical
 * form, which is unique for a given set of leaf cells. Most queries require a normalized union.
 *
 * <p>Instances are mutable and not synchronized.
 */
public strictfp class S2CellUnion implements S2Region, Iterable<S2CellId> {
  private static final Logger log = Platform.getLoggerForClass(S2CellUnion.class);

  /** The cell ids that form the union, owned exclusively by this instance. */
  private ArrayList<S2CellId> cellIds = new ArrayList<>();

  public S2CellUnion() {}

  /** Returns a normalized union of the given cell ids. */
  public static S2CellUnion fromCellIds(Iterable<S2CellId> cellIds) {
    S2CellUnion union = new S2CellUnion();
    Iterables.addAll(union.cellIds, cellIds);
    union.normalize();
    return union;
  }

  /** Returns a normalized union of all six face cells. */
  public static S2CellUnion wholeSphere() {
    S2CellUnion union = new S2CellUnion();
    for (int face = 0; face < S2CellId.NUM_FACES; face++) {
      union.cellIds.add(S2CellId.fromFace(face));
    }
    return union;
  }

  /** Returns a copy of {@code other}, without normalizing. */
  public static S2CellUnion copyFrom(S2CellUnion other) {
    S2CellUnion copy = new S2CellUnion();
    copy.cellIds = new ArrayList<>(other.cellIds);
    return copy;
  }

  /** Populates a cell union with the given cell ids, then normalizes it. The input is copied. */
  @CanIgnoreReturnValue
  public S2CellUnion initFromCellIds(List<S2CellId> cellIds) {
    initRawCellIds(cellIds);
    normalize();
    return this;
  }

  /** As {@link #initFromCellIds(List)}, with the cells given as raw 64-bit ids. */
  @CanIgnoreReturnValue
  public S2CellUnion initFromIds(List<Long> cellIds) {
    initRawIds(cellIds);
    normalize();
    return this;
  }

  /**
   * Populates a cell union with the given cell ids without normalizing. The input is copied. The
   * caller is responsible for passing valid ids if later queries need them.
   */
  @CanIgnoreReturnValue
  public S2CellUnion initRawCellIds(List<S2CellId> cellIds) {
    this.cellIds = new ArrayList<>(cellIds);
    return this;
  }

  /** As {@link #initRawCellIds(List)}, with the cells given as raw 64-bit ids. */
  @CanIgnoreReturnValue
  public S2CellUnion initRawIds(List<Long> cellIds) {
    ArrayList<S2CellId> ids = new ArrayList<>(cellIds.size());
    for (long id : cellIds) {
      ids.add(new S2CellId(id));
    }
    this.cellIds = ids;
    return this;
  }

  /**
   * Sets this union to the normalized set of cells covering the leaf cells from {@code minId} to
   * {@code maxId}, both inclusive.
   *
   * @throws IllegalArgumentException unless both ids are valid leaf cells and minId <= maxId
   */
  @CanIgnoreReturnValue
  public S2CellUnion initFromMinMax(S2CellId minId, S2CellId maxId) {
    Preconditions.checkArgument(maxId.isValid() && maxId.isLeaf(), "Not a leaf cell: %s", maxId);
    return initFromBeginEnd(minId, maxId.next());
  }

  /**
   * Sets this union to the normalized set of cells covering the leaf cells from {@code begin}
   * inclusive to {@code end} exclusive. The union is empty if the two are equal.
   *
   * @throws IllegalArgumentException unless both ids are leaf cells and begin <= end
   */
  @CanIgnoreReturnValue
  public S2CellUnion initFromBeginEnd(S2CellId begin, S2CellId end) {
    Preconditions.checkArgument(begin.isLeaf(), "Not a leaf cell: %s", begin);
    Preconditions.checkArgument(end.isLeaf(), "Not a leaf cell: %s", end);
    Preconditions.checkArgument(begin.lessOrEquals(end), "%s is after %s", begin, end);

    // Repeatedly add the largest cell that starts at nextBegin and ends before end.
    ArrayList<S2CellId> ids = new ArrayList<>();
    for (S2CellId nextBegin = begin; nextBegin.lessThan(end); ) {
      S2CellId nextId = nextBegin;
      while (!nextId.isFace()
          && nextId.parent().rangeMin().equals(nextBegin)
          && nextId.parent().rangeMax().lessThan(end)) {
        nextId = nextId.parent();
      }
      ids.add(nextId);
      nextBegin = nextId.rangeMax().next();
    }
    cellIds = ids;
    return this;
  }

  public int size() {
    return cellIds.size();
  }

  public boolean isEmpty() {
    return cellIds.isEmpty();
  }

  public S2CellId cellId(int i) {
    return cellIds.get(i);
  }

  /** Returns an unmodifiable view of the cell ids. */
  public List<S2CellId> cellIds() {
    return Collections.unmodifiableList(cellIds);
  }

  @Override
  public Iterator<S2CellId> iterator() {
    return cellIds().iterator();
  }

  /** Returns true if the cell ids are valid, sorted and non-overlapping. */
  public boolean isValid() {
    for (int i = 0; i < cellIds.size(); i++) {
      if (!cellIds.get(i).isValid()) {
        log.log(Level.FINE, "Invalid cell id {0} at index {1}", new Object[] {cellIds.get(i), i});
        return false;
      }
      if (i > 0 && cellIds.get(i - 1).rangeMax().greaterOrEquals(cellIds.get(i).rangeMin())) {
        log.log(Level.FINE, "Cells at index {0} and {1} are out of order or overlap",
            new Object[] {i - 1, i});
        return false;
      }
    }
    return true;
  }

  /** Returns true if the union is valid and no four of its cells share a parent. */
  public boolean isNormalized() {
    if (!isValid()) {
      return false;
    }
    for (int i = 3; i < cellIds.size(); i++) {
      if (areSiblings(cellIds.get(i - 3), cellIds.get(i - 2), cellIds.get(i - 1), cellIds.get(i))) {
        log.log(Level.FINE, "Cells at index {0} to {1} can be replaced by their parent",
            new Object[] {i - 3, i});
        return false;
      }
    }
    return true;
  }

  /**
   * Returns true if {@code a, b, c} and {@code d} are the four children of one parent. The four
   * cells must be distinct.
   */
  private static boolean areSiblings(S2CellId a, S2CellId b, S2CellId c, S2CellId d) {
    // The XOR of four siblings is zero. This is necessary but not sufficient.
    if ((a.id() ^ b.id() ^ c.id()) != d.id()) {
      return false;
    }
    // Mask out the two bits that select d's position within its parent; everything else must
    // agree.
    long mask = d.lowestOnBit() << 1;
    mask = ~(mask + (mask << 1));
    long dMasked = d.id() & mask;
    return !d.isFace()
        && (a.id() & mask) == dMasked
        && (b.id() & mask) == dMasked
        && (c.id() & mask) == dMasked;
  }

  /**
   * Normalizes the union: sorts the cell ids, discards cells contained by other cells, and replaces
   * each group of four sibling cells by their parent, repeatedly. The stored sequence is replaced
   * by the result.
   *
   * @return true if the number of cells was reduced. A pass that only reorders the cells returns
   *     false.
   */
  @CanIgnoreReturnValue
  public boolean normalize() {
    int before = cellIds.size();
    cellIds = normalizedCopy(cellIds);
    return cellIds.size() < before;
  }

  /**
   * As {@link #normalize()}, but rewrites the given list in place.
   *
   * @return true if the number of cells was reduced
   */
  @CanIgnoreReturnValue
  public static boolean normalize(List<S2CellId> ids) {
    int before = ids.size();
    ArrayList<S2CellId> output = normalizedCopy(ids);
    ids.clear();
    ids.addAll(output);
    return output.size() < before;
  }

  /** Returns the canonical form of {@code ids} as a new list. The input is not modified. */
  private static ArrayList<S2CellId> normalizedCopy(List<S2CellId> ids) {
    ArrayList<S2CellId> sorted = new ArrayList<>(ids);
    Collections.sort(sorted);
    ArrayList<S2CellId> output = new ArrayList<>(sorted.size());
    for (S2CellId id : sorted) {
      int out = output.size();
      // Skip this cell if the previous output cell contains it.
      if (out > 0 && output.get(out - 1).contains(id)) {
        continue;
      }
      // Discard any previous output cells that this cell contains.
      while (out > 0 && id.contains(output.get(out - 1))) {
        output.remove(--out);
      }
      // Collapse the last three output cells and this one into their parent, which may in turn
      // complete a group of four with earlier output cells.
      while (out >= 3
          && areSiblings(output.get(out - 3), output.get(out - 2), output.get(out - 1), id)) {
        output.remove(--out);
        output.remove(--out);
        output.remove(--out);
        id = id.parent();
      }
      output.add(id);
    }
    return output;
  }

  /**
   * Returns the cells of this union, expanded so that every cell's level is at least {@code
   * minLevel} and {@code (level - minLevel)} is a multiple of {@code levelMod}, unless the cell is
   * a leaf. A cell that does not meet these conditions is replaced by all of its descendants at the
   * smallest level that does. The cells are produced in the union's order.
   *
   * @throws IllegalArgumentException unless {@code 0 <= minLevel <= MAX_LEVEL} and {@code 1 <=
   *     levelMod <= 3}
   */
  public List<S2CellId> denormalize(int minLevel, int levelMod) {
    ArrayList<S2CellId> output = new ArrayList<>();
    denormalize(minLevel, levelMod, output);
    return output;
  }

  /** As {@link #denormalize(int, int)} with a {@code levelMod} of 1. */
  public List<S2CellId> denormalize(int minLevel) {
    return denormalize(minLevel, 1);
  }

  /** As {@link #denormalize(int, int)}, but clears {@code output} and writes the cells to it. */
  public void denormalize(int minLevel, int levelMod, List<S2CellId> output) {
    Preconditions.checkArgument(
        minLevel >= 0 && minLevel <= S2CellId.MAX_LEVEL, "minLevel %s out of range", minLevel);
    Preconditions.checkArgument(
        levelMod >= 1 && levelMod <= 3, "levelMod %s out of range", levelMod);

    output.clear();
    for (S2CellId id : cellIds) {
      int level = id.level();
      int newLevel = Math.max(minLevel, level);
      if (levelMod > 1) {
        // Round up so that (newLevel - minLevel) is a multiple of levelMod. MAX_LEVEL is a
        // multiple of 1, 2 and 3.
        newLevel += (S2CellId.MAX_LEVEL - (newLevel - minLevel)) % levelMod;
        newLevel = Math.min(S2CellId.MAX_LEVEL, newLevel);
      }
      if (newLevel == level) {
        output.add(id);
      } else {
        S2CellId end = id.childEnd(newLevel);
        for (S2CellId child = id.childBegin(newLevel); !child.equals(end); child = child.next()) {
          output.add(child);
        }
      }
    }
  }

  /**
   * Returns true if the union contains the given cell id. A normalized union is required for
   * groups of four children to count as containing their parent.
   */
  public boolean contains(S2CellId id) {
    // Each cell covers a contiguous range of the curve centered on its id, so only the two union
    // cells that surround id need to be checked.
    int pos = lowerBound(cellIds, id, 0);
    if (pos < cellIds.size() && cellIds.get(pos).rangeMin().lessOrEquals(id)) {
      return true;
    }
    return pos != 0 && cellIds.get(pos - 1).rangeMax().greaterOrEquals(id);
  }

  /** Returns true if the union intersects the given cell id. */
  public boolean intersects(S2CellId id) {
    int pos = lowerBound(cellIds, id, 0);
    if (pos < cellIds.size() && cellIds.get(pos).rangeMin().lessOrEquals(id.rangeMax())) {
      return true;
    }
    return pos != 0 && cellIds.get(pos - 1).rangeMax().greaterOrEquals(id.rangeMin());
  }

  /** Returns true if this union contains every cell of {@code that}. Both must be normalized. */
  public boolean contains(S2CellUnion that) {
    for (S2CellId id : that.cellIds) {
      if (!contains(id)) {
        return false;
      }
    }
    return true;
  }

  /** Returns true if this union and {@code that} have any leaf cell in common. */
  public boolean intersects(S2CellUnion that) {
    for (S2CellId id : that.cellIds) {
      if (intersects(id)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the normalized union of {@code x} and {@code y}. */
  public static S2CellUnion union(S2CellUnion x, S2CellUnion y) {
    ArrayList<S2CellId> ids = new ArrayList<>(x.size() + y.size());
    ids.addAll(x.cellIds);
    ids.addAll(y.cellIds);
    normalize(ids);
    S2CellUnion result = new S2CellUnion();
    result.cellIds = ids;
    return result;
  }

  /**
   * Returns the intersection of a normalized union with a single cell: either the cell itself, or
   * the union's cells that lie inside it.
   */
  public static S2CellUnion intersection(S2CellUnion x, S2CellId id) {
    S2CellUnion result = new S2CellUnion();
    if (x.contains(id)) {
      result.cellIds.add(id);
      return result;
    }
    int pos = lowerBound(x.cellIds, id.rangeMin(), 0);
    S2CellId idMax = id.rangeMax();
    while (pos < x.cellIds.size() && x.cellIds.get(pos).lessOrEquals(idMax)) {
      result.cellIds.add(x.cellIds.get(pos++));
    }
    return result;
  }

  /**
   * Returns the intersection of two unions. The result is normalized if either input is
   * normalized.
   */
  public static S2CellUnion intersection(S2CellUnion x, S2CellUnion y) {
    S2CellUnion result = new S2CellUnion();
    getIntersection(x.cellIds, y.cellIds, result.cellIds);
    return result;
  }

  /**
   * Writes the intersection of two sorted, non-overlapping lists of cell ids to {@code results},
   * which is cleared first. The inputs may contain groups of four sibling cells.
   */
  public static void getIntersection(List<S2CellId> x, List<S2CellId> y, List<S2CellId> results) {
    Preconditions.checkArgument(x != results && y != results, "Output aliases an input");
    // Binary search skips over runs of either list that cannot intersect the other, so disjoint
    // inputs take constant time.
    results.clear();
    int i = 0;
    int j = 0;
    while (i < x.size() && j < y.size()) {
      S2CellId xCell = x.get(i);
      S2CellId xMin = xCell.rangeMin();
      S2CellId yCell = y.get(j);
      S2CellId yMin = yCell.rangeMin();
      if (xMin.greaterThan(yMin)) {
        // Either yCell contains xCell or the two are disjoint.
        if (xCell.lessOrEquals(yCell.rangeMax())) {
          results.add(xCell);
          i++;
        } else {
          j = lowerBound(y, xMin, j + 1);
          // The cell before j may contain xCell.
          if (xCell.lessOrEquals(y.get(j - 1).rangeMax())) {
            --j;
          }
        }
      } else if (yMin.greaterThan(xMin)) {
        if (yCell.lessOrEquals(xCell.rangeMax())) {
          results.add(yCell);
          j++;
        } else {
          i = lowerBound(x, yMin, i + 1);
          if (yCell.lessOrEquals(x.get(i - 1).rangeMax())) {
            --i;
          }
        }
      } else {
        // Same rangeMin, so one cell contains the other; keep the smaller.
        if (xCell.lessThan(yCell)) {
          results.add(xCell);
          i++;
        } else {
          results.add(yCell);
          j++;
        }
      }
    }
  }

  /**
   * Returns the cells of {@code x} that are not in {@code y}. The result is normalized if {@code x}
   * is normalized.
   */
  public static S2CellUnion difference(S2CellUnion x, S2CellUnion y) {
    S2CellUnion result = new S2CellUnion();
    for (S2CellId id : x.cellIds) {
      addDifference(id, y, result.cellIds);
    }
    return result;
  }

  private static void addDifference(S2CellId cell, S2CellUnion y, List<S2CellId> output) {
    if (!y.intersects(cell)) {
      output.add(cell);
    } else if (!y.contains(cell)) {
      for (S2CellId child : cell.children()) {
        addDifference(child, y, output);
      }
    }
  }

  /**
   * Returns the index of the first element of {@code ids} at or after {@code low} that is not less
   * than {@code key}, or {@code ids.size()} if there is none.
   */
  private static int lowerBound(List<S2CellId> ids, S2CellId key, int low) {
    int high = ids.size();
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (ids.get(mid).lessThan(key)) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }

  /**
   * Returns a cap containing the union. The axis is the area-weighted centroid of the cells, so the
   * cap is close to, but not always, the smallest one.
   */
  @Override
  public S2Cap getCapBound() {
    if (cellIds.isEmpty()) {
      return S2Cap.empty();
    }
    S2Point centroid = S2Point.ORIGIN;
    for (S2CellId id : cellIds) {
      centroid = centroid.add(id.toPoint().mul(S2Cell.averageArea(id.level())));
    }
    if (centroid.equalsPoint(S2Point.ORIGIN)) {
      centroid = S2Point.X_POS;
    } else {
      centroid = centroid.normalize();
    }
    // Bounding the cell vertices is not enough, since the cap may cover more than a hemisphere.
    S2Cap cap = S2Cap.fromAxisHeight(centroid, 0);
    for (S2CellId id : cellIds) {
      cap = cap.addCap(new S2Cell(id).getCapBound());
    }
    return cap;
  }

  @Override
  public S2LatLngRect getRectBound() {
    S2LatLngRect.Builder builder = S2LatLngRect.Builder.empty();
    for (S2CellId id : cellIds) {
      builder.union(new S2Cell(id).getRectBound());
    }
    return builder.build();
  }

  @Override
  public void getCellUnionBound(Collection<S2CellId> results) {
    results.addAll(cellIds);
  }

  @Override
  public boolean contains(S2Cell cell) {
    return contains(cell.id());
  }

  @Override
  public boolean mayIntersect(S2Cell cell) {
    return intersects(cell.id());
  }

  /** The point need not be unit length. */
  @Override
  public boolean contains(S2Point p) {
    return contains(S2CellId.fromPoint(p));
  }

  /** Returns the number of leaf cells covered by the union, at most 6 * 2**60. */
  public long leafCellsCovered() {
    long numLeaves = 0;
    for (S2CellId id : cellIds) {
      numLeaves += id.lowestOnBit();
    }
    return numLeaves;
  }

  /**
   * Returns the area of the union estimated as the number of leaf cells covered times the average
   * leaf cell area. Cell distortion makes this off by up to a factor of 1.7.
   */
  public double averageBasedArea() {
    return S2Cell.averageArea(S2CellId.MAX_LEVEL) * leafCellsCovered();
  }

  /** Returns the sum of {@link S2Cell#approxArea()} over the cells. */
  public double approxArea() {
    double area = 0;
    for (S2CellId id : cellIds) {
      area += new S2Cell(id).approxArea();
    }
    return area;
  }

  @Override
  public boolean equals(Object that) {
    if (!(that instanceof S2CellUnion)) {
      return false;
    }
    return cellIds.equals(((S2CellUnion) that).cellIds);
  }

  @Override
  public int hashCode() {
    int value = 17;
    for (S2CellId id : cellIds) {
      value = 37 * value + id.hashCode();
    }
    return value;
  }

  @Override
  public String toString() {
    return "S2CellUnion" + cellIds;
  }
}
