/*
 * Copyright 2026 Yellowbrick Data, Inc.
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

package ai.floedb.tracestats.parquet;

import java.util.Arrays;

/**
 * Position of a leaf value inside the nested trace structure.
 *
 * <p>One slot per repeated nesting level, root first: trace, resource spans, scope spans, span,
 * then attribute or event and their nested lists. A slot is {@code -1} when the value is not
 * defined at that depth. Index records keep only the first four levels. Row numbers are
 * advanced from the repetition and definition levels of each value, following the Dremel
 * encoding:
 *
 * <pre>
 * value | r | d | row number
 * ------+---+---+---------------------
 *       |   |   | -1, -1, -1, -1   (start)
 * us    | 0 | 3 |  0,  0,  0,  0
 * null  | 2 | 2 |  0,  0,  1, -1
 * null  | 1 | 1 |  0,  1, -1, -1
 * gb    | 1 | 3 |  0,  2,  0,  0
 * null  | 0 | 1 |  1,  0, -1, -1
 * </pre>
 *
 * <p>Instances are mutable; iterators advance a single instance in place. Use {@link #copy()}
 * before retaining one.
 */
public final class RowNumber implements Comparable<RowNumber> {

  public static final int LEVELS = 7;
  public static final int MAX_DEFINITION_LEVEL = LEVELS - 1;

  private final int[] levels = new int[LEVELS];

  private RowNumber() {
    Arrays.fill(levels, -1);
  }

  /** A row number before the first row: every level undefined. */
  public static RowNumber empty() {
    return new RowNumber();
  }

  /** Builds a row number from explicit leading levels; the remaining levels are undefined. */
  public static RowNumber of(int... values) {
    if (values.length > LEVELS) {
      throw new IllegalArgumentException("At most " + LEVELS + " levels, got " + values.length);
    }
    RowNumber rn = new RowNumber();
    System.arraycopy(values, 0, rn.levels, 0, values.length);
    return rn;
  }

  public int get(int level) {
    return levels[level];
  }

  public boolean valid() {
    return levels[0] >= 0;
  }

  /**
   * Advances to the next value given its repetition and definition levels: the repeated level is
   * incremented, deeper levels up to the definition level start at 0 and anything below is
   * undefined.
   */
  public void next(int repetitionLevel, int definitionLevel) {
    levels[repetitionLevel]++;
    for (int i = repetitionLevel + 1; i <= definitionLevel; i++) {
      levels[i] = 0;
    }
    for (int i = definitionLevel + 1; i < LEVELS; i++) {
      levels[i] = -1;
    }
  }

  /** Skips {@code rows} whole rows at the root level. */
  public void skip(long rows) {
    levels[0] = Math.toIntExact(levels[0] + rows);
    for (int i = 1; i < LEVELS; i++) {
      levels[i] = -1;
    }
  }

  public void set(RowNumber other) {
    System.arraycopy(other.levels, 0, levels, 0, LEVELS);
  }

  public RowNumber copy() {
    RowNumber rn = new RowNumber();
    rn.set(this);
    return rn;
  }

  /**
   * Returns the largest row number immediately before this one. {@code 1000.0.0} is preceded by
   * {@code 999.MAX.MAX}, {@code 1000.-1.-1} by {@code 999.-1.-1}.
   */
  public RowNumber preceding() {
    RowNumber rn = copy();
    for (int i = LEVELS - 1; i >= 0; i--) {
      int v = rn.levels[i];
      if (v == -1) {
        continue;
      }
      if (v == 0) {
        rn.levels[i] = Integer.MAX_VALUE;
      } else {
        rn.levels[i] = v - 1;
        return rn;
      }
    }
    return rn;
  }

  /** Returns a copy keeping levels {@code 0..level} and leaving the rest undefined. */
  public RowNumber truncate(int level) {
    RowNumber rn = new RowNumber();
    System.arraycopy(levels, 0, rn.levels, 0, level + 1);
    return rn;
  }

  /** Compares {@code a} and {@code b} level by level, from the root through {@code level}. */
  public static int compare(int level, RowNumber a, RowNumber b) {
    for (int i = 0; i <= level; i++) {
      int c = Integer.compare(a.levels[i], b.levels[i]);
      if (c != 0) {
        return c;
      }
    }
    return 0;
  }

  public static boolean equal(int level, RowNumber a, RowNumber b) {
    for (int i = 0; i <= level; i++) {
      if (a.levels[i] != b.levels[i]) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int compareTo(RowNumber o) {
    return compare(MAX_DEFINITION_LEVEL, this, o);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof RowNumber rn && Arrays.equals(levels, rn.levels);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(levels);
  }

  @Override
  public String toString() {
    return Arrays.toString(levels);
  }
}
