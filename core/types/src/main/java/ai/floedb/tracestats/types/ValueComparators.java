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

package ai.floedb.tracestats.types;

import java.util.Comparator;
import java.util.List;

/**
 * Orderings for attribute values and multi-element (array) values.
 *
 * <p>Scalars order naturally within their kind: strings by UTF-8 byte order, integers
 * numerically, floats by {@link Double#compare} (so {@code -0.0 < 0.0} and {@code NaN} sorts
 * last) and booleans {@code false < true}.
 *
 * <p>Lists order element by element; when one list is a strict prefix of the other, the shorter
 * list sorts first. A scalar is treated as a single-element list.
 */
public final class ValueComparators {

  public static final Comparator<String> STRING = Utf8::compare;
  public static final Comparator<Long> INT64 = Long::compare;
  public static final Comparator<Double> FLOAT64 = Double::compare;
  public static final Comparator<Boolean> BOOL = Boolean::compare;

  public static final Comparator<List<String>> STRING_LIST = lexicographic(STRING);
  public static final Comparator<List<Long>> INT64_LIST = lexicographic(INT64);
  public static final Comparator<List<Double>> FLOAT64_LIST = lexicographic(FLOAT64);
  public static final Comparator<List<Boolean>> BOOL_LIST = lexicographic(BOOL);

  private ValueComparators() {}

  /** Builds an element-by-element list ordering where a strict prefix sorts first. */
  public static <T> Comparator<List<T>> lexicographic(Comparator<? super T> element) {
    return (a, b) -> {
      int n = Math.min(a.size(), b.size());
      for (int i = 0; i < n; i++) {
        int c = element.compare(a.get(i), b.get(i));
        if (c != 0) {
          return c;
        }
      }
      return Integer.compare(a.size(), b.size());
    };
  }

  /**
   * Compares two scalar values of the same kind.
   *
   * @throws IllegalArgumentException if the kinds differ or either value is missing
   */
  public static int compare(AttrValue a, AttrValue b) {
    if (a.kind() != b.kind()) {
      throw new IllegalArgumentException(
          "Cannot compare values of different kinds: " + a.kind() + " vs " + b.kind());
    }
    if (a instanceof AttrValue.Str sa && b instanceof AttrValue.Str sb) {
      return STRING.compare(sa.value(), sb.value());
    }
    if (a instanceof AttrValue.Int64 ia && b instanceof AttrValue.Int64 ib) {
      return Long.compare(ia.value(), ib.value());
    }
    if (a instanceof AttrValue.Float64 fa && b instanceof AttrValue.Float64 fb) {
      return Double.compare(fa.value(), fb.value());
    }
    if (a instanceof AttrValue.Bool ba && b instanceof AttrValue.Bool bb) {
      return Boolean.compare(ba.value(), bb.value());
    }
    throw new IllegalArgumentException("Missing values are not orderable");
  }
}
