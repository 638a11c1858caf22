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

package ai.floedb.tracestats.index.format;

import ai.floedb.tracestats.index.stats.AttributeInfo;
import ai.floedb.tracestats.index.stats.FileStats;
import ai.floedb.tracestats.index.stats.ValueGroups;
import ai.floedb.tracestats.index.stats.ValueInfo;
import ai.floedb.tracestats.types.ValueComparators;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns collected {@link FileStats} into index records.
 *
 * <p>Keys are sorted by UTF-8 byte order and numbered 1..K in that order; records come out in the
 * same order. Within a key each value type is sorted on its own and numbered 1..M. All variants
 * share this ordering, so the codes of a combined index equal those of a codes index built from
 * the same stats.
 */
public final class AttributeIndexBuilder {

  private AttributeIndexBuilder() {}

  public static List<IndexedAttr> generate(IndexType type, FileStats stats) {
    return switch (type) {
      case COMBINED -> List.copyOf(generateCombinedIndex(stats));
      case ROWS -> List.copyOf(generateRowsIndex(stats));
      case CODES -> List.copyOf(generateCodesIndex(stats));
    };
  }

  public static List<IndexedAttr.Combined> generateCombinedIndex(FileStats stats) {
    List<AttributeInfo> keys = sortedKeys(stats);
    List<IndexedAttr.Combined> out = new ArrayList<>(keys.size());
    for (int i = 0; i < keys.size(); i++) {
      AttributeInfo a = keys.get(i);
      out.add(
          new IndexedAttr.Combined(
              a.key(),
              i + 1,
              a.scopeMask(),
              combined(a.strings(), ValueComparators.STRING_LIST),
              combined(a.ints(), ValueComparators.INT64_LIST),
              combined(a.floats(), ValueComparators.FLOAT64_LIST),
              combined(a.bools(), ValueComparators.BOOL_LIST)));
    }
    return out;
  }

  public static List<IndexedAttr.Rows> generateRowsIndex(FileStats stats) {
    List<AttributeInfo> keys = sortedKeys(stats);
    List<IndexedAttr.Rows> out = new ArrayList<>(keys.size());
    for (AttributeInfo a : keys) {
      out.add(
          new IndexedAttr.Rows(
              a.key(),
              a.scopeMask(),
              rows(a.strings(), ValueComparators.STRING_LIST),
              rows(a.ints(), ValueComparators.INT64_LIST),
              rows(a.floats(), ValueComparators.FLOAT64_LIST),
              rows(a.bools(), ValueComparators.BOOL_LIST)));
    }
    return out;
  }

  public static List<IndexedAttr.Codes> generateCodesIndex(FileStats stats) {
    List<AttributeInfo> keys = sortedKeys(stats);
    List<IndexedAttr.Codes> out = new ArrayList<>(keys.size());
    for (int i = 0; i < keys.size(); i++) {
      AttributeInfo a = keys.get(i);
      out.add(
          new IndexedAttr.Codes(
              a.key(),
              i + 1,
              a.scopeMask(),
              codes(a.strings(), ValueComparators.STRING_LIST),
              codes(a.ints(), ValueComparators.INT64_LIST),
              codes(a.floats(), ValueComparators.FLOAT64_LIST),
              codes(a.bools(), ValueComparators.BOOL_LIST)));
    }
    return out;
  }

  private static List<AttributeInfo> sortedKeys(FileStats stats) {
    List<AttributeInfo> keys = new ArrayList<>(stats.attributes().values());
    keys.sort(Comparator.comparing(AttributeInfo::key, ValueComparators.STRING));
    return keys;
  }

  private static <T> List<ValueInfo<T>> sorted(
      ValueGroups<T> groups, Comparator<List<T>> order) {
    List<ValueInfo<T>> out = new ArrayList<>(groups.groups());
    out.sort((a, b) -> order.compare(a.value(), b.value()));
    return out;
  }

  private static <T> List<IndexedAttr.CombinedValue<T>> combined(
      ValueGroups<T> groups, Comparator<List<T>> order) {
    List<ValueInfo<T>> sorted = sorted(groups, order);
    List<IndexedAttr.CombinedValue<T>> out = new ArrayList<>(sorted.size());
    for (int i = 0; i < sorted.size(); i++) {
      ValueInfo<T> v = sorted.get(i);
      out.add(new IndexedAttr.CombinedValue<>(v.value(), i + 1, List.copyOf(v.rowNumbers())));
    }
    return out;
  }

  private static <T> List<IndexedAttr.RowsValue<T>> rows(
      ValueGroups<T> groups, Comparator<List<T>> order) {
    List<IndexedAttr.RowsValue<T>> out = new ArrayList<>(groups.size());
    for (ValueInfo<T> v : sorted(groups, order)) {
      out.add(new IndexedAttr.RowsValue<>(v.value(), List.copyOf(v.rowNumbers())));
    }
    return out;
  }

  private static <T> List<IndexedAttr.CodesValue<T>> codes(
      ValueGroups<T> groups, Comparator<List<T>> order) {
    List<ValueInfo<T>> sorted = sorted(groups, order);
    List<IndexedAttr.CodesValue<T>> out = new ArrayList<>(sorted.size());
    for (int i = 0; i < sorted.size(); i++) {
      out.add(new IndexedAttr.CodesValue<>(sorted.get(i).value(), i + 1));
    }
    return out;
  }
}
