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

package ai.floedb.tracestats.index.stats;

import ai.floedb.tracestats.types.ValueHashing;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToLongFunction;

/**
 * Distinct values of one attribute and one value type, bucketed by FNV-1a hash. Values whose
 * hashes collide are kept apart in the bucket's chain and compared by equality, so a collision
 * never merges two values.
 */
public final class ValueGroups<T> {

  private final ToLongFunction<List<T>> hash;
  private final Map<Long, List<ValueInfo<T>>> buckets = new LinkedHashMap<>();
  private final List<ValueInfo<T>> groups = new ArrayList<>();

  ValueGroups(ToLongFunction<List<T>> hash) {
    this.hash = hash;
  }

  public static ValueGroups<String> strings() {
    return new ValueGroups<>(ValueHashing::hashStrings);
  }

  public static ValueGroups<Long> longs() {
    return new ValueGroups<>(ValueHashing::hashLongs);
  }

  public static ValueGroups<Double> doubles() {
    return new ValueGroups<>(ValueHashing::hashDoubles);
  }

  public static ValueGroups<Boolean> bools() {
    return new ValueGroups<>(ValueHashing::hashBools);
  }

  /** Records an occurrence of {@code value} at {@code row}. */
  public void add(List<T> value, IndexRowNumber row) {
    List<ValueInfo<T>> chain =
        buckets.computeIfAbsent(hash.applyAsLong(value), k -> new ArrayList<>(1));
    for (ValueInfo<T> info : chain) {
      if (info.value().equals(value)) {
        info.add(row);
        return;
      }
    }
    ValueInfo<T> info = new ValueInfo<>(value);
    info.add(row);
    chain.add(info);
    groups.add(info);
  }

  /** Distinct values in first-seen order. */
  public List<ValueInfo<T>> groups() {
    return Collections.unmodifiableList(groups);
  }

  public int size() {
    return groups.size();
  }

  public boolean isEmpty() {
    return groups.isEmpty();
  }

  int bucketCount() {
    return buckets.size();
  }
}
