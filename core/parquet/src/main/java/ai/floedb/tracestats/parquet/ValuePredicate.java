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

import ai.floedb.tracestats.types.AttrValue;
import java.util.Set;
import org.apache.parquet.column.statistics.Statistics;
import org.apache.parquet.io.api.Binary;
import org.apache.parquet.schema.PrimitiveComparator;

/** Filter applied by a column iterator to decide which values it returns. */
@FunctionalInterface
public interface ValuePredicate {

  boolean keepValue(AttrValue value);

  /**
   * Whether a whole column chunk may contain matching values, judged from its statistics. Chunks
   * rejected here are skipped without decoding, but still advance the row numbers.
   */
  default boolean keepColumnChunk(Statistics<?> stats) {
    return true;
  }

  static ValuePredicate notNull() {
    return v -> !v.isMissing();
  }

  /** Keeps string values contained in {@code values}, pruning chunks whose min/max exclude all. */
  static ValuePredicate stringIn(Set<String> values) {
    Set<String> copy = Set.copyOf(values);
    return new ValuePredicate() {
      @Override
      public boolean keepValue(AttrValue value) {
        return value instanceof AttrValue.Str s && copy.contains(s.value());
      }

      @Override
      @SuppressWarnings("unchecked")
      public boolean keepColumnChunk(Statistics<?> stats) {
        if (stats == null || stats.isEmpty()) {
          return true;
        }
        if (!stats.hasNonNullValue()) {
          // only nulls in this chunk
          return false;
        }
        if (!(stats.genericGetMin() instanceof Binary min)
            || !(stats.genericGetMax() instanceof Binary max)) {
          return true;
        }
        PrimitiveComparator<Binary> cmp =
            (PrimitiveComparator<Binary>) (PrimitiveComparator<?>) stats.comparator();
        for (String v : copy) {
          Binary b = Binary.fromString(v);
          if (cmp.compare(b, min) >= 0 && cmp.compare(b, max) <= 0) {
            return true;
          }
        }
        return false;
      }

      @Override
      public String toString() {
        return "stringIn" + copy;
      }
    };
  }
}
