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

import ai.floedb.tracestats.parquet.RowNumber;
import ai.floedb.tracestats.types.Scope;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Attribute occurrences and structural counters of one block file.
 *
 * <p>Null or empty values are ignored entirely: they neither create the attribute nor count as
 * an occurrence.
 */
public final class FileStats {

  /** Scope mask ascending, then occurrence count descending, then key. */
  public static final Comparator<AttributeInfo> BY_SCOPE_AND_COUNT =
      Comparator.comparingLong((AttributeInfo a) -> a.scopeMask().value())
          .thenComparing(Comparator.comparingLong(AttributeInfo::count).reversed())
          .thenComparing(AttributeInfo::key);

  long traces;
  long resources;
  long spans;
  long events;
  long links;
  long arrays;
  private final Map<String, AttributeInfo> attributes = new HashMap<>(256);

  public long traces() {
    return traces;
  }

  public long resources() {
    return resources;
  }

  public long spans() {
    return spans;
  }

  public long events() {
    return events;
  }

  public long links() {
    return links;
  }

  public long arrays() {
    return arrays;
  }

  public Map<String, AttributeInfo> attributes() {
    return Collections.unmodifiableMap(attributes);
  }

  public AttributeInfo attribute(String key) {
    return attributes.get(key);
  }

  /** Attributes ordered by {@link #BY_SCOPE_AND_COUNT}. */
  public List<AttributeInfo> sortedByScopeAndCount() {
    List<AttributeInfo> out = new ArrayList<>(attributes.values());
    out.sort(BY_SCOPE_AND_COUNT);
    return out;
  }

  public void addString(RowNumber row, Scope scope, String key, String value) {
    if (value != null) {
      addStrings(row, scope, key, List.of(value));
    }
  }

  public void addStrings(RowNumber row, Scope scope, String key, List<String> values) {
    if (values != null && !values.isEmpty()) {
      info(key, scope).strings().add(values, IndexRowNumber.of(row));
    }
  }

  public void addLong(RowNumber row, Scope scope, String key, Long value) {
    if (value != null) {
      addLongs(row, scope, key, List.of(value));
    }
  }

  public void addLongs(RowNumber row, Scope scope, String key, List<Long> values) {
    if (values != null && !values.isEmpty()) {
      info(key, scope).ints().add(values, IndexRowNumber.of(row));
    }
  }

  public void addDoubles(RowNumber row, Scope scope, String key, List<Double> values) {
    if (values != null && !values.isEmpty()) {
      info(key, scope).floats().add(values, IndexRowNumber.of(row));
    }
  }

  public void addBools(RowNumber row, Scope scope, String key, List<Boolean> values) {
    if (values != null && !values.isEmpty()) {
      info(key, scope).bools().add(values, IndexRowNumber.of(row));
    }
  }

  private AttributeInfo info(String key, Scope scope) {
    AttributeInfo info = attributes.computeIfAbsent(key, AttributeInfo::new);
    info.occurred(scope);
    return info;
  }

  @Override
  public String toString() {
    return "FileStats{traces="
        + traces
        + ", resources="
        + resources
        + ", spans="
        + spans
        + ", events="
        + events
        + ", links="
        + links
        + ", arrays="
        + arrays
        + ", attributes="
        + attributes.size()
        + "}";
  }
}
