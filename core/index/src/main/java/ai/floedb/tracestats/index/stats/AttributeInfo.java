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

import ai.floedb.tracestats.types.Scope;
import ai.floedb.tracestats.types.ScopeMask;

/** Everything collected for one attribute key across all scopes of a block. */
public final class AttributeInfo {
  private final String key;
  private ScopeMask scopeMask = ScopeMask.EMPTY;
  private long count;
  private final ValueGroups<String> strings = ValueGroups.strings();
  private final ValueGroups<Long> ints = ValueGroups.longs();
  private final ValueGroups<Double> floats = ValueGroups.doubles();
  private final ValueGroups<Boolean> bools = ValueGroups.bools();

  AttributeInfo(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }

  public ScopeMask scopeMask() {
    return scopeMask;
  }

  /** Number of occurrences, arrays counting once. */
  public long count() {
    return count;
  }

  public ValueGroups<String> strings() {
    return strings;
  }

  public ValueGroups<Long> ints() {
    return ints;
  }

  public ValueGroups<Double> floats() {
    return floats;
  }

  public ValueGroups<Boolean> bools() {
    return bools;
  }

  /** Distinct values over all value types. */
  public int cardinality() {
    return strings.size() + ints.size() + floats.size() + bools.size();
  }

  void occurred(Scope scope) {
    count++;
    scopeMask = scopeMask.add(scope);
  }

  @Override
  public String toString() {
    return key + "{" + scopeMask + ", count=" + count + ", cardinality=" + cardinality() + "}";
  }
}
