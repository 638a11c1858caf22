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

import java.util.ArrayList;
import java.util.List;

/** One distinct value of an attribute (a single element for scalars) and where it occurs. */
public final class ValueInfo<T> {
  private final List<T> value;
  private final List<IndexRowNumber> rowNumbers = new ArrayList<>(1);

  ValueInfo(List<T> value) {
    this.value = List.copyOf(value);
  }

  public List<T> value() {
    return value;
  }

  /** Occurrences in scan order. */
  public List<IndexRowNumber> rowNumbers() {
    return rowNumbers;
  }

  void add(IndexRowNumber row) {
    rowNumbers.add(row);
  }

  @Override
  public String toString() {
    return value + "x" + rowNumbers.size();
  }
}
