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
import java.util.ArrayList;
import java.util.List;

/**
 * One row produced by a {@link ColumnIterator}: a row number plus named column values.
 *
 * <p>Column values live in {@link #entries()} under the name the source column was opened with
 * ({@code key}, {@code value}, {@code isArray}). Row consumers attach derived objects to {@link
 * #otherEntries()}. Iterators reuse their result instance between calls, so callers copy what
 * they keep.
 */
public final class IteratorResult {

  public record Entry(String key, AttrValue value) {}

  public record OtherEntry(String key, Object value) {}

  private final RowNumber rowNumber = RowNumber.empty();
  private final List<Entry> entries = new ArrayList<>(4);
  private final List<OtherEntry> otherEntries = new ArrayList<>(1);

  public RowNumber rowNumber() {
    return rowNumber;
  }

  public List<Entry> entries() {
    return entries;
  }

  public List<OtherEntry> otherEntries() {
    return otherEntries;
  }

  public void appendValue(String key, AttrValue value) {
    entries.add(new Entry(key, value));
  }

  public void appendOtherValue(String key, Object value) {
    otherEntries.add(new OtherEntry(key, value));
  }

  /** Appends the entries and other entries of {@code other}; the row number is left alone. */
  public void append(IteratorResult other) {
    entries.addAll(other.entries);
    otherEntries.addAll(other.otherEntries);
  }

  /** Returns the first other entry stored under {@code key} that is a {@code type}, or null. */
  public <T> T otherValue(String key, Class<T> type) {
    for (OtherEntry e : otherEntries) {
      if (e.key().equals(key) && type.isInstance(e.value())) {
        return type.cast(e.value());
      }
    }
    return null;
  }

  /** Drops the column entries, keeping the row number and other entries. */
  public void clearEntries() {
    entries.clear();
  }

  public void reset() {
    rowNumber.set(RowNumber.empty());
    entries.clear();
    otherEntries.clear();
  }

  @Override
  public String toString() {
    return "IteratorResult{" + rowNumber + ", " + entries + ", " + otherEntries + "}";
  }
}
