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

/** In-memory column for join tests: a fixed list of (row number, value) pairs. */
final class ListColumnIterator implements ColumnIterator {

  record Cell(RowNumber row, AttrValue value) {}

  private final String name;
  private final List<Cell> cells;
  private final IteratorResult at = new IteratorResult();
  private int pos;
  boolean closed;

  ListColumnIterator(String name, List<Cell> cells) {
    this.name = name;
    this.cells = new ArrayList<>(cells);
  }

  static Cell cell(AttrValue value, int... levels) {
    return new Cell(RowNumber.of(levels), value);
  }

  @Override
  public IteratorResult next() {
    if (pos >= cells.size()) {
      return null;
    }
    Cell c = cells.get(pos++);
    at.reset();
    at.rowNumber().set(c.row());
    at.appendValue(name, c.value());
    return at;
  }

  @Override
  public IteratorResult seekTo(RowNumber to, int definitionLevel) {
    while (pos < cells.size() && RowNumber.compare(definitionLevel, cells.get(pos).row(), to) < 0) {
      pos++;
    }
    return next();
  }

  @Override
  public void close() {
    closed = true;
  }
}
