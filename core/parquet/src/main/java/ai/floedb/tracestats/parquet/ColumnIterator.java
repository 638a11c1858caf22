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

import java.io.Closeable;
import java.io.IOException;

/**
 * Ordered stream of {@link IteratorResult rows} read from one or more columns of a block.
 *
 * <p>Results are returned in ascending row number order. A returned result is only valid until
 * the next call to {@link #next()} or {@link #seekTo}; implementations reuse it.
 */
public interface ColumnIterator extends Closeable {

  /** Returns the next result, or {@code null} once the iterator is exhausted. */
  IteratorResult next() throws IOException;

  /**
   * Advances to the first result whose row number, compared through {@code definitionLevel}, is
   * not less than {@code to}. Returns {@code null} if there is none.
   */
  IteratorResult seekTo(RowNumber to, int definitionLevel) throws IOException;

  @Override
  void close();
}
