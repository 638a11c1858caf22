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

/**
 * Hook invoked by {@link JoinIterator} for every joined row. Implementations may rewrite the row,
 * for example replacing its column entries with a derived object in {@link
 * IteratorResult#otherEntries()}.
 */
@FunctionalInterface
public interface RowConsumer {

  /** Returns {@code true} to emit the row, {@code false} to drop it. */
  boolean keepRow(IteratorResult row);
}
