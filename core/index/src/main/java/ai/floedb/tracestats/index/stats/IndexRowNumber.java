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

/**
 * Location of an attribute occurrence: trace, resource spans, scope spans and span index.
 * Levels below the owning scope are {@code -1}, e.g. resource attributes have {@code lvl03} and
 * {@code lvl04} undefined.
 */
public record IndexRowNumber(long lvl01, long lvl02, long lvl03, long lvl04) {

  public static IndexRowNumber of(RowNumber row) {
    return new IndexRowNumber(row.get(0), row.get(1), row.get(2), row.get(3));
  }
}
