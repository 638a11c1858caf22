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

package ai.floedb.tracestats.analysis.stats;

import ai.floedb.tracestats.parquet.IteratorResult;
import ai.floedb.tracestats.parquet.RowConsumer;
import ai.floedb.tracestats.types.AttrValue;

/**
 * Turns each joined {@code key}/{@code value}/{@code isArray} row into an {@link AttrStats}
 * attached under {@link #STATS}. Rows with a null value are dropped.
 */
public final class AttrStatsCollector implements RowConsumer {

  public static final String KEY = "key";
  public static final String VALUE = "value";
  public static final String IS_ARRAY = "isArray";
  public static final String STATS = "stats";

  private final AttrStatsPool pool;

  public AttrStatsCollector(AttrStatsPool pool) {
    this.pool = pool;
  }

  @Override
  public boolean keepRow(IteratorResult row) {
    AttrStats stats = row.otherValue(STATS, AttrStats.class);
    boolean attached = stats != null;
    if (!attached) {
      stats = pool.acquire();
    }

    for (IteratorResult.Entry e : row.entries()) {
      switch (e.key()) {
        case KEY -> stats.name(e.value().asString());
        case VALUE -> {
          AttrValue v = e.value();
          if (v.isMissing()) {
            stats.markNull();
          } else {
            stats.addValue(v.asString(), v.byteSize());
          }
        }
        case IS_ARRAY -> {
          if (!stats.isArray() && e.value() instanceof AttrValue.Bool b && b.value()) {
            stats.markArray();
          }
        }
        default -> {}
      }
    }

    row.clearEntries();
    if (stats.isNull()) {
      if (attached) {
        AttrStats dropped = stats;
        row.otherEntries().removeIf(o -> o.value() == dropped);
      }
      pool.release(stats);
      return false;
    }

    if (!attached) {
      row.appendOtherValue(STATS, stats);
    }
    return true;
  }

  @Override
  public String toString() {
    return "AttrStatsCollector{}";
  }
}
