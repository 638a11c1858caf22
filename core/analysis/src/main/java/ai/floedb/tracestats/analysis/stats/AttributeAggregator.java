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

import ai.floedb.tracestats.analysis.block.BlockMeta;
import ai.floedb.tracestats.analysis.block.DedicatedColumn;
import ai.floedb.tracestats.analysis.block.DedicatedColumnScope;
import ai.floedb.tracestats.analysis.paths.ScopeAttributePath;
import ai.floedb.tracestats.parquet.ColumnIterator;
import ai.floedb.tracestats.parquet.ColumnNotFoundException;
import ai.floedb.tracestats.parquet.IteratorResult;
import ai.floedb.tracestats.parquet.JoinIterator;
import ai.floedb.tracestats.parquet.ParquetBlockFile;
import ai.floedb.tracestats.parquet.ValuePredicate;
import ai.floedb.tracestats.types.AttrValue;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Sums attribute sizes and value counts of one scope of a block file by joining its key, value
 * and array flag columns.
 *
 * <p>Not thread safe: an aggregator owns the {@link AttrStatsPool} of the scans it runs.
 */
public final class AttributeAggregator {
  private static final Logger LOG = Logger.getLogger(AttributeAggregator.class);

  private final AttrStatsPool pool;

  public AttributeAggregator() {
    this(new AttrStatsPool());
  }

  public AttributeAggregator(AttrStatsPool pool) {
    this.pool = pool;
  }

  /**
   * Scans the generic attribute list of a scope.
   *
   * @param definitionLevel level at which key, value and array flag of one attribute line up
   * @param isArrayPath array flag column, absent for formats without array attributes
   * @throws ColumnNotFoundException if one of the paths is not in the file
   */
  public GenericAttrSummary aggregateAttributes(
      ParquetBlockFile file,
      int definitionLevel,
      String keyPath,
      String valuePath,
      Optional<String> isArrayPath)
      throws IOException {
    List<ColumnIterator> iters = new ArrayList<>(3);
    try {
      iters.add(file.openColumn(keyPath, AttrStatsCollector.KEY));
      iters.add(file.openColumn(valuePath, AttrStatsCollector.VALUE));
      if (isArrayPath.isPresent()) {
        iters.add(file.openColumn(isArrayPath.get(), AttrStatsCollector.IS_ARRAY));
      }
    } catch (IOException | RuntimeException e) {
      closeAll(iters, e);
      throw e;
    }

    GenericAttrSummary.Builder summary = GenericAttrSummary.builder();
    long rows = 0;
    try (JoinIterator join =
        new JoinIterator(definitionLevel, iters, new AttrStatsCollector(pool))) {
      IteratorResult res;
      while ((res = join.next()) != null) {
        for (IteratorResult.OtherEntry e : res.otherEntries()) {
          if (e.value() instanceof AttrStats stats) {
            if (stats.isArray()) {
              summary.addArrayAttribute(stats.name(), stats.bytes());
            } else {
              summary.addAttribute(stats.name(), stats.bytes(), stats.value());
            }
            pool.release(stats);
            rows++;
          }
        }
      }
    }

    GenericAttrSummary result = summary.build();
    LOG.debugf(
        "Aggregated %d attribute rows of %s: %d attributes, %d array attributes",
        rows,
        keyPath,
        result.attributes().size(),
        result.arrayAttributes().size());
    return result;
  }

  /**
   * Scans a scope's generic attribute list and merges the dedicated string columns the block
   * declares for that scope.
   *
   * @throws ColumnNotFoundException if the block declares more dedicated columns than the format
   *     has slots, or a path is not in the file
   */
  public GenericAttrSummary aggregateScope(
      ParquetBlockFile file, BlockMeta meta, ScopeAttributePath path) throws IOException {
    GenericAttrSummary generic =
        aggregateAttributes(
            file, path.definitionLevel(), path.keyPath(), path.valuePath(), path.isArrayPath());
    if (path.dedicatedScope().isEmpty()) {
      return generic;
    }

    DedicatedColumnScope scope = path.dedicatedScope().get();
    List<DedicatedColumn> columns = meta.dedicatedColumns(scope);
    if (columns.isEmpty()) {
      return generic;
    }
    List<String> slots = path.dedicatedColumnPaths();
    if (columns.size() > slots.size()) {
      throw new ColumnNotFoundException(
          scope.label() + " dedicated column " + (slots.size() + 1),
          "Block declares "
              + columns.size()
              + " dedicated "
              + scope.label()
              + " columns but the format has "
              + slots.size()
              + " slots");
    }

    GenericAttrSummary.Builder merged = generic.toBuilder();
    for (int i = 0; i < columns.size(); i++) {
      Map<String, Long> values = new HashMap<>();
      long bytes = aggregateSingleColumn(file, slots.get(i), values);
      merged.dedicatedColumn(columns.get(i).name(), bytes, values);
      LOG.debugf(
          "Dedicated %s column %s in %s: %d bytes",
          scope.label(), columns.get(i).name(), slots.get(i), bytes);
    }
    return merged.build();
  }

  /** Sums the byte size of the non-null values of one column, counting each value. */
  long aggregateSingleColumn(ParquetBlockFile file, String path, Map<String, Long> values)
      throws IOException {
    long bytes = 0;
    try (ColumnIterator it =
        file.openColumn(path, AttrStatsCollector.VALUE, ValuePredicate.notNull())) {
      IteratorResult res;
      while ((res = it.next()) != null) {
        for (IteratorResult.Entry e : res.entries()) {
          AttrValue v = e.value();
          bytes += v.byteSize();
          values.merge(v.asString(), 1L, Long::sum);
        }
      }
    }
    return bytes;
  }

  private static void closeAll(List<ColumnIterator> iters, Exception failure) {
    for (ColumnIterator it : iters) {
      try {
        it.close();
      } catch (RuntimeException e) {
        failure.addSuppressed(e);
      }
    }
  }
}
