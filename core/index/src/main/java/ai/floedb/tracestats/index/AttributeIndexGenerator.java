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

package ai.floedb.tracestats.index;

import ai.floedb.tracestats.analysis.block.BlockMeta;
import ai.floedb.tracestats.analysis.block.BlockMetaReader;
import ai.floedb.tracestats.analysis.block.DedicatedColumn;
import ai.floedb.tracestats.analysis.block.DedicatedColumnScope;
import ai.floedb.tracestats.analysis.block.FormatVersion;
import ai.floedb.tracestats.analysis.block.UnsupportedVersionException;
import ai.floedb.tracestats.index.format.AttributeIndexBuilder;
import ai.floedb.tracestats.index.format.AttributeIndexWriter;
import ai.floedb.tracestats.index.format.IndexType;
import ai.floedb.tracestats.index.format.IndexedAttr;
import ai.floedb.tracestats.index.stats.AttributeInfo;
import ai.floedb.tracestats.index.stats.FileStats;
import ai.floedb.tracestats.index.stats.TraceAttributeCollector;
import ai.floedb.tracestats.parquet.ParquetBlockFile;
import ai.floedb.tracestats.parquet.io.LocalBlockInputFile;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Builds the attribute index of one vParquet4 block: collects every attribute occurrence from
 * the block's trace records, encodes them in the configured layout and writes {@code
 * index.parquet} into the block directory.
 */
public final class AttributeIndexGenerator {
  private static final Logger LOG = Logger.getLogger(AttributeIndexGenerator.class);

  private static final String TRACE_RESOURCE_SPANS = "rs";

  private final BlockMetaReader metaReader;
  private final IndexType type;
  private final boolean addIntrinsics;
  private final int readBatchSize;

  public AttributeIndexGenerator(IndexConfig config) {
    this(
        new BlockMetaReader(),
        IndexType.fromTypes(config.indexTypes()),
        config.addIntrinsics(),
        config.readBatchSize());
  }

  AttributeIndexGenerator(
      BlockMetaReader metaReader, IndexType type, boolean addIntrinsics, int readBatchSize) {
    this.metaReader = metaReader;
    this.type = type;
    this.addIntrinsics = addIntrinsics;
    this.readBatchSize = readBatchSize;
  }

  public record Result(Path indexFile, IndexType type, FileStats stats, int records) {}

  /**
   * Generates the index of the block stored in {@code blockDir}.
   *
   * @throws UnsupportedVersionException if the block is not vParquet4
   */
  public Result generate(Path blockDir) throws IOException {
    BlockMeta meta = metaReader.read(blockDir);
    if (meta.formatVersion() != FormatVersion.VPARQUET4) {
      throw new UnsupportedVersionException(meta.version());
    }

    long started = System.nanoTime();
    FileStats stats = collect(blockDir, meta);
    logStats(meta, stats);

    List<IndexedAttr> records = AttributeIndexBuilder.generate(type, stats);
    Path out;
    try {
      out = AttributeIndexWriter.write(blockDir, type, records);
    } catch (IOException e) {
      throw new IOException("Failed to write index of block " + meta.blockId(), e);
    }
    LOG.infof(
        "Indexed block %s: %d keys, %s layout, %d ms",
        meta.blockId(), records.size(), type, (System.nanoTime() - started) / 1_000_000);
    return new Result(out, type, stats, records.size());
  }

  FileStats collect(Path blockDir, BlockMeta meta) throws IOException {
    TraceAttributeCollector collector =
        new TraceAttributeCollector(
            new FileStats(),
            names(meta.dedicatedColumns(DedicatedColumnScope.RESOURCE)),
            names(meta.dedicatedColumns(DedicatedColumnScope.SPAN)),
            addIntrinsics);
    try {
      ParquetBlockFile file =
          ParquetBlockFile.open(
              new LocalBlockInputFile(blockDir.resolve(FormatVersion.DATA_FILE_NAME)));
      file.readGroups(List.of(TRACE_RESOURCE_SPANS), readBatchSize, collector::collect);
    } catch (IOException e) {
      throw new IOException("Failed to read block " + meta.blockId(), e);
    }
    return collector.stats();
  }

  private static List<String> names(List<DedicatedColumn> columns) {
    return columns.stream().map(DedicatedColumn::name).toList();
  }

  private static void logStats(BlockMeta meta, FileStats stats) {
    LOG.infof(
        "Block %s: %d traces, %d resources, %d spans, %d events, %d links, %d arrays,"
            + " %d attributes",
        meta.blockId(),
        stats.traces(),
        stats.resources(),
        stats.spans(),
        stats.events(),
        stats.links(),
        stats.arrays(),
        stats.attributes().size());
    if (LOG.isDebugEnabled()) {
      for (AttributeInfo a : stats.sortedByScopeAndCount()) {
        LOG.debugf(
            "%-40s %-30s count=%d cardinality=%d",
            a.key(), a.scopeMask(), a.count(), a.cardinality());
      }
    }
  }
}
