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

package ai.floedb.tracestats.analysis;

import ai.floedb.tracestats.analysis.block.BlockMeta;
import ai.floedb.tracestats.analysis.block.BlockMetaReader;
import ai.floedb.tracestats.analysis.block.FormatVersion;
import ai.floedb.tracestats.analysis.block.UnsupportedVersionException;
import ai.floedb.tracestats.analysis.paths.AttributePaths;
import ai.floedb.tracestats.analysis.paths.ColumnPathResolver;
import ai.floedb.tracestats.analysis.stats.AttributeAggregator;
import ai.floedb.tracestats.analysis.stats.GenericAttrSummary;
import ai.floedb.tracestats.parquet.ParquetBlockFile;
import ai.floedb.tracestats.parquet.io.BufferedBlockInputFile;
import ai.floedb.tracestats.parquet.io.LocalBlockInputFile;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Computes the attribute statistics of a single block stored in a local directory holding its
 * {@code meta.json} and {@code data.parquet}.
 */
public final class BlockAnalyzer {
  private static final Logger LOG = Logger.getLogger(BlockAnalyzer.class);

  private final BlockMetaReader metaReader;
  private final int minCompactionLevel;
  private final int bufferWindowBytes;
  private final int bufferCount;

  public BlockAnalyzer(AnalysisConfig config) {
    this(
        new BlockMetaReader(),
        config.minCompactionLevel(),
        config.bufferWindowBytes(),
        config.bufferCount());
  }

  BlockAnalyzer(
      BlockMetaReader metaReader, int minCompactionLevel, int bufferWindowBytes, int bufferCount) {
    this.metaReader = metaReader;
    this.minCompactionLevel = minCompactionLevel;
    this.bufferWindowBytes = bufferWindowBytes;
    this.bufferCount = bufferCount;
  }

  public Optional<BlockSummary> analyze(Path blockDir) throws IOException {
    return analyze(blockDir, StartTimeWindow.unbounded());
  }

  /**
   * Analyses the block in {@code blockDir}.
   *
   * @return the block's summary, or empty when the block is filtered out by compaction level or
   *     start time
   * @throws UnsupportedVersionException if the block's format cannot be analysed
   */
  public Optional<BlockSummary> analyze(Path blockDir, StartTimeWindow window) throws IOException {
    BlockMeta meta = metaReader.read(blockDir);
    if (meta.compactionLevel() < minCompactionLevel) {
      LOG.debugf(
          "Skipping block %s: compaction level %d below %d",
          meta.blockId(), meta.compactionLevel(), minCompactionLevel);
      return Optional.empty();
    }
    if (meta.startTime() != null && !window.contains(meta.startTime())) {
      LOG.debugf(
          "Skipping block %s: start time %s outside %s", meta.blockId(), meta.startTime(), window);
      return Optional.empty();
    }

    FormatVersion version = meta.formatVersion();
    AttributePaths paths = ColumnPathResolver.pathsForVersion(version);
    Path data = blockDir.resolve(FormatVersion.DATA_FILE_NAME);

    LOG.infof("Scanning block %s (%s, %d bytes)", meta.blockId(), version, meta.size());
    long started = System.nanoTime();
    AttributeAggregator aggregator = new AttributeAggregator();
    BlockSummary summary;
    try (BufferedBlockInputFile in =
        new BufferedBlockInputFile(new LocalBlockInputFile(data), bufferWindowBytes, bufferCount)) {
      ParquetBlockFile file = ParquetBlockFile.open(in);
      GenericAttrSummary span = aggregator.aggregateScope(file, meta, paths.span());
      GenericAttrSummary resource = aggregator.aggregateScope(file, meta, paths.resource());
      GenericAttrSummary event =
          paths.event().isPresent()
              ? aggregator.aggregateScope(file, meta, paths.event().get())
              : GenericAttrSummary.empty();
      summary = new BlockSummary(span, resource, event);
    } catch (IOException e) {
      throw new IOException("Failed to analyse block " + meta.blockId(), e);
    }

    LOG.infof(
        "Scanned block %s in %d ms: span %d bytes, resource %d bytes, event %d bytes",
        meta.blockId(),
        (System.nanoTime() - started) / 1_000_000,
        summary.span().totalBytes(),
        summary.resource().totalBytes(),
        summary.event().totalBytes());
    return Optional.of(summary);
  }
}
