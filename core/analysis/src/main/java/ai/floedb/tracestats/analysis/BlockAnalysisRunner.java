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

import ai.floedb.tracestats.analysis.block.DedicatedColumn;
import ai.floedb.tracestats.analysis.block.UnsupportedVersionException;
import ai.floedb.tracestats.analysis.stats.AttributeSize;
import ai.floedb.tracestats.analysis.stats.GenericAttrSummary;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.jboss.logging.Logger;

/**
 * Analyses many blocks on a fixed pool of worker threads and merges their summaries on the
 * calling thread.
 *
 * <p>Blocks in an unsupported format are skipped with a warning. Any other failure is recorded in
 * {@link Result#failed()} and the remaining blocks are still merged.
 */
public final class BlockAnalysisRunner implements AutoCloseable {
  private static final Logger LOG = Logger.getLogger(BlockAnalysisRunner.class);
  private static final AtomicInteger COUNTER = new AtomicInteger(1);

  private final BlockAnalyzer analyzer;
  private final ExecutorService executor;
  private final int numAttr;
  private final int suggestions;

  public BlockAnalysisRunner(AnalysisConfig config) {
    this(
        new BlockAnalyzer(config),
        config.concurrency(),
        config.numAttr(),
        config.dedicatedColumnSuggestions());
  }

  /**
   * @param numAttr attributes logged per scope once the run is merged
   * @param suggestions dedicated columns suggested per scope in {@link Result#suggestions()}
   */
  public BlockAnalysisRunner(
      BlockAnalyzer analyzer, int concurrency, int numAttr, int suggestions) {
    if (concurrency <= 0) {
      throw new IllegalArgumentException("concurrency must be positive: " + concurrency);
    }
    if (numAttr < 0 || suggestions < 0) {
      throw new IllegalArgumentException(
          "numAttr and suggestions must not be negative: " + numAttr + ", " + suggestions);
    }
    this.analyzer = analyzer;
    this.numAttr = numAttr;
    this.suggestions = suggestions;
    this.executor =
        Executors.newFixedThreadPool(
            concurrency,
            new ThreadFactory() {
              @Override
              public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, "block-analysis-" + COUNTER.getAndIncrement());
                thread.setDaemon(true);
                return thread;
              }
            });
  }

  /** Outcome of a run; block directories are reported by their file name (the block id). */
  public record Result(
      BlockSummary summary,
      List<DedicatedColumn> suggestions,
      List<String> analyzed,
      List<String> skipped,
      List<BlockFailure> failed) {

    public Result {
      suggestions = List.copyOf(suggestions);
      analyzed = List.copyOf(analyzed);
      skipped = List.copyOf(skipped);
      failed = List.copyOf(failed);
    }
  }

  public record BlockFailure(String blockId, Throwable cause) {}

  public Result run(List<Path> blockDirs) throws InterruptedException {
    return run(blockDirs, StartTimeWindow.unbounded());
  }

  public Result run(List<Path> blockDirs, StartTimeWindow window) throws InterruptedException {
    List<Future<Optional<BlockSummary>>> futures = new ArrayList<>(blockDirs.size());
    for (Path dir : blockDirs) {
      futures.add(executor.submit(() -> analyzer.analyze(dir, window)));
    }

    BlockSummary.Builder merged = BlockSummary.builder();
    List<String> analyzed = new ArrayList<>();
    List<String> skipped = new ArrayList<>();
    List<BlockFailure> failed = new ArrayList<>();
    for (int i = 0; i < futures.size(); i++) {
      String blockId = blockDirs.get(i).getFileName().toString();
      try {
        Optional<BlockSummary> summary = futures.get(i).get();
        if (summary.isPresent()) {
          merged.add(summary.get());
          analyzed.add(blockId);
        } else {
          skipped.add(blockId);
        }
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof UnsupportedVersionException uve) {
          LOG.warnf("Skipping block %s: unsupported version %s", blockId, uve.version());
          skipped.add(blockId);
        } else {
          LOG.warnf(cause, "Failed to analyse block %s", blockId);
          failed.add(new BlockFailure(blockId, cause));
        }
      }
    }

    LOG.infof(
        "Analysed %d blocks, skipped %d, failed %d",
        analyzed.size(), skipped.size(), failed.size());
    BlockSummary summary = merged.build();
    logTop("span", summary.span());
    logTop("resource", summary.resource());
    logTop("event", summary.event());
    return new Result(
        summary, summary.suggestDedicatedColumns(suggestions), analyzed, skipped, failed);
  }

  private void logTop(String scope, GenericAttrSummary summary) {
    if (summary.totalBytes() == 0) {
      return;
    }
    LOG.infof("Top %d %s attributes of %d bytes", numAttr, scope, summary.totalBytes());
    for (AttributeSize a : summary.topAttributes(numAttr)) {
      LOG.infof(
          "  %s%s: %d bytes (%.2f%%), %d distinct values",
          a.name(),
          summary.isDedicated(a.name()) ? " (dedicated)" : "",
          a.bytes(),
          summary.percentOf(a.name()),
          summary.cardinality(a.name()).size());
    }
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
