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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Inner join of several column iterators at a definition level.
 *
 * <p>A joined row is produced for every row number (compared through the definition level) that
 * all sources have a value at. All values of a source sharing that row prefix are collected into
 * the row, so a repeated column contributes several entries. The source with the highest pending
 * row number drives seeks of the others, which lets sparse columns skip ahead quickly.
 *
 * <p>The join ends when any source is exhausted. Closing the join closes every source.
 */
public final class JoinIterator implements ColumnIterator {

  private final int definitionLevel;
  private final List<ColumnIterator> iters;
  private final IteratorResult[] peeks;
  private final RowConsumer consumer;
  private final IteratorResult at = new IteratorResult();
  private boolean closed;

  public JoinIterator(int definitionLevel, List<ColumnIterator> iters, RowConsumer consumer) {
    if (iters.isEmpty()) {
      throw new IllegalArgumentException("join needs at least one iterator");
    }
    if (definitionLevel < 0 || definitionLevel > RowNumber.MAX_DEFINITION_LEVEL) {
      throw new IllegalArgumentException("invalid definition level " + definitionLevel);
    }
    this.definitionLevel = definitionLevel;
    this.iters = new ArrayList<>(iters);
    this.peeks = new IteratorResult[iters.size()];
    this.consumer = consumer;
  }

  @Override
  public IteratorResult next() throws IOException {
    outer:
    while (true) {
      if (peeks[0] == null) {
        for (int i = 0; i < iters.size(); i++) {
          if (peek(i) == null) {
            return null;
          }
        }
      }

      for (int i = 1; i < iters.size(); i++) {
        seek(i, peeks[0].rowNumber(), definitionLevel);
        if (peeks[i] == null) {
          return null;
        }

        if (RowNumber.compare(definitionLevel, peeks[i].rowNumber(), peeks[0].rowNumber()) > 0) {
          // this source is ahead of all previous ones, let it drive
          swap(0, i);
          continue outer;
        }
      }

      IteratorResult result = collect(peeks[0].rowNumber().copy());
      if (consumer == null || consumer.keepRow(result)) {
        return result;
      }
    }
  }

  @Override
  public IteratorResult seekTo(RowNumber to, int level) throws IOException {
    RowNumber t = to.truncate(level);
    for (int i = 0; i < iters.size(); i++) {
      if (peeks[i] == null || RowNumber.compare(level, peeks[i].rowNumber(), t) < 0) {
        peeks[i] = iters.get(i).seekTo(t, level);
        if (peeks[i] == null) {
          break;
        }
      }
    }
    return next();
  }

  private void seek(int i, RowNumber to, int level) throws IOException {
    RowNumber t = to.truncate(level);
    if (peeks[i] == null || RowNumber.compare(level, peeks[i].rowNumber(), t) < 0) {
      peeks[i] = iters.get(i).seekTo(t, level);
    }
  }

  private IteratorResult peek(int i) throws IOException {
    if (peeks[i] == null) {
      peeks[i] = iters.get(i).next();
    }
    return peeks[i];
  }

  private IteratorResult collect(RowNumber rowNumber) throws IOException {
    at.reset();
    at.rowNumber().set(rowNumber);
    for (int i = 0; i < iters.size(); i++) {
      while (peeks[i] != null && RowNumber.equal(definitionLevel, peeks[i].rowNumber(), rowNumber)) {
        at.append(peeks[i]);
        peeks[i] = iters.get(i).next();
      }
    }
    return at;
  }

  private void swap(int a, int b) {
    ColumnIterator it = iters.get(a);
    iters.set(a, iters.get(b));
    iters.set(b, it);
    IteratorResult p = peeks[a];
    peeks[a] = peeks[b];
    peeks[b] = p;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    RuntimeException failure = null;
    for (ColumnIterator it : iters) {
      try {
        it.close();
      } catch (RuntimeException e) {
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  @Override
  public String toString() {
    return "JoinIterator{" + definitionLevel + ", " + Objects.toString(consumer) + ", " + iters + "}";
  }
}
