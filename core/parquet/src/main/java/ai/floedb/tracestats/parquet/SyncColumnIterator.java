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
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.column.ColumnReader;
import org.apache.parquet.column.impl.ColumnReadStoreImpl;
import org.apache.parquet.column.page.PageReadStore;
import org.apache.parquet.column.statistics.Statistics;
import org.apache.parquet.example.data.simple.convert.GroupRecordConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.metadata.BlockMetaData;
import org.apache.parquet.hadoop.metadata.ColumnChunkMetaData;
import org.apache.parquet.hadoop.metadata.ColumnPath;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.schema.MessageType;
import org.jboss.logging.Logger;

/**
 * Reads a single leaf column row group by row group, tracking the nested row number of every
 * value from its repetition and definition levels.
 *
 * <p>Null leaves (definition level below the column maximum) are returned as {@link
 * AttrValue#missing()} so that joins can still line them up with sibling columns. A {@link
 * ValuePredicate} may drop values and skip whole row groups by their column statistics; skipped
 * values still advance the row number.
 *
 * <p>Each iterator owns its own {@link ParquetFileReader} restricted to the one column.
 */
public final class SyncColumnIterator implements ColumnIterator {
  private static final Logger LOG = Logger.getLogger(SyncColumnIterator.class);

  private final String columnName;
  private final String selectAs;
  private final ValuePredicate predicate;
  private final ParquetFileReader reader;
  private final MessageType projection;
  private final ColumnDescriptor column;
  private final ColumnPath columnPath;
  private final String createdBy;
  private final List<BlockMetaData> rowGroups;
  private final int maxDefinitionLevel;

  private final RowNumber curr = RowNumber.empty();
  private final RowNumber currMax = RowNumber.empty();
  private final IteratorResult at = new IteratorResult();

  private int nextRowGroup;
  private long rowsBefore;
  private ColumnReader current;
  private long remaining;
  private boolean closed;

  SyncColumnIterator(
      InputFile file,
      MessageType projection,
      String[] path,
      String selectAs,
      ValuePredicate predicate)
      throws IOException {
    this.columnName = String.join(".", path);
    this.selectAs = selectAs;
    this.predicate = predicate;
    this.projection = projection;
    this.column = projection.getColumnDescription(path);
    this.columnPath = ColumnPath.get(path);
    this.maxDefinitionLevel = column.getMaxDefinitionLevel();
    if (maxDefinitionLevel > RowNumber.MAX_DEFINITION_LEVEL) {
      throw new IllegalArgumentException(
          "Column "
              + columnName
              + " is nested deeper than "
              + RowNumber.MAX_DEFINITION_LEVEL
              + " levels");
    }

    this.reader = ParquetFileReader.open(file);
    reader.setRequestedSchema(projection);
    this.createdBy = reader.getFooter().getFileMetaData().getCreatedBy();
    this.rowGroups = reader.getRowGroups();
  }

  public String columnName() {
    return columnName;
  }

  public int maxDefinitionLevel() {
    return maxDefinitionLevel;
  }

  @Override
  public IteratorResult next() throws IOException {
    return read(null, 0);
  }

  @Override
  public IteratorResult seekTo(RowNumber to, int definitionLevel) throws IOException {
    if (current != null && RowNumber.compare(definitionLevel, to, currMax) >= 0) {
      closeRowGroup();
    }

    while (current == null) {
      if (nextRowGroup >= rowGroups.size()) {
        return null;
      }
      long rows = rowGroups.get(nextRowGroup).getRowCount();
      RowNumber max = RowNumber.of(Math.toIntExact(rowsBefore + rows));
      if (RowNumber.compare(definitionLevel, to, max) >= 0) {
        skipRowGroup(rows);
        continue;
      }
      if (!openNextRowGroup()) {
        return null;
      }
    }

    return read(to, definitionLevel);
  }

  private IteratorResult read(RowNumber to, int definitionLevel) throws IOException {
    while (true) {
      if (current == null && !openNextRowGroup()) {
        return null;
      }
      if (remaining == 0) {
        closeRowGroup();
        continue;
      }

      int r = current.getCurrentRepetitionLevel();
      int d = current.getCurrentDefinitionLevel();
      curr.next(r, d);
      remaining--;

      if (to != null && RowNumber.compare(definitionLevel, curr, to) < 0) {
        if (d == maxDefinitionLevel) {
          current.skip();
        }
        current.consume();
        continue;
      }

      AttrValue value = d == maxDefinitionLevel ? readValue() : AttrValue.missing();
      current.consume();

      if (predicate != null && !predicate.keepValue(value)) {
        continue;
      }

      at.reset();
      at.rowNumber().set(curr);
      if (selectAs != null) {
        at.appendValue(selectAs, value);
      }
      return at;
    }
  }

  private AttrValue readValue() {
    return switch (column.getPrimitiveType().getPrimitiveTypeName()) {
      case BINARY, FIXED_LEN_BYTE_ARRAY -> AttrValue.of(current.getBinary().toStringUsingUTF8());
      case INT64 -> AttrValue.of(current.getLong());
      case INT32 -> AttrValue.of((long) current.getInteger());
      case DOUBLE -> AttrValue.of(current.getDouble());
      case FLOAT -> AttrValue.of((double) current.getFloat());
      case BOOLEAN -> AttrValue.of(current.getBoolean());
      case INT96 ->
          throw new UnsupportedOperationException("INT96 column not supported: " + columnName);
    };
  }

  private boolean openNextRowGroup() throws IOException {
    while (nextRowGroup < rowGroups.size()) {
      BlockMetaData block = rowGroups.get(nextRowGroup);
      long rows = block.getRowCount();
      if (predicate != null && !predicate.keepColumnChunk(chunkStatistics(block))) {
        LOG.debugf("Skipping row group %d of %s by statistics", nextRowGroup, columnName);
        skipRowGroup(rows);
        continue;
      }

      PageReadStore pages = reader.readNextRowGroup();
      if (pages == null) {
        return false;
      }
      ColumnReadStoreImpl store =
          new ColumnReadStoreImpl(
              pages, new GroupRecordConverter(projection).getRootConverter(), projection, createdBy);
      current = store.getColumnReader(column);
      remaining = pages.getPageReader(column).getTotalValueCount();

      curr.set(RowNumber.of(Math.toIntExact(rowsBefore - 1)));
      currMax.set(RowNumber.of(Math.toIntExact(rowsBefore + rows)));
      rowsBefore += rows;
      nextRowGroup++;
      return true;
    }
    return false;
  }

  private void skipRowGroup(long rows) throws IOException {
    reader.skipNextRowGroup();
    rowsBefore += rows;
    nextRowGroup++;
  }

  private void closeRowGroup() {
    current = null;
    remaining = 0;
  }

  private Statistics<?> chunkStatistics(BlockMetaData block) {
    for (ColumnChunkMetaData chunk : block.getColumns()) {
      if (chunk.getPath().equals(columnPath)) {
        return chunk.getStatistics();
      }
    }
    return null;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    current = null;
    try {
      reader.close();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to close column " + columnName, e);
    }
  }

  @Override
  public String toString() {
    return "SyncColumnIterator{" + columnName + (predicate == null ? "" : ", " + predicate) + "}";
  }
}
