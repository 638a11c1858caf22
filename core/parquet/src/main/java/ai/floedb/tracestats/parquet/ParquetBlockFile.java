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
import java.util.function.Consumer;
import org.apache.parquet.column.page.PageReadStore;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.convert.GroupRecordConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.metadata.BlockMetaData;
import org.apache.parquet.hadoop.metadata.ParquetMetadata;
import org.apache.parquet.io.ColumnIOFactory;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.MessageColumnIO;
import org.apache.parquet.io.RecordReader;
import org.apache.parquet.schema.GroupType;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.Type;
import org.jboss.logging.Logger;

/**
 * Read access to the data file of one trace block.
 *
 * <p>The footer is read once when the file is opened. Column iterators and record scans each
 * open their own reader over the same {@link InputFile}; wrap it in a {@link
 * ai.floedb.tracestats.parquet.io.BufferedBlockInputFile} to share buffered bytes between them.
 */
public final class ParquetBlockFile {
  private static final Logger LOG = Logger.getLogger(ParquetBlockFile.class);

  private final InputFile file;
  private final ParquetMetadata footer;
  private final MessageType schema;

  private ParquetBlockFile(InputFile file, ParquetMetadata footer) {
    this.file = file;
    this.footer = footer;
    this.schema = footer.getFileMetaData().getSchema();
  }

  public static ParquetBlockFile open(InputFile file) throws IOException {
    try (ParquetFileReader reader = ParquetFileReader.open(file)) {
      return new ParquetBlockFile(file, reader.getFooter());
    }
  }

  public MessageType schema() {
    return schema;
  }

  public String createdBy() {
    return footer.getFileMetaData().getCreatedBy();
  }

  public int rowGroupCount() {
    return footer.getBlocks().size();
  }

  public long rowCount() {
    long rows = 0;
    for (BlockMetaData block : footer.getBlocks()) {
      rows += block.getRowCount();
    }
    return rows;
  }

  public boolean hasColumn(String path) {
    return schema.containsPath(split(path));
  }

  /** Maximum definition level of the leaf column at {@code path}. */
  public int maxDefinitionLevel(String path) {
    String[] parts = split(path);
    if (!schema.containsPath(parts)) {
      throw new ColumnNotFoundException(path);
    }
    return schema.getMaxDefinitionLevel(parts);
  }

  /**
   * Opens an iterator over the leaf column at {@code path} (dot separated, e.g. {@code
   * rs.list.element.Resource.Attrs.list.element.Key}). Values are exposed under {@code selectAs}.
   *
   * @throws ColumnNotFoundException if the path is not a leaf column of this file
   */
  public SyncColumnIterator openColumn(String path, String selectAs, ValuePredicate predicate)
      throws IOException {
    String[] parts = split(path);
    if (!schema.containsPath(parts) || !schema.getType(parts).isPrimitive()) {
      throw new ColumnNotFoundException(path);
    }
    MessageType projection = project(schema, List.of(parts));
    return new SyncColumnIterator(file, projection, parts, selectAs, predicate);
  }

  public SyncColumnIterator openColumn(String path, String selectAs) throws IOException {
    return openColumn(path, selectAs, null);
  }

  /**
   * Reads whole records, handing them to {@code batchConsumer} in batches of at most {@code
   * batchSize}. The batch list is reused between calls.
   *
   * @param fields top-level fields to read, or an empty list for all of them
   */
  public long readGroups(List<String> fields, int batchSize, Consumer<List<Group>> batchConsumer)
      throws IOException {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
    }
    MessageType projection = fields.isEmpty() ? schema : projectTopLevel(fields);
    List<Group> batch = new ArrayList<>(batchSize);
    long total = 0;

    try (ParquetFileReader reader = ParquetFileReader.open(file)) {
      reader.setRequestedSchema(projection);
      ColumnIOFactory factory = new ColumnIOFactory();
      PageReadStore pages;
      while ((pages = reader.readNextRowGroup()) != null) {
        long rowCount = pages.getRowCount();
        MessageColumnIO columnIO = factory.getColumnIO(projection, schema);
        RecordReader<Group> rr = columnIO.getRecordReader(pages, new GroupRecordConverter(projection));
        for (long r = 0; r < rowCount; r++) {
          batch.add(rr.read());
          if (batch.size() == batchSize) {
            batchConsumer.accept(batch);
            total += batch.size();
            batch.clear();
          }
        }
      }
    }

    if (!batch.isEmpty()) {
      batchConsumer.accept(batch);
      total += batch.size();
      batch.clear();
    }
    LOG.debugf("Read %d records from %s", total, file);
    return total;
  }

  private MessageType projectTopLevel(List<String> fields) {
    List<Type> types = new ArrayList<>(fields.size());
    for (String f : fields) {
      if (!schema.containsField(f)) {
        throw new ColumnNotFoundException(f);
      }
      types.add(schema.getType(f));
    }
    return new MessageType(schema.getName(), types);
  }

  /** Prunes {@code schema} down to the single branch leading to {@code path}. */
  static MessageType project(MessageType schema, List<String> path) {
    Type pruned = prune(schema.getType(path.get(0)), path, 1);
    return new MessageType(schema.getName(), pruned);
  }

  private static Type prune(Type type, List<String> path, int depth) {
    if (depth == path.size()) {
      return type;
    }
    GroupType group = type.asGroupType();
    Type child = prune(group.getType(path.get(depth)), path, depth + 1);
    return group.withNewFields(child);
  }

  private static String[] split(String path) {
    return path.split("\\.");
  }
}
