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

package ai.floedb.tracestats.index.format;

import static ai.floedb.tracestats.index.format.AttributeIndexSchemas.KEY;
import static ai.floedb.tracestats.index.format.AttributeIndexSchemas.KEY_CODE;
import static ai.floedb.tracestats.index.format.AttributeIndexSchemas.LEVELS;
import static ai.floedb.tracestats.index.format.AttributeIndexSchemas.ROW_NUMBERS;
import static ai.floedb.tracestats.index.format.AttributeIndexSchemas.SCOPE_MASK;
import static ai.floedb.tracestats.index.format.AttributeIndexSchemas.VALUE;
import static ai.floedb.tracestats.index.format.AttributeIndexSchemas.VALUES_BOOL;
import static ai.floedb.tracestats.index.format.AttributeIndexSchemas.VALUES_FLOAT;
import static ai.floedb.tracestats.index.format.AttributeIndexSchemas.VALUES_INT;
import static ai.floedb.tracestats.index.format.AttributeIndexSchemas.VALUES_STRING;
import static ai.floedb.tracestats.index.format.AttributeIndexSchemas.VALUE_CODE;

import ai.floedb.tracestats.index.stats.IndexRowNumber;
import ai.floedb.tracestats.parquet.ParquetBlockFile;
import ai.floedb.tracestats.parquet.io.LocalBlockInputFile;
import ai.floedb.tracestats.types.ScopeMask;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.schema.MessageType;

/** Reads {@code index.parquet} files back into index records. */
public final class AttributeIndexReader {

  private static final int BATCH_SIZE = 256;

  /** Reads one primitive of a repeated field. */
  @FunctionalInterface
  private interface ValueReader<T> {
    T read(Group g, String field, int index);
  }

  private AttributeIndexReader() {}

  /** Variant of the index stored in {@code indexFile}, derived from its schema. */
  public static IndexType type(Path indexFile) throws IOException {
    return typeOf(ParquetBlockFile.open(new LocalBlockInputFile(indexFile)).schema());
  }

  public static List<IndexedAttr> read(Path indexFile) throws IOException {
    ParquetBlockFile file = ParquetBlockFile.open(new LocalBlockInputFile(indexFile));
    IndexType type = typeOf(file.schema());
    List<IndexedAttr> out = new ArrayList<>();
    file.readGroups(
        List.of(),
        BATCH_SIZE,
        batch -> {
          for (Group g : batch) {
            out.add(fromGroup(type, g));
          }
        });
    return out;
  }

  public static List<IndexedAttr.Rows> readRows(Path indexFile) throws IOException {
    return read(indexFile, IndexType.ROWS, IndexedAttr.Rows.class);
  }

  public static List<IndexedAttr.Combined> readCombined(Path indexFile) throws IOException {
    return read(indexFile, IndexType.COMBINED, IndexedAttr.Combined.class);
  }

  public static List<IndexedAttr.Codes> readCodes(Path indexFile) throws IOException {
    return read(indexFile, IndexType.CODES, IndexedAttr.Codes.class);
  }

  private static <R extends IndexedAttr> List<R> read(
      Path indexFile, IndexType expected, Class<R> recordType) throws IOException {
    List<IndexedAttr> records = read(indexFile);
    List<R> out = new ArrayList<>(records.size());
    for (IndexedAttr r : records) {
      if (!recordType.isInstance(r)) {
        throw new IllegalStateException(indexFile + " is not a " + expected + " index");
      }
      out.add(recordType.cast(r));
    }
    return out;
  }

  static IndexType typeOf(MessageType schema) {
    boolean codes = schema.containsField(KEY_CODE);
    boolean rows =
        schema.containsField(VALUES_STRING)
            && schema
                .getType(VALUES_STRING)
                .asGroupType()
                .getType("list")
                .asGroupType()
                .getType("element")
                .asGroupType()
                .containsField(ROW_NUMBERS);
    if (codes && rows) {
      return IndexType.COMBINED;
    }
    if (rows) {
      return IndexType.ROWS;
    }
    if (codes) {
      return IndexType.CODES;
    }
    throw new IllegalStateException("Not an attribute index schema: " + schema);
  }

  private static IndexedAttr fromGroup(IndexType type, Group g) {
    String key = g.getString(KEY, 0);
    ScopeMask mask = ScopeMask.fromValue(g.getLong(SCOPE_MASK, 0));
    Group strings = g.getGroup(VALUES_STRING, 0);
    Group ints = g.getGroup(VALUES_INT, 0);
    Group floats = g.getGroup(VALUES_FLOAT, 0);
    Group bools = g.getGroup(VALUES_BOOL, 0);
    return switch (type) {
      case COMBINED -> new IndexedAttr.Combined(
          key,
          g.getInteger(KEY_CODE, 0),
          mask,
          combined(strings, Group::getString),
          combined(ints, Group::getLong),
          combined(floats, Group::getDouble),
          combined(bools, Group::getBoolean));
      case ROWS -> new IndexedAttr.Rows(
          key,
          mask,
          rows(strings, Group::getString),
          rows(ints, Group::getLong),
          rows(floats, Group::getDouble),
          rows(bools, Group::getBoolean));
      case CODES -> new IndexedAttr.Codes(
          key,
          g.getInteger(KEY_CODE, 0),
          mask,
          codes(strings, Group::getString),
          codes(ints, Group::getLong),
          codes(floats, Group::getDouble),
          codes(bools, Group::getBoolean));
    };
  }

  private static <T> List<IndexedAttr.CombinedValue<T>> combined(
      Group list, ValueReader<T> reader) {
    List<IndexedAttr.CombinedValue<T>> out = new ArrayList<>();
    for (Group e : elements(list)) {
      out.add(
          new IndexedAttr.CombinedValue<>(
              value(e, reader), e.getInteger(VALUE_CODE, 0), rowNumbers(e)));
    }
    return out;
  }

  private static <T> List<IndexedAttr.RowsValue<T>> rows(Group list, ValueReader<T> reader) {
    List<IndexedAttr.RowsValue<T>> out = new ArrayList<>();
    for (Group e : elements(list)) {
      out.add(new IndexedAttr.RowsValue<>(value(e, reader), rowNumbers(e)));
    }
    return out;
  }

  private static <T> List<IndexedAttr.CodesValue<T>> codes(Group list, ValueReader<T> reader) {
    List<IndexedAttr.CodesValue<T>> out = new ArrayList<>();
    for (Group e : elements(list)) {
      out.add(new IndexedAttr.CodesValue<>(value(e, reader), e.getInteger(VALUE_CODE, 0)));
    }
    return out;
  }

  private static List<Group> elements(Group list) {
    int n = list.getFieldRepetitionCount("list");
    List<Group> out = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      out.add(list.getGroup("list", i).getGroup("element", 0));
    }
    return out;
  }

  private static <T> List<T> value(Group element, ValueReader<T> reader) {
    int n = element.getFieldRepetitionCount(VALUE);
    List<T> out = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      out.add(reader.read(element, VALUE, i));
    }
    return List.copyOf(out);
  }

  private static List<IndexRowNumber> rowNumbers(Group element) {
    int n = element.getFieldRepetitionCount(ROW_NUMBERS);
    List<IndexRowNumber> out = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      Group rn = element.getGroup(ROW_NUMBERS, i);
      out.add(
          new IndexRowNumber(
              rn.getLong(LEVELS[0], 0),
              rn.getLong(LEVELS[1], 0),
              rn.getLong(LEVELS[2], 0),
              rn.getLong(LEVELS[3], 0)));
    }
    return List.copyOf(out);
  }
}
