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
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.apache.parquet.column.ParquetProperties;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.example.ExampleParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.LocalOutputFile;
import org.apache.parquet.schema.MessageType;
import org.jboss.logging.Logger;

/** Writes index records to {@code index.parquet}, snappy compressed with v2 data pages. */
public final class AttributeIndexWriter {

  public static final String INDEX_FILE_NAME = "index.parquet";

  private static final Logger LOG = Logger.getLogger(AttributeIndexWriter.class);

  private AttributeIndexWriter() {}

  /**
   * Writes {@code records} to {@code blockDir/index.parquet}, replacing an existing index.
   *
   * @throws IllegalArgumentException if a record does not belong to {@code type}
   */
  public static Path write(Path blockDir, IndexType type, List<? extends IndexedAttr> records)
      throws IOException {
    Path out = blockDir.resolve(INDEX_FILE_NAME);
    MessageType schema = AttributeIndexSchemas.forType(type);
    SimpleGroupFactory groups = new SimpleGroupFactory(schema);

    long started = System.nanoTime();
    try (ParquetWriter<Group> writer =
        ExampleParquetWriter.builder(new LocalOutputFile(out))
            .withType(schema)
            .withCompressionCodec(CompressionCodecName.SNAPPY)
            .withWriterVersion(ParquetProperties.WriterVersion.PARQUET_2_0)
            .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
            .build()) {
      for (IndexedAttr record : records) {
        writer.write(toGroup(groups.newGroup(), type, record));
      }
    }
    LOG.infof(
        "Wrote %s index with %d keys to %s in %d ms",
        type,
        records.size(),
        out,
        (System.nanoTime() - started) / 1_000_000);
    return out;
  }

  static Group toGroup(Group g, IndexType type, IndexedAttr record) {
    if (type == IndexType.COMBINED && record instanceof IndexedAttr.Combined c) {
      g.append(KEY, c.key())
          .append(KEY_CODE, c.keyCode())
          .append(SCOPE_MASK, c.scopeMask().value());
      Group strings = g.addGroup(VALUES_STRING);
      c.strings().forEach(v -> element(strings, v.value(), v.valueCode(), v.rowNumbers()));
      Group ints = g.addGroup(VALUES_INT);
      c.ints().forEach(v -> element(ints, v.value(), v.valueCode(), v.rowNumbers()));
      Group floats = g.addGroup(VALUES_FLOAT);
      c.floats().forEach(v -> element(floats, v.value(), v.valueCode(), v.rowNumbers()));
      Group bools = g.addGroup(VALUES_BOOL);
      c.bools().forEach(v -> element(bools, v.value(), v.valueCode(), v.rowNumbers()));
    } else if (type == IndexType.ROWS && record instanceof IndexedAttr.Rows r) {
      g.append(KEY, r.key()).append(SCOPE_MASK, r.scopeMask().value());
      Group strings = g.addGroup(VALUES_STRING);
      r.strings().forEach(v -> element(strings, v.value(), null, v.rowNumbers()));
      Group ints = g.addGroup(VALUES_INT);
      r.ints().forEach(v -> element(ints, v.value(), null, v.rowNumbers()));
      Group floats = g.addGroup(VALUES_FLOAT);
      r.floats().forEach(v -> element(floats, v.value(), null, v.rowNumbers()));
      Group bools = g.addGroup(VALUES_BOOL);
      r.bools().forEach(v -> element(bools, v.value(), null, v.rowNumbers()));
    } else if (type == IndexType.CODES && record instanceof IndexedAttr.Codes c) {
      g.append(KEY, c.key())
          .append(KEY_CODE, c.keyCode())
          .append(SCOPE_MASK, c.scopeMask().value());
      Group strings = g.addGroup(VALUES_STRING);
      c.strings().forEach(v -> element(strings, v.value(), v.valueCode(), null));
      Group ints = g.addGroup(VALUES_INT);
      c.ints().forEach(v -> element(ints, v.value(), v.valueCode(), null));
      Group floats = g.addGroup(VALUES_FLOAT);
      c.floats().forEach(v -> element(floats, v.value(), v.valueCode(), null));
      Group bools = g.addGroup(VALUES_BOOL);
      c.bools().forEach(v -> element(bools, v.value(), v.valueCode(), null));
    } else {
      throw new IllegalArgumentException(
          "Record " + record.getClass().getSimpleName() + " does not fit a " + type + " index");
    }
    return g;
  }

  private static void element(
      Group list, List<?> value, Integer valueCode, List<IndexRowNumber> rowNumbers) {
    Group e = list.addGroup("list").addGroup("element");
    for (Object v : value) {
      if (v instanceof String s) {
        e.append(VALUE, s);
      } else if (v instanceof Long l) {
        e.append(VALUE, l.longValue());
      } else if (v instanceof Double d) {
        e.append(VALUE, d.doubleValue());
      } else if (v instanceof Boolean b) {
        e.append(VALUE, b.booleanValue());
      } else {
        throw new IllegalArgumentException("Unsupported index value: " + v);
      }
    }
    if (valueCode != null) {
      e.append(VALUE_CODE, valueCode.intValue());
    }
    if (rowNumbers != null) {
      for (IndexRowNumber rn : rowNumbers) {
        e.addGroup(ROW_NUMBERS)
            .append(LEVELS[0], rn.lvl01())
            .append(LEVELS[1], rn.lvl02())
            .append(LEVELS[2], rn.lvl03())
            .append(LEVELS[3], rn.lvl04());
      }
    }
  }
}
