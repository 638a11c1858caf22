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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.tracestats.parquet.io.LocalBlockInputFile;
import ai.floedb.tracestats.types.AttrValue;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.example.ExampleParquetWriter;
import org.apache.parquet.io.LocalOutputFile;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.MessageTypeParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SyncColumnIteratorTest {

  private static final MessageType SCHEMA =
      MessageTypeParser.parseMessageType(
          """
          message trace {
            required binary TraceID;
            required group rs (LIST) {
              repeated group list {
                required group element {
                  required binary Key (STRING);
                  optional binary Value (STRING);
                }
              }
            }
          }
          """);

  private static final String KEY = "rs.list.element.Key";
  private static final String VALUE = "rs.list.element.Value";

  @TempDir Path dir;

  private ParquetBlockFile file;

  @BeforeEach
  void writeFile() throws IOException {
    Path path = dir.resolve("data.parquet");
    SimpleGroupFactory groups = new SimpleGroupFactory(SCHEMA);

    Group row0 = groups.newGroup().append("TraceID", "t0");
    Group rs0 = row0.addGroup("rs");
    rs0.addGroup("list").addGroup("element").append("Key", "a").append("Value", "x");
    rs0.addGroup("list").addGroup("element").append("Key", "b");

    Group row1 = groups.newGroup().append("TraceID", "t1");
    row1.addGroup("rs");

    Group row2 = groups.newGroup().append("TraceID", "t2");
    row2.addGroup("rs").addGroup("list").addGroup("element").append("Key", "c").append("Value", "z");

    try (ParquetWriter<Group> writer =
        ExampleParquetWriter.builder(new LocalOutputFile(path))
            .withType(SCHEMA)
            .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
            .build()) {
      writer.write(row0);
      writer.write(row1);
      writer.write(row2);
    }

    file = ParquetBlockFile.open(new LocalBlockInputFile(path));
  }

  @Test
  void tracksNestedRowNumbersAndNulls() throws IOException {
    assertThat(file.rowCount()).isEqualTo(3);
    assertThat(file.maxDefinitionLevel(KEY)).isEqualTo(1);
    assertThat(file.maxDefinitionLevel(VALUE)).isEqualTo(2);

    try (ColumnIterator it = file.openColumn(VALUE, "value")) {
      assertThat(drain(it))
          .containsExactly(
              "[0, 0, 0, -1, -1, -1, -1]=x",
              "[0, 1, -1, -1, -1, -1, -1]=<missing>",
              "[1, -1, -1, -1, -1, -1, -1]=<missing>",
              "[2, 0, 0, -1, -1, -1, -1]=z");
    }
  }

  @Test
  void predicateFiltersValuesButKeepsRowNumbering() throws IOException {
    try (ColumnIterator it = file.openColumn(VALUE, "value", ValuePredicate.stringIn(Set.of("z")))) {
      assertThat(drain(it)).containsExactly("[2, 0, 0, -1, -1, -1, -1]=z");
    }
  }

  @Test
  void seekToSkipsToRequestedRow() throws IOException {
    try (ColumnIterator it = file.openColumn(KEY, "key")) {
      IteratorResult r = it.seekTo(RowNumber.of(2), 0);
      assertThat(r.rowNumber()).isEqualTo(RowNumber.of(2, 0));
      assertThat(r.entries().get(0).value()).isEqualTo(AttrValue.of("c"));
      assertThat(it.next()).isNull();
    }
  }

  @Test
  void joinsKeyAndValueColumns() throws IOException {
    List<String> joined = new ArrayList<>();
    RowConsumer nonNull =
        row -> row.entries().stream().noneMatch(e -> e.value().isMissing());

    try (JoinIterator join =
        new JoinIterator(
            1, List.of(file.openColumn(KEY, "key"), file.openColumn(VALUE, "value")), nonNull)) {
      for (IteratorResult r = join.next(); r != null; r = join.next()) {
        StringBuilder sb = new StringBuilder();
        for (IteratorResult.Entry e : r.entries()) {
          sb.append(e.key()).append('=').append(e.value().asString()).append(' ');
        }
        joined.add(sb.toString().trim());
      }
    }

    assertThat(joined).containsExactly("key=a value=x", "key=c value=z");
  }

  @Test
  void unknownColumnIsTypedError() {
    assertThatThrownBy(() -> file.openColumn("rs.list.element.Nope", "x"))
        .isInstanceOf(ColumnNotFoundException.class)
        .extracting(e -> ((ColumnNotFoundException) e).column())
        .isEqualTo("rs.list.element.Nope");
    assertThatThrownBy(() -> file.openColumn("rs.list.element", "x"))
        .isInstanceOf(ColumnNotFoundException.class);
  }

  @Test
  void readsWholeRecordsInBatches() throws IOException {
    List<Integer> batchSizes = new ArrayList<>();
    List<String> traceIds = new ArrayList<>();

    long total =
        file.readGroups(
            List.of("TraceID"),
            2,
            batch -> {
              batchSizes.add(batch.size());
              for (Group g : batch) {
                traceIds.add(g.getString("TraceID", 0));
              }
            });

    assertThat(total).isEqualTo(3);
    assertThat(batchSizes).containsExactly(2, 1);
    assertThat(traceIds).containsExactly("t0", "t1", "t2");
  }

  private static List<String> drain(ColumnIterator it) throws IOException {
    List<String> out = new ArrayList<>();
    for (IteratorResult r = it.next(); r != null; r = it.next()) {
      AttrValue v = r.entries().get(0).value();
      out.add(r.rowNumber() + "=" + (v.isMissing() ? "<missing>" : v.asString()));
    }
    return out;
  }
}
