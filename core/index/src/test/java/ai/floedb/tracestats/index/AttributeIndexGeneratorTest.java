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

import static ai.floedb.tracestats.testing.TraceFixture.resource;
import static ai.floedb.tracestats.testing.TraceFixture.scope;
import static ai.floedb.tracestats.testing.TraceFixture.span;
import static ai.floedb.tracestats.testing.TraceFixture.trace;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.tracestats.analysis.block.BlockMetaReader;
import ai.floedb.tracestats.analysis.block.UnsupportedVersionException;
import ai.floedb.tracestats.index.format.AttributeIndexReader;
import ai.floedb.tracestats.index.format.IndexType;
import ai.floedb.tracestats.index.format.IndexedAttr;
import ai.floedb.tracestats.index.stats.IndexRowNumber;
import ai.floedb.tracestats.testing.FixtureSchemas;
import ai.floedb.tracestats.testing.TestBlockFixtures;
import ai.floedb.tracestats.testing.TraceFixture.Attr;
import ai.floedb.tracestats.testing.TraceFixture.Trace;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AttributeIndexGeneratorTest {

  @TempDir Path tenant;

  private static List<Trace> traces(int count) {
    List<Trace> out = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      out.add(
          trace("t" + i)
              .resource(
                  resource(i % 2 == 0 ? "cart" : "db")
                      .dedicated(1, "team-" + (i % 3))
                      .scope(
                          scope("lib")
                              .span(
                                  span("op")
                                      .attr(Attr.int64("retries", i % 4))
                                      .dedicated(2, "eu")))));
    }
    return out;
  }

  private Path block(List<Trace> traces) {
    return TestBlockFixtures.block(FixtureSchemas.V4)
        .dedicatedColumn("resource", "team")
        .dedicatedColumn("span", "unused")
        .dedicatedColumn("span", "region")
        .traces(traces)
        .writeTo(tenant);
  }

  @Test
  void writesARowsIndexNextToTheData() throws IOException {
    Path dir = block(traces(10));
    AttributeIndexGenerator generator =
        new AttributeIndexGenerator(new BlockMetaReader(), IndexType.ROWS, false, 3);

    AttributeIndexGenerator.Result result = generator.generate(dir);

    assertThat(result.indexFile()).isEqualTo(dir.resolve("index.parquet"));
    assertThat(Files.exists(result.indexFile())).isTrue();
    assertThat(result.stats().traces()).isEqualTo(10);

    List<IndexedAttr.Rows> index = AttributeIndexReader.readRows(result.indexFile());
    assertThat(index)
        .extracting(IndexedAttr.Rows::key)
        .containsExactly("region", "retries", "service.name", "team");
    assertThat(result.records()).isEqualTo(4);

    IndexedAttr.Rows service = index.get(2);
    assertThat(service.strings()).extracting(IndexedAttr.RowsValue::value)
        .containsExactly(List.of("cart"), List.of("db"));
    assertThat(service.strings().get(1).rowNumbers())
        .startsWith(new IndexRowNumber(1, 0, -1, -1), new IndexRowNumber(3, 0, -1, -1))
        .hasSize(5);
    assertThat(index.get(3).strings()).hasSize(3);
    assertThat(index.get(0).strings().get(0).rowNumbers()).hasSize(10);
    assertThat(index.get(1).ints()).hasSize(4);
  }

  @Test
  void rowsIndexSpansSeveralRowGroups() throws IOException {
    Path dir =
        TestBlockFixtures.block(FixtureSchemas.V4)
            .dedicatedColumn("resource", "team")
            .rowGroupSize(8 * 1024)
            .traces(traces(300))
            .writeTo(tenant);
    AttributeIndexGenerator generator =
        new AttributeIndexGenerator(new BlockMetaReader(), IndexType.ROWS, false, 64);

    List<IndexedAttr.Rows> index =
        AttributeIndexReader.readRows(generator.generate(dir).indexFile());

    IndexedAttr.Rows retries =
        index.stream().filter(a -> a.key().equals("retries")).findFirst().orElseThrow();
    assertThat(retries.ints()).extracting(IndexedAttr.RowsValue::value)
        .containsExactly(List.of(0L), List.of(1L), List.of(2L), List.of(3L));
    assertThat(retries.ints().stream().mapToInt(v -> v.rowNumbers().size()).sum())
        .isEqualTo(300);
    List<IndexRowNumber> threes = retries.ints().get(3).rowNumbers();
    assertThat(threes.get(threes.size() - 1)).isEqualTo(new IndexRowNumber(299, 0, 0, 0));
  }

  @Test
  void intrinsicsInACombinedIndex() throws IOException {
    Path dir = block(traces(2));
    AttributeIndexGenerator generator =
        new AttributeIndexGenerator(new BlockMetaReader(), IndexType.COMBINED, true, 1024);

    AttributeIndexGenerator.Result result = generator.generate(dir);

    List<IndexedAttr.Combined> index = AttributeIndexReader.readCombined(result.indexFile());
    assertThat(index).extracting(IndexedAttr.Combined::key).contains("name", "kind", "scope.name");
    assertThat(index).extracting(IndexedAttr.Combined::keyCode).startsWith(1, 2, 3);
  }

  @Test
  void rejectsOlderFormats() {
    Path dir =
        TestBlockFixtures.block(FixtureSchemas.V3)
            .traces(traces(1))
            .writeTo(tenant);
    AttributeIndexGenerator generator =
        new AttributeIndexGenerator(new BlockMetaReader(), IndexType.ROWS, false, 16);

    assertThatThrownBy(() -> generator.generate(dir))
        .isInstanceOf(UnsupportedVersionException.class);
    assertThat(Files.exists(dir.resolve("index.parquet"))).isFalse();
  }
}
