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

package ai.floedb.tracestats.analysis.stats;

import static ai.floedb.tracestats.testing.TraceFixture.event;
import static ai.floedb.tracestats.testing.TraceFixture.resource;
import static ai.floedb.tracestats.testing.TraceFixture.scope;
import static ai.floedb.tracestats.testing.TraceFixture.span;
import static ai.floedb.tracestats.testing.TraceFixture.trace;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.tracestats.analysis.block.BlockMeta;
import ai.floedb.tracestats.analysis.block.BlockMetaReader;
import ai.floedb.tracestats.analysis.paths.AttributePaths;
import ai.floedb.tracestats.analysis.paths.ColumnPathResolver;
import ai.floedb.tracestats.parquet.ColumnNotFoundException;
import ai.floedb.tracestats.parquet.ParquetBlockFile;
import ai.floedb.tracestats.parquet.io.LocalBlockInputFile;
import ai.floedb.tracestats.testing.FixtureSchemas;
import ai.floedb.tracestats.testing.TestBlockFixtures;
import ai.floedb.tracestats.testing.TraceFixture.Attr;
import ai.floedb.tracestats.testing.TraceFixture.ScopeSpans;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AttributeAggregatorTest {

  @TempDir Path tenant;

  private final AttributeAggregator aggregator = new AttributeAggregator();

  private static ParquetBlockFile open(Path blockDir) throws IOException {
    return ParquetBlockFile.open(
        new LocalBlockInputFile(blockDir.resolve(TestBlockFixtures.DATA_FILE)));
  }

  @Test
  void scalarStringAttributeSumsBytesAndCountsValues() throws IOException {
    ScopeSpans lib = scope("lib");
    for (int i = 0; i < 1000; i++) {
      lib.span(span("op").attr(Attr.str("http.method", "GET")));
    }
    Path dir =
        TestBlockFixtures.block(FixtureSchemas.V3)
            .trace(trace("t1").resource(resource("svc").scope(lib)))
            .writeTo(tenant);

    AttributePaths paths = ColumnPathResolver.pathsForVersion("vParquet3");
    GenericAttrSummary s =
        aggregator.aggregateAttributes(
            open(dir),
            paths.span().definitionLevel(),
            paths.span().keyPath(),
            paths.span().valuePath(),
            paths.span().isArrayPath());

    assertThat(s.attributes()).containsExactlyEntriesOf(Map.of("http.method", 3000L));
    assertThat(s.totalBytes()).isEqualTo(3000);
    assertThat(s.cardinality()).containsExactlyEntriesOf(Map.of("http.method", Map.of("GET", 1000L)));
    assertThat(s.arrayAttributes()).isEmpty();
  }

  @Test
  void arrayAttributesAreTrackedApart() throws IOException {
    Path dir =
        TestBlockFixtures.block(FixtureSchemas.V4)
            .trace(
                trace("t1")
                    .resource(
                        resource("svc")
                            .scope(
                                scope("lib")
                                    .span(
                                        span("a")
                                            .attr(Attr.strArray("tags", "red", "blue"))
                                            .attr(Attr.str("peer", "db")))
                                    .span(span("b").attr(Attr.strArray("tags", "green"))))))
            .writeTo(tenant);

    AttributePaths paths = ColumnPathResolver.pathsForVersion("vParquet4");
    GenericAttrSummary s =
        aggregator.aggregateAttributes(
            open(dir),
            paths.span().definitionLevel(),
            paths.span().keyPath(),
            paths.span().valuePath(),
            paths.span().isArrayPath());

    assertThat(s.arrayAttributes()).containsExactlyEntriesOf(Map.of("tags", 12L));
    assertThat(s.attributes()).containsExactlyEntriesOf(Map.of("peer", 2L));
    assertThat(s.cardinality()).doesNotContainKey("tags");
    assertThat(s.totalBytes()).isEqualTo(2);
  }

  @Test
  void attributesWithoutStringValueAreDropped() throws IOException {
    Path dir =
        TestBlockFixtures.block(FixtureSchemas.V4)
            .trace(
                trace("t1")
                    .resource(
                        resource("svc")
                            .attr(Attr.int64("pid", 42))
                            .attr(Attr.str("host", "node-1"))
                            .scope(scope("lib").span(span("a")))))
            .writeTo(tenant);

    AttributePaths paths = ColumnPathResolver.pathsForVersion("vParquet4");
    GenericAttrSummary s =
        aggregator.aggregateAttributes(
            open(dir),
            paths.resource().definitionLevel(),
            paths.resource().keyPath(),
            paths.resource().valuePath(),
            paths.resource().isArrayPath());

    assertThat(s.attributes()).containsExactlyEntriesOf(Map.of("host", 6L));
  }

  @Test
  void eventAttributesAreAggregated() throws IOException {
    Path dir =
        TestBlockFixtures.block(FixtureSchemas.V4)
            .trace(
                trace("t1")
                    .resource(
                        resource("svc")
                            .scope(
                                scope("lib")
                                    .span(
                                        span("a")
                                            .event(event("exception").attr(Attr.str("type", "IOError")))
                                            .event(event("retry").attr(Attr.str("type", "x")))))))
            .writeTo(tenant);

    AttributePaths paths = ColumnPathResolver.pathsForVersion("vParquet4");
    GenericAttrSummary s =
        aggregator.aggregateScope(open(dir), meta(dir), paths.event().orElseThrow());

    assertThat(s.attributes()).containsExactlyEntriesOf(Map.of("type", 8L));
    assertThat(s.cardinality("type")).containsEntry("IOError", 1L).containsEntry("x", 1L);
  }

  @Test
  void dedicatedColumnsMergeIntoScope() throws IOException {
    ScopeSpans lib = scope("lib");
    for (int i = 0; i < 500; i++) {
      lib.span(span("op").dedicated(1, "prod").attr(Attr.str("http.method", "GET")));
    }
    lib.span(span("no-env").attr(Attr.str("http.method", "PUT")));
    Path dir =
        TestBlockFixtures.block(FixtureSchemas.V3)
            .dedicatedColumn("span", "env")
            .dedicatedColumn("resource", "namespace")
            .trace(trace("t1").resource(resource("svc").dedicated(1, "payments").scope(lib)))
            .writeTo(tenant);

    AttributePaths paths = ColumnPathResolver.pathsForVersion("vParquet3");
    ParquetBlockFile file = open(dir);
    BlockMeta meta = meta(dir);

    GenericAttrSummary span = aggregator.aggregateScope(file, meta, paths.span());
    assertThat(span.attributes()).containsEntry("env", 2000L).containsEntry("http.method", 1503L);
    assertThat(span.totalBytes()).isEqualTo(2000 + 1503);
    assertThat(span.dedicated()).containsExactly("env");
    assertThat(span.cardinality("env")).containsExactlyEntriesOf(Map.of("prod", 500L));

    GenericAttrSummary resource = aggregator.aggregateScope(file, meta, paths.resource());
    assertThat(resource.attributes()).containsExactlyEntriesOf(Map.of("namespace", 8L));
    assertThat(resource.totalBytes()).isEqualTo(8);
    assertThat(resource.dedicated()).containsExactly("namespace");
  }

  @Test
  void dedicatedColumnSharingAGenericNameAddsItsBytesToTheTotal() throws IOException {
    ScopeSpans lib = scope("lib");
    for (int i = 0; i < 2; i++) {
      lib.span(span("op").dedicated(1, "prod").attr(Attr.str("env", "staging")));
    }
    Path dir =
        TestBlockFixtures.block(FixtureSchemas.V3)
            .dedicatedColumn("span", "env")
            .trace(trace("t1").resource(resource("svc").scope(lib)))
            .writeTo(tenant);

    AttributePaths paths = ColumnPathResolver.pathsForVersion("vParquet3");
    GenericAttrSummary span = aggregator.aggregateScope(open(dir), meta(dir), paths.span());

    assertThat(span.attributes()).containsExactlyEntriesOf(Map.of("env", 2L * 4));
    assertThat(span.totalBytes()).isEqualTo(2L * 7 + 2L * 4);
    assertThat(span.cardinality("env")).containsExactlyEntriesOf(Map.of("prod", 2L));
  }

  @Test
  void moreDedicatedColumnsThanSlotsIsASchemaError() throws IOException {
    TestBlockFixtures.BlockSpec spec =
        TestBlockFixtures.block(FixtureSchemas.V3)
            .trace(trace("t1").resource(resource("svc").scope(scope("lib").span(span("a")))));
    for (int i = 0; i < 11; i++) {
      spec.dedicatedColumn("span", "attr" + i);
    }
    Path dir = spec.writeTo(tenant);

    AttributePaths paths = ColumnPathResolver.pathsForVersion("vParquet3");
    ParquetBlockFile file = open(dir);
    BlockMeta meta = meta(dir);
    assertThatThrownBy(() -> aggregator.aggregateScope(file, meta, paths.span()))
        .isInstanceOf(ColumnNotFoundException.class);
  }

  @Test
  void unknownColumnAbortsTheScope() throws IOException {
    Path dir =
        TestBlockFixtures.block(FixtureSchemas.V2)
            .trace(trace("t1").resource(resource("svc")))
            .writeTo(tenant);

    AttributePaths v4 = ColumnPathResolver.pathsForVersion("vParquet4");
    ParquetBlockFile file = open(dir);
    assertThatThrownBy(
            () ->
                aggregator.aggregateAttributes(
                    file,
                    v4.span().definitionLevel(),
                    v4.span().keyPath(),
                    v4.span().valuePath(),
                    v4.span().isArrayPath()))
        .isInstanceOf(ColumnNotFoundException.class);
  }

  private static BlockMeta meta(Path dir) throws IOException {
    return new BlockMetaReader().read(dir);
  }
}
