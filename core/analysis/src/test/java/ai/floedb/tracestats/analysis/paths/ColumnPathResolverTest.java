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

package ai.floedb.tracestats.analysis.paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.tracestats.analysis.block.DedicatedColumnScope;
import ai.floedb.tracestats.analysis.block.UnsupportedVersionException;
import org.junit.jupiter.api.Test;

class ColumnPathResolverTest {

  @Test
  void vParquet2HasNoArrayFlagOrDedicatedSlots() {
    AttributePaths paths = ColumnPathResolver.pathsForVersion("vParquet2");

    assertThat(paths.span().definitionLevel()).isEqualTo(4);
    assertThat(paths.resource().definitionLevel()).isEqualTo(2);
    assertThat(paths.span().valuePath())
        .isEqualTo("rs.list.element.ss.list.element.Spans.list.element.Attrs.list.element.Value");
    assertThat(paths.span().isArrayPath()).isEmpty();
    assertThat(paths.span().dedicatedColumnPaths()).isEmpty();
    assertThat(paths.event()).isEmpty();
  }

  @Test
  void vParquet3AddsTenDedicatedSlotsPerScope() {
    AttributePaths paths = ColumnPathResolver.pathsForVersion("vParquet3");

    assertThat(paths.resource().dedicatedColumnPaths())
        .hasSize(10)
        .first()
        .isEqualTo("rs.list.element.Resource.DedicatedAttributes.String01");
    assertThat(paths.span().dedicatedColumnPaths())
        .last()
        .isEqualTo("rs.list.element.ss.list.element.Spans.list.element.DedicatedAttributes.String10");
    assertThat(paths.resource().dedicatedScope()).contains(DedicatedColumnScope.RESOURCE);
    assertThat(paths.resource().isArrayPath()).isEmpty();
  }

  @Test
  void vParquet4ReadsValueListsAndEvents() {
    AttributePaths paths = ColumnPathResolver.pathsForVersion("vParquet4");

    assertThat(paths.resource().valuePath())
        .isEqualTo("rs.list.element.Resource.Attrs.list.element.Value.list.element");
    assertThat(paths.resource().isArrayPath())
        .contains("rs.list.element.Resource.Attrs.list.element.IsArray");
    assertThat(paths.event()).isPresent();
    ScopeAttributePath event = paths.event().get();
    assertThat(event.definitionLevel()).isEqualTo(5);
    assertThat(event.keyPath())
        .isEqualTo(
            "rs.list.element.ss.list.element.Spans.list.element.Events.list.element.Attrs.list.element.Key");
    assertThat(event.dedicatedScope()).isEmpty();
    assertThat(event.dedicatedColumnPaths()).isEmpty();
  }

  @Test
  void unknownVersionIsRejected() {
    assertThatThrownBy(() -> ColumnPathResolver.pathsForVersion("vParquet9"))
        .isInstanceOf(UnsupportedVersionException.class)
        .extracting(e -> ((UnsupportedVersionException) e).version())
        .isEqualTo("vParquet9");
  }
}
