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
import ai.floedb.tracestats.analysis.stats.AttributeSize;
import ai.floedb.tracestats.analysis.stats.GenericAttrSummary;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Attribute statistics of one block, or of several merged blocks. The event summary is empty for
 * formats without event attributes.
 */
public record BlockSummary(
    GenericAttrSummary span, GenericAttrSummary resource, GenericAttrSummary event) {

  public BlockSummary {
    Objects.requireNonNull(span, "span");
    Objects.requireNonNull(resource, "resource");
    event = event == null ? GenericAttrSummary.empty() : event;
  }

  public static BlockSummary empty() {
    return new BlockSummary(
        GenericAttrSummary.empty(), GenericAttrSummary.empty(), GenericAttrSummary.empty());
  }

  public BlockSummary add(BlockSummary other) {
    return new BlockSummary(
        span.add(other.span), resource.add(other.resource), event.add(other.event));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * The {@code n} largest span attributes followed by the {@code n} largest resource attributes,
   * as dedicated string columns. Array attributes are never suggested.
   */
  public List<DedicatedColumn> suggestDedicatedColumns(int n) {
    List<DedicatedColumn> out = new ArrayList<>(2 * n);
    for (AttributeSize a : span.topAttributes(n)) {
      out.add(DedicatedColumn.span(a.name()));
    }
    for (AttributeSize a : resource.topAttributes(n)) {
      out.add(DedicatedColumn.resource(a.name()));
    }
    return out;
  }

  /** Accumulates many block summaries without copying the running totals on every merge. */
  public static final class Builder {
    private final GenericAttrSummary.Builder span = GenericAttrSummary.builder();
    private final GenericAttrSummary.Builder resource = GenericAttrSummary.builder();
    private final GenericAttrSummary.Builder event = GenericAttrSummary.builder();

    private Builder() {}

    public Builder add(BlockSummary summary) {
      span.add(summary.span);
      resource.add(summary.resource);
      event.add(summary.event);
      return this;
    }

    public BlockSummary build() {
      return new BlockSummary(span.build(), resource.build(), event.build());
    }
  }
}
