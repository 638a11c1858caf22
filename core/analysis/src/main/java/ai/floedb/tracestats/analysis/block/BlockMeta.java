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

package ai.floedb.tracestats.analysis.block;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** The parts of a block's {@code meta.json} the analysis needs. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BlockMeta(
    @JsonProperty("blockID") UUID blockId,
    @JsonProperty("tenantID") String tenantId,
    @JsonProperty("format") String version,
    @JsonProperty("startTime") Instant startTime,
    @JsonProperty("endTime") Instant endTime,
    @JsonProperty("totalObjects") long totalObjects,
    @JsonProperty("size") long size,
    @JsonProperty("compactionLevel") int compactionLevel,
    @JsonProperty("dedicatedColumns") List<DedicatedColumn> dedicatedColumns) {

  public BlockMeta {
    dedicatedColumns = dedicatedColumns == null ? List.of() : List.copyOf(dedicatedColumns);
  }

  /** Dedicated string columns of {@code scope}, in declaration order. */
  public List<DedicatedColumn> dedicatedColumns(DedicatedColumnScope scope) {
    return dedicatedColumns.stream()
        .filter(c -> c.scope() == scope && c.type() == DedicatedColumnType.STRING)
        .toList();
  }

  public FormatVersion formatVersion() {
    return FormatVersion.of(version);
  }
}
