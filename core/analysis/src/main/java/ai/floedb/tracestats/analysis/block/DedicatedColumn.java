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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * An attribute stored in its own column instead of the generic attribute list. Serialized with
 * the short keys used by block metadata: {@code s} (scope), {@code n} (name), {@code t} (type).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DedicatedColumn(
    @JsonProperty("s") DedicatedColumnScope scope,
    @JsonProperty("n") String name,
    @JsonProperty("t") DedicatedColumnType type) {

  @JsonCreator
  public DedicatedColumn {
    Objects.requireNonNull(name, "name");
    scope = scope == null ? DedicatedColumnScope.SPAN : scope;
    type = type == null ? DedicatedColumnType.STRING : type;
  }

  public static DedicatedColumn span(String name) {
    return new DedicatedColumn(DedicatedColumnScope.SPAN, name, DedicatedColumnType.STRING);
  }

  public static DedicatedColumn resource(String name) {
    return new DedicatedColumn(DedicatedColumnScope.RESOURCE, name, DedicatedColumnType.STRING);
  }
}
