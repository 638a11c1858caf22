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

import ai.floedb.tracestats.analysis.block.DedicatedColumnScope;
import ai.floedb.tracestats.analysis.block.FormatVersion;
import ai.floedb.tracestats.analysis.block.UnsupportedVersionException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Maps a block format version to the column paths of its attribute lists. */
public final class ColumnPathResolver {

  public static final int DEDICATED_STRING_SLOTS = 10;

  public static final int DEFINITION_LEVEL_RESOURCE_ATTRS = 2;
  public static final int DEFINITION_LEVEL_SPAN_ATTRS = 4;
  public static final int DEFINITION_LEVEL_EVENT_ATTRS = 5;

  static final String RESOURCE = "rs.list.element.Resource";
  static final String SPAN = "rs.list.element.ss.list.element.Spans.list.element";
  static final String EVENT = SPAN + ".Events.list.element";

  private static final String ATTRS = ".Attrs.list.element";
  private static final String DEDICATED = ".DedicatedAttributes.String";

  private static final AttributePaths V2 = legacy(false);
  private static final AttributePaths V3 = legacy(true);
  private static final AttributePaths V4 =
      new AttributePaths(
          v4Scope(SPAN, DEFINITION_LEVEL_SPAN_ATTRS, DedicatedColumnScope.SPAN),
          v4Scope(RESOURCE, DEFINITION_LEVEL_RESOURCE_ATTRS, DedicatedColumnScope.RESOURCE),
          Optional.of(v4Scope(EVENT, DEFINITION_LEVEL_EVENT_ATTRS, null)));

  private ColumnPathResolver() {}

  /**
   * Returns the attribute paths of {@code version}.
   *
   * @throws UnsupportedVersionException if the version is unknown
   */
  public static AttributePaths pathsForVersion(String version) {
    return pathsForVersion(FormatVersion.of(version));
  }

  public static AttributePaths pathsForVersion(FormatVersion version) {
    return switch (version) {
      case VPARQUET2 -> V2;
      case VPARQUET3 -> V3;
      case VPARQUET4 -> V4;
    };
  }

  /** Paths of the dedicated string slots String01..String10 under {@code parent}. */
  static List<String> dedicatedSlots(String parent) {
    List<String> paths = new ArrayList<>(DEDICATED_STRING_SLOTS);
    for (int i = 1; i <= DEDICATED_STRING_SLOTS; i++) {
      paths.add(String.format("%s%s%02d", parent, DEDICATED, i));
    }
    return paths;
  }

  private static AttributePaths legacy(boolean dedicated) {
    return new AttributePaths(
        new ScopeAttributePath(
            DEFINITION_LEVEL_SPAN_ATTRS,
            SPAN + ATTRS + ".Key",
            SPAN + ATTRS + ".Value",
            null,
            DedicatedColumnScope.SPAN,
            dedicated ? dedicatedSlots(SPAN) : List.of()),
        new ScopeAttributePath(
            DEFINITION_LEVEL_RESOURCE_ATTRS,
            RESOURCE + ATTRS + ".Key",
            RESOURCE + ATTRS + ".Value",
            null,
            DedicatedColumnScope.RESOURCE,
            dedicated ? dedicatedSlots(RESOURCE) : List.of()),
        Optional.empty());
  }

  private static ScopeAttributePath v4Scope(
      String parent, int definitionLevel, DedicatedColumnScope dedicatedScope) {
    return new ScopeAttributePath(
        definitionLevel,
        parent + ATTRS + ".Key",
        parent + ATTRS + ".Value.list.element",
        parent + ATTRS + ".IsArray",
        dedicatedScope,
        dedicatedScope == null ? List.of() : dedicatedSlots(parent));
  }
}
