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
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Scope a dedicated column belongs to, as written in block metadata. */
public enum DedicatedColumnScope {
  SPAN("span"),
  RESOURCE("resource");

  private final String label;

  DedicatedColumnScope(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  /** Parses a metadata label; a missing or empty label means {@link #SPAN}. */
  @JsonCreator
  public static DedicatedColumnScope fromLabel(String label) {
    if (label == null || label.isEmpty()) {
      return SPAN;
    }
    return switch (label.toLowerCase(Locale.ROOT)) {
      case "span" -> SPAN;
      case "resource" -> RESOURCE;
      default -> throw new IllegalArgumentException("Unknown dedicated column scope: " + label);
    };
  }
}
