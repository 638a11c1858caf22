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

public enum DedicatedColumnType {
  STRING("string"),
  INT("int");

  private final String label;

  DedicatedColumnType(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  /** Parses a metadata label; a missing or empty label means {@link #STRING}. */
  @JsonCreator
  public static DedicatedColumnType fromLabel(String label) {
    if (label == null || label.isEmpty()) {
      return STRING;
    }
    return switch (label.toLowerCase(Locale.ROOT)) {
      case "string" -> STRING;
      case "int" -> INT;
      default -> throw new IllegalArgumentException("Unknown dedicated column type: " + label);
    };
  }
}
