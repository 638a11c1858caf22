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

package ai.floedb.tracestats.types;

/**
 * Physical kinds an attribute value can take inside a trace block.
 *
 * <p>{@link #MISSING} marks a slot that exists structurally but carries no value (a null leaf in
 * the columnar encoding). It never participates in size or cardinality accounting.
 */
public enum ValueKind {
  STRING,
  INT64,
  FLOAT64,
  BOOL,
  MISSING;

  /** Number of bytes a single value of this kind occupies when serialized, or -1 if variable. */
  public int fixedWidth() {
    return switch (this) {
      case INT64, FLOAT64 -> 8;
      case BOOL -> 1;
      case MISSING -> 0;
      case STRING -> -1;
    };
  }
}
