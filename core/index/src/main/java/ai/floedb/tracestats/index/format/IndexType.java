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

package ai.floedb.tracestats.index.format;

import java.util.List;
import java.util.Locale;

/** Encoding variant of an attribute index. */
public enum IndexType {
  /** Key and value codes together with row numbers. */
  COMBINED,
  /** Row numbers without codes. */
  ROWS,
  /** Key and value codes without row numbers. */
  CODES;

  /**
   * Resolves the requested type names. Requesting both {@code rows} and {@code codes}, or nothing
   * at all, selects {@link #COMBINED}.
   *
   * @throws IllegalArgumentException for a name other than {@code rows} or {@code codes}
   */
  public static IndexType fromTypes(List<String> types) {
    boolean rows = false;
    boolean codes = false;
    for (String t : types) {
      switch (t.trim().toLowerCase(Locale.ROOT)) {
        case "rows" -> rows = true;
        case "codes" -> codes = true;
        case "" -> {}
        default -> throw new IllegalArgumentException("Unknown index type: " + t);
      }
    }
    if (rows == codes) {
      return COMBINED;
    }
    return rows ? ROWS : CODES;
  }
}
