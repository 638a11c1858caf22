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

import java.util.Locale;

/** Structural level of a trace an attribute is attached to, in enumeration order. */
public enum Scope {
  RESOURCE(1),
  SCOPE(2),
  SPAN(4),
  EVENT(8),
  LINK(16);

  private final int bit;

  Scope(int bit) {
    this.bit = bit;
  }

  public int bit() {
    return bit;
  }

  /** Lower-case name as rendered in scope masks, e.g. {@code "resource"}. */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
