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

import java.util.ArrayList;
import java.util.List;

/**
 * Set of {@link Scope scopes} an attribute key was observed in, stored as a bitmask.
 *
 * <p>Instances are immutable; {@link #add} returns a new mask. The mask is descriptive metadata
 * only and is never used in size or count arithmetic.
 */
public record ScopeMask(long value) {

  private static final long ALL_BITS = allBits();

  public static final ScopeMask EMPTY = new ScopeMask(0);

  public ScopeMask {
    if ((value & ~ALL_BITS) != 0) {
      throw new IllegalArgumentException("Unknown scope bits in mask: " + value);
    }
  }

  public static ScopeMask of(Scope... scopes) {
    long v = 0;
    for (Scope s : scopes) {
      v |= s.bit();
    }
    return new ScopeMask(v);
  }

  public static ScopeMask fromValue(long value) {
    return new ScopeMask(value);
  }

  /** Bitwise union. Adding a scope that is already present returns an equal mask. */
  public ScopeMask add(ScopeMask other) {
    return new ScopeMask(value | other.value);
  }

  public ScopeMask add(Scope scope) {
    return new ScopeMask(value | scope.bit());
  }

  /** True if any bit of {@code other} is set in this mask. */
  public boolean has(ScopeMask other) {
    return (value & other.value) != 0;
  }

  public boolean has(Scope scope) {
    return (value & scope.bit()) != 0;
  }

  public boolean isEmpty() {
    return value == 0;
  }

  /** Scopes present in this mask, in enumeration order. */
  public List<Scope> scopes() {
    List<Scope> out = new ArrayList<>(Scope.values().length);
    for (Scope s : Scope.values()) {
      if (has(s)) {
        out.add(s);
      }
    }
    return out;
  }

  /** Space-joined scope labels in enumeration order, e.g. {@code "resource span"}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Scope s : scopes()) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append(s.label());
    }
    return sb.toString();
  }

  private static long allBits() {
    long v = 0;
    for (Scope s : Scope.values()) {
      v |= s.bit();
    }
    return v;
  }
}
