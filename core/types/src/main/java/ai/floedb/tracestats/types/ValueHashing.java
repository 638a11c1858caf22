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

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 64-bit FNV-1a content hashes over serialized attribute values.
 *
 * <p>Serialization per element: strings as their UTF-8 bytes with no separator between elements,
 * integers and floats as 8 little-endian bytes (floats by their raw IEEE-754 bits), booleans as a
 * single {@code 0}/{@code 1} byte. The hashes only bucket values; callers must still compare the
 * values themselves, since two distinct lists can share a hash.
 */
public final class ValueHashing {

  static final long OFFSET_BASIS = 0xcbf29ce484222325L;
  static final long PRIME = 0x100000001b3L;

  private ValueHashing() {}

  public static long hashStrings(List<String> values) {
    long h = OFFSET_BASIS;
    for (String v : values) {
      for (byte b : v.getBytes(StandardCharsets.UTF_8)) {
        h = step(h, b);
      }
    }
    return h;
  }

  public static long hashLongs(List<Long> values) {
    long h = OFFSET_BASIS;
    for (long v : values) {
      h = stepLong(h, v);
    }
    return h;
  }

  public static long hashDoubles(List<Double> values) {
    long h = OFFSET_BASIS;
    for (double v : values) {
      h = stepLong(h, Double.doubleToRawLongBits(v));
    }
    return h;
  }

  public static long hashBools(List<Boolean> values) {
    long h = OFFSET_BASIS;
    for (boolean v : values) {
      h = step(h, (byte) (v ? 1 : 0));
    }
    return h;
  }

  /** Hash of raw bytes, mostly useful to check the constants against published test vectors. */
  public static long hashBytes(byte[] data) {
    long h = OFFSET_BASIS;
    for (byte b : data) {
      h = step(h, b);
    }
    return h;
  }

  private static long stepLong(long h, long v) {
    for (int i = 0; i < 8; i++) {
      h = step(h, (byte) (v >>> (8 * i)));
    }
    return h;
  }

  private static long step(long h, byte b) {
    return (h ^ (b & 0xff)) * PRIME;
  }
}
