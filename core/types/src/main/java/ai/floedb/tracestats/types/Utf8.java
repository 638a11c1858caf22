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

/** UTF-8 helpers that avoid materializing encoded byte arrays. */
public final class Utf8 {

  private Utf8() {}

  /**
   * Returns the number of bytes {@code s} occupies when encoded as UTF-8.
   *
   * <p>Unpaired surrogates count as 3 bytes.
   */
  public static int encodedLength(CharSequence s) {
    int len = s.length();
    int bytes = 0;
    for (int i = 0; i < len; i++) {
      char c = s.charAt(i);
      if (c < 0x80) {
        bytes += 1;
      } else if (c < 0x800) {
        bytes += 2;
      } else if (Character.isHighSurrogate(c)
          && i + 1 < len
          && Character.isLowSurrogate(s.charAt(i + 1))) {
        bytes += 4;
        i++;
      } else {
        bytes += 3;
      }
    }
    return bytes;
  }

  /**
   * Compares two strings by the unsigned byte order of their UTF-8 encodings.
   *
   * <p>UTF-8 preserves code point order, so this walks code points instead of encoding. Note that
   * {@link String#compareTo} compares UTF-16 code units and disagrees for supplementary
   * characters.
   */
  public static int compare(String a, String b) {
    int i = 0;
    int j = 0;
    int la = a.length();
    int lb = b.length();
    while (i < la && j < lb) {
      int ca = a.codePointAt(i);
      int cb = b.codePointAt(j);
      if (ca != cb) {
        return Integer.compare(ca, cb);
      }
      i += Character.charCount(ca);
      j += Character.charCount(cb);
    }
    return Boolean.compare(i < la, j < lb);
  }
}
