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

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AttrValueTest {

  @Test
  void byteSizeFollowsSerializedWidth() {
    assertThat(AttrValue.of("GET").byteSize()).isEqualTo(3);
    assertThat(AttrValue.of("hé").byteSize()).isEqualTo(3);
    assertThat(AttrValue.of("€").byteSize()).isEqualTo(3);
    assertThat(AttrValue.of(new String(Character.toChars(0x1F600))).byteSize()).isEqualTo(4);
    assertThat(AttrValue.of(42L).byteSize()).isEqualTo(8);
    assertThat(AttrValue.of(4.2).byteSize()).isEqualTo(8);
    assertThat(AttrValue.of(true).byteSize()).isEqualTo(1);
    assertThat(AttrValue.missing().byteSize()).isZero();
  }

  @Test
  void nullStringIsMissing() {
    AttrValue v = AttrValue.of((String) null);

    assertThat(v.isMissing()).isTrue();
    assertThat(v.kind()).isEqualTo(ValueKind.MISSING);
    assertThat(v.asString()).isEmpty();
  }

  @Test
  void stringFormsAreCanonical() {
    assertThat(AttrValue.of(200L).asString()).isEqualTo("200");
    assertThat(AttrValue.of(false).asString()).isEqualTo("false");
    assertThat(AttrValue.of("prod").asString()).isEqualTo("prod");
    assertThat(AttrValue.of(true)).isEqualTo(new AttrValue.Bool(true));
  }

  @Test
  void fixedWidthMatchesByteSize() {
    assertThat(ValueKind.INT64.fixedWidth()).isEqualTo(AttrValue.of(1L).byteSize());
    assertThat(ValueKind.BOOL.fixedWidth()).isEqualTo(AttrValue.of(true).byteSize());
    assertThat(ValueKind.STRING.fixedWidth()).isEqualTo(-1);
  }
}
