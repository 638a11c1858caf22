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

package ai.floedb.tracestats.analysis.stats;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TopNTest {

  @Test
  void ordersByBytesThenName() {
    List<AttributeSize> top = TopN.topN(3, Map.of("b", 10L, "a", 10L, "c", 30L, "d", 1L));

    assertThat(top)
        .containsExactly(
            new AttributeSize("c", 30), new AttributeSize("a", 10), new AttributeSize("b", 10));
  }

  @Test
  void truncatesToAvailable() {
    assertThat(TopN.topN(10, Map.of("x", 1L))).hasSize(1);
    assertThat(TopN.topN(0, Map.of("x", 1L))).isEmpty();
  }

  @Test
  void repeatedApplicationIsStable() {
    Map<String, Long> attrs = Map.of("p", 5L, "q", 7L, "r", 5L, "s", 2L);
    List<AttributeSize> once = TopN.topN(3, attrs);

    assertThat(TopN.topN(3, once)).isEqualTo(once);
    assertThat(TopN.topN(2, once)).isEqualTo(TopN.topN(2, attrs));
  }
}
