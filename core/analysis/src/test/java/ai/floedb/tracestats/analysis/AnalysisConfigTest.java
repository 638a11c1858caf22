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

package ai.floedb.tracestats.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class AnalysisConfigTest {

  @AfterEach
  void clearOverrides() {
    System.clearProperty("tracestats.analysis.num-attr");
    System.clearProperty("tracestats.analysis.concurrency");
  }

  @Test
  void defaultsApplyWhereNothingIsConfigured() {
    AnalysisConfig config = AnalysisConfig.load();

    assertThat(config.numAttr()).isEqualTo(15);
    assertThat(config.concurrency()).isEqualTo(10);
    assertThat(config.minCompactionLevel()).isZero();
    assertThat(config.dedicatedColumnSuggestions()).isEqualTo(10);
  }

  @Test
  void propertiesFileOverridesDefaults() {
    AnalysisConfig config = AnalysisConfig.load();

    assertThat(config.bufferWindowBytes()).isEqualTo(4096);
    assertThat(config.bufferCount()).isEqualTo(8);
  }

  @Test
  void systemPropertiesOverrideEverything() {
    System.setProperty("tracestats.analysis.num-attr", "3");
    System.setProperty("tracestats.analysis.concurrency", "2");

    AnalysisConfig config = AnalysisConfig.load();

    assertThat(config.numAttr()).isEqualTo(3);
    assertThat(config.concurrency()).isEqualTo(2);
  }
}
