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

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.WithDefault;

@ConfigMapping(prefix = "tracestats.analysis")
public interface AnalysisConfig {

  /** Number of attributes reported per scope. */
  @WithDefault("15")
  int numAttr();

  @WithDefault("2097152")
  int bufferWindowBytes();

  @WithDefault("64")
  int bufferCount();

  /** Blocks analysed in parallel. */
  @WithDefault("10")
  int concurrency();

  /** Blocks below this compaction level are skipped. */
  @WithDefault("0")
  int minCompactionLevel();

  @WithDefault("10")
  int dedicatedColumnSuggestions();

  /**
   * Loads the mapping from system properties, environment variables and {@code
   * META-INF/microprofile-config.properties}.
   */
  static AnalysisConfig load() {
    SmallRyeConfig config =
        new SmallRyeConfigBuilder()
            .addDefaultSources()
            .addDiscoveredConverters()
            .withMapping(AnalysisConfig.class)
            .build();
    return config.getConfigMapping(AnalysisConfig.class);
  }
}
