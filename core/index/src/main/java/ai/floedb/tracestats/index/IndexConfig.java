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

package ai.floedb.tracestats.index;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.WithDefault;
import java.util.List;

@ConfigMapping(prefix = "tracestats.index")
public interface IndexConfig {

  /** Also index span, scope and event intrinsics such as {@code name} and {@code kind}. */
  @WithDefault("false")
  boolean addIntrinsics();

  /** {@code rows}, {@code codes} or both; both selects the combined layout. */
  @WithDefault("rows,codes")
  List<String> indexTypes();

  /** Trace records read per batch while collecting. */
  @WithDefault("1024")
  int readBatchSize();

  static IndexConfig load() {
    SmallRyeConfig config =
        new SmallRyeConfigBuilder()
            .addDefaultSources()
            .addDiscoveredConverters()
            .withMapping(IndexConfig.class)
            .build();
    return config.getConfigMapping(IndexConfig.class);
  }
}
