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

import java.util.ArrayDeque;

/**
 * Free list of {@link AttrStats}. Not thread safe; one pool serves one scan. Instances are reset
 * both when handed out and when returned.
 */
public final class AttrStatsPool {

  static final int DEFAULT_MAX_IDLE = 1024;

  private final ArrayDeque<AttrStats> free = new ArrayDeque<>();
  private final int maxIdle;

  public AttrStatsPool() {
    this(DEFAULT_MAX_IDLE);
  }

  public AttrStatsPool(int maxIdle) {
    this.maxIdle = maxIdle;
  }

  public AttrStats acquire() {
    AttrStats s = free.poll();
    if (s == null) {
      return new AttrStats();
    }
    s.reset();
    return s;
  }

  public void release(AttrStats s) {
    s.reset();
    if (free.size() < maxIdle) {
      free.push(s);
    }
  }

  int idle() {
    return free.size();
  }
}
