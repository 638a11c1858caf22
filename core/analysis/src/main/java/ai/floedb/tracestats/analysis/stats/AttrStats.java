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

/**
 * Statistics of one attribute occurrence, built from a joined key/value row. Instances are
 * pooled by {@link AttrStatsPool} and must not be kept after they are released.
 */
public final class AttrStats {
  private String name = "";
  private String value = "";
  private long bytes;
  private boolean isArray;
  private boolean isNull;

  public String name() {
    return name;
  }

  public String value() {
    return value;
  }

  public long bytes() {
    return bytes;
  }

  public boolean isArray() {
    return isArray;
  }

  public boolean isNull() {
    return isNull;
  }

  void name(String name) {
    this.name = name;
  }

  void addValue(String value, long bytes) {
    this.value = value;
    this.bytes += bytes;
  }

  void markArray() {
    this.isArray = true;
  }

  void markNull() {
    this.isNull = true;
  }

  void reset() {
    name = "";
    value = "";
    bytes = 0;
    isArray = false;
    isNull = false;
  }

  @Override
  public String toString() {
    return "AttrStats{"
        + name
        + ", bytes="
        + bytes
        + (isArray ? ", array" : "")
        + (isNull ? ", null" : "")
        + "}";
  }
}
