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

package ai.floedb.tracestats.analysis.block;

/** Parquet trace block formats that can be analysed. */
public enum FormatVersion {
  VPARQUET2("vParquet2"),
  VPARQUET3("vParquet3"),
  VPARQUET4("vParquet4");

  public static final String DATA_FILE_NAME = "data.parquet";

  private final String versionString;

  FormatVersion(String versionString) {
    this.versionString = versionString;
  }

  public String versionString() {
    return versionString;
  }

  /** Whether blocks of this version carry dedicated attribute columns. */
  public boolean hasDedicatedColumns() {
    return this != VPARQUET2;
  }

  /**
   * Looks up a version by its metadata string.
   *
   * @throws UnsupportedVersionException if {@code version} is not a known format
   */
  public static FormatVersion of(String version) {
    for (FormatVersion v : values()) {
      if (v.versionString.equals(version)) {
        return v;
      }
    }
    throw new UnsupportedVersionException(version);
  }

  @Override
  public String toString() {
    return versionString;
  }
}
