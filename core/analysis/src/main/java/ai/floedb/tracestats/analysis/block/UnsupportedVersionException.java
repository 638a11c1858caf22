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

/** Raised for a block written in a format version this tool cannot read. */
public final class UnsupportedVersionException extends RuntimeException {

  private final String version;

  public UnsupportedVersionException(String version) {
    super("Unsupported block version: " + version);
    this.version = version;
  }

  public String version() {
    return version;
  }
}
