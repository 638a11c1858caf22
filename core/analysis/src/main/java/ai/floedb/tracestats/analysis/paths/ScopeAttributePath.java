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

package ai.floedb.tracestats.analysis.paths;

import ai.floedb.tracestats.analysis.block.DedicatedColumnScope;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Column paths of the generic attribute list of one scope (span, resource or event), with the
 * definition level at which key, value and array flag line up.
 */
public final class ScopeAttributePath {

  private final int definitionLevel;
  private final String keyPath;
  private final String valuePath;
  private final String isArrayPath;
  private final DedicatedColumnScope dedicatedScope;
  private final List<String> dedicatedColumnPaths;

  ScopeAttributePath(
      int definitionLevel,
      String keyPath,
      String valuePath,
      String isArrayPath,
      DedicatedColumnScope dedicatedScope,
      List<String> dedicatedColumnPaths) {
    this.definitionLevel = definitionLevel;
    this.keyPath = Objects.requireNonNull(keyPath, "keyPath");
    this.valuePath = Objects.requireNonNull(valuePath, "valuePath");
    this.isArrayPath = isArrayPath;
    this.dedicatedScope = dedicatedScope;
    this.dedicatedColumnPaths = List.copyOf(dedicatedColumnPaths);
  }

  public int definitionLevel() {
    return definitionLevel;
  }

  public String keyPath() {
    return keyPath;
  }

  public String valuePath() {
    return valuePath;
  }

  /** Path of the array flag column; absent in formats before vParquet4. */
  public Optional<String> isArrayPath() {
    return Optional.ofNullable(isArrayPath);
  }

  /** Scope tag used to match dedicated columns in block metadata; absent for events. */
  public Optional<DedicatedColumnScope> dedicatedScope() {
    return Optional.ofNullable(dedicatedScope);
  }

  /** Physical dedicated string slots, in slot order. Empty when the format has none. */
  public List<String> dedicatedColumnPaths() {
    return dedicatedColumnPaths;
  }

  @Override
  public String toString() {
    return "ScopeAttributePath{def="
        + definitionLevel
        + ", key="
        + keyPath
        + ", value="
        + valuePath
        + ", isArray="
        + isArrayPath
        + ", dedicated="
        + dedicatedColumnPaths.size()
        + "}";
  }
}
