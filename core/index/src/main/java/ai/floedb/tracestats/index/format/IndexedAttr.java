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

package ai.floedb.tracestats.index.format;

import ai.floedb.tracestats.index.stats.IndexRowNumber;
import ai.floedb.tracestats.types.ScopeMask;
import java.util.List;

/** One index record: a key with its values grouped per value type. */
public sealed interface IndexedAttr
    permits IndexedAttr.Combined, IndexedAttr.Rows, IndexedAttr.Codes {

  String key();

  ScopeMask scopeMask();

  record Combined(
      String key,
      int keyCode,
      ScopeMask scopeMask,
      List<CombinedValue<String>> strings,
      List<CombinedValue<Long>> ints,
      List<CombinedValue<Double>> floats,
      List<CombinedValue<Boolean>> bools)
      implements IndexedAttr {}

  record Rows(
      String key,
      ScopeMask scopeMask,
      List<RowsValue<String>> strings,
      List<RowsValue<Long>> ints,
      List<RowsValue<Double>> floats,
      List<RowsValue<Boolean>> bools)
      implements IndexedAttr {}

  record Codes(
      String key,
      int keyCode,
      ScopeMask scopeMask,
      List<CodesValue<String>> strings,
      List<CodesValue<Long>> ints,
      List<CodesValue<Double>> floats,
      List<CodesValue<Boolean>> bools)
      implements IndexedAttr {}

  record CombinedValue<T>(List<T> value, int valueCode, List<IndexRowNumber> rowNumbers) {}

  record RowsValue<T>(List<T> value, List<IndexRowNumber> rowNumbers) {}

  record CodesValue<T>(List<T> value, int valueCode) {}
}
