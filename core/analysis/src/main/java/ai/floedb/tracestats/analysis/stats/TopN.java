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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/** Largest attributes by size. */
public final class TopN {

  /** Descending bytes, then ascending name. */
  public static final Comparator<AttributeSize> BY_SIZE =
      Comparator.comparingLong(AttributeSize::bytes)
          .reversed()
          .thenComparing(AttributeSize::name);

  private TopN() {}

  public static List<AttributeSize> topN(int n, Map<String, Long> attrs) {
    List<AttributeSize> all = new ArrayList<>(attrs.size());
    attrs.forEach((name, bytes) -> all.add(new AttributeSize(name, bytes)));
    return topN(n, all);
  }

  public static List<AttributeSize> topN(int n, List<AttributeSize> attrs) {
    if (n < 0) {
      throw new IllegalArgumentException("n must not be negative: " + n);
    }
    List<AttributeSize> sorted = new ArrayList<>(attrs);
    sorted.sort(BY_SIZE);
    return List.copyOf(sorted.subList(0, Math.min(n, sorted.size())));
  }
}
