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

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Attribute statistics of one scope (span, resource or event) over one or more blocks.
 *
 * <ul>
 *   <li>{@link #attributes()}: bytes per scalar attribute, dedicated columns included
 *   <li>{@link #arrayAttributes()}: bytes per array attribute, not part of {@link #totalBytes()}
 *   <li>{@link #cardinality()}: occurrences per value of each scalar attribute
 *   <li>{@link #dedicated()}: names stored in dedicated columns
 * </ul>
 *
 * <p>Instances are immutable. {@link #add} combines two summaries and is commutative and
 * associative, so per-block summaries can be merged in any order.
 */
public final class GenericAttrSummary {

  private static final GenericAttrSummary EMPTY = builder().build();

  private final long totalBytes;
  private final Map<String, Long> attributes;
  private final Map<String, Long> arrayAttributes;
  private final Set<String> dedicated;
  private final Map<String, Map<String, Long>> cardinality;

  private GenericAttrSummary(Builder b) {
    this.totalBytes = b.totalBytes;
    this.attributes = Collections.unmodifiableMap(new HashMap<>(b.attributes));
    this.arrayAttributes = Collections.unmodifiableMap(new HashMap<>(b.arrayAttributes));
    this.dedicated = Collections.unmodifiableSet(new HashSet<>(b.dedicated));
    Map<String, Map<String, Long>> card = new HashMap<>(b.cardinality.size() * 2);
    b.cardinality.forEach(
        (name, values) -> card.put(name, Collections.unmodifiableMap(new HashMap<>(values))));
    this.cardinality = Collections.unmodifiableMap(card);
  }

  public static GenericAttrSummary empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public long totalBytes() {
    return totalBytes;
  }

  public Map<String, Long> attributes() {
    return attributes;
  }

  public Map<String, Long> arrayAttributes() {
    return arrayAttributes;
  }

  public Set<String> dedicated() {
    return dedicated;
  }

  public boolean isDedicated(String name) {
    return dedicated.contains(name);
  }

  public Map<String, Map<String, Long>> cardinality() {
    return cardinality;
  }

  /** Occurrences per value of {@code name}; empty for unknown and array attributes. */
  public Map<String, Long> cardinality(String name) {
    return cardinality.getOrDefault(name, Map.of());
  }

  /** Share of {@link #totalBytes()} taken by {@code name}, in percent. */
  public double percentOf(String name) {
    Long bytes = attributes.get(name);
    if (bytes == null || totalBytes == 0) {
      return 0.0;
    }
    return bytes * 100.0 / totalBytes;
  }

  public List<AttributeSize> topAttributes(int n) {
    return TopN.topN(n, attributes);
  }

  public GenericAttrSummary add(GenericAttrSummary other) {
    return toBuilder().add(other).build();
  }

  public Builder toBuilder() {
    Builder b = new Builder();
    b.totalBytes = totalBytes;
    b.attributes.putAll(attributes);
    b.arrayAttributes.putAll(arrayAttributes);
    b.dedicated.addAll(dedicated);
    cardinality.forEach((name, values) -> b.cardinality.put(name, new HashMap<>(values)));
    return b;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof GenericAttrSummary s
        && totalBytes == s.totalBytes
        && attributes.equals(s.attributes)
        && arrayAttributes.equals(s.arrayAttributes)
        && dedicated.equals(s.dedicated)
        && cardinality.equals(s.cardinality);
  }

  @Override
  public int hashCode() {
    return Long.hashCode(totalBytes) * 31 + attributes.hashCode();
  }

  @Override
  public String toString() {
    return "GenericAttrSummary{totalBytes="
        + totalBytes
        + ", attributes="
        + attributes.size()
        + ", arrayAttributes="
        + arrayAttributes.size()
        + ", dedicated="
        + dedicated
        + "}";
  }

  public static final class Builder {
    private long totalBytes;
    private final Map<String, Long> attributes = new HashMap<>();
    private final Map<String, Long> arrayAttributes = new HashMap<>();
    private final Set<String> dedicated = new HashSet<>();
    private final Map<String, Map<String, Long>> cardinality = new HashMap<>();

    private Builder() {}

    /** Records one scalar occurrence of {@code name} with {@code value}. */
    public Builder addAttribute(String name, long bytes, String value) {
      attributes.merge(name, bytes, Long::sum);
      totalBytes += bytes;
      cardinality.computeIfAbsent(name, k -> new HashMap<>()).merge(value, 1L, Long::sum);
      return this;
    }

    public Builder addArrayAttribute(String name, long bytes) {
      arrayAttributes.merge(name, bytes, Long::sum);
      return this;
    }

    /**
     * Folds {@code other} into this builder. Merging many summaries through one builder copies
     * each of them once.
     */
    public Builder add(GenericAttrSummary other) {
      totalBytes += other.totalBytes;
      other.attributes.forEach((k, v) -> attributes.merge(k, v, Long::sum));
      other.arrayAttributes.forEach((k, v) -> arrayAttributes.merge(k, v, Long::sum));
      dedicated.addAll(other.dedicated);
      other.cardinality.forEach(
          (name, values) -> {
            Map<String, Long> into = cardinality.computeIfAbsent(name, k -> new HashMap<>());
            values.forEach((v, c) -> into.merge(v, c, Long::sum));
          });
      return this;
    }

    /**
     * Records a dedicated column. Its bytes and value counts replace the entry the generic
     * attribute list held under the same name, and its bytes are added to the total.
     */
    public Builder dedicatedColumn(String name, long bytes, Map<String, Long> values) {
      attributes.put(name, bytes);
      totalBytes += bytes;
      cardinality.put(name, new HashMap<>(values));
      dedicated.add(name);
      return this;
    }

    public GenericAttrSummary build() {
      return new GenericAttrSummary(this);
    }
  }
}
