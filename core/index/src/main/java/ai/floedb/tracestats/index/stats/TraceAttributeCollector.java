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

package ai.floedb.tracestats.index.stats;

import ai.floedb.tracestats.parquet.RowNumber;
import ai.floedb.tracestats.types.Scope;
import java.util.ArrayList;
import java.util.List;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.schema.GroupType;
import org.apache.parquet.schema.PrimitiveType;

/**
 * Walks vParquet4 trace records and adds every attribute occurrence to a {@link FileStats}.
 *
 * <p>Collected per scope:
 *
 * <ul>
 *   <li>resource: generic attributes, dedicated columns and the well-known columns ({@code
 *       service.name}, {@code cluster}, {@code k8s.pod.name}, ...)
 *   <li>scope: generic attributes; with intrinsics also {@code scope.name} and {@code version}
 *   <li>span: generic attributes, dedicated columns and the http columns; with intrinsics also
 *       {@code name}, {@code kind}, {@code status.code} and {@code status.message}
 *   <li>event: generic attributes; with intrinsics also {@code event.name}
 *   <li>link: generic attributes
 * </ul>
 *
 * <p>Occurrences are located by trace, resource spans, scope spans and span index. Event and link
 * attributes share the row of their span. The row number carries over between calls to {@link
 * #collect}, so batches must be passed in file order.
 */
public final class TraceAttributeCollector {

  private static final String[][] RESOURCE_COLUMNS = {
    {"ServiceName", "service.name"},
    {"Cluster", "cluster"},
    {"Namespace", "namespace"},
    {"Pod", "pod"},
    {"Container", "container"},
    {"K8sClusterName", "k8s.cluster.name"},
    {"K8sNamespaceName", "k8s.namespace.name"},
    {"K8sPodName", "k8s.pod.name"},
    {"K8sContainerName", "k8s.container.name"},
  };

  private final FileStats stats;
  private final List<String> dedicatedResource;
  private final List<String> dedicatedSpan;
  private final boolean addIntrinsics;
  private final RowNumber row = RowNumber.empty();

  public TraceAttributeCollector(
      FileStats stats,
      List<String> dedicatedResource,
      List<String> dedicatedSpan,
      boolean addIntrinsics) {
    this.stats = stats;
    this.dedicatedResource = List.copyOf(dedicatedResource);
    this.dedicatedSpan = List.copyOf(dedicatedSpan);
    this.addIntrinsics = addIntrinsics;
  }

  public FileStats stats() {
    return stats;
  }

  public void collect(List<Group> traces) {
    stats.traces += traces.size();
    for (Group trace : traces) {
      row.next(0, 0);
      List<Group> resourceSpans = elements(trace, "rs");
      stats.resources += resourceSpans.size();
      for (Group rs : resourceSpans) {
        row.next(1, 1);
        resource(rs);
        for (Group ss : elements(rs, "ss")) {
          row.next(2, 2);
          scopeSpans(ss);
        }
      }
    }
  }

  private void resource(Group rs) {
    Group res = group(rs, "Resource");
    if (res == null) {
      return;
    }
    attributes(res, Scope.RESOURCE);
    dedicated(res, Scope.RESOURCE, dedicatedResource);
    for (String[] column : RESOURCE_COLUMNS) {
      stats.addString(row, Scope.RESOURCE, column[1], string(res, column[0]));
    }
  }

  private void scopeSpans(Group ss) {
    Group scope = group(ss, "Scope");
    List<Group> spans = elements(ss, "Spans");
    stats.spans += spans.size();

    if (scope != null) {
      attributes(scope, Scope.SCOPE);
      if (addIntrinsics) {
        stats.addString(row, Scope.SCOPE, "scope.name", string(scope, "Name"));
        stats.addString(row, Scope.SCOPE, "version", string(scope, "Version"));
      }
    }

    for (Group span : spans) {
      row.next(3, 3);
      span(span);
    }
  }

  private void span(Group span) {
    List<Group> events = elements(span, "Events");
    List<Group> links = elements(span, "Links");
    stats.events += events.size();
    stats.links += links.size();

    attributes(span, Scope.SPAN);
    dedicated(span, Scope.SPAN, dedicatedSpan);
    stats.addString(row, Scope.SPAN, "http.method", string(span, "HttpMethod"));
    stats.addString(row, Scope.SPAN, "http.url", string(span, "HttpUrl"));
    stats.addLong(row, Scope.SPAN, "http.status_code", integer(span, "HttpStatusCode"));
    if (addIntrinsics) {
      stats.addString(row, Scope.SPAN, "name", string(span, "Name"));
      stats.addLong(row, Scope.SPAN, "kind", integer(span, "Kind"));
      stats.addLong(row, Scope.SPAN, "status.code", integer(span, "StatusCode"));
      stats.addString(row, Scope.SPAN, "status.message", string(span, "StatusMessage"));
    }

    for (Group event : events) {
      attributes(event, Scope.EVENT);
      if (addIntrinsics) {
        stats.addString(row, Scope.EVENT, "event.name", string(event, "Name"));
      }
    }
    for (Group link : links) {
      attributes(link, Scope.LINK);
    }
  }

  /**
   * Adds the generic attributes under {@code Attrs}. Scalars use the first value of the first
   * non-empty typed list; arrays use the whole of it.
   */
  private void attributes(Group owner, Scope scope) {
    for (Group attr : elements(owner, "Attrs")) {
      String key = string(attr, "Key");
      if (key == null) {
        continue;
      }
      boolean isArray = has(attr, "IsArray") && attr.getBoolean("IsArray", 0);
      if (isArray) {
        stats.arrays++;
      }

      List<String> strings = strings(attr, "Value");
      if (!strings.isEmpty()) {
        stats.addStrings(row, scope, key, isArray ? strings : strings.subList(0, 1));
        continue;
      }
      List<Long> ints = longs(attr, "ValueInt");
      if (!ints.isEmpty()) {
        stats.addLongs(row, scope, key, isArray ? ints : ints.subList(0, 1));
        continue;
      }
      List<Double> doubles = doubles(attr, "ValueDouble");
      if (!doubles.isEmpty()) {
        stats.addDoubles(row, scope, key, isArray ? doubles : doubles.subList(0, 1));
        continue;
      }
      List<Boolean> bools = bools(attr, "ValueBool");
      if (!bools.isEmpty()) {
        stats.addBools(row, scope, key, isArray ? bools : bools.subList(0, 1));
      }
    }
  }

  /** Adds the dedicated string slots that carry a declared name, slot i holding name i. */
  private void dedicated(Group owner, Scope scope, List<String> names) {
    Group slots = group(owner, "DedicatedAttributes");
    if (slots == null) {
      return;
    }
    for (int i = 0; i < names.size(); i++) {
      String field = String.format("String%02d", i + 1);
      stats.addString(row, scope, names.get(i), string(slots, field));
    }
  }

  private static boolean has(Group g, String field) {
    return g.getType().containsField(field) && g.getFieldRepetitionCount(field) > 0;
  }

  private static Group group(Group g, String field) {
    return has(g, field) ? g.getGroup(field, 0) : null;
  }

  private static String string(Group g, String field) {
    return has(g, field) ? g.getString(field, 0) : null;
  }

  /** Reads an integer column written either as INT32 or INT64. */
  private static Long integer(Group g, String field) {
    if (!has(g, field)) {
      return null;
    }
    PrimitiveType type = g.getType().getType(field).asPrimitiveType();
    return type.getPrimitiveTypeName() == PrimitiveType.PrimitiveTypeName.INT32
        ? (long) g.getInteger(field, 0)
        : g.getLong(field, 0);
  }

  /** Elements of a three-level LIST group, empty if the field is absent. */
  private static List<Group> elements(Group g, String field) {
    Group list = group(g, field);
    if (list == null) {
      return List.of();
    }
    int n = list.getFieldRepetitionCount("list");
    List<Group> out = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      Group entry = list.getGroup("list", i);
      if (has(entry, "element")) {
        out.add(entry.getGroup("element", 0));
      }
    }
    return out;
  }

  private static List<Group> primitiveEntries(Group g, String field) {
    Group list = group(g, field);
    if (list == null || !isList(list.getType())) {
      return List.of();
    }
    int n = list.getFieldRepetitionCount("list");
    List<Group> out = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      Group entry = list.getGroup("list", i);
      if (has(entry, "element")) {
        out.add(entry);
      }
    }
    return out;
  }

  private static boolean isList(GroupType type) {
    return type.containsField("list");
  }

  private static List<String> strings(Group g, String field) {
    List<String> out = new ArrayList<>();
    for (Group e : primitiveEntries(g, field)) {
      out.add(e.getString("element", 0));
    }
    return out;
  }

  private static List<Long> longs(Group g, String field) {
    List<Long> out = new ArrayList<>();
    for (Group e : primitiveEntries(g, field)) {
      out.add(e.getLong("element", 0));
    }
    return out;
  }

  private static List<Double> doubles(Group g, String field) {
    List<Double> out = new ArrayList<>();
    for (Group e : primitiveEntries(g, field)) {
      out.add(e.getDouble("element", 0));
    }
    return out;
  }

  private static List<Boolean> bools(Group g, String field) {
    List<Boolean> out = new ArrayList<>();
    for (Group e : primitiveEntries(g, field)) {
      out.add(e.getBoolean("element", 0));
    }
    return out;
  }
}
