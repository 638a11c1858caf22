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

package ai.floedb.tracestats.testing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * In-memory trace model used to build fixture blocks: traces hold resource spans, which hold
 * scope spans, which hold spans with their events and links.
 */
public final class TraceFixture {

  public static final int DEDICATED_SLOTS = 10;

  private TraceFixture() {}

  public static Trace trace(String traceId) {
    return new Trace(traceId);
  }

  public static ResourceSpans resource(String serviceName) {
    return new ResourceSpans(serviceName);
  }

  public static ScopeSpans scope(String name) {
    return new ScopeSpans(name);
  }

  public static Span span(String name) {
    return new Span(name);
  }

  public static Event event(String name) {
    return new Event(name);
  }

  public static Link link() {
    return new Link();
  }

  /**
   * A key with its value(s). Values are {@link String}, {@link Long}, {@link Double} or {@link
   * Boolean}, all of one type. Scalars have exactly one value.
   */
  public record Attr(String key, List<Object> values, boolean array) {

    public Attr {
      values = List.copyOf(values);
      if (!array && values.size() != 1) {
        throw new IllegalArgumentException("scalar attribute needs one value: " + key);
      }
    }

    public static Attr str(String key, String value) {
      return new Attr(key, List.of(value), false);
    }

    public static Attr int64(String key, long value) {
      return new Attr(key, List.of(value), false);
    }

    public static Attr float64(String key, double value) {
      return new Attr(key, List.of(value), false);
    }

    public static Attr bool(String key, boolean value) {
      return new Attr(key, List.of(value), false);
    }

    public static Attr strArray(String key, String... values) {
      return new Attr(key, Arrays.asList((Object[]) values), true);
    }

    public static Attr int64Array(String key, Long... values) {
      return new Attr(key, Arrays.asList((Object[]) values), true);
    }

    Object first() {
      return values.isEmpty() ? null : values.get(0);
    }
  }

  public static final class Trace {
    final String traceId;
    final List<ResourceSpans> resourceSpans = new ArrayList<>();

    private Trace(String traceId) {
      this.traceId = traceId;
    }

    public Trace resource(ResourceSpans rs) {
      resourceSpans.add(rs);
      return this;
    }
  }

  public static final class ResourceSpans {
    final String serviceName;
    final List<Attr> attrs = new ArrayList<>();
    final String[] dedicated = new String[DEDICATED_SLOTS];
    final List<ScopeSpans> scopeSpans = new ArrayList<>();
    String cluster;
    String namespace;
    String pod;
    String container;
    String k8sClusterName;
    String k8sNamespaceName;
    String k8sPodName;
    String k8sContainerName;

    private ResourceSpans(String serviceName) {
      this.serviceName = serviceName;
    }

    public ResourceSpans attr(Attr attr) {
      attrs.add(attr);
      return this;
    }

    /** Sets dedicated slot {@code slot} (1-based, String01..String10). */
    public ResourceSpans dedicated(int slot, String value) {
      dedicated[slot - 1] = value;
      return this;
    }

    public ResourceSpans cluster(String cluster) {
      this.cluster = cluster;
      return this;
    }

    public ResourceSpans namespace(String namespace) {
      this.namespace = namespace;
      return this;
    }

    public ResourceSpans pod(String pod) {
      this.pod = pod;
      return this;
    }

    public ResourceSpans container(String container) {
      this.container = container;
      return this;
    }

    public ResourceSpans k8s(String cluster, String namespace, String pod, String container) {
      this.k8sClusterName = cluster;
      this.k8sNamespaceName = namespace;
      this.k8sPodName = pod;
      this.k8sContainerName = container;
      return this;
    }

    public ResourceSpans scope(ScopeSpans ss) {
      scopeSpans.add(ss);
      return this;
    }
  }

  public static final class ScopeSpans {
    final String name;
    String version = "";
    final List<Attr> attrs = new ArrayList<>();
    final List<Span> spans = new ArrayList<>();

    private ScopeSpans(String name) {
      this.name = name;
    }

    public ScopeSpans version(String version) {
      this.version = version;
      return this;
    }

    public ScopeSpans attr(Attr attr) {
      attrs.add(attr);
      return this;
    }

    public ScopeSpans span(Span span) {
      spans.add(span);
      return this;
    }
  }

  public static final class Span {
    final String name;
    long kind = 1;
    long statusCode;
    String statusMessage = "";
    String httpMethod;
    String httpUrl;
    Long httpStatusCode;
    final List<Attr> attrs = new ArrayList<>();
    final String[] dedicated = new String[DEDICATED_SLOTS];
    final List<Event> events = new ArrayList<>();
    final List<Link> links = new ArrayList<>();

    private Span(String name) {
      this.name = name;
    }

    public Span kind(long kind) {
      this.kind = kind;
      return this;
    }

    public Span status(long code, String message) {
      this.statusCode = code;
      this.statusMessage = message;
      return this;
    }

    public Span http(String method, String url, Long statusCode) {
      this.httpMethod = method;
      this.httpUrl = url;
      this.httpStatusCode = statusCode;
      return this;
    }

    public Span attr(Attr attr) {
      attrs.add(attr);
      return this;
    }

    /** Sets dedicated slot {@code slot} (1-based, String01..String10). */
    public Span dedicated(int slot, String value) {
      dedicated[slot - 1] = value;
      return this;
    }

    public Span event(Event event) {
      events.add(event);
      return this;
    }

    public Span link(Link link) {
      links.add(link);
      return this;
    }
  }

  public static final class Event {
    final String name;
    final List<Attr> attrs = new ArrayList<>();

    private Event(String name) {
      this.name = name;
    }

    public Event attr(Attr attr) {
      attrs.add(attr);
      return this;
    }
  }

  public static final class Link {
    final List<Attr> attrs = new ArrayList<>();

    private Link() {}

    public Link attr(Attr attr) {
      attrs.add(attr);
      return this;
    }
  }
}
