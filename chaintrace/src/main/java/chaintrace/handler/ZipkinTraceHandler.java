/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace.handler;

import chaintrace.Exchange;
import chaintrace.Segment;
import chaintrace.internal.HexCodec;
import chaintrace.internal.Nullable;
import chaintrace.internal.Platform;
import java.util.List;
import java.util.Locale;
import zipkin2.Endpoint;
import zipkin2.Span;
import zipkin2.reporter.Reporter;

/**
 * Converts each finished trace into Zipkin spans: one {@link Span.Kind#SERVER} span for the
 * request, and one local span per segment, with parent IDs mirroring the segment tree.
 *
 * <p>The reporter owns transport. Failures it raises are caught and logged by {@link
 * chaintrace.Tracing}, as the supplied reporter could have bugs.
 */
public final class ZipkinTraceHandler extends TraceHandler {
  public static final String TAG_TRUNCATED = "chaintrace.truncated";
  public static final String TAG_COLLAPSED = "chaintrace.collapsed";

  public static ZipkinTraceHandler create(Reporter<Span> spanReporter) {
    return newBuilder(spanReporter).build();
  }

  public static Builder newBuilder(Reporter<Span> spanReporter) {
    return new Builder(spanReporter);
  }

  public static final class Builder {
    final Reporter<Span> spanReporter;
    String localServiceName = "unknown";

    Builder(Reporter<Span> spanReporter) {
      if (spanReporter == null) throw new NullPointerException("spanReporter == null");
      this.spanReporter = spanReporter;
    }

    /** Label of the application reported as the local endpoint. Defaults to "unknown". */
    public Builder localServiceName(String localServiceName) {
      if (localServiceName == null || localServiceName.isEmpty()) {
        throw new IllegalArgumentException(localServiceName + " is not a valid serviceName");
      }
      // Zipkin does not allow mixed case service names
      this.localServiceName = localServiceName.toLowerCase(Locale.ROOT);
      return this;
    }

    public ZipkinTraceHandler build() {
      return new ZipkinTraceHandler(this);
    }
  }

  final Reporter<Span> spanReporter;
  final Endpoint localEndpoint;

  ZipkinTraceHandler(Builder builder) {
    this.spanReporter = builder.spanReporter;
    this.localEndpoint = Endpoint.newBuilder().serviceName(builder.localServiceName).build();
  }

  @Override public boolean end(FinishedTrace trace) {
    String traceId = trace.requestId();
    Segment root = trace.root();

    Span.Builder result = newSpan(traceId, null, traceId, root).kind(Span.Kind.SERVER);
    Exchange exchange = trace.exchange();
    result.putTag("http.method", exchange.method());
    result.putTag("http.path", exchange.path());
    int statusCode = exchange.statusCode();
    if (statusCode != 0) result.putTag("http.status_code", String.valueOf(statusCode));
    List<Throwable> errors = trace.errors();
    if (!errors.isEmpty()) result.putTag("error", errorMessage(errors.get(0)));
    spanReporter.report(result.build());

    reportChildren(traceId, traceId, root);
    return true;
  }

  void reportChildren(String traceId, String parentId, Segment parent) {
    List<Segment> children = parent.children();
    for (int i = 0, length = children.size(); i < length; i++) {
      Segment child = children.get(i);
      String id = nextId();
      Span.Builder result = newSpan(traceId, parentId, id, child);
      if (child.isTruncated()) result.putTag(TAG_TRUNCATED, "true");
      if (child.isPlaceholder()) {
        result.putTag(TAG_COLLAPSED, String.valueOf(child.collapsedCount()));
      }
      Throwable error = child.error();
      if (error != null) result.putTag("error", errorMessage(error));
      spanReporter.report(result.build());
      reportChildren(traceId, id, child);
    }
  }

  Span.Builder newSpan(String traceId, @Nullable String parentId, String id, Segment segment) {
    Span.Builder result = Span.newBuilder()
      .traceId(traceId)
      .parentId(parentId)
      .id(id)
      .name(segment.name())
      .localEndpoint(localEndpoint);

    long start = segment.startTimestamp(), finish = segment.finishTimestamp();
    result.timestamp(start);
    if (start != 0L && finish != 0L) result.duration(Math.max(finish - start, 1));
    return result;
  }

  static String nextId() {
    long id;
    do {
      id = Platform.get().randomLong();
    } while (id == 0L);
    return HexCodec.toLowerHex(id);
  }

  static String errorMessage(Throwable error) {
    String message = error.getMessage();
    return message != null ? message : error.getClass().getSimpleName();
  }

  @Override public String toString() {
    return spanReporter.toString();
  }
}
