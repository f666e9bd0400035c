/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace.propagation;

import chaintrace.RequestContext;
import chaintrace.Segment;

/**
 * The request a unit of work belongs to, and the segment new segments should nest under. This is
 * what {@link CurrentRequestContext} carries across suspension points.
 */
public final class RequestFrame {
  public static RequestFrame create(RequestContext context, Segment segment) {
    if (context == null) throw new NullPointerException("context == null");
    if (segment == null) throw new NullPointerException("segment == null");
    return new RequestFrame(context, segment);
  }

  final RequestContext context;
  final Segment segment;

  RequestFrame(RequestContext context, Segment segment) {
    this.context = context;
    this.segment = segment;
  }

  public RequestContext context() {
    return context;
  }

  /** The active segment: new segments opened in this frame become its children. */
  public Segment segment() {
    return segment;
  }

  /** Returns a frame of the same request with a different active segment. */
  public RequestFrame withSegment(Segment segment) {
    if (segment == null) throw new NullPointerException("segment == null");
    if (segment == this.segment) return this;
    return new RequestFrame(context, segment);
  }

  /** Equal when both the request and the active segment are the same instances. */
  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof RequestFrame)) return false;
    RequestFrame that = (RequestFrame) o;
    return context == that.context && segment == that.segment;
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= System.identityHashCode(context);
    h *= 1000003;
    h ^= System.identityHashCode(segment);
    return h;
  }

  @Override public String toString() {
    return "RequestFrame{requestId=" + context.id() + ", segment=" + segment.name() + "}";
  }
}
