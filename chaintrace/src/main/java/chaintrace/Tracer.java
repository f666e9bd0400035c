/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace;

import chaintrace.internal.Nullable;
import chaintrace.propagation.CurrentRequestContext;
import chaintrace.propagation.CurrentRequestContext.Scope;
import chaintrace.propagation.RequestFrame;

/**
 * Using a tracer, code running inside a middleware can see the request it serves and attribute
 * time to segments nested under the active middleware.
 *
 * <p>Ex.
 * <pre>{@code
 * Segment segment = tracer.startSegment("db.query");
 * try (Scope scope = tracer.withSegmentInScope(segment)) {
 *   return runQuery();
 * } finally {
 *   tracer.finishSegment(segment);
 * }
 * }</pre>
 *
 * <p>A segment left open is reported as {@code Truncated/<name>} when the request finishes.
 */
public final class Tracer {
  final CurrentRequestContext currentRequestContext;

  Tracer(CurrentRequestContext currentRequestContext) {
    this.currentRequestContext = currentRequestContext;
  }

  /** Returns the request in scope, or null if there is none. */
  @Nullable public RequestContext currentRequest() {
    RequestFrame frame = currentRequestContext.get();
    return frame != null ? frame.context() : null;
  }

  /** Returns the active segment of the request in scope, or null if there is none. */
  @Nullable public Segment currentSegment() {
    RequestFrame frame = currentRequestContext.get();
    return frame != null ? frame.segment() : null;
  }

  /**
   * Starts a child of the {@link #currentSegment() active segment}.
   *
   * @return {@link Segment#NOOP} if no request is in scope or it already finished
   */
  public Segment startSegment(String name) {
    if (name == null) throw new NullPointerException("name == null");
    RequestFrame frame = currentRequestContext.get();
    if (frame == null) return Segment.NOOP;
    return frame.context().startSegment(frame.segment(), name);
  }

  /**
   * Finishes a segment started by this tracer. Calling more than once, or after its request
   * finished, has no effect.
   *
   * @return true if this call finished the segment
   */
  public boolean finishSegment(Segment segment) {
    if (segment == null) throw new NullPointerException("segment == null");
    RequestContext owner = RequestContext.owner(segment);
    return owner != null && owner.finishSegment(segment);
  }

  /**
   * Makes the segment active until the result is closed, so that segments started meanwhile nest
   * under it. Passing null or {@link Segment#NOOP} clears the scope.
   */
  public Scope withSegmentInScope(@Nullable Segment segment) {
    RequestContext owner = segment != null ? RequestContext.owner(segment) : null;
    if (owner == null) return currentRequestContext.newScope(null);
    return currentRequestContext.newScope(RequestFrame.create(owner, segment));
  }

  @Override public String toString() {
    RequestFrame frame = currentRequestContext.get();
    return "Tracer{" + (frame != null ? "current=" + frame : "") + "}";
  }
}
