/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace.middleware;

import chaintrace.RequestContext;
import chaintrace.Segment;
import chaintrace.internal.Nullable;
import chaintrace.internal.Platform;
import chaintrace.propagation.CurrentRequestContext;
import chaintrace.propagation.CurrentRequestContext.Scope;
import chaintrace.propagation.RequestFrame;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Records a segment for each call of a middleware, nested under the middleware that called it.
 *
 * <p>The request is looked up from the {@linkplain CurrentRequestContext current frame}, which the
 * framework adapter places in scope when it dispatches the chain. When there is no request in
 * scope, or it already finished, the middleware runs untouched.
 *
 * <h3>Why wrap next?</h3>
 * <p>A middleware can call {@code next} after awaiting work that completed on another thread. The
 * traced {@link Next} restores the caller's frame before running downstream, so downstream
 * segments nest under the caller regardless of which thread resumed. The stage it returns
 * completes with the caller's frame in scope, so continuations such as {@code thenRun} open
 * segments as siblings of the downstream middleware.
 */
public final class TracingMiddleware<C> implements Middleware<C> {
  final MiddlewareTracing middlewareTracing;
  @Nullable final String mountPath;
  final String name;
  final Middleware<C> delegate;

  TracingMiddleware(MiddlewareTracing middlewareTracing, @Nullable String mountPath, String name,
    Middleware<C> delegate) {
    this.middlewareTracing = middlewareTracing;
    this.mountPath = mountPath;
    this.name = name;
    this.delegate = delegate;
  }

  /** The name used in the segment, such as "auth" or "anonymous2" */
  public String name() {
    return name;
  }

  /** The path appended to the request name on entry, or null if none. */
  @Nullable public String mountPath() {
    return mountPath;
  }

  @Override public CompletionStage<Void> handle(C context, Next next) {
    RequestContext request = middlewareTracing.tracer.currentRequest();
    return invoke(middlewareTracing, request, mountPath, name, next,
      tracedNext -> delegate.handle(context, tracedNext));
  }

  static CompletionStage<Void> invoke(MiddlewareTracing middlewareTracing,
    @Nullable RequestContext request, @Nullable String mountPath, String name, Next next,
    Invocation invocation) {
    if (request == null || request.isFinished()) return invocation.invoke(next);

    CurrentRequestContext current = middlewareTracing.currentRequestContext;
    RequestFrame callerFrame = current.get();
    Segment parent = callerFrame != null && callerFrame.context() == request
      ? callerFrame.segment()
      : request.root();
    Segment segment = request.startSegment(parent, middlewareTracing.segmentName(name));
    if (segment.isNoop()) return invocation.invoke(next); // finished meanwhile

    request.nameState().appendPath(mountPath);
    RequestFrame frame = RequestFrame.create(request, segment);

    CompletionStage<Void> result;
    try (Scope scope = current.maybeScope(frame)) {
      result = invocation.invoke(new TracedNext(current, frame, next));
    } catch (RuntimeException | Error e) {
      request.recordError(segment, e);
      request.finishSegment(segment);
      throw e;
    }

    if (result == null) { // nothing to wait on
      request.finishSegment(segment);
      return null;
    }

    // A new future closes the segment before the caller's continuations run. Completing it
    // manually instead of via whenComplete relays errors as-is.
    CompletableFuture<Void> finished = new CompletableFuture<>();
    result.whenComplete((value, error) -> {
      if (error != null) request.recordError(segment, error);
      request.finishSegment(segment);
      if (error != null) {
        finished.completeExceptionally(error);
      } else {
        finished.complete(value);
      }
    });
    return finished;
  }

  @Override public String toString() {
    return "TracingMiddleware{name=" + name + ", delegate=" + delegate + "}";
  }

  static final class TracedNext implements Next {
    final CurrentRequestContext current;
    final RequestFrame frame;
    final Next delegate;
    final AtomicBoolean invoked = new AtomicBoolean();

    TracedNext(CurrentRequestContext current, RequestFrame frame, Next delegate) {
      this.current = current;
      this.frame = frame;
      this.delegate = delegate;
    }

    @Override public CompletionStage<Void> invoke() {
      if (!invoked.compareAndSet(false, true)) {
        Platform.get().log("{0} called next more than once", frame.segment().name(), null);
      }
      CompletionStage<Void> downstream;
      try (Scope scope = current.maybeScope(frame)) {
        downstream = delegate.invoke();
      }
      if (downstream == null) return null;
      return current.decorate(frame, downstream);
    }

    @Override public String toString() {
      return "TracedNext{" + frame + "}";
    }
  }
}
