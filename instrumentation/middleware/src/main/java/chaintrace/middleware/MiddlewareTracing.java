/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace.middleware;

import chaintrace.Exchange;
import chaintrace.NameTrigger;
import chaintrace.RequestContext;
import chaintrace.Tracer;
import chaintrace.Tracing;
import chaintrace.handler.FinishedTrace;
import chaintrace.internal.Nullable;
import chaintrace.propagation.CurrentRequestContext;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for a framework adapter. The adapter reports request boundaries and response
 * mutations, and either registers {@linkplain #wrap(Middleware) wrapped middleware} or intercepts
 * dispatch via {@link #onMiddlewareInvoke(RequestContext, String, Next, Invocation)}.
 *
 * <p>Ex.
 * <pre>{@code
 * RequestContext request = middlewareTracing.onRequestStart(exchange);
 * CompletionStage<Void> chain;
 * try (Scope scope = tracer.withSegmentInScope(request.root())) {
 *   chain = dispatch(exchange);
 * }
 * chain.whenComplete((v, error) -> {
 *   if (error != null) middlewareTracing.onUnhandledError(request, error);
 *   respond(exchange);
 *   middlewareTracing.onRequestEnd(request);
 * });
 * }</pre>
 */
public final class MiddlewareTracing {
  public static MiddlewareTracing create(Tracing tracing) {
    return newBuilder(tracing).build();
  }

  public static Builder newBuilder(Tracing tracing) {
    return new Builder(tracing);
  }

  public static final class Builder {
    final Tracing tracing;
    String segmentPrefix = "Middleware/";

    Builder(Tracing tracing) {
      if (tracing == null) throw new NullPointerException("tracing == null");
      this.tracing = tracing;
    }

    /**
     * Prepended to each middleware segment name, before the framework name. Defaults to
     * "Middleware/", which results in names like {@code Middleware/Koa/auth}.
     */
    public Builder segmentPrefix(String segmentPrefix) {
      if (segmentPrefix == null) throw new NullPointerException("segmentPrefix == null");
      this.segmentPrefix = segmentPrefix;
      return this;
    }

    public MiddlewareTracing build() {
      return new MiddlewareTracing(this);
    }
  }

  final Tracing tracing;
  final Tracer tracer;
  final CurrentRequestContext currentRequestContext;
  final String segmentNamePrefix;
  final AtomicInteger ordinal = new AtomicInteger();

  MiddlewareTracing(Builder builder) { // intentionally hidden constructor
    this.tracing = builder.tracing;
    this.tracer = tracing.tracer();
    this.currentRequestContext = tracing.currentRequestContext();
    this.segmentNamePrefix = builder.segmentPrefix + tracing.frameworkName() + "/";
  }

  public Tracing tracing() {
    return tracing;
  }

  /** Call once when a request arrives, before dispatching the middleware chain. */
  public RequestContext onRequestStart(Exchange exchange) {
    return tracing.newRequest(exchange);
  }

  /**
   * Traces one middleware call for adapters that intercept dispatch instead of registering
   * {@linkplain #wrap(Middleware) wrapped middleware}.
   *
   * @param request the request being dispatched, or null if unknown
   * @param middlewareName the declared name of the middleware
   * @param next the framework's continuation of the chain
   * @param invokeReal calls the real middleware with the {@link Next} it is given
   * @return the middleware's result, relayed unchanged
   */
  public CompletionStage<Void> onMiddlewareInvoke(@Nullable RequestContext request,
    String middlewareName, Next next, Invocation invokeReal) {
    if (middlewareName == null) throw new NullPointerException("middlewareName == null");
    if (next == null) throw new NullPointerException("next == null");
    if (invokeReal == null) throw new NullPointerException("invokeReal == null");
    return TracingMiddleware.invoke(this, request, null, middlewareName, next, invokeReal);
  }

  /** Call when the response body or status is assigned. Ignored once the request finished. */
  public void onResponseMutation(@Nullable RequestContext request, NameTrigger kind) {
    if (kind == null) throw new NullPointerException("kind == null");
    if (request == null) return;
    request.nameTrigger(kind);
  }

  /**
   * Call when an error escaped the chain or reached the framework's error listener. Only the first
   * such error of a request is reported.
   */
  public void onUnhandledError(@Nullable RequestContext request, Throwable error) {
    if (error == null) throw new NullPointerException("error == null");
    if (request == null) return;
    request.recordUnhandledError(error);
  }

  /**
   * Call once the response is finalized.
   *
   * @return null if the request already finished
   */
  @Nullable public FinishedTrace onRequestEnd(RequestContext request) {
    return tracing.finishRequest(request, FinishedTrace.Cause.FINISHED);
  }

  /**
   * Call when the connection closed before the response was finalized.
   *
   * @return null if the request already finished
   */
  @Nullable public FinishedTrace onRequestAbort(RequestContext request) {
    return tracing.finishRequest(request, FinishedTrace.Cause.ABORTED);
  }

  /**
   * Like {@link #wrap(String, Middleware)}, except the name is the simple name of the
   * middleware's class. Lambdas and anonymous classes are named {@code anonymous<ordinal>}, where
   * the ordinal is the registration order among all middleware wrapped by this instance.
   */
  public <C> TracingMiddleware<C> wrap(Middleware<C> middleware) {
    if (middleware == null) throw new NullPointerException("middleware == null");
    if (middleware instanceof TracingMiddleware) {
      throw new IllegalArgumentException(middleware + " is already traced");
    }
    int ordinal = this.ordinal.getAndIncrement();
    Class<?> type = middleware.getClass();
    String name = type.isAnonymousClass() || type.isSynthetic()
      ? "anonymous" + ordinal
      : type.getSimpleName();
    return new TracingMiddleware<>(this, null, name, middleware);
  }

  /** Returns a middleware that records a segment named after the given name on each call. */
  public <C> TracingMiddleware<C> wrap(String name, Middleware<C> middleware) {
    return wrap(null, name, middleware);
  }

  /**
   * Like {@link #wrap(String, Middleware)}, except the mount path, such as a router prefix, is
   * appended to the request name on entry.
   *
   * @param mountPath the path component to append, or null for none
   */
  public <C> TracingMiddleware<C> wrap(@Nullable String mountPath, String name,
    Middleware<C> middleware) {
    if (name == null) throw new NullPointerException("name == null");
    if (middleware == null) throw new NullPointerException("middleware == null");
    if (middleware instanceof TracingMiddleware) {
      throw new IllegalArgumentException(middleware + " is already traced");
    }
    ordinal.getAndIncrement();
    return new TracingMiddleware<>(this, mountPath, name, middleware);
  }

  String segmentName(String middlewareName) {
    return segmentNamePrefix + middlewareName;
  }

  @Override public String toString() {
    return "MiddlewareTracing{" + tracing + "}";
  }
}
