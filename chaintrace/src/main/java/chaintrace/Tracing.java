/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace;

import chaintrace.handler.FinishedTrace;
import chaintrace.handler.TraceHandler;
import chaintrace.internal.HexCodec;
import chaintrace.internal.Nullable;
import chaintrace.internal.Platform;
import chaintrace.internal.handler.SafeTraceHandler;
import chaintrace.internal.recorder.RequestContexts;
import chaintrace.internal.recorder.TickClock;
import chaintrace.propagation.CurrentRequestContext;
import chaintrace.propagation.ThreadLocalCurrentRequestContext;
import java.io.Closeable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntPredicate;

/**
 * This provides utilities needed for request tracing. For example, a {@link Tracer}.
 *
 * <p>This owns every request in flight. A framework adapter calls {@link #newRequest(Exchange)}
 * when a request arrives and {@link #finishRequest(RequestContext, FinishedTrace.Cause)} when the
 * response is finalized. Finished traces are passed to each {@link TraceHandler}.
 *
 * <p>Instances built via {@link #newBuilder()} are registered automatically such that statically
 * configured instrumentation can use {@link #current()}.
 */
public abstract class Tracing implements Closeable {
  static final AtomicReference<Tracing> CURRENT = new AtomicReference<>();

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Use a tracer to see the current request and record segments inside it. */
  public abstract Tracer tracer();

  /**
   * This supports in-process propagation, typically across thread boundaries. This includes
   * utilities for concurrent types like {@linkplain java.util.concurrent.Executor} and {@linkplain
   * java.util.concurrent.CompletionStage}.
   */
  public abstract CurrentRequestContext currentRequestContext();

  /** Label of the web framework, used in transaction and segment names. Ex. "Koa" */
  public abstract String frameworkName();

  /**
   * Registers a new request with a root segment and an empty name state.
   *
   * <p>This also finalizes requests that outlived their {@linkplain Builder#requestTimeout(long,
   * TimeUnit) timeout}, at most once per timeout period.
   */
  public abstract RequestContext newRequest(Exchange exchange);

  /** Returns the request in flight with the given ID, or null if there is none. */
  @Nullable public abstract RequestContext request(String requestId);

  /** Count of requests registered and not yet finished */
  public abstract int requestsInFlight();

  /**
   * Finalizes the request: captures its name, truncates open segments, hands the trace to
   * handlers and detaches the request.
   *
   * @return null if the request was already finished
   */
  @Nullable public abstract FinishedTrace finishRequest(RequestContext context,
    FinishedTrace.Cause cause);

  /**
   * Finalizes every request that outlived its timeout with {@link FinishedTrace.Cause#TIMED_OUT}.
   *
   * @return the count of requests finalized
   */
  public abstract int expireStaleRequests();

  /**
   * Returns the most recently created tracing component iff it hasn't been closed. null otherwise.
   *
   * <p>This object should not be cached.
   */
  @Nullable public static Tracing current() {
    return CURRENT.get();
  }

  /**
   * Returns the most recently created tracer if its component hasn't been closed. null otherwise.
   *
   * <p>This object should not be cached.
   */
  @Nullable public static Tracer currentTracer() {
    Tracing tracing = current();
    return tracing != null ? tracing.tracer() : null;
  }

  /** Ensures this component can be garbage collected, by making it not {@link #current()} */
  @Override public abstract void close();

  public static final class Builder {
    String frameworkName = "Middleware";
    int maxOpenSegments = 900;
    long requestTimeoutNanos = TimeUnit.MINUTES.toNanos(5);
    IntPredicate errorStatus = new IntPredicate() {
      @Override public boolean test(int status) {
        return status >= 500;
      }

      @Override public String toString() {
        return "status >= 500";
      }
    };
    Clock clock;
    CurrentRequestContext currentRequestContext = ThreadLocalCurrentRequestContext.create();
    Set<TraceHandler> traceHandlers = new LinkedHashSet<>(); // dupes not ok

    Builder() {
    }

    /**
     * Label of the web framework, such as "Koa". This is part of every transaction name, ex.
     * {@code WebTransaction/WebFrameworkUri/Koa/GET//users}. Defaults to "Middleware".
     */
    public Builder frameworkName(String frameworkName) {
      if (frameworkName == null || frameworkName.isEmpty()) {
        throw new IllegalArgumentException(frameworkName + " is not a valid frameworkName");
      }
      this.frameworkName = frameworkName;
      return this;
    }

    /**
     * Bounds how many segments of one request are open in detail at the same time. Beyond this,
     * segments collapse into a {@code Truncated/} placeholder. Defaults to 900.
     */
    public Builder maxOpenSegments(int maxOpenSegments) {
      if (maxOpenSegments <= 0) {
        throw new IllegalArgumentException("maxOpenSegments <= 0: " + maxOpenSegments);
      }
      this.maxOpenSegments = maxOpenSegments;
      return this;
    }

    /**
     * Requests not finalized within this time are finalized as {@link
     * FinishedTrace.Cause#TIMED_OUT}, so that a dropped connection cannot leak a request. Defaults
     * to 5 minutes.
     */
    public Builder requestTimeout(long timeout, TimeUnit unit) {
      if (unit == null) throw new NullPointerException("unit == null");
      if (timeout <= 0) throw new IllegalArgumentException("timeout <= 0: " + timeout);
      this.requestTimeoutNanos = unit.toNanos(timeout);
      return this;
    }

    /**
     * Decides if the final status code makes an error recorded inside the chain a failure. For
     * example, a middleware that catches an error and responds 500 did not really handle it.
     * Defaults to {@code status >= 500}.
     */
    public Builder errorStatus(IntPredicate errorStatus) {
      if (errorStatus == null) throw new NullPointerException("errorStatus == null");
      this.errorStatus = errorStatus;
      return this;
    }

    /**
     * Assigns microsecond-resolution timestamp source for segments.
     *
     * <p>By default, the platform clock is read once per request, and ticks using {@link
     * System#nanoTime()} thereafter. A clock assigned here is used as-is, which helps tests pin
     * timestamps.
     */
    public Builder clock(Clock clock) {
      if (clock == null) throw new NullPointerException("clock == null");
      this.clock = clock;
      return this;
    }

    /**
     * Responsible for implementing {@link Tracer#currentRequest()} and carrying requests across
     * suspension points. By default a thread-local restored by wrappers is used.
     */
    public Builder currentRequestContext(CurrentRequestContext currentRequestContext) {
      if (currentRequestContext == null) {
        throw new NullPointerException("currentRequestContext == null");
      }
      this.currentRequestContext = currentRequestContext;
      return this;
    }

    /**
     * Inputs receive every finished trace. Handlers execute in order: If any handler returns
     * {@code false}, the next will not see the trace.
     *
     * @param traceHandler skipped if {@link TraceHandler#NOOP} or already added
     */
    public Builder addTraceHandler(TraceHandler traceHandler) {
      if (traceHandler == null) throw new NullPointerException("traceHandler == null");

      // Some configuration can coerce to no-op, ignore in this case.
      if (traceHandler == TraceHandler.NOOP) return this;

      if (!traceHandlers.add(traceHandler)) {
        Platform.get().log("Please check configuration as {0} was added twice", traceHandler, null);
      }
      return this;
    }

    /** Returns an immutable copy of the current {@linkplain #addTraceHandler trace handlers}. */
    public Set<TraceHandler> traceHandlers() {
      return Collections.unmodifiableSet(new LinkedHashSet<>(traceHandlers));
    }

    public Tracing build() {
      return new Default(this);
    }
  }

  static final class Default extends Tracing {
    final Platform platform = Platform.get();
    final Tracer tracer;
    final CurrentRequestContext currentRequestContext;
    final String frameworkName;
    final int maxOpenSegments;
    final IntPredicate errorStatus;
    @Nullable final Clock clock;
    final TraceHandler traceHandler;
    final RequestContexts requests;

    Default(Builder builder) {
      this.currentRequestContext = builder.currentRequestContext;
      this.tracer = new Tracer(currentRequestContext);
      this.frameworkName = builder.frameworkName;
      this.maxOpenSegments = builder.maxOpenSegments;
      this.errorStatus = builder.errorStatus;
      this.clock = builder.clock;
      this.traceHandler =
        SafeTraceHandler.create(builder.traceHandlers.toArray(new TraceHandler[0]));
      this.requests = new RequestContexts(builder.requestTimeoutNanos, platform.nanoTime());
      maybeSetCurrent();
    }

    @Override public Tracer tracer() {
      return tracer;
    }

    @Override public CurrentRequestContext currentRequestContext() {
      return currentRequestContext;
    }

    @Override public String frameworkName() {
      return frameworkName;
    }

    @Override public RequestContext newRequest(Exchange exchange) {
      if (exchange == null) throw new NullPointerException("exchange == null");
      expire(requests.maybeExpire(platform.nanoTime()));

      Clock requestClock = clock != null ? clock : TickClock.create(platform, platform.clock());
      while (true) {
        long nextId = platform.randomLong();
        if (nextId == 0L) continue;
        String id = HexCodec.toLowerHex(nextId);
        RequestContext result = new RequestContext(id, exchange, frameworkName, errorStatus,
          requestClock, maxOpenSegments, platform.nanoTime());
        if (requests.putIfAbsent(result)) return result;
      }
    }

    @Override @Nullable public RequestContext request(String requestId) {
      return requests.get(requestId);
    }

    @Override public int requestsInFlight() {
      return requests.size();
    }

    @Override @Nullable public FinishedTrace finishRequest(RequestContext context,
      FinishedTrace.Cause cause) {
      if (context == null) throw new NullPointerException("context == null");
      if (cause == null) throw new NullPointerException("cause == null");
      FinishedTrace trace = context.finish(cause);
      if (trace == null) return null;
      requests.remove(context);
      try {
        traceHandler.end(trace);
      } finally {
        context.done();
      }
      return trace;
    }

    @Override public int expireStaleRequests() {
      return expire(requests.expire(platform.nanoTime()));
    }

    int expire(List<RequestContext> stale) {
      int expired = 0;
      for (int i = 0, length = stale.size(); i < length; i++) {
        RequestContext context = stale.get(i);
        Platform.get().log("Request {0} timed out before it finished", context.id(), null);
        if (finishRequest(context, FinishedTrace.Cause.TIMED_OUT) != null) expired++;
      }
      return expired;
    }

    @Override public String toString() {
      return "Tracing{frameworkName=" + frameworkName + ", requests=" + requests + "}";
    }

    @Override public void close() {
      // only set null if we are the outermost instance
      CURRENT.compareAndSet(this, null);
    }

    void maybeSetCurrent() {
      if (CURRENT.get() == this) return;
      CURRENT.set(this);
    }
  }

  Tracing() { // intentionally hidden constructor
  }
}
