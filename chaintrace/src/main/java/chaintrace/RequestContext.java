/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace;

import chaintrace.handler.FinishedTrace;
import chaintrace.internal.Nullable;
import chaintrace.internal.Platform;
import chaintrace.internal.Throwables;
import java.util.Collections;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Binds one inbound request to one {@link SegmentTree} and one {@link NameState}.
 *
 * <p>The lifecycle is {@code CREATED -> ACTIVE -> FINALIZING -> DONE}. Once finalizing starts, the
 * request no longer changes: late callbacks, for example from a slow timer, are ignored.
 *
 * <p>Continuations of a request can run on any thread. This instance is the lock guarding both
 * the tree and the name state, and is never shared with another request.
 *
 * @see Tracing#newRequest(Exchange)
 */
public final class RequestContext {
  static final String NAME_PREFIX = "WebTransaction/WebFrameworkUri/";

  public enum State {
    /** The root segment is open and nothing ran yet. */
    CREATED,
    /** At least one segment started. */
    ACTIVE,
    /** The response was finalized, aborted or timed out. The trace is being captured. */
    FINALIZING,
    /** The trace was handed to handlers. Nothing changes after this. */
    DONE
  }

  final String id;
  final Exchange exchange;
  final String frameworkName;
  final IntPredicate errorStatus;
  final long startNanos;
  final SegmentTree tree;
  final NameState nameState;

  State state = State.CREATED;
  @Nullable Throwable lastError, unhandledError;

  RequestContext(String id, Exchange exchange, String frameworkName, IntPredicate errorStatus,
    Clock clock, int maxOpenSegments, long startNanos) {
    this.id = id;
    this.exchange = exchange;
    this.frameworkName = frameworkName;
    this.errorStatus = errorStatus;
    this.startNanos = startNanos;
    this.nameState = new NameState(this);
    this.tree = new SegmentTree(transactionName("/"), clock, maxOpenSegments);
    this.tree.owner = this;
  }

  /** Lower-hex identifier, unique among requests in flight */
  public String id() {
    return id;
  }

  public Exchange exchange() {
    return exchange;
  }

  public NameState nameState() {
    return nameState;
  }

  public Segment root() {
    return tree.root();
  }

  /** Returns the request owning the segment, or null if it is {@link Segment#NOOP} or detached. */
  @Nullable public static RequestContext owner(Segment segment) {
    if (segment == null) throw new NullPointerException("segment == null");
    return segment.tree != null ? segment.tree.owner : null;
  }

  /** {@link chaintrace.internal.Platform#nanoTime()} when this request started */
  public long startNanos() {
    return startNanos;
  }

  public synchronized State state() {
    return state;
  }

  /** True once finalizing started. Callbacks firing after this are ignored. */
  public synchronized boolean isFinished() {
    return state == State.FINALIZING || state == State.DONE;
  }

  /**
   * Opens a segment under the given parent, or under the root when null.
   *
   * @return {@link Segment#NOOP} when this request already finished
   */
  public Segment startSegment(@Nullable Segment parent, String name) {
    synchronized (this) {
      if (state == State.FINALIZING || state == State.DONE) {
        Platform.get().log("Ignoring segment {0} started after the request finished", name, null);
        return Segment.NOOP;
      }
      state = State.ACTIVE;
      return tree.open(parent, name);
    }
  }

  /**
   * Closes the segment. Calling more than once, or after the request finished, has no effect.
   *
   * @return true if this call finished the segment
   */
  public synchronized boolean finishSegment(Segment segment) {
    if (state == State.FINALIZING || state == State.DONE) return false;
    return tree.close(segment);
  }

  /**
   * Records an error raised by the work of the given segment. This is only reported as a failure
   * when it escapes the chain or the final status is an error status.
   *
   * @param segment the segment whose work failed, or null if unknown
   */
  public void recordError(@Nullable Segment segment, Throwable error) {
    if (error == null) throw new NullPointerException("error == null");
    Throwable cause = Throwables.unwrapCompletion(error);
    synchronized (this) {
      if (state == State.FINALIZING || state == State.DONE) return;
      if (segment != null && segment.tree == tree && segment.error == null) {
        segment.error = cause;
      }
      lastError = cause;
    }
  }

  /**
   * Records an error that escaped the middleware chain, or reached a global error listener. Only
   * the first such error is reported.
   */
  public void recordUnhandledError(Throwable error) {
    if (error == null) throw new NullPointerException("error == null");
    Throwable cause = Throwables.unwrapCompletion(error);
    synchronized (this) {
      if (state == State.FINALIZING || state == State.DONE) {
        Platform.get().log("Ignoring error after request {0} finished", id, cause);
        return;
      }
      if (unhandledError == null) unhandledError = cause;
    }
  }

  /** Fires a name trigger in response to a body or status assignment. */
  public void nameTrigger(NameTrigger kind) {
    nameState.trigger(kind);
  }

  /** Returns the name this request would be reported with if it finished now. */
  public String transactionName() {
    return transactionName(nameState.capturedPathString());
  }

  String transactionName(String path) {
    return NAME_PREFIX + frameworkName + "/" + exchange.method() + "/" + path;
  }

  /**
   * Captures the name, closes any open segments as truncated and returns the trace. The state
   * remains {@link State#FINALIZING} until {@link #done()}.
   *
   * @return null if this request already finished
   */
  @Nullable synchronized FinishedTrace finish(FinishedTrace.Cause cause) {
    if (state == State.FINALIZING || state == State.DONE) return null;
    state = State.FINALIZING;
    String name = transactionName();
    nameState.seal();
    tree.finish(name);
    return new FinishedTrace(id, name, exchange, tree.root(), errors(), cause);
  }

  synchronized void done() {
    state = State.DONE;
  }

  List<Throwable> errors() {
    if (unhandledError != null) return Collections.singletonList(unhandledError);
    if (lastError != null && errorStatus.test(exchange.statusCode())) {
      return Collections.singletonList(lastError);
    }
    return Collections.emptyList();
  }

  @Override public String toString() {
    return "RequestContext{id=" + id + ", exchange=" + exchange + "}";
  }
}
