/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace.propagation;

import chaintrace.internal.Nullable;

/**
 * In-process request context propagation backed by a thread local.
 *
 * <h3>Design notes</h3>
 *
 * <p>The thread local only holds the frame while work runs. It is never inherited: child threads
 * and executor threads see a frame only when the work was wrapped, for example via {@link
 * #wrap(Runnable)} or {@link #executor(java.util.concurrent.Executor)}. Otherwise, a pooled thread
 * would resume one request inside the context of whichever request used the thread before it.
 */
public class ThreadLocalCurrentRequestContext extends CurrentRequestContext {
  static final ThreadLocal<RequestFrame> DEFAULT = new ThreadLocal<>();

  /** Uses a static thread local shared by all instances created this way. */
  public static ThreadLocalCurrentRequestContext create() {
    return new ThreadLocalCurrentRequestContext(DEFAULT);
  }

  /** Uses a thread local private to the result. This is mainly used to isolate tests. */
  public static ThreadLocalCurrentRequestContext createIsolated() {
    return new ThreadLocalCurrentRequestContext(new ThreadLocal<>());
  }

  @SuppressWarnings("ThreadLocalUsage") // intentional: to support multiple Tracing instances
  final ThreadLocal<RequestFrame> local;
  final RevertToNullScope revertToNull;

  ThreadLocalCurrentRequestContext(ThreadLocal<RequestFrame> local) {
    if (local == null) throw new NullPointerException("local == null");
    this.local = local;
    this.revertToNull = new RevertToNullScope(local);
  }

  /**
   * Call this to clear the reference when you are sure any residual state is due to a leak. This
   * is generally only useful in tests.
   */
  public void clear() {
    local.remove();
  }

  @Override public RequestFrame get() {
    return local.get();
  }

  @Override public Scope newScope(@Nullable RequestFrame frame) {
    final RequestFrame previous = local.get();
    local.set(frame);
    return previous != null ? new RevertToPreviousScope(local, previous) : revertToNull;
  }

  static final class RevertToNullScope implements Scope {
    final ThreadLocal<RequestFrame> local;

    RevertToNullScope(ThreadLocal<RequestFrame> local) {
      this.local = local;
    }

    @Override public void close() {
      local.set(null);
    }
  }

  static final class RevertToPreviousScope implements Scope {
    final ThreadLocal<RequestFrame> local;
    final RequestFrame previous;

    RevertToPreviousScope(ThreadLocal<RequestFrame> local, RequestFrame previous) {
      this.local = local;
      this.previous = previous;
    }

    @Override public void close() {
      local.set(previous);
    }
  }
}
