/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace.propagation;

import chaintrace.internal.Nullable;
import java.io.Closeable;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * This makes a given {@link RequestFrame} current by placing it in scope (usually but not always a
 * thread local scope).
 *
 * <p>Middleware resume on whichever thread completes the work they waited on. The helpers here
 * capture the frame current when work is scheduled, and restore it when that work runs. This
 * associates a request with its chain of continuations rather than with a thread.
 *
 * <p>This type is an SPI, and intended to be used by implementors looking to change thread-local
 * storage.
 *
 * <h3>Design</h3>
 *
 * This design was inspired by com.google.inject.servlet.RequestScoper
 */
public abstract class CurrentRequestContext {

  /** Returns the current frame in scope or null if there isn't one. */
  public abstract @Nullable RequestFrame get();

  /**
   * Sets the current frame in scope until the returned object is closed. It is a programming error
   * to drop or never close the result. Using try-with-resources is preferred for this reason.
   *
   * @param frame frame to place into scope or null to clear the scope
   */
  public abstract Scope newScope(@Nullable RequestFrame frame);

  /**
   * Like {@link #newScope(RequestFrame)}, except returns {@link Scope#NOOP} if the given frame is
   * already in scope. This reduces overhead when scoping callbacks that are usually invoked on the
   * same thread that scheduled them.
   *
   * @param frame frame to place into scope or null to clear the scope
   * @return a new scope object or {@link Scope#NOOP} if the input is already the case
   */
  public Scope maybeScope(@Nullable RequestFrame frame) {
    RequestFrame current = get();
    if (frame == null) {
      if (current == null) return Scope.NOOP;
      return newScope(null);
    }
    return frame.equals(current) ? Scope.NOOP : newScope(frame);
  }

  /** A frame remains in the scope it was bound to until close is called. */
  public interface Scope extends Closeable {
    /** Returned when {@link #maybeScope(RequestFrame)} detected scope redundancy. */
    Scope NOOP = new Scope() {
      @Override public void close() {
      }

      @Override public String toString() {
        return "NoopScope";
      }
    };

    /** No exceptions are thrown when unbinding a frame. */
    @Override void close();
  }

  /** Wraps the input so that it executes with the same frame as now. */
  public <C> Callable<C> wrap(Callable<C> task) {
    if (task == null) throw new NullPointerException("task == null");
    final RequestFrame invocationFrame = get();
    class CurrentRequestContextCallable implements Callable<C> {
      @Override public C call() throws Exception {
        try (Scope scope = maybeScope(invocationFrame)) {
          return task.call();
        }
      }
    }
    return new CurrentRequestContextCallable();
  }

  /** Wraps the input so that it executes with the same frame as now. */
  public Runnable wrap(Runnable task) {
    if (task == null) throw new NullPointerException("task == null");
    final RequestFrame invocationFrame = get();
    class CurrentRequestContextRunnable implements Runnable {
      @Override public void run() {
        try (Scope scope = maybeScope(invocationFrame)) {
          task.run();
        }
      }
    }
    return new CurrentRequestContextRunnable();
  }

  /**
   * Decorates the input such that the {@link #get() current frame} at the time a task is scheduled
   * is made current when the task is executed.
   */
  public Executor executor(Executor delegate) {
    if (delegate == null) throw new NullPointerException("delegate == null");
    class CurrentRequestContextExecutor implements Executor {
      @Override public void execute(Runnable task) {
        delegate.execute(CurrentRequestContext.this.wrap(task));
      }
    }
    return new CurrentRequestContextExecutor();
  }

  /** Like {@link #decorate(RequestFrame, CompletionStage)} using the current frame. */
  public <T> CompletableFuture<T> decorate(CompletionStage<T> stage) {
    return decorate(get(), stage);
  }

  /**
   * Returns a future that completes like the input, with the given frame in scope while it
   * completes.
   *
   * <p>Dependents of the result, such as {@code thenRun}, run with the frame in scope. This holds
   * whether they were registered before or after completion, and on whichever thread runs them,
   * including one that belongs to another request or to no request at all. Dependents of those
   * dependents inherit the frame.
   *
   * @param frame frame to restore on completion, or null to clear the scope on completion
   */
  public <T> CompletableFuture<T> decorate(@Nullable RequestFrame frame, CompletionStage<T> stage) {
    if (stage == null) throw new NullPointerException("stage == null");
    CompletableFuture<T> result = new FrameBoundFuture<>(this, frame);
    stage.whenComplete((value, error) -> {
      try (Scope scope = maybeScope(frame)) {
        if (error != null) {
          result.completeExceptionally(error);
        } else {
          result.complete(value);
        }
      }
    });
    return result;
  }
}
