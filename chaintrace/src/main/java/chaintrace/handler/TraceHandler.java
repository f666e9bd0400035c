/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace.handler;

/**
 * Receives each request's {@link FinishedTrace} once the request reached its final state. Common
 * implementations include reporting (ex to Zipkin) and metrics.
 *
 * <p>It is important to do work quickly as callbacks are run on the thread that finalized the
 * response. The trace is read-only: its segments will not change after this call.
 *
 * @see chaintrace.Tracing.Builder#addTraceHandler(TraceHandler)
 */
public abstract class TraceHandler {
  /** Use to avoid comparing against null references. */
  public static final TraceHandler NOOP = new TraceHandler() {
    @Override public boolean end(FinishedTrace trace) {
      return true;
    }

    @Override public String toString() {
      return "NoopTraceHandler{}";
    }
  };

  /**
   * Called once per request when it finished, was aborted or timed out.
   *
   * @return {@code true} retains the trace for the next handler, {@code false} drops it.
   */
  public abstract boolean end(FinishedTrace trace);
}
