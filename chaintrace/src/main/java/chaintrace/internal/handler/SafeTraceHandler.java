/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace.internal.handler;

import chaintrace.handler.FinishedTrace;
import chaintrace.handler.TraceHandler;
import chaintrace.internal.Platform;
import java.util.Arrays;

import static chaintrace.internal.Throwables.propagateIfFatal;

/** This logs exceptions instead of raising an error, as the supplied handler could have bugs. */
public final class SafeTraceHandler extends TraceHandler {
  // Array ensures no iterators are created at runtime
  public static TraceHandler create(TraceHandler[] handlers) {
    if (handlers.length == 0) return TraceHandler.NOOP;
    return new SafeTraceHandler(handlers.clone());
  }

  final TraceHandler[] handlers;

  SafeTraceHandler(TraceHandler[] handlers) {
    this.handlers = handlers;
  }

  @Override public boolean end(FinishedTrace trace) {
    for (TraceHandler handler : handlers) {
      boolean retain;
      try {
        retain = handler.end(trace);
      } catch (Throwable t) {
        propagateIfFatal(t);
        Platform.get().log("error handling end {0}", trace.requestId(), t);
        retain = true; // user error in this handler shouldn't impact another
      }
      if (!retain) return false;
    }
    return true;
  }

  @Override public int hashCode() {
    return Arrays.hashCode(handlers);
  }

  @Override public boolean equals(Object obj) {
    if (!(obj instanceof SafeTraceHandler)) return false;
    return Arrays.equals(((SafeTraceHandler) obj).handlers, handlers);
  }

  @Override public String toString() {
    return Arrays.toString(handlers);
  }
}
