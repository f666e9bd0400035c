/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace.internal.recorder;

import chaintrace.RequestContext;
import chaintrace.internal.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Requests in flight, keyed by {@link RequestContext#id()}.
 *
 * <p>Similar to Finagle's deadline span map, requests that are never finalized, for example when a
 * connection dropped silently, expire after a timeout. There's no bookkeeping thread: work is
 * stolen from callers. {@link #maybeExpire(long)} sweeps at most once per timeout period, so
 * starting a request usually costs a single comparison.
 */
public final class RequestContexts {
  final ConcurrentHashMap<String, RequestContext> contexts = new ConcurrentHashMap<>();
  final long timeoutNanos;
  final AtomicLong nextSweepNanos;

  public RequestContexts(long timeoutNanos, long nowNanos) {
    if (timeoutNanos <= 0) throw new IllegalArgumentException("timeoutNanos <= 0: " + timeoutNanos);
    this.timeoutNanos = timeoutNanos;
    this.nextSweepNanos = new AtomicLong(nowNanos + timeoutNanos);
  }

  /** @return false if another request in flight has the same ID */
  public boolean putIfAbsent(RequestContext context) {
    return contexts.putIfAbsent(context.id(), context) == null;
  }

  @Nullable public RequestContext get(String id) {
    if (id == null) throw new NullPointerException("id == null");
    return contexts.get(id);
  }

  /** Removes the context if it is still registered. */
  public boolean remove(RequestContext context) {
    return contexts.remove(context.id(), context);
  }

  public int size() {
    return contexts.size();
  }

  /** Removes and returns every context not finalized within the timeout. */
  public List<RequestContext> expire(long nowNanos) {
    List<RequestContext> result = null;
    for (Iterator<RequestContext> i = contexts.values().iterator(); i.hasNext(); ) {
      RequestContext next = i.next();
      if (nowNanos - next.startNanos() < timeoutNanos) continue;
      i.remove();
      if (result == null) result = new ArrayList<>();
      result.add(next);
    }
    return result != null ? result : Collections.emptyList();
  }

  /**
   * Like {@link #expire(long)}, except only one caller per timeout period does the work. Others
   * return an empty list.
   */
  public List<RequestContext> maybeExpire(long nowNanos) {
    long next = nextSweepNanos.get();
    if (nowNanos - next < 0) return Collections.emptyList();
    if (!nextSweepNanos.compareAndSet(next, nowNanos + timeoutNanos)) {
      return Collections.emptyList(); // lost race: another caller is sweeping
    }
    return expire(nowNanos);
  }

  @Override public String toString() {
    return "RequestContexts{size=" + contexts.size() + "}";
  }
}
