/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace.handler;

import chaintrace.Exchange;
import chaintrace.Segment;
import java.util.Collections;
import java.util.List;

/**
 * The result of one request: its transaction name, the segment tree rooted at the request, and the
 * failure, if any, that the request is reported with.
 */
public final class FinishedTrace {
  /** What ended the data collection? */
  public enum Cause {
    /** The framework signalled the response was finalized. */
    FINISHED,
    /** The connection was aborted before the response was finalized. */
    ABORTED,
    /** Nothing finalized the request before its timeout elapsed. */
    TIMED_OUT
  }

  final String requestId, name;
  final Exchange exchange;
  final Segment root;
  final List<Throwable> errors;
  final Cause cause;

  public FinishedTrace(String requestId, String name, Exchange exchange, Segment root,
    List<Throwable> errors, Cause cause) {
    if (requestId == null) throw new NullPointerException("requestId == null");
    if (name == null) throw new NullPointerException("name == null");
    if (exchange == null) throw new NullPointerException("exchange == null");
    if (root == null) throw new NullPointerException("root == null");
    if (errors == null) throw new NullPointerException("errors == null");
    if (cause == null) throw new NullPointerException("cause == null");
    this.requestId = requestId;
    this.name = name;
    this.exchange = exchange;
    this.root = root;
    this.errors = Collections.unmodifiableList(errors);
    this.cause = cause;
  }

  /** Lower-hex identifier of the request, unique among requests in flight */
  public String requestId() {
    return requestId;
  }

  /** The transaction name, such as {@code WebTransaction/WebFrameworkUri/Koa/GET//users} */
  public String name() {
    return name;
  }

  public Exchange exchange() {
    return exchange;
  }

  /** The root segment, named the same as {@link #name()} */
  public Segment root() {
    return root;
  }

  public long startTimestamp() {
    return root.startTimestamp();
  }

  public long finishTimestamp() {
    return root.finishTimestamp();
  }

  public long durationMicros() {
    return root.durationMicros();
  }

  public long durationMs() {
    return root.durationMicros() / 1000L;
  }

  /**
   * Failures visible to the end user. This is empty when errors were raised but handled inside the
   * chain, and otherwise holds a single error.
   */
  public List<Throwable> errors() {
    return errors;
  }

  public Cause cause() {
    return cause;
  }

  @Override public String toString() {
    return "FinishedTrace{requestId=" + requestId
      + ", name=" + name
      + ", cause=" + cause
      + ", errors=" + errors
      + ", root=" + root
      + "}";
  }
}
