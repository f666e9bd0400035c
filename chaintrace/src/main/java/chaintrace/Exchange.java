/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace;

import chaintrace.internal.Nullable;

/**
 * Request and response view of one inbound request, as seen by the framework adapter. The engine
 * reads this when naming the request and when deciding if a recorded error is a failure.
 *
 * <p>Implementations are usually thin wrappers over the framework's own context object.
 */
public abstract class Exchange {
  /** The HTTP method, such as "GET" */
  public abstract String method();

  /** The request path without the query string, such as "/users/1" */
  public abstract String path();

  /** The response status code or zero if none has been assigned yet */
  public abstract int statusCode();

  /**
   * Returns the underlying framework object or {@code null} if there is none. Cast carefully (ex
   * using {@code instanceof}) as the type may change between framework versions.
   */
  @Nullable public abstract Object unwrap();

  @Override public String toString() {
    Object unwrapped = unwrap();
    // handles case where unwrap() returning this or null: don't NPE or stack overflow!
    if (unwrapped == null || unwrapped == this) return getClass().getSimpleName();
    return getClass().getSimpleName() + "{" + unwrapped + "}";
  }

  protected Exchange() { // no instances of this type: only subtypes
  }
}
