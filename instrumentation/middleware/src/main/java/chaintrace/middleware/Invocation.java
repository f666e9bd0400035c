/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace.middleware;

import java.util.concurrent.CompletionStage;

/**
 * The real call of one middleware, as seen by a framework adapter that intercepts dispatch.
 *
 * @see MiddlewareTracing#onMiddlewareInvoke(chaintrace.RequestContext, String, Next, Invocation)
 */
@FunctionalInterface
public interface Invocation {
  /**
   * Invokes the middleware.
   *
   * @param next what the middleware must receive in place of the framework's own {@link Next}
   */
  CompletionStage<Void> invoke(Next next);
}
