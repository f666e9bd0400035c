/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace.middleware;

import java.util.concurrent.CompletionStage;

/**
 * One handler of an ordered middleware chain. A middleware either produces the response, or calls
 * {@link Next#invoke()} to pass control downstream, optionally continuing once the downstream
 * completes.
 *
 * <p>Ex.
 * <pre>{@code
 * Middleware<Context> timing = (ctx, next) -> {
 *   long start = System.nanoTime();
 *   return next.invoke().thenRun(() -> ctx.set("X-Response-Time", System.nanoTime() - start));
 * };
 * }</pre>
 *
 * @param <C> the framework's per-request context type
 */
@FunctionalInterface
public interface Middleware<C> {
  /**
   * @return a stage that completes when this middleware, and anything it awaited, completed
   */
  CompletionStage<Void> handle(C context, Next next);
}
