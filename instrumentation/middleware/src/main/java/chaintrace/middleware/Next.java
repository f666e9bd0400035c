/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace.middleware;

import java.util.concurrent.CompletionStage;

/** Continues the middleware chain with the middleware registered after the caller. */
@FunctionalInterface
public interface Next {
  /**
   * Runs the rest of the chain. The result completes once every downstream middleware completed.
   * Whether calling this more than once is allowed is up to the framework.
   */
  CompletionStage<Void> invoke();
}
