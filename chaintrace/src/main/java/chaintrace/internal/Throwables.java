/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace.internal;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class Throwables {
  // Taken from RxJava throwIfFatal, which was taken from scala
  public static void propagateIfFatal(Throwable t) {
    if (t instanceof VirtualMachineError) {
      throw (VirtualMachineError) t;
    } else if (t instanceof ThreadDeath) {
      throw (ThreadDeath) t;
    } else if (t instanceof LinkageError) {
      throw (LinkageError) t;
    }
  }

  /**
   * Returns the error an application raised, skipping the wrappers {@link
   * java.util.concurrent.CompletableFuture} adds when a failure crosses a dependent stage.
   */
  public static Throwable unwrapCompletion(Throwable t) {
    Throwable result = t;
    while ((result instanceof CompletionException || result instanceof ExecutionException)
      && result.getCause() != null) {
      result = result.getCause();
    }
    return result;
  }

  Throwables() {
  }
}
