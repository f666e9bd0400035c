/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace.propagation;

import chaintrace.RequestContext;
import chaintrace.TestExchange;
import chaintrace.Tracing;
import chaintrace.propagation.CurrentRequestContext.Scope;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadLocalCurrentRequestContextTest {
  ThreadLocalCurrentRequestContext currentRequestContext =
    ThreadLocalCurrentRequestContext.createIsolated();
  Tracing tracing = Tracing.newBuilder().currentRequestContext(currentRequestContext).build();
  RequestContext request = tracing.newRequest(new TestExchange("GET", "/"));
  RequestContext otherRequest = tracing.newRequest(new TestExchange("GET", "/other"));
  RequestFrame frame = RequestFrame.create(request, request.root());
  RequestFrame otherFrame = RequestFrame.create(otherRequest, otherRequest.root());
  ExecutorService executor = Executors.newSingleThreadExecutor();

  @AfterEach void close() {
    executor.shutdownNow();
    tracing.close();
    currentRequestContext.clear();
  }

  @Test void get_defaultsToNull() {
    assertThat(currentRequestContext.get()).isNull();
  }

  @Test void newScope_retainsFrame() {
    try (Scope scope = currentRequestContext.newScope(frame)) {
      assertThat(scope).isNotEqualTo(Scope.NOOP);
      assertThat(currentRequestContext.get()).isEqualTo(frame);
    }
    assertThat(currentRequestContext.get()).isNull();
  }

  @Test void newScope_restoresPrevious() {
    try (Scope scope = currentRequestContext.newScope(frame)) {
      try (Scope scope2 = currentRequestContext.newScope(otherFrame)) {
        assertThat(currentRequestContext.get()).isEqualTo(otherFrame);
      }
      assertThat(currentRequestContext.get()).isEqualTo(frame);
    }
  }

  @Test void maybeScope_doesntDuplicateFrame() {
    try (Scope scope = currentRequestContext.newScope(frame)) {
      try (Scope scope2 = currentRequestContext.maybeScope(
        RequestFrame.create(request, request.root()))) {
        assertThat(scope2).isEqualTo(Scope.NOOP);
      }
    }
  }

  @Test void maybeScope_noticesDifferentSegment() {
    RequestFrame child = frame.withSegment(request.startSegment(null, "child"));

    try (Scope scope = currentRequestContext.newScope(frame)) {
      try (Scope scope2 = currentRequestContext.maybeScope(child)) {
        assertThat(scope2).isNotEqualTo(Scope.NOOP);
        assertThat(currentRequestContext.get()).isEqualTo(child);
      }
    }
  }

  @Test void maybeScope_canClearScope() {
    try (Scope scope = currentRequestContext.newScope(frame)) {
      try (Scope scope2 = currentRequestContext.maybeScope(null)) {
        assertThat(currentRequestContext.get()).isNull();
      }
      assertThat(currentRequestContext.get()).isEqualTo(frame);
    }
  }

  @Test void maybeScope_doesntDuplicateFrame_onNull() {
    try (Scope scope = currentRequestContext.maybeScope(null)) {
      assertThat(scope).isEqualTo(Scope.NOOP);
    }
  }

  @Test void wrap_runnable() throws Exception {
    AtomicReference<RequestFrame> seen = new AtomicReference<>();
    Runnable task;
    try (Scope scope = currentRequestContext.newScope(frame)) {
      task = currentRequestContext.wrap(() -> seen.set(currentRequestContext.get()));
    }

    executor.submit(task).get();

    assertThat(seen.get()).isEqualTo(frame);
  }

  @Test void wrap_callable() throws Exception {
    Future<RequestFrame> seen;
    try (Scope scope = currentRequestContext.newScope(frame)) {
      seen = executor.submit(currentRequestContext.wrap(currentRequestContext::get));
    }

    assertThat(seen.get()).isEqualTo(frame);
  }

  @Test void executor_doesNotLeakToNextTask() throws Exception {
    AtomicReference<RequestFrame> seen = new AtomicReference<>();
    try (Scope scope = currentRequestContext.newScope(frame)) {
      currentRequestContext.executor(executor).execute(() -> seen.set(currentRequestContext.get()));
    }
    executor.submit(() -> { // block until the first task completed
    }).get();
    assertThat(seen.get()).isEqualTo(frame);

    Future<RequestFrame> next = executor.submit(currentRequestContext::get);
    assertThat(next.get()).isNull();
  }

  @Test void decorate_restoresFrameOnCompletion() throws Exception {
    CompletableFuture<String> work = new CompletableFuture<>();
    AtomicReference<RequestFrame> seen = new AtomicReference<>();

    CompletableFuture<String> decorated = currentRequestContext.decorate(frame, work);
    CompletableFuture<Void> dependent =
      decorated.thenAccept(value -> seen.set(currentRequestContext.get()));

    // complete while another request is in scope on another thread
    executor.submit(() -> {
      try (Scope scope = currentRequestContext.newScope(otherFrame)) {
        work.complete("done");
      }
    }).get();
    dependent.get();

    assertThat(seen.get()).isEqualTo(frame);
    assertThat(decorated.get()).isEqualTo("done");
  }

  @Test void decorate_currentFrame() throws Exception {
    CompletableFuture<Void> work = new CompletableFuture<>();
    AtomicReference<RequestFrame> seen = new AtomicReference<>();

    CompletableFuture<Void> dependent;
    try (Scope scope = currentRequestContext.newScope(frame)) {
      dependent = currentRequestContext.decorate(work)
        .thenRun(() -> seen.set(currentRequestContext.get()));
    }
    executor.submit(() -> work.complete(null)).get();
    dependent.get();

    assertThat(seen.get()).isEqualTo(frame);
  }

  @Test void decorate_restoresFrameForDependentsAddedAfterCompletion() throws Exception {
    CompletableFuture<String> decorated =
      currentRequestContext.decorate(frame, CompletableFuture.completedFuture("done"));

    // add dependents on a thread that has no frame, after the input already completed
    Future<RequestFrame> seen = executor.submit(() -> decorated
      .thenApply(value -> currentRequestContext.get())
      .join());
    Future<RequestFrame> seenByChained = executor.submit(() -> decorated
      .thenRun(() -> {
      })
      .thenCompose(v -> CompletableFuture.completedFuture(currentRequestContext.get()))
      .join());

    assertThat(seen.get()).isEqualTo(frame);
    assertThat(seenByChained.get()).isEqualTo(frame);
    assertThat(executor.submit(currentRequestContext::get).get()).isNull();
  }

  @Test void decorate_restoresFrameInErrorCallbacks() {
    IllegalStateException error = new IllegalStateException("boom");
    CompletableFuture<Void> decorated =
      currentRequestContext.decorate(frame, CompletableFuture.failedFuture(error));

    assertThat(decorated.handle((v, e) -> currentRequestContext.get()).join()).isEqualTo(frame);
    assertThat(decorated.exceptionally(e -> null).thenApply(v -> currentRequestContext.get()).join())
      .isEqualTo(frame);
    assertThat(currentRequestContext.get()).isNull();
  }

  @Test void decorate_relaysErrorAsIs() {
    IllegalStateException error = new IllegalStateException("boom");
    CompletableFuture<Void> work = new CompletableFuture<>();
    AtomicReference<Throwable> seen = new AtomicReference<>();

    currentRequestContext.decorate(frame, work).exceptionally(e -> {
      seen.set(e);
      return null;
    });
    work.completeExceptionally(error);

    assertThat(seen.get()).isSameAs(error);
  }

  @Test void decorate_failedDependentsSeeCompletionException() {
    IllegalStateException error = new IllegalStateException("boom");
    CompletableFuture<Void> decorated =
      currentRequestContext.decorate(frame, CompletableFuture.failedFuture(error));

    assertThat(decorated).isCompletedExceptionally();
    assertThat(decorated.thenRun(() -> {
    }).handle((v, e) -> e).join())
      .isInstanceOf(CompletionException.class)
      .hasCause(error);
  }
}
