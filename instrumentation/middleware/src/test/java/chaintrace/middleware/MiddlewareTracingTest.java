/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace.middleware;

import chaintrace.RequestContext;
import chaintrace.Segment;
import chaintrace.Tracer;
import chaintrace.Tracing;
import chaintrace.handler.FinishedTrace;
import chaintrace.propagation.ThreadLocalCurrentRequestContext;
import chaintrace.test.TestTraceHandler;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import static org.assertj.core.api.Assertions.assertThat;

/** Drives a Koa-style application end to end, as a framework adapter would. */
class MiddlewareTracingTest {
  static final String ROOT = "WebTransaction/WebFrameworkUri/Koa/GET/";

  @RegisterExtension TestTraceHandler traces = new TestTraceHandler();

  ThreadLocalCurrentRequestContext currentRequestContext =
    ThreadLocalCurrentRequestContext.createIsolated();
  Tracing tracing = Tracing.newBuilder()
    .frameworkName("Koa")
    .currentRequestContext(currentRequestContext)
    .addTraceHandler(traces)
    .build();
  Tracer tracer = tracing.tracer();
  MiddlewareTracing middlewareTracing = MiddlewareTracing.create(tracing);
  TestApplication app = new TestApplication(middlewareTracing);
  ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
  ExecutorService executor = Executors.newFixedThreadPool(4);

  @AfterEach void close() {
    scheduler.shutdownNow();
    executor.shutdownNow();
    tracing.close();
    currentRequestContext.clear();
  }

  void appendPath(String component) {
    tracer.currentRequest().nameState().appendPath(component);
  }

  @Test void namesAfterMiddlewareThatSetsBody() {
    app.use("one", (ctx, next) -> {
      appendPath("one-start");
      return next.invoke().thenRun(() -> appendPath("one-end"));
    });
    app.use("two", (ctx, next) -> {
      appendPath("two");
      ctx.body("done");
      return CompletableFuture.completedFuture(null);
    });

    app.get("/");

    assertThat(traces.takeTrace().name()).isEqualTo(ROOT + "/one-start/two");
  }

  @Test void namesAfterLastMiddlewareThatSetsBody() {
    app.use("one", (ctx, next) -> {
      appendPath("one-start");
      return next.invoke().thenRun(() -> appendPath("one-end"));
    });
    app.use("two", (ctx, next) -> {
      appendPath("two");
      ctx.body("not actually done");
      return next.invoke();
    });
    app.use("three", (ctx, next) -> {
      appendPath("three");
      ctx.body("done");
      return CompletableFuture.completedFuture(null);
    });

    app.get("/");

    assertThat(traces.takeTrace().name()).isEqualTo(ROOT + "/one-start/two/three");
  }

  @Test void namesAfterMiddlewareThatSetsStatus() {
    app.use("one", (ctx, next) -> {
      appendPath("one-start");
      return next.invoke().thenRun(() -> appendPath("one-end"));
    });
    app.use("two", (ctx, next) -> {
      appendPath("two");
      ctx.status(200);
      return CompletableFuture.completedFuture(null);
    });

    app.get("/");

    assertThat(traces.takeTrace().name()).isEqualTo(ROOT + "/one-start/two");
  }

  @Test void namesAfterBodyEvenIfStatusSetAfter() {
    app.use("one", (ctx, next) -> {
      appendPath("one-start");
      return next.invoke().thenRun(() -> appendPath("one-end"));
    });
    app.use("two", (ctx, next) -> {
      appendPath("two");
      ctx.body("done");
      appendPath("setting-status");
      ctx.status(200);
      return CompletableFuture.completedFuture(null);
    });

    app.get("/");

    assertThat(traces.takeTrace().name()).isEqualTo(ROOT + "/one-start/two");
  }

  @Test void namesAfterCausalOrderOfAppends() {
    app.use("a", (ctx, next) -> {
      appendPath("a");
      return next.invoke().thenRun(() -> appendPath("a-end"));
    });
    app.use("b", (ctx, next) -> {
      appendPath("b");
      return next.invoke();
    });
    app.use("c", (ctx, next) -> {
      appendPath("c");
      ctx.body("done");
      return CompletableFuture.completedFuture(null);
    });

    app.get("/");

    FinishedTrace trace = traces.takeTrace();
    assertThat(trace.name()).isEqualTo(ROOT + "/a/b/c");
    assertThat(tree(trace.root())).isEqualTo(
      ROOT + "/a/b/c[Middleware/Koa/a[Middleware/Koa/b[Middleware/Koa/c]]]");
  }

  @Test void namesWithMountPath() {
    app.use("users", "router", (ctx, next) -> next.invoke());
    app.use("list", (ctx, next) -> {
      appendPath("list");
      ctx.body("[]");
      return CompletableFuture.completedFuture(null);
    });

    app.get("/users/list");

    assertThat(traces.takeTrace().name()).isEqualTo(ROOT + "/users/list");
  }

  @Test void namesSlashWhenNothingAppended() {
    app.use("one", (ctx, next) -> {
      ctx.body("done");
      return CompletableFuture.completedFuture(null);
    });

    app.get("/");

    assertThat(traces.takeTrace().name()).isEqualTo(ROOT + "/");
  }

  @Test void tracesMultipleMiddleware() {
    app.use("one", (ctx, next) -> next.invoke());
    app.use("two", (ctx, next) -> {
      ctx.body("done");
      return CompletableFuture.completedFuture(null);
    });

    app.get("/");

    FinishedTrace trace = traces.takeTrace();
    assertThat(tree(trace.root())).isEqualTo(
      ROOT + "/[Middleware/Koa/one[Middleware/Koa/two]]");
  }

  @Test void tracesNestedMiddleware() {
    int count = 10;
    for (int i = 0; i < count - 1; i++) {
      app.use("m" + i, (ctx, next) -> next.invoke());
    }
    app.use("m" + (count - 1), (ctx, next) -> {
      ctx.body("done");
      return CompletableFuture.completedFuture(null);
    });

    app.get("/");

    Segment segment = traces.takeTrace().root();
    for (int i = 0; i < count; i++) {
      assertThat(segment.children()).hasSize(1);
      Segment child = segment.children().get(0);
      assertThat(child.name()).isEqualTo("Middleware/Koa/m" + i);
      assertThat(child.startTimestamp()).isGreaterThanOrEqualTo(segment.startTimestamp());
      assertThat(child.finishTimestamp()).isLessThanOrEqualTo(segment.finishTimestamp());
      segment = child;
    }
    assertThat(segment.children()).isEmpty();
  }

  @Test void recordsActionsInterspersedAmongMiddleware() {
    app.use("one", (ctx, next) -> {
      tracer.startSegment("testSegment");
      return next.invoke().thenRun(() -> tracer.startSegment("nestedSegment"));
    });
    app.use("two", (ctx, next) -> {
      Segment timer = tracer.startSegment("timers.setTimeout");
      CompletableFuture<Void> delay = new CompletableFuture<>();
      scheduler.schedule(() -> {
        tracer.finishSegment(timer);
        delay.complete(null);
      }, 10, TimeUnit.MILLISECONDS);
      return delay.thenCompose(v -> next.invoke());
    });
    app.use("three", (ctx, next) -> {
      ctx.body("done");
      return CompletableFuture.completedFuture(null);
    });

    app.get("/");

    assertThat(tree(traces.takeTrace().root())).isEqualTo(ROOT + "/["
      + "Middleware/Koa/one["
      + "Truncated/testSegment, "
      + "Middleware/Koa/two[timers.setTimeout, Middleware/Koa/three], "
      + "Truncated/nestedSegment]]");
  }

  @Test void errorsHandledWithinMiddlewareAreNotRecorded() {
    List<Throwable> caught = new ArrayList<>();
    app.use("one", (ctx, next) -> next.invoke().exceptionally(error -> {
      caught.add(unwrap(error));
      ctx.status(200);
      ctx.body("handled error");
      return null;
    }));
    app.use("two", (ctx, next) -> {
      throw new IllegalStateException("middleware error");
    });

    TestContext response = app.get("/");

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(caught).extracting(Throwable::getMessage).containsExactly("middleware error");
    FinishedTrace trace = traces.takeTrace();
    assertThat(tree(trace.root())).isEqualTo(
      trace.name() + "[Middleware/Koa/one[Middleware/Koa/two]]");
    assertThat(trace.root().children().get(0).children().get(0).error())
      .hasMessage("middleware error");
  }

  @Test void errorsNotHandledByMiddlewareAreRecorded() {
    app.use("one", (ctx, next) -> next.invoke().exceptionally(error -> {
      ctx.status(500);
      ctx.body("error is not actually handled");
      return null;
    }));
    app.use("two", (ctx, next) -> {
      throw new IllegalStateException("middleware error");
    });

    TestContext response = app.get("/");

    assertThat(response.statusCode()).isEqualTo(500);
    assertThat(app.errors).isEmpty();
    FinishedTrace trace = traces.takeTraceWithErrorMessage("middleware error");
    assertThat(tree(trace.root())).isEqualTo(
      trace.name() + "[Middleware/Koa/one[Middleware/Koa/two]]");
  }

  @Test void errorsCaughtByDefaultErrorListenerAreRecorded() {
    app.use("one", (ctx, next) -> next.invoke());
    app.use("two", (ctx, next) -> {
      throw new IllegalStateException("middleware error");
    });

    TestContext response = app.get("/");

    assertThat(response.statusCode()).isEqualTo(500);
    assertThat(app.errors).extracting(Throwable::getMessage).containsExactly("middleware error");
    FinishedTrace trace = traces.takeTraceWithErrorMessage("middleware error");
    assertThat(tree(trace.root())).isEqualTo(
      trace.name() + "[Middleware/Koa/one[Middleware/Koa/two]]");
  }

  @Test void errorsFromFailedStagesAreRecorded() {
    app.use("one", (ctx, next) -> next.invoke());
    app.use("two", (ctx, next) -> CompletableFuture.supplyAsync(() -> {
      throw new IllegalStateException("async error");
    }, executor));

    app.get("/");

    traces.takeTraceWithErrorMessage("async error");
    assertThat(app.errors).extracting(Throwable::getMessage).containsExactly("async error");
  }

  @Test void nextCalledTwicePassesThrough() {
    AtomicInteger downstreamCalls = new AtomicInteger();
    app.use("retry", (ctx, next) -> next.invoke().thenCompose(v -> next.invoke()));
    app.use("two", (ctx, next) -> {
      downstreamCalls.incrementAndGet();
      ctx.body("done");
      return CompletableFuture.completedFuture(null);
    });

    app.get("/");

    assertThat(downstreamCalls).hasValue(2);
    assertThat(app.errors).isEmpty();
    FinishedTrace trace = traces.takeTrace();
    assertThat(tree(trace.root())).isEqualTo(
      trace.name() + "[Middleware/Koa/retry[Middleware/Koa/two, Middleware/Koa/two]]");
  }

  @Test void continuationAddedAfterNextCompletedKeepsRequest() {
    AtomicReference<RequestContext> seen = new AtomicReference<>();
    app.use("one", (ctx, next) -> {
      CompletableFuture<Void> delay = new CompletableFuture<>();
      scheduler.schedule(() -> {
        delay.complete(null);
      }, 10, TimeUnit.MILLISECONDS);
      // next runs on the scheduler thread and "two" completes synchronously, so thenRun is added
      // to an already completed stage
      return delay.thenCompose(v -> next.invoke().thenRun(() -> {
        seen.set(tracer.currentRequest());
        appendPath("one-end");
        tracer.finishSegment(tracer.startSegment("afterNext"));
      }));
    });
    app.use("two", (ctx, next) -> {
      appendPath("two");
      ctx.body("done");
      return CompletableFuture.completedFuture(null);
    });

    TestContext response = app.get("/");

    assertThat(seen.get()).isSameAs(response.request);
    FinishedTrace trace = traces.takeTrace();
    assertThat(trace.name()).isEqualTo(ROOT + "/two");
    assertThat(tree(trace.root())).isEqualTo(
      trace.name() + "[Middleware/Koa/one[Middleware/Koa/two, afterNext]]");
  }

  @Test void keepsConcurrentRequestsSeparate() {
    Executor traced = tracing.currentRequestContext().executor(executor);
    app.use("one", (ctx, next) -> CompletableFuture
      .runAsync(() -> appendPath(ctx.path().substring(1)), traced)
      .thenCompose(v -> next.invoke()));
    app.use("two", (ctx, next) -> CompletableFuture
      .runAsync(() -> {
        tracer.finishSegment(tracer.startSegment("work"));
        ctx.body("done");
      }, traced));

    int count = 20;
    List<TestContext> requests = new ArrayList<>();
    for (int i = 0; i < count; i++) requests.add(app.start("GET", "/r" + i));
    for (TestContext request : requests) request.response.join();

    List<FinishedTrace> finished = new ArrayList<>();
    for (int i = 0; i < count; i++) finished.add(traces.takeTrace());

    assertThat(finished).extracting(FinishedTrace::name)
      .containsExactlyInAnyOrderElementsOf(requests.stream()
        .map(r -> ROOT + r.path())
        .collect(Collectors.toList()));
    for (FinishedTrace trace : finished) {
      assertThat(tree(trace.root())).isEqualTo(
        trace.name() + "[Middleware/Koa/one[Middleware/Koa/two[work]]]");
    }
  }

  @Test void abortedRequest() {
    CompletableFuture<Void> pending = new CompletableFuture<>();
    app.use("slow", (ctx, next) -> pending.thenRun(() -> {
      // late signals: the request already finished
      tracer.startSegment("late");
      ctx.body("too late");
    }));

    TestContext context = app.start("GET", "/slow");
    middlewareTracing.onRequestAbort(context.request);

    FinishedTrace trace = traces.takeTrace(FinishedTrace.Cause.ABORTED);
    assertThat(tree(trace.root())).isEqualTo(ROOT + "/[Truncated/Middleware/Koa/slow]");

    pending.complete(null);
    context.response.join();
    assertThat(context.finishedTrace).isNull();
    assertThat(tree(trace.root())).isEqualTo(ROOT + "/[Truncated/Middleware/Koa/slow]");
  }

  @Test void timedOutRequest() throws InterruptedException {
    try (Tracing tracing = Tracing.newBuilder()
      .frameworkName("Koa")
      .requestTimeout(1, TimeUnit.MILLISECONDS)
      .currentRequestContext(currentRequestContext)
      .addTraceHandler(traces)
      .build()) {
      TestApplication app = new TestApplication(MiddlewareTracing.create(tracing));
      app.use("stuck", (ctx, next) -> new CompletableFuture<>());

      app.start("GET", "/stuck");
      Thread.sleep(10);

      assertThat(tracing.expireStaleRequests()).isOne();
    }

    FinishedTrace trace = traces.takeTrace(FinishedTrace.Cause.TIMED_OUT);
    assertThat(tree(trace.root())).isEqualTo(ROOT + "/[Truncated/Middleware/Koa/stuck]");
  }

  static Throwable unwrap(Throwable error) {
    return error instanceof CompletionException && error.getCause() != null
      ? error.getCause()
      : error;
  }

  /** Renders the segment tree like {@code root[child[grandchild], child2]} */
  static String tree(Segment segment) {
    List<Segment> children = segment.children();
    if (children.isEmpty()) return segment.name();
    return segment.name() + children.stream()
      .map(MiddlewareTracingTest::tree)
      .collect(Collectors.joining(", ", "[", "]"));
  }
}
