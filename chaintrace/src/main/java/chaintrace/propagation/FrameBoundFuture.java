/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package chaintrace.propagation;

import chaintrace.internal.Nullable;
import chaintrace.propagation.CurrentRequestContext.Scope;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A future whose callbacks run with a fixed frame in scope, whether they are registered before or
 * after completion, and on whichever thread runs them. Dependent futures inherit the frame.
 */
final class FrameBoundFuture<T> extends CompletableFuture<T> {
  final CurrentRequestContext current;
  @Nullable final RequestFrame frame;

  FrameBoundFuture(CurrentRequestContext current, @Nullable RequestFrame frame) {
    this.current = current;
    this.frame = frame;
  }

  @Override public <U> CompletableFuture<U> newIncompleteFuture() {
    return new FrameBoundFuture<>(current, frame);
  }

  @Override public <U> CompletableFuture<U> thenApply(Function<? super T, ? extends U> fn) {
    return super.thenApply(this.<T, U>bind(fn));
  }

  @Override public <U> CompletableFuture<U> thenApplyAsync(Function<? super T, ? extends U> fn) {
    return super.thenApplyAsync(this.<T, U>bind(fn));
  }

  @Override public <U> CompletableFuture<U> thenApplyAsync(Function<? super T, ? extends U> fn,
    Executor executor) {
    return super.thenApplyAsync(this.<T, U>bind(fn), executor);
  }

  @Override public CompletableFuture<Void> thenAccept(Consumer<? super T> action) {
    return super.thenAccept(bind(action));
  }

  @Override public CompletableFuture<Void> thenAcceptAsync(Consumer<? super T> action) {
    return super.thenAcceptAsync(bind(action));
  }

  @Override
  public CompletableFuture<Void> thenAcceptAsync(Consumer<? super T> action, Executor executor) {
    return super.thenAcceptAsync(bind(action), executor);
  }

  @Override public CompletableFuture<Void> thenRun(Runnable action) {
    return super.thenRun(bind(action));
  }

  @Override public CompletableFuture<Void> thenRunAsync(Runnable action) {
    return super.thenRunAsync(bind(action));
  }

  @Override public CompletableFuture<Void> thenRunAsync(Runnable action, Executor executor) {
    return super.thenRunAsync(bind(action), executor);
  }

  @Override public <U, V> CompletableFuture<V> thenCombine(CompletionStage<? extends U> other,
    BiFunction<? super T, ? super U, ? extends V> fn) {
    return super.thenCombine(other, this.<T, U, V>bind(fn));
  }

  @Override public <U, V> CompletableFuture<V> thenCombineAsync(CompletionStage<? extends U> other,
    BiFunction<? super T, ? super U, ? extends V> fn) {
    return super.thenCombineAsync(other, this.<T, U, V>bind(fn));
  }

  @Override public <U, V> CompletableFuture<V> thenCombineAsync(CompletionStage<? extends U> other,
    BiFunction<? super T, ? super U, ? extends V> fn, Executor executor) {
    return super.thenCombineAsync(other, this.<T, U, V>bind(fn), executor);
  }

  @Override public <U> CompletableFuture<Void> thenAcceptBoth(CompletionStage<? extends U> other,
    BiConsumer<? super T, ? super U> action) {
    return super.thenAcceptBoth(other, this.<T, U>bind(action));
  }

  @Override public <U> CompletableFuture<Void> thenAcceptBothAsync(
    CompletionStage<? extends U> other, BiConsumer<? super T, ? super U> action) {
    return super.thenAcceptBothAsync(other, this.<T, U>bind(action));
  }

  @Override public <U> CompletableFuture<Void> thenAcceptBothAsync(
    CompletionStage<? extends U> other, BiConsumer<? super T, ? super U> action,
    Executor executor) {
    return super.thenAcceptBothAsync(other, this.<T, U>bind(action), executor);
  }

  @Override public CompletableFuture<Void> runAfterBoth(CompletionStage<?> other, Runnable action) {
    return super.runAfterBoth(other, bind(action));
  }

  @Override
  public CompletableFuture<Void> runAfterBothAsync(CompletionStage<?> other, Runnable action) {
    return super.runAfterBothAsync(other, bind(action));
  }

  @Override public CompletableFuture<Void> runAfterBothAsync(CompletionStage<?> other,
    Runnable action, Executor executor) {
    return super.runAfterBothAsync(other, bind(action), executor);
  }

  @Override public <U> CompletableFuture<U> applyToEither(CompletionStage<? extends T> other,
    Function<? super T, U> fn) {
    return super.applyToEither(other, this.<T, U>bind(fn));
  }

  @Override public <U> CompletableFuture<U> applyToEitherAsync(CompletionStage<? extends T> other,
    Function<? super T, U> fn) {
    return super.applyToEitherAsync(other, this.<T, U>bind(fn));
  }

  @Override public <U> CompletableFuture<U> applyToEitherAsync(CompletionStage<? extends T> other,
    Function<? super T, U> fn, Executor executor) {
    return super.applyToEitherAsync(other, this.<T, U>bind(fn), executor);
  }

  @Override public CompletableFuture<Void> acceptEither(CompletionStage<? extends T> other,
    Consumer<? super T> action) {
    return super.acceptEither(other, bind(action));
  }

  @Override public CompletableFuture<Void> acceptEitherAsync(CompletionStage<? extends T> other,
    Consumer<? super T> action) {
    return super.acceptEitherAsync(other, bind(action));
  }

  @Override public CompletableFuture<Void> acceptEitherAsync(CompletionStage<? extends T> other,
    Consumer<? super T> action, Executor executor) {
    return super.acceptEitherAsync(other, bind(action), executor);
  }

  @Override
  public CompletableFuture<Void> runAfterEither(CompletionStage<?> other, Runnable action) {
    return super.runAfterEither(other, bind(action));
  }

  @Override
  public CompletableFuture<Void> runAfterEitherAsync(CompletionStage<?> other, Runnable action) {
    return super.runAfterEitherAsync(other, bind(action));
  }

  @Override public CompletableFuture<Void> runAfterEitherAsync(CompletionStage<?> other,
    Runnable action, Executor executor) {
    return super.runAfterEitherAsync(other, bind(action), executor);
  }

  @Override public <U> CompletableFuture<U> thenCompose(
    Function<? super T, ? extends CompletionStage<U>> fn) {
    return super.thenCompose(this.<T, CompletionStage<U>>bind(fn));
  }

  @Override public <U> CompletableFuture<U> thenComposeAsync(
    Function<? super T, ? extends CompletionStage<U>> fn) {
    return super.thenComposeAsync(this.<T, CompletionStage<U>>bind(fn));
  }

  @Override public <U> CompletableFuture<U> thenComposeAsync(
    Function<? super T, ? extends CompletionStage<U>> fn, Executor executor) {
    return super.thenComposeAsync(this.<T, CompletionStage<U>>bind(fn), executor);
  }

  @Override
  public CompletableFuture<T> whenComplete(BiConsumer<? super T, ? super Throwable> action) {
    return super.whenComplete(this.<T, Throwable>bind(action));
  }

  @Override
  public CompletableFuture<T> whenCompleteAsync(BiConsumer<? super T, ? super Throwable> action) {
    return super.whenCompleteAsync(this.<T, Throwable>bind(action));
  }

  @Override public CompletableFuture<T> whenCompleteAsync(
    BiConsumer<? super T, ? super Throwable> action, Executor executor) {
    return super.whenCompleteAsync(this.<T, Throwable>bind(action), executor);
  }

  @Override
  public <U> CompletableFuture<U> handle(BiFunction<? super T, Throwable, ? extends U> fn) {
    return super.handle(this.<T, Throwable, U>bind(fn));
  }

  @Override
  public <U> CompletableFuture<U> handleAsync(BiFunction<? super T, Throwable, ? extends U> fn) {
    return super.handleAsync(this.<T, Throwable, U>bind(fn));
  }

  @Override public <U> CompletableFuture<U> handleAsync(
    BiFunction<? super T, Throwable, ? extends U> fn, Executor executor) {
    return super.handleAsync(this.<T, Throwable, U>bind(fn), executor);
  }

  @Override public CompletableFuture<T> exceptionally(Function<Throwable, ? extends T> fn) {
    return super.exceptionally(this.<Throwable, T>bind(fn));
  }

  @Override public CompletableFuture<T> exceptionallyAsync(Function<Throwable, ? extends T> fn) {
    return super.exceptionallyAsync(this.<Throwable, T>bind(fn));
  }

  @Override public CompletableFuture<T> exceptionallyAsync(Function<Throwable, ? extends T> fn,
    Executor executor) {
    return super.exceptionallyAsync(this.<Throwable, T>bind(fn), executor);
  }

  @Override public CompletableFuture<T> exceptionallyCompose(
    Function<Throwable, ? extends CompletionStage<T>> fn) {
    return super.exceptionallyCompose(this.<Throwable, CompletionStage<T>>bind(fn));
  }

  @Override public CompletableFuture<T> exceptionallyComposeAsync(
    Function<Throwable, ? extends CompletionStage<T>> fn) {
    return super.exceptionallyComposeAsync(this.<Throwable, CompletionStage<T>>bind(fn));
  }

  @Override public CompletableFuture<T> exceptionallyComposeAsync(
    Function<Throwable, ? extends CompletionStage<T>> fn, Executor executor) {
    return super.exceptionallyComposeAsync(this.<Throwable, CompletionStage<T>>bind(fn), executor);
  }

  <A, R> Function<A, R> bind(Function<? super A, ? extends R> fn) {
    if (fn == null) throw new NullPointerException("fn == null");
    return a -> {
      try (Scope scope = current.maybeScope(frame)) {
        return fn.apply(a);
      }
    };
  }

  <A, B, R> BiFunction<A, B, R> bind(BiFunction<? super A, ? super B, ? extends R> fn) {
    if (fn == null) throw new NullPointerException("fn == null");
    return (a, b) -> {
      try (Scope scope = current.maybeScope(frame)) {
        return fn.apply(a, b);
      }
    };
  }

  Consumer<T> bind(Consumer<? super T> action) {
    if (action == null) throw new NullPointerException("action == null");
    return t -> {
      try (Scope scope = current.maybeScope(frame)) {
        action.accept(t);
      }
    };
  }

  <A, B> BiConsumer<A, B> bind(BiConsumer<? super A, ? super B> action) {
    if (action == null) throw new NullPointerException("action == null");
    return (a, b) -> {
      try (Scope scope = current.maybeScope(frame)) {
        action.accept(a, b);
      }
    };
  }

  Runnable bind(Runnable action) {
    if (action == null) throw new NullPointerException("action == null");
    return () -> {
      try (Scope scope = current.maybeScope(frame)) {
        action.run();
      }
    };
  }

  @Override public String toString() {
    return "FrameBoundFuture{frame=" + frame + ", " + super.toString() + "}";
  }
}
