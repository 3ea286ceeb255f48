package com.flamingo.ai.corpusindex.service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs side-effect-free pipeline work on an executor with a per-task time bound.
 *
 * <p>The bound starts when the task starts running, not when it is queued, so a long queue behind
 * a small pool does not time out work that has not begun. A task that overruns keeps its thread
 * until the underlying call returns; only its result is abandoned.
 */
public final class BoundedExecution {

  private BoundedExecution() {}

  /**
   * Submits {@code task}; the returned future completes exceptionally with {@link
   * java.util.concurrent.TimeoutException} when the task runs longer than {@code timeout}, and with
   * {@link RejectedExecutionException} when the executor refuses it.
   */
  public static <T> CompletableFuture<T> submit(
      Executor executor, Duration timeout, Supplier<T> task) {
    CompletableFuture<T> result = new CompletableFuture<>();
    try {
      executor.execute(
          () -> {
            result.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
            try {
              result.complete(task.get());
            } catch (RuntimeException e) {
              result.completeExceptionally(e);
            }
          });
    } catch (RejectedExecutionException e) {
      result.completeExceptionally(e);
    }
    return result;
  }
}
