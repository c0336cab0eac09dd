package io.flowkube.kubernetes.utils;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-assignment result shared by every asynchronous wait.
 * <p>
 * The first call to {@link #complete(Object)} or {@link #fail(Throwable)} wins; every later call is
 * ignored and reports {@code false}, whatever thread it comes from. Callers use the returned flag
 * to run their "on resolution" side effects (cancel a timer, close a stream) exactly once.
 *
 * @param <T> the type of the resolved value
 */
public final class OneShot<T> {
    private final AtomicBoolean fired = new AtomicBoolean(false);
    private final CompletableFuture<T> future = new CompletableFuture<>();

    /**
     * @return true if this call resolved the result, false if it was already resolved
     */
    public boolean complete(T value) {
        if (!fired.compareAndSet(false, true)) {
            return false;
        }

        future.complete(value);
        return true;
    }

    /**
     * @return true if this call resolved the result, false if it was already resolved
     */
    public boolean fail(Throwable cause) {
        if (!fired.compareAndSet(false, true)) {
            return false;
        }

        future.completeExceptionally(cause);
        return true;
    }

    public boolean isDone() {
        return fired.get();
    }

    /**
     * Blocks until resolved. A failure is rethrown as is when unchecked, wrapped otherwise.
     */
    public T get() throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    /**
     * Blocks until resolved or until the timeout elapses.
     *
     * @return the resolved value, or empty if nothing resolved in time
     */
    public Optional<T> get(Duration timeout) throws InterruptedException {
        try {
            return Optional.ofNullable(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (TimeoutException e) {
            return Optional.empty();
        }
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();

        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }

        if (cause instanceof Error) {
            throw (Error) cause;
        }

        return new IllegalStateException(cause);
    }
}
