/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.concise.core;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Single-shot timer that fails with {@link TestTimeoutException} once its duration has
 * elapsed, raced against a test body's pending result.
 * <p>
 * Whichever side settles first decides the outcome; the later settlement of the other
 * side is dropped. Losing the race does not stop the body's own computation, the engine
 * simply stops waiting for it.
 */
public final class TimeoutGuard {

    private static final ScheduledExecutorService SCHEDULER = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "concise-timeout");
        thread.setDaemon(true);
        return thread;
    });

    private final long timeoutMillis;
    private final CompletableFuture<Void> future = new CompletableFuture<>();
    private ScheduledFuture<?> scheduled;

    private TimeoutGuard(long timeoutMillis) {
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Start a guard that fires after {@code timeoutMillis}.
     */
    public static TimeoutGuard start(long timeoutMillis) {
        TimeoutGuard guard = new TimeoutGuard(timeoutMillis);
        guard.scheduled = SCHEDULER.schedule(
                () -> guard.future.completeExceptionally(new TestTimeoutException(timeoutMillis)),
                timeoutMillis, TimeUnit.MILLISECONDS);
        return guard;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    /**
     * Completes exceptionally with {@link TestTimeoutException} when the guard fires.
     */
    public CompletableFuture<Void> future() {
        return future;
    }

    public boolean hasFired() {
        return future.isCompletedExceptionally();
    }

    public void cancel() {
        if (scheduled != null) {
            scheduled.cancel(false);
        }
    }

    /**
     * Wait for {@code pending} or this guard, whichever settles first, and cancel the guard.
     *
     * @return the value of {@code pending} if it completed first
     * @throws TestTimeoutException if the guard fired first
     * @throws Exception the failure of {@code pending} if it failed first
     */
    public <T> T race(CompletionStage<T> pending) throws Exception {
        CompletableFuture<T> winner = new CompletableFuture<>();
        pending.whenComplete((value, error) -> {
            if (error != null) {
                winner.completeExceptionally(error);
            } else {
                winner.complete(value);
            }
        });
        future.whenComplete((ignored, error) -> winner.completeExceptionally(error));
        try {
            return winner.join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        } finally {
            cancel();
        }
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cause = t;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

}
