package com.github.rudygunawan.memo.impl;

import com.github.rudygunawan.memo.api.FlightCancelledException;
import com.github.rudygunawan.memo.key.CacheKey;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * One asynchronous computation in progress for a key, shared by every caller that asks for the key
 * before it settles.
 *
 * <p>The shared handle is completed exactly once: with the value, with the failure, or with a
 * {@link FlightCancelledException}. Callers never receive the handle itself, only futures completed
 * from it, so that one caller cancelling its own future cannot affect the others.
 */
final class Flight {

    private final CacheKey key;
    private final CompletableFuture<Object> shared = new CompletableFuture<>();
    private final long startNanos;

    Flight(CacheKey key, long startNanos) {
        this.key = key;
        this.startNanos = startNanos;
    }

    CacheKey key() {
        return key;
    }

    long startNanos() {
        return startNanos;
    }

    /**
     * Returns a new future that completes when the shared handle does, with the same outcome. A
     * cancelled flight leaves the returned future cancelled, with the {@link FlightCancelledException}
     * as its exception.
     */
    @SuppressWarnings("unchecked")
    <V> CompletableFuture<V> join() {
        CompletableFuture<V> waiter = new CompletableFuture<>();
        shared.whenComplete((value, failure) -> {
            if (failure == null) {
                waiter.complete((V) value);
            } else {
                waiter.completeExceptionally(unwrap(failure));
            }
        });
        return waiter;
    }

    private static Throwable unwrap(Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    void succeed(Object value) {
        shared.complete(value);
    }

    void fail(Throwable failure) {
        shared.completeExceptionally(failure);
    }

    /**
     * Delivers a {@link FlightCancelledException} to every waiter, unless the flight already settled.
     *
     * @return true if this call cancelled the flight
     */
    boolean cancel(String reason) {
        return shared.completeExceptionally(new FlightCancelledException(reason + ": " + key));
    }
}
