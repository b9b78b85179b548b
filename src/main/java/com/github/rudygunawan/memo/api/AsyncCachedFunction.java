package com.github.rudygunawan.memo.api;

import com.github.rudygunawan.memo.key.Arguments;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * An asynchronous computation whose result can be memoized by a {@link MemoCache}.
 *
 * <p>The function returns immediately with a stage that completes when the result is ready. It may
 * also fail synchronously by throwing; {@link MemoCache#callAsync} treats both the same way.
 *
 * <p><b>Example usage:</b>
 * <pre>{@code
 * AsyncCachedFunction<User> fetch = args ->
 *     CompletableFuture.supplyAsync(() -> database.fetchUser((String) args.get(0)), executor);
 *
 * CompletableFuture<User> user = cache.callAsync(fetch, "user-42");
 * }</pre>
 *
 * @param <V> the type of the result
 */
@FunctionalInterface
public interface AsyncCachedFunction<V> {

    /**
     * Starts computing the result for {@code args}.
     *
     * @param args the call arguments
     * @return a stage that completes with the result, or exceptionally with the failure
     */
    CompletionStage<V> apply(Arguments args);

    /**
     * Invokes this function with positional arguments.
     */
    default CompletableFuture<V> invoke(Object... args) {
        return apply(Arguments.of(args)).toCompletableFuture();
    }
}
