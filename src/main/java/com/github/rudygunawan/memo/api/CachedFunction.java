package com.github.rudygunawan.memo.api;

import com.github.rudygunawan.memo.key.Arguments;

/**
 * A computation whose result can be memoized by a {@link MemoCache}, keyed on its arguments.
 *
 * <p>The function may throw any exception; {@link MemoCache#call} propagates it unchanged and
 * caches nothing.
 *
 * @param <V> the type of the result
 */
@FunctionalInterface
public interface CachedFunction<V> {

    /**
     * Computes the result for {@code args}.
     *
     * @param args the call arguments
     * @return the result, may be {@code null}
     * @throws Exception if the result cannot be computed
     */
    V apply(Arguments args) throws Exception;

    /**
     * Invokes this function with positional arguments.
     */
    default V invoke(Object... args) throws Exception {
        return apply(Arguments.of(args));
    }
}
