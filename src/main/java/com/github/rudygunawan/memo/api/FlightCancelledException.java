package com.github.rudygunawan.memo.api;

import java.util.concurrent.CancellationException;

/**
 * Delivered to the callers waiting on an asynchronous computation that was discarded by
 * {@link MemoCache#invalidateAsync} or {@link MemoCache#clear} before it completed.
 *
 * <p>Distinct from a failure of the computation itself: the work may still finish, but its result
 * is neither returned to these callers nor stored.
 */
public class FlightCancelledException extends CancellationException {

    private static final long serialVersionUID = 1L;

    public FlightCancelledException(String message) {
        super(message);
    }
}
