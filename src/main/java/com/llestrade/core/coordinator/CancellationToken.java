package com.llestrade.core.coordinator;

import com.llestrade.core.errors.CancellationRequestedException;

/**
 * Cooperative cancellation flag, polled between units of work.
 */
public interface CancellationToken {

    CancellationToken NONE = () -> false;

    boolean isCancellationRequested();

    default void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationRequestedException("Cancellation requested");
        }
    }
}
