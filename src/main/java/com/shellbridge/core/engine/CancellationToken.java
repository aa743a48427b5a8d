package com.shellbridge.core.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-owned cancellation signal threaded through a run. The executor polls it
 * while waiting for the child to exit; once set it cannot be cleared.
 */
public final class CancellationToken {

    /** Token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final boolean cancellable;

    public CancellationToken() {
        this(true);
    }

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * Requests cancellation.
     *
     * @return true if this call moved the token to the cancelled state
     */
    public boolean cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
