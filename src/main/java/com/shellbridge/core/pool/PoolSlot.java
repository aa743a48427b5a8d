package com.shellbridge.core.pool;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Admission ticket for one child process. Released exactly once: later calls to
 * {@link #release()} (e.g. the exit hook racing the timeout path) are no-ops.
 */
public final class PoolSlot {

    private final ProcessPool pool;
    private final long id;
    private final AtomicBoolean released = new AtomicBoolean(false);

    PoolSlot(ProcessPool pool, long id) {
        this.pool = pool;
        this.id = id;
    }

    /**
     * Attaches the spawned process. The slot is released automatically when the
     * process terminates.
     */
    public void bind(Process process) {
        pool.track(this, process);
        process.onExit().thenRun(this::release);
    }

    public void release() {
        if (released.compareAndSet(false, true)) {
            pool.free(this);
        }
    }

    public boolean isReleased() {
        return released.get();
    }

    public long id() {
        return id;
    }

    @Override
    public String toString() {
        return "PoolSlot[" + id + (released.get() ? ", released" : "") + "]";
    }
}
