package com.shellbridge.core.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounds the number of live child processes. Admission is refused, never queued,
 * once {@code maxConcurrent} slots are out; callers turn a refusal into a
 * resource-exhausted result.
 */
public class ProcessPool {

    private static final Logger log = LoggerFactory.getLogger(ProcessPool.class);

    /**
     * Point-in-time pool counters.
     *
     * @param active admitted slots not yet released
     * @param max    configured concurrency bound
     * @param peak   highest {@code active} value observed since creation
     */
    public record Stats(int active, int max, int peak) {}

    private final int maxConcurrent;
    private final AtomicLong slotIds = new AtomicLong();
    private final Object lock = new Object();
    private final Map<PoolSlot, Process> tracked = new LinkedHashMap<>();
    private int admitted;
    private int peak;

    public ProcessPool(int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1: " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
    }

    /**
     * Reserves a slot, or returns empty when the pool is full.
     */
    public Optional<PoolSlot> tryAdmit() {
        synchronized (lock) {
            if (admitted >= maxConcurrent) {
                log.debug("Admission refused: {}/{} slots in use", admitted, maxConcurrent);
                return Optional.empty();
            }
            admitted++;
            peak = Math.max(peak, admitted);
            return Optional.of(new PoolSlot(this, slotIds.incrementAndGet()));
        }
    }

    /**
     * Returns a slot to the pool. Safe to call more than once for the same slot.
     */
    public void release(PoolSlot slot) {
        slot.release();
    }

    void free(PoolSlot slot) {
        synchronized (lock) {
            tracked.remove(slot);
            admitted--;
        }
    }

    void track(PoolSlot slot, Process process) {
        synchronized (lock) {
            if (!slot.isReleased()) {
                tracked.put(slot, process);
            }
        }
    }

    /**
     * Sends a graceful termination request to every tracked process and forgets
     * them. Does not wait for the processes to exit.
     *
     * @return number of processes signalled
     */
    public int killAll() {
        ArrayList<Process> victims;
        synchronized (lock) {
            victims = new ArrayList<>(tracked.values());
            tracked.clear();
        }
        if (!victims.isEmpty()) {
            log.info("Terminating {} tracked process(es)", victims.size());
        }
        for (Process process : victims) {
            try {
                List<ProcessHandle> children = process.descendants().toList();
                process.destroy();
                children.forEach(ProcessHandle::destroy);
            } catch (RuntimeException e) {
                log.warn("Failed to signal process {}: {}", safePid(process), e.getMessage());
            }
        }
        return victims.size();
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public int activeCount() {
        synchronized (lock) {
            return admitted;
        }
    }

    public int trackedCount() {
        synchronized (lock) {
            return tracked.size();
        }
    }

    public Stats stats() {
        synchronized (lock) {
            return new Stats(admitted, maxConcurrent, peak);
        }
    }

    private static String safePid(Process process) {
        try {
            return String.valueOf(process.pid());
        } catch (UnsupportedOperationException e) {
            return "?";
        }
    }
}
