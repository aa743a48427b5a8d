package com.shellbridge.core.health;

import com.shellbridge.core.model.BackendKind;
import com.shellbridge.core.model.ErrorCode;

import java.time.Duration;

/**
 * Result of probing one shell backend.
 *
 * @param backend      the probed backend
 * @param executable   shell executable the catalog resolves for it
 * @param availability UP when the probe succeeded, DOWN when the shell could not be started
 * @param detail       probe output when up, otherwise the failure description
 * @param probeTime    wall time of the probe
 * @param error        failure code, null when up
 */
public record BackendHealth(
    BackendKind backend,
    String executable,
    Availability availability,
    String detail,
    Duration probeTime,
    ErrorCode error
) {

    public enum Availability { UP, DEGRADED, DOWN }

    public boolean isUp() {
        return availability == Availability.UP;
    }

    public String name() {
        return backend.name().toLowerCase();
    }
}
