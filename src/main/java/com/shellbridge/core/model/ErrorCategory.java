package com.shellbridge.core.model;

/**
 * Coarse failure classes. Adapters decide retry policy from these
 * (e.g. retry RESOURCE_EXHAUSTED, never retry VALIDATION).
 */
public enum ErrorCategory {
    VALIDATION,
    SPAWN_FAILURE,
    TIMEOUT,
    CANCELLED,
    RESOURCE_EXHAUSTED,
    NON_ZERO_EXIT,
    INTERNAL
}
