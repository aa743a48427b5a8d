package com.shellbridge.core.model;

/**
 * Machine-readable failure codes, each bound to one {@link ErrorCategory}.
 */
public enum ErrorCode {
    INVALID_COMMAND(ErrorCategory.VALIDATION),
    DANGEROUS_COMMAND(ErrorCategory.VALIDATION),
    SPAWN_FAILED(ErrorCategory.SPAWN_FAILURE),
    TIMEOUT(ErrorCategory.TIMEOUT),
    CANCELLED(ErrorCategory.CANCELLED),
    POOL_EXHAUSTED(ErrorCategory.RESOURCE_EXHAUSTED),
    NON_ZERO_EXIT(ErrorCategory.NON_ZERO_EXIT),
    INTERNAL_ERROR(ErrorCategory.INTERNAL);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}
