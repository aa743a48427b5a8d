package com.shellbridge.core.model;

/**
 * How the command text is appended after a plan's fixed prefix arguments.
 */
public enum TrailingArgument {
    /** The whole normalized command is passed as one argument. */
    FULL_COMMAND,
    /** The leading subsystem token (e.g. {@code wsl }) is stripped and the remainder passed verbatim. */
    AFTER_SUBSYSTEM_PREFIX
}
