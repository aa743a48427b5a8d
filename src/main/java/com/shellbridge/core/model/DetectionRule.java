package com.shellbridge.core.model;

/**
 * Which classifier detector produced a {@link ShellPlan}. Recorded for audit output.
 */
public enum DetectionRule {
    OVERRIDE,
    SUBSYSTEM_PREFIX,
    SUBSYSTEM_MOUNT_PATH,
    POWERSHELL_SYNTAX,
    ECOSYSTEM_TOOL,
    DEFAULT
}
