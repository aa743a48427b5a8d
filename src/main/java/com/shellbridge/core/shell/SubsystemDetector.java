package com.shellbridge.core.shell;

import java.util.regex.Pattern;

/**
 * Recognizes commands aimed at the POSIX subsystem. Shared by the classifier and
 * the normalizer so that subsystem-native paths are never rewritten.
 */
final class SubsystemDetector {

    /** {@code wsl ls -la}, {@code wsl.exe -- uname}. */
    static final Pattern PREFIX = Pattern.compile("^\\s*wsl(?:\\.exe)?\\s+", Pattern.CASE_INSENSITIVE);

    /** {@code /mnt/c/...} mounts and {@code \\wsl$\...} / {@code \\wsl.localhost\...} UNC shares. */
    static final Pattern MOUNT_PATH = Pattern.compile("/mnt/[a-zA-Z](?:/|\\b)|\\\\wsl[.$]", Pattern.CASE_INSENSITIVE);

    private SubsystemDetector() {}

    static boolean hasPrefix(String command) {
        return PREFIX.matcher(command).find();
    }

    static boolean hasMountPath(String command) {
        return MOUNT_PATH.matcher(command).find();
    }

    static boolean isSubsystemInvocation(String command) {
        return hasPrefix(command) || hasMountPath(command);
    }
}
