package com.shellbridge.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Resolved invocation for one command: which shell, which executable, which fixed
 * arguments, and how the command text is appended.
 *
 * @param backend     the shell family
 * @param executable  executable path or token handed to the OS
 * @param prefixArgs  fixed arguments placed before the command text
 * @param trailing    how the command text becomes the final argument
 * @param rule        detector that selected this plan
 */
public record ShellPlan(
    BackendKind backend,
    String executable,
    List<String> prefixArgs,
    TrailingArgument trailing,
    DetectionRule rule
) {

    private static final Pattern SUBSYSTEM_TOKEN = Pattern.compile("^\\s*wsl(?:\\.exe)?\\s+", Pattern.CASE_INSENSITIVE);

    public ShellPlan {
        prefixArgs = List.copyOf(prefixArgs);
    }

    /**
     * Builds the full argument vector (executable first) for the given command.
     */
    public List<String> argv(Command command) {
        var argv = new ArrayList<String>(prefixArgs.size() + 2);
        argv.add(executable);
        argv.addAll(prefixArgs);
        argv.add(trailingText(command.text()));
        return argv;
    }

    String trailingText(String text) {
        if (trailing == TrailingArgument.AFTER_SUBSYSTEM_PREFIX) {
            return SUBSYSTEM_TOKEN.matcher(text).replaceFirst("");
        }
        return text;
    }
}
