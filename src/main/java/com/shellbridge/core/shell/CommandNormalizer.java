package com.shellbridge.core.shell;

import com.shellbridge.core.model.Command;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites Unix idioms into the console backend's syntax. Rewrites run in a
 * fixed order and only when their trigger is present:
 * <ol>
 *   <li>{@code " && "} becomes {@code " ; "}; a lone {@code &} is left alone</li>
 *   <li>{@code /c/Users/x} becomes {@code C:\Users\x}, unless the command targets the POSIX subsystem</li>
 *   <li>a bare {@code pwsh ...} without {@code -Command} becomes the PowerShell backend invocation</li>
 * </ol>
 * The output is a fixpoint: normalizing a normalized command returns it unchanged.
 */
public class CommandNormalizer {

    public static final int DEFAULT_CACHE_CAPACITY = 1000;

    private static final String UNIX_AND = " && ";
    private static final String CONSOLE_SEQUENCE = " ; ";

    /** A single drive-letter segment at the start of a whitespace/quote/= delimited token. */
    static final Pattern DRIVE_PATH = Pattern.compile("(?<=^|[\\s\"'=(])/([a-zA-Z])/([^\\s\"';|&<>()]*)");

    private static final Pattern PWSH_PREFIX = Pattern.compile("^pwsh(?:\\.exe)?\\s+");
    private static final Pattern COMMAND_FLAG = Pattern.compile("(?i)(?:^|\\s)-(?:Command|c)\\b");

    private final String powershellInvocation;
    private final boolean rewriteDrivePaths;
    private final BoundedFifoCache<String, Command> cache;

    public CommandNormalizer(String powershellInvocation, boolean rewriteDrivePaths) {
        this(powershellInvocation, rewriteDrivePaths, DEFAULT_CACHE_CAPACITY);
    }

    public CommandNormalizer(String powershellInvocation, boolean rewriteDrivePaths, int cacheCapacity) {
        this.powershellInvocation = powershellInvocation;
        this.rewriteDrivePaths = rewriteDrivePaths;
        this.cache = new BoundedFifoCache<>(cacheCapacity);
    }

    /**
     * @throws IllegalArgumentException when {@code raw} is not a valid command
     */
    public Command normalize(String raw) {
        Command.problem(raw).ifPresent(p -> {
            throw new IllegalArgumentException(p);
        });
        return cache.computeIfAbsent(raw, text -> new Command(rewrite(text)));
    }

    String rewrite(String command) {
        String fixed = command;

        // Loop: "a && && b" only exposes its second operator after the first is replaced.
        while (fixed.contains(UNIX_AND)) {
            fixed = fixed.replace(UNIX_AND, CONSOLE_SEQUENCE);
        }

        if (rewriteDrivePaths && fixed.indexOf('/') >= 0 && !SubsystemDetector.isSubsystemInvocation(fixed)) {
            fixed = rewriteDrivePaths(fixed);
        }

        if (PWSH_PREFIX.matcher(fixed).find() && !COMMAND_FLAG.matcher(fixed).find()) {
            fixed = PWSH_PREFIX.matcher(fixed).replaceFirst(Matcher.quoteReplacement(powershellInvocation));
        }

        return fixed;
    }

    static String rewriteDrivePaths(String command) {
        Matcher m = DRIVE_PATH.matcher(command);
        var sb = new StringBuilder();
        while (m.find()) {
            String drive = m.group(1).toUpperCase();
            String rest = m.group(2).replace('/', '\\');
            m.appendReplacement(sb, Matcher.quoteReplacement(drive + ":\\" + rest));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    public boolean rewritesDrivePaths() {
        return rewriteDrivePaths;
    }

    public int cacheSize() {
        return cache.size();
    }

    public void clearCache() {
        cache.clear();
    }
}
