package com.shellbridge.core.shell;

import com.shellbridge.core.model.BackendKind;
import com.shellbridge.core.model.Command;
import com.shellbridge.core.model.DetectionRule;
import com.shellbridge.core.model.ShellPlan;
import com.shellbridge.core.model.TrailingArgument;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Chooses the backend for a command by running an ordered list of detectors;
 * the first match wins, regardless of how specific a later detector would be.
 * <ol>
 *   <li>POSIX subsystem prefix ({@code wsl ...}) or mount path ({@code /mnt/c/...})</li>
 *   <li>PowerShell syntax (verb-noun cmdlets, {@code $PSVersionTable}, {@code Import-Module})</li>
 *   <li>Tools from other ecosystems (git, npm/node/yarn/pnpm, docker, python, uv) go to the console</li>
 *   <li>Everything else goes to the console</li>
 * </ol>
 * Classification depends only on the command text and the override, so results
 * are memoized by text.
 */
public class ShellClassifier {

    public static final int DEFAULT_CACHE_CAPACITY = 500;

    static final Pattern POWERSHELL_SYNTAX = Pattern.compile(
            "\\b(?:Get|Set|New|Remove|Add|Clear|Invoke|Start|Stop|Restart|Select|Where|ForEach|Sort|Measure"
                    + "|Write|Read|Out|Test|Import|Export|ConvertTo|ConvertFrom|Format|Copy|Move|Rename)"
                    + "-[A-Z][A-Za-z]+"
                    + "|\\$PSVersionTable"
                    + "|\\bImport-Module\\b");

    static final List<Pattern> ECOSYSTEM_PREFIXES = List.of(
            Pattern.compile("^git\\s+"),
            Pattern.compile("^(?:npm|npx|node|yarn|pnpm)\\s+"),
            Pattern.compile("^docker\\s+"),
            Pattern.compile("^(?:python|python3|py)\\s+"),
            Pattern.compile("^uv\\s+"));

    private final ShellCatalog catalog;
    private final BoundedFifoCache<String, ShellPlan> cache;

    public ShellClassifier(ShellCatalog catalog) {
        this(catalog, DEFAULT_CACHE_CAPACITY);
    }

    public ShellClassifier(ShellCatalog catalog, int cacheCapacity) {
        this.catalog = catalog;
        this.cache = new BoundedFifoCache<>(cacheCapacity);
    }

    public ShellPlan classify(Command command) {
        return classify(command, null);
    }

    /**
     * Resolves the plan for a command. A non-null override wins unconditionally and
     * bypasses the cache.
     */
    public ShellPlan classify(Command command, BackendKind override) {
        if (override != null) {
            return plan(override, TrailingArgument.FULL_COMMAND, DetectionRule.OVERRIDE);
        }
        return cache.computeIfAbsent(command.text(), this::detect);
    }

    private ShellPlan detect(String text) {
        if (SubsystemDetector.hasPrefix(text)) {
            return plan(BackendKind.POSIX_SUBSYSTEM, TrailingArgument.AFTER_SUBSYSTEM_PREFIX, DetectionRule.SUBSYSTEM_PREFIX);
        }
        if (SubsystemDetector.hasMountPath(text)) {
            return plan(BackendKind.POSIX_SUBSYSTEM, TrailingArgument.FULL_COMMAND, DetectionRule.SUBSYSTEM_MOUNT_PATH);
        }
        if (POWERSHELL_SYNTAX.matcher(text).find()) {
            return plan(BackendKind.POWERSHELL, TrailingArgument.FULL_COMMAND, DetectionRule.POWERSHELL_SYNTAX);
        }
        String trimmed = text.stripLeading();
        for (Pattern prefix : ECOSYSTEM_PREFIXES) {
            if (prefix.matcher(trimmed).find()) {
                return plan(BackendKind.CONSOLE, TrailingArgument.FULL_COMMAND, DetectionRule.ECOSYSTEM_TOOL);
            }
        }
        return plan(BackendKind.CONSOLE, TrailingArgument.FULL_COMMAND, DetectionRule.DEFAULT);
    }

    private ShellPlan plan(BackendKind backend, TrailingArgument trailing, DetectionRule rule) {
        ShellCatalog.Shell shell = catalog.shellFor(backend);
        return new ShellPlan(backend, shell.executable(), shell.prefixArgs(), trailing, rule);
    }

    public ShellCatalog catalog() {
        return catalog;
    }

    public int cacheSize() {
        return cache.size();
    }

    public int cacheCapacity() {
        return cache.capacity();
    }

    public void clearCache() {
        cache.clear();
    }
}
