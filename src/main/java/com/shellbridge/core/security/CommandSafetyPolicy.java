package com.shellbridge.core.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Rejects raw command text that matches one of a small set of destructive patterns
 * (recursive root deletes, drive formats, registry and account changes).
 * Matching is case-insensitive and runs before any rewriting.
 */
@Service
public class CommandSafetyPolicy {

    private static final Logger log = LoggerFactory.getLogger(CommandSafetyPolicy.class);

    private final boolean enabled;
    private final List<Pattern> blocked;

    @Autowired
    public CommandSafetyPolicy(SafetyProperties properties) {
        this(properties.isEnabled(), properties.getBlockedPatterns());
    }

    public CommandSafetyPolicy(boolean enabled, List<String> blockedPatterns) {
        this.enabled = enabled;
        this.blocked = blockedPatterns.stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    public static CommandSafetyPolicy defaults() {
        return new CommandSafetyPolicy(true, SafetyProperties.DEFAULT_BLOCKED_PATTERNS);
    }

    public static CommandSafetyPolicy permissive() {
        return new CommandSafetyPolicy(false, List.of());
    }

    /**
     * Returns the first blocked pattern found in {@code command}, if any.
     */
    public Optional<String> findViolation(String command) {
        if (!enabled || command == null) {
            return Optional.empty();
        }
        for (Pattern pattern : blocked) {
            if (pattern.matcher(command).find()) {
                log.warn("Blocked command matching pattern '{}'", pattern.pattern());
                return Optional.of(pattern.pattern());
            }
        }
        return Optional.empty();
    }

    public boolean isAllowed(String command) {
        return findViolation(command).isEmpty();
    }

    public boolean isEnabled() {
        return enabled;
    }
}
