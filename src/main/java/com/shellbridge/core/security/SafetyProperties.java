package com.shellbridge.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "shellbridge.safety")
public class SafetyProperties {

    public static final List<String> DEFAULT_BLOCKED_PATTERNS = List.of(
            "rm\\s+-rf\\s+/",
            "del\\s+/[fs]",
            "format\\s+[a-z]:",
            "rd\\s+/s",
            ">\\s*con\\b",
            "net\\s+user.*add",
            "reg\\s+add.*HKLM"
    );

    private boolean enabled = true;
    private List<String> blockedPatterns = new ArrayList<>(DEFAULT_BLOCKED_PATTERNS);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getBlockedPatterns() {
        return blockedPatterns;
    }

    public void setBlockedPatterns(List<String> blockedPatterns) {
        this.blockedPatterns = blockedPatterns;
    }
}
