package com.shellbridge.core.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandSafetyPolicyTest {

    private final CommandSafetyPolicy policy = new CommandSafetyPolicy(new SafetyProperties());

    @Test
    @DisplayName("default patterns block destructive commands")
    void blocksDefaults() {
        for (String command : List.of(
                "rm -rf /",
                "sudo RM -RF /var",
                "del /f important.txt",
                "DEL /S *.*",
                "format c:",
                "rd /s /q C:\\work",
                "type secrets > con",
                "net user eve hunter2 /add",
                "reg add HKLM\\Software\\X /v Y")) {
            assertTrue(policy.findViolation(command).isPresent(), command);
        }
    }

    @Test
    @DisplayName("ordinary commands are allowed")
    void allowsOrdinary() {
        for (String command : List.of("echo hello", "rm -rf ./build", "git status", "dir /w", "Get-Process")) {
            assertTrue(policy.isAllowed(command), command);
        }
    }

    @Test
    @DisplayName("the violation names the matching pattern")
    void reportsPattern() {
        assertEquals("format\\s+[a-z]:", policy.findViolation("format d:").orElseThrow());
    }

    @Test
    @DisplayName("custom patterns replace the defaults")
    void customPatterns() {
        var properties = new SafetyProperties();
        properties.setBlockedPatterns(List.of("shutdown"));
        var custom = new CommandSafetyPolicy(properties);

        assertFalse(custom.isAllowed("shutdown -h now"));
        assertTrue(custom.isAllowed("rm -rf /"));
    }

    @Test
    @DisplayName("a disabled policy allows everything")
    void disabled() {
        var permissive = CommandSafetyPolicy.permissive();
        assertFalse(permissive.isEnabled());
        assertTrue(permissive.isAllowed("rm -rf /"));
    }
}
