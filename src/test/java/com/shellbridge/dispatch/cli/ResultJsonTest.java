package com.shellbridge.dispatch.cli;

import com.shellbridge.core.model.BackendKind;
import com.shellbridge.core.model.CommandResult;
import com.shellbridge.core.model.ExecutionError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResultJsonTest {

    @Test
    @DisplayName("success maps without an error object")
    void success() {
        var result = new CommandResult.Success("echo hi", BackendKind.CONSOLE, "hi\n", "",
                Duration.ofMillis(42), Instant.parse("2025-01-15T10:30:00Z"));

        Map<String, Object> map = ResultJson.toMap(result);

        assertEquals(true, map.get("success"));
        assertEquals("CONSOLE", map.get("backend"));
        assertEquals(0, map.get("exitCode"));
        assertEquals(42L, map.get("durationMs"));
        assertEquals("2025-01-15T10:30:00Z", map.get("timestamp"));
        assertFalse(map.containsKey("error"));
    }

    @Test
    @DisplayName("failure carries code, category and message")
    void failure() {
        var result = CommandResult.rejected("", null, ExecutionError.invalidCommand("Command is empty"), Duration.ZERO);

        String json = ResultJson.toJson(result);

        assertTrue(json.contains("\"success\":false"));
        assertTrue(json.contains("\"backend\":null"));
        assertTrue(json.contains("\"code\":\"INVALID_COMMAND\""));
        assertTrue(json.contains("\"category\":\"VALIDATION\""));
        assertTrue(json.contains("\"exitCode\":-1"));
    }

    @Test
    @DisplayName("exit code helper maps child exits and other failures")
    void exitCodes() {
        var now = Instant.now();
        assertEquals(0, ExecCommand.exitCodeFor(
                new CommandResult.Success("x", BackendKind.CONSOLE, "", "", Duration.ZERO, now)));
        assertEquals(7, ExecCommand.exitCodeFor(new CommandResult.Failure("x", BackendKind.CONSOLE, "", "", 7,
                Duration.ZERO, now, ExecutionError.nonZeroExit(7))));
        assertEquals(1, ExecCommand.exitCodeFor(new CommandResult.Failure("x", BackendKind.CONSOLE, "", "", 300,
                Duration.ZERO, now, ExecutionError.nonZeroExit(300))));
        assertEquals(1, ExecCommand.exitCodeFor(new CommandResult.Failure("x", BackendKind.CONSOLE, "", "", -1,
                Duration.ZERO, now, ExecutionError.timeout(500))));
    }
}
