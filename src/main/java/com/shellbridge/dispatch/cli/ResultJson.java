package com.shellbridge.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shellbridge.core.model.CommandResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders results as single-line JSON for adapters that read line-delimited output.
 */
public final class ResultJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ResultJson() {}

    public static Map<String, Object> toMap(CommandResult result) {
        var map = new LinkedHashMap<String, Object>();
        map.put("success", result.success());
        map.put("command", result.command());
        map.put("backend", result.backend() == null ? null : result.backend().name());
        map.put("stdout", result.stdout());
        map.put("stderr", result.stderr());
        map.put("exitCode", result.exitCode());
        map.put("durationMs", result.duration().toMillis());
        map.put("timestamp", result.timestamp().toString());
        result.error().ifPresent(error -> {
            var err = new LinkedHashMap<String, Object>();
            err.put("code", error.code().name());
            err.put("category", error.category().name());
            err.put("message", error.message());
            map.put("error", err);
        });
        return map;
    }

    public static String toJson(CommandResult result) {
        return write(toMap(result));
    }

    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
