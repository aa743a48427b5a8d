package com.shellbridge.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * One audit record.
 *
 * @param timestamp     when the entry was recorded
 * @param level         severity
 * @param message       free-text message
 * @param payload       structured data rendered inline as JSON, nullable
 * @param correlationId ties together the entries of one execution, nullable
 * @param component     emitting component tag, nullable
 */
public record LogEntry(
    Instant timestamp,
    LogLevel level,
    String message,
    Map<String, Object> payload,
    String correlationId,
    String component
) {}
