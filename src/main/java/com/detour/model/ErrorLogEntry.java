package com.detour.model;

import java.time.Instant;

/**
 * Terminal entry for a dispatch that failed without a response.
 */
public record ErrorLogEntry(
        String id,
        Instant timestamp,
        String message,
        long durationMs) implements LogEntry {
}
