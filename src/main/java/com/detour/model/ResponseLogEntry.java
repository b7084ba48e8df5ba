package com.detour.model;

import java.time.Instant;
import java.util.Map;

/**
 * Terminal entry for a dispatch that produced a response (of any status).
 *
 * @param size Content-Length when the response declares one, otherwise the body length
 * @param success whether the status was 2xx
 */
public record ResponseLogEntry(
        String id,
        Instant timestamp,
        String url,
        int status,
        String statusText,
        Map<String, String> headers,
        long durationMs,
        Long size,
        boolean success,
        ResponseSource source) implements LogEntry {

    public ResponseLogEntry {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
