package com.detour.model;

import java.time.Instant;
import java.util.Map;

public record RequestLogEntry(
        String id,
        Instant timestamp,
        String method,
        String url,
        Map<String, String> headers) implements LogEntry {

    public RequestLogEntry {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
