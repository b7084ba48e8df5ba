package com.detour.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

/**
 * One event in the request log. Every wrapped dispatch produces a
 * {@link RequestLogEntry} followed by exactly one terminal
 * {@link ResponseLogEntry} or {@link ErrorLogEntry}, all sharing the correlation id.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RequestLogEntry.class, name = "request"),
        @JsonSubTypes.Type(value = ResponseLogEntry.class, name = "response"),
        @JsonSubTypes.Type(value = ErrorLogEntry.class, name = "error")
})
public interface LogEntry {

    String id();

    Instant timestamp();

    /**
     * Whether this entry ends a dispatch.
     */
    default boolean isTerminal() {
        return !(this instanceof RequestLogEntry);
    }
}
