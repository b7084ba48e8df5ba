package com.detour.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Cached response snapshot keyed by {@code METHOD:url}.
 */
@Value
public class CacheEntry {

    String key;
    ResponseDescriptor response;
    Instant storedAt;

    /**
     * Valid only while {@code now - storedAt < duration}.
     */
    public boolean isExpired(Instant now, Duration duration) {
        return Duration.between(storedAt, now).compareTo(duration) >= 0;
    }

    public long ageMillis(Instant now) {
        return Duration.between(storedAt, now).toMillis();
    }
}
