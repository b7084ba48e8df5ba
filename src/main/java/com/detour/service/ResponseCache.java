package com.detour.service;

import com.detour.config.DetourProperties;
import com.detour.model.CacheEntry;
import com.detour.model.RequestDescriptor;
import com.detour.model.ResponseDescriptor;
import com.detour.model.ResponseSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TTL cache of GET responses keyed by {@code METHOD:url}.
 *
 * <p>Expiry is lazy: a stale entry is removed when it is looked up, never by
 * a background sweep. An entry whose key is never requested again therefore
 * stays in memory until {@link #clear()}. URLs are not normalized, so the same
 * query parameters in a different order produce a different key.
 */
@Slf4j
@Service
public class ResponseCache {

    private static final String CACHEABLE_METHOD = "GET";

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Duration duration;
    private final Clock clock;
    private volatile boolean enabled;

    public ResponseCache(DetourProperties properties, Clock clock) {
        this.duration = properties.getCache().getDuration();
        this.enabled = properties.getCache().isEnabled();
        this.clock = clock;
    }

    public boolean isCacheable(RequestDescriptor request) {
        return enabled && CACHEABLE_METHOD.equals(request.getMethod());
    }

    public Optional<ResponseDescriptor> lookup(RequestDescriptor request) {
        if (!isCacheable(request)) {
            return Optional.empty();
        }

        String key = keyOf(request);
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            log.debug("Cache MISS: {}", key);
            return Optional.empty();
        }

        Instant now = clock.instant();
        if (entry.isExpired(now, duration)) {
            // only drop the entry we saw; a concurrent store may already have replaced it
            entries.remove(key, entry);
            log.debug("Cache EXPIRED: {} (age {}ms)", key, entry.ageMillis(now));
            return Optional.empty();
        }

        log.debug("Cache HIT: {} (age {}ms)", key, entry.ageMillis(now));
        return Optional.of(entry.getResponse().snapshot().withSource(ResponseSource.CACHE));
    }

    /**
     * Store a snapshot of a successful response. Non-2xx responses and
     * non-cacheable methods are ignored.
     */
    public void store(RequestDescriptor request, ResponseDescriptor response) {
        if (!isCacheable(request) || !response.isSuccessful()) {
            return;
        }

        String key = keyOf(request);
        entries.put(key, new CacheEntry(key, response.snapshot(), clock.instant()));
        log.debug("Cached response: {}", key);
    }

    public void clear() {
        entries.clear();
        log.info("Cache cleared");
    }

    /**
     * Number of stored entries, including expired ones not yet looked up.
     */
    public int size() {
        return entries.size();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getDuration() {
        return duration;
    }

    static String keyOf(RequestDescriptor request) {
        return request.getMethod() + ":" + request.getUrl();
    }
}
