package com.detour.service;

import com.detour.config.DetourProperties;
import com.detour.model.ErrorLogEntry;
import com.detour.model.Headers;
import com.detour.model.LogEntry;
import com.detour.model.RequestDescriptor;
import com.detour.model.RequestLogEntry;
import com.detour.model.ResponseDescriptor;
import com.detour.model.ResponseLogEntry;
import com.detour.model.ResponseSource;
import com.detour.model.dto.RequestStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded in-memory log of dispatch events.
 *
 * <p>Once full, each new entry evicts the oldest one. Statistics are
 * recomputed from the buffer on every call so they always agree with
 * {@link #getEntries()}.
 */
@Slf4j
@Service
public class RequestLog {

    private final Deque<LogEntry> entries = new ArrayDeque<>();
    private final int capacity;
    private final Clock clock;
    private volatile boolean enabled;

    public RequestLog(DetourProperties properties, Clock clock) {
        int maxEntries = properties.getLogging().getMaxEntries();
        if (maxEntries < 1) {
            throw new IllegalArgumentException("detour.logging.max-entries must be at least 1, was " + maxEntries);
        }
        this.capacity = maxEntries;
        this.enabled = properties.getLogging().isEnabled();
        this.clock = clock;
    }

    public void logRequest(String id, RequestDescriptor request) {
        add(new RequestLogEntry(id, clock.instant(), request.getMethod(), request.getUrl(),
                Headers.flatten(request.getHeaders())));
    }

    public void logResponse(String id, ResponseDescriptor response, Instant startedAt) {
        Long size = response.getContentLength();
        add(new ResponseLogEntry(
                id,
                clock.instant(),
                response.getUrl(),
                response.getStatus(),
                response.getStatusText(),
                Headers.flatten(response.getHeaders()),
                elapsedMillis(startedAt),
                size != null ? size : (long) response.getBodyLength(),
                response.isSuccessful(),
                response.getSource()));
    }

    public void logError(String id, Throwable error, Instant startedAt) {
        String message = error.getMessage() != null ? error.getMessage() : error.toString();
        logError(id, message, startedAt);
    }

    public void logError(String id, String message, Instant startedAt) {
        add(new ErrorLogEntry(id, clock.instant(), message, elapsedMillis(startedAt)));
    }

    /**
     * Append an entry, evicting the oldest one when the buffer is full.
     */
    public void add(LogEntry entry) {
        if (!enabled) {
            return;
        }
        synchronized (entries) {
            entries.addLast(entry);
            while (entries.size() > capacity) {
                entries.removeFirst();
            }
        }
    }

    /**
     * Snapshot of the buffer, oldest first.
     */
    public List<LogEntry> getEntries() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
        log.info("Request log cleared");
    }

    public RequestStats getStats() {
        List<LogEntry> snapshot = getEntries();

        long successful = 0;
        long failed = 0;
        long cached = 0;
        long mocked = 0;
        for (LogEntry entry : snapshot) {
            if (entry instanceof ResponseLogEntry response) {
                if (response.success()) {
                    successful++;
                } else {
                    failed++;
                }
                if (response.source() == ResponseSource.CACHE) {
                    cached++;
                } else if (response.source() == ResponseSource.MOCK) {
                    mocked++;
                }
            } else if (entry instanceof ErrorLogEntry) {
                failed++;
            }
        }

        long total = successful + failed;
        return RequestStats.builder()
                .total(total)
                .successful(successful)
                .failed(failed)
                .successRate(total > 0 ? (successful * 100.0) / total : 0.0)
                .cached(cached)
                .mocked(mocked)
                .build();
    }

    public int getCapacity() {
        return capacity;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    private long elapsedMillis(Instant startedAt) {
        return Math.max(0, Duration.between(startedAt, clock.instant()).toMillis());
    }
}
