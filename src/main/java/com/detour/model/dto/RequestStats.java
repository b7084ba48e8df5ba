package com.detour.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate view of the request log, recomputed from the buffer on every call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequestStats {

    /**
     * Terminal entries (responses and errors) currently in the log.
     */
    private long total;

    /**
     * Responses with a 2xx status.
     */
    private long successful;

    /**
     * Non-2xx responses plus errors.
     */
    private long failed;

    /**
     * Percentage of successful outcomes (0-100), 0 when the log is empty.
     */
    private double successRate;

    /**
     * Responses served from the cache.
     */
    private long cached;

    /**
     * Responses synthesized by mock rules.
     */
    private long mocked;
}
