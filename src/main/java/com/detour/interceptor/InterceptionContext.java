package com.detour.interceptor;

import com.detour.model.RequestDescriptor;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Per-dispatch information handed to interceptors alongside the descriptor.
 */
@Value
@Builder
public class InterceptionContext {

    /**
     * Correlation id shared by all log entries of the dispatch.
     */
    String requestId;

    /**
     * The request as it currently stands: the dispatched descriptor during the
     * request phase, the fully intercepted one during the response phase.
     */
    @With
    RequestDescriptor request;

    Instant startedAt;
}
