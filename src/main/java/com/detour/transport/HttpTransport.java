package com.detour.transport;

import com.detour.model.RequestDescriptor;
import com.detour.model.ResponseDescriptor;
import reactor.core.publisher.Mono;

/**
 * The "perform this request" primitive wrapped by the dispatcher.
 * Implementations handle the actual wire exchange; Detour never does.
 */
public interface HttpTransport {

    /**
     * Get transport name (e.g., "webclient").
     *
     * @return transport name
     */
    String getName();

    /**
     * Perform a single request. Must not retry.
     *
     * @param request request to send
     * @return the response for any status; errors with {@link TransportException} when no response was received
     */
    Mono<ResponseDescriptor> perform(RequestDescriptor request);
}
