package com.detour.model;

/**
 * Where a response handed back by the dispatcher came from.
 */
public enum ResponseSource {
    /**
     * Produced by the underlying transport.
     */
    NETWORK,

    /**
     * Served from the response cache without a transport call.
     */
    CACHE,

    /**
     * Synthesized by a mock rule without a transport call.
     */
    MOCK
}
