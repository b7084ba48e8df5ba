package com.detour.transport;

/**
 * Classification of a failure that produced no HTTP response.
 */
public enum ErrorKind {
    /**
     * Connectivity failure (refused, reset, DNS); retried when retry-on-network-error is set.
     */
    NETWORK,

    /**
     * Deadline exceeded or aborted; retried when retry-on-timeout is set.
     */
    TIMEOUT,

    /**
     * Anything else. Never retried.
     */
    FATAL
}
