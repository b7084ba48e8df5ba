package com.detour.interceptor;

import lombok.Getter;

/**
 * An interceptor threw while transforming a request or response.
 */
@Getter
public class InterceptorException extends RuntimeException {

    public enum Phase {
        REQUEST,
        RESPONSE
    }

    private final String interceptorName;
    private final Phase phase;

    public InterceptorException(String interceptorName, Phase phase, Throwable cause) {
        super(phase.name().toLowerCase() + " interceptor '" + interceptorName + "' failed: "
                + cause.getMessage(), cause);
        this.interceptorName = interceptorName;
        this.phase = phase;
    }
}
