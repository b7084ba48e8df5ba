package com.detour.transport;

import lombok.Getter;

import java.util.concurrent.TimeoutException;

/**
 * Raised when the transport could not produce a response at all.
 * HTTP error statuses are responses, not exceptions.
 */
@Getter
public class TransportException extends RuntimeException {

    private final ErrorKind kind;

    public TransportException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public TransportException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public static TransportException network(String message, Throwable cause) {
        return new TransportException(ErrorKind.NETWORK, message, cause);
    }

    public static TransportException timeout(String message, Throwable cause) {
        return new TransportException(ErrorKind.TIMEOUT, message, cause);
    }

    /**
     * Kind of an arbitrary failure: the carried kind for transport exceptions,
     * TIMEOUT for an expired deadline, FATAL otherwise.
     */
    public static ErrorKind classify(Throwable error) {
        if (error instanceof TransportException transportException) {
            return transportException.getKind();
        }
        if (error instanceof TimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        return ErrorKind.FATAL;
    }
}
