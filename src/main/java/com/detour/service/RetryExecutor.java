package com.detour.service;

import com.detour.config.DetourProperties;
import com.detour.model.RequestDescriptor;
import com.detour.model.ResponseDescriptor;
import com.detour.transport.ErrorKind;
import com.detour.transport.HttpTransport;
import com.detour.transport.TransportException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Performs the real transport call, retrying transient failures with exponential backoff.
 *
 * <ul>
 *   <li>Any well-formed response is returned as-is, except 502/503/504 which are
 *       retried while attempts remain.</li>
 *   <li>NETWORK and TIMEOUT failures are retried when the matching option is on.</li>
 *   <li>Every other failure propagates immediately.</li>
 * </ul>
 *
 * Retry k (0-indexed) waits {@code delay * 2^k}; at most {@code maxRetries}
 * retries follow the first attempt. On exhaustion the last response is
 * returned or the last error rethrown.
 */
@Slf4j
@Service
public class RetryExecutor {

    static final Set<Integer> RETRYABLE_STATUSES = Set.of(502, 503, 504);

    private final HttpTransport transport;
    private final DetourProperties.RetryConfig config;
    private final Duration defaultTimeout;

    public RetryExecutor(HttpTransport transport, DetourProperties properties) {
        this.transport = transport;
        this.config = properties.getRetry();
        this.defaultTimeout = properties.getTransport().getTimeout();
    }

    public Mono<ResponseDescriptor> execute(RequestDescriptor request) {
        if (!config.isEnabled()) {
            return attempt(request);
        }

        return attempt(request)
                .flatMap(response -> RETRYABLE_STATUSES.contains(response.getStatus())
                        ? Mono.<ResponseDescriptor>error(new RetryableStatusException(response))
                        : Mono.just(response))
                .retryWhen(Retry.backoff(config.getMaxRetries(), config.getDelay())
                        .jitter(0d)
                        .filter(this::isRetryable)
                        .doBeforeRetry(signal -> log.warn("Retrying {} {} (retry {}/{}): {}",
                                request.getMethod(), request.getUrl(),
                                signal.totalRetries() + 1, config.getMaxRetries(),
                                signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .onErrorResume(RetryableStatusException.class, e -> Mono.just(e.getResponse()));
    }

    /**
     * Whether a failed attempt may be retried under the current options.
     */
    boolean isRetryable(Throwable error) {
        if (error instanceof RetryableStatusException) {
            return true;
        }
        ErrorKind kind = TransportException.classify(error);
        return switch (kind) {
            case NETWORK -> config.isOnNetworkError();
            case TIMEOUT -> config.isOnTimeout();
            case FATAL -> false;
        };
    }

    /**
     * One transport call bounded by the request's deadline.
     */
    private Mono<ResponseDescriptor> attempt(RequestDescriptor request) {
        Duration timeout = request.getTimeout() != null ? request.getTimeout() : defaultTimeout;
        return Mono.defer(() -> transport.perform(request))
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> TransportException.timeout(
                        request.getMethod() + " " + request.getUrl() + " timed out after "
                                + timeout.toMillis() + "ms", e));
    }

    /**
     * Carries a 502/503/504 response through the retry operator.
     */
    @Getter
    static class RetryableStatusException extends RuntimeException {

        private final transient ResponseDescriptor response;

        RetryableStatusException(ResponseDescriptor response) {
            super("Upstream returned " + response.getStatus(), null, false, false);
            this.response = response;
        }
    }
}
