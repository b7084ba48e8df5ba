package com.detour.service;

import com.detour.config.DetourProperties;
import com.detour.config.JacksonConfiguration;
import com.detour.interceptor.InterceptionContext;
import com.detour.interceptor.RequestInterceptor;
import com.detour.interceptor.ResponseInterceptor;
import com.detour.model.LogEntry;
import com.detour.model.MockRule;
import com.detour.model.RequestDescriptor;
import com.detour.model.ResponseDescriptor;
import com.detour.model.dto.InterceptorSummary;
import com.detour.model.dto.RequestStats;
import com.detour.transport.HttpTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point that wraps the transport with interceptors, mocking, caching,
 * retry and request logging.
 *
 * <p>Flow of a wrapped dispatch:
 * <ol>
 *   <li>assign a correlation id and log the request</li>
 *   <li>run request interceptors</li>
 *   <li>serve a mock response if a rule matches (mocking enabled)</li>
 *   <li>serve a fresh cached response for GET (caching enabled)</li>
 *   <li>call the transport through the retry executor</li>
 *   <li>run response interceptors, cache a successful GET response</li>
 *   <li>log the response, or the error that ended the dispatch</li>
 * </ol>
 *
 * HTTP error statuses are returned as ordinary responses. The returned Mono
 * errors only on a transport failure that outlived its retries, or on an
 * interceptor or responder failure.
 *
 * <p>Each instance owns its own cache, log, rules and interceptors.
 */
@Slf4j
@Service
public class DispatchService {

    private static final long ID_SUFFIX_MIN = 2_821_109_907_456L;       // 36^8
    private static final long ID_SUFFIX_BOUND = 101_559_956_668_416L;   // 36^9

    private final HttpTransport transport;
    private final InterceptorPipeline pipeline;
    private final MockRuleMatcher mockRuleMatcher;
    private final ResponseCache responseCache;
    private final RetryExecutor retryExecutor;
    private final RequestLog requestLog;
    private final Clock clock;
    private final AtomicBoolean enabled;

    public DispatchService(DetourProperties properties,
                           HttpTransport transport,
                           InterceptorPipeline pipeline,
                           MockRuleMatcher mockRuleMatcher,
                           ResponseCache responseCache,
                           RetryExecutor retryExecutor,
                           RequestLog requestLog,
                           Clock clock) {
        this.transport = transport;
        this.pipeline = pipeline;
        this.mockRuleMatcher = mockRuleMatcher;
        this.responseCache = responseCache;
        this.retryExecutor = retryExecutor;
        this.requestLog = requestLog;
        this.clock = clock;
        this.enabled = new AtomicBoolean(properties.getIntercept().isEnabled());
        log.info("Initialized DispatchService over transport '{}' (intercept={}, mocking={}, caching={}, retry={})",
                transport.getName(), enabled.get(), mockRuleMatcher.isEnabled(),
                responseCache.isEnabled(), properties.getRetry().isEnabled());
    }

    /**
     * Build a standalone dispatcher with its own components.
     */
    public static DispatchService create(DetourProperties properties, HttpTransport transport) {
        return create(properties, transport, JacksonConfiguration.createObjectMapper(), Clock.systemUTC());
    }

    public static DispatchService create(DetourProperties properties,
                                         HttpTransport transport,
                                         ObjectMapper objectMapper,
                                         Clock clock) {
        return new DispatchService(
                properties,
                transport,
                new InterceptorPipeline(properties),
                new MockRuleMatcher(properties, objectMapper),
                new ResponseCache(properties, clock),
                new RetryExecutor(transport, properties),
                new RequestLog(properties, clock),
                clock);
    }

    /**
     * Dispatch a request. Nothing happens until the returned Mono is subscribed.
     */
    public Mono<ResponseDescriptor> dispatch(RequestDescriptor request) {
        Objects.requireNonNull(request, "request");

        if (!enabled.get()) {
            return Mono.defer(() -> transport.perform(request));
        }

        return Mono.defer(() -> {
            String id = request.getId() != null ? request.getId() : nextRequestId();
            Instant startedAt = clock.instant();
            RequestDescriptor dispatched = request.withId(id);
            requestLog.logRequest(id, dispatched);
            log.debug("Dispatching {} {} as {}", dispatched.getMethod(), dispatched.getUrl(), id);

            InterceptionContext context = InterceptionContext.builder()
                    .requestId(id)
                    .request(dispatched)
                    .startedAt(startedAt)
                    .build();

            // exactly one terminal entry, whichever signal comes first
            AtomicBoolean finished = new AtomicBoolean();
            return process(dispatched, context)
                    .doOnNext(response -> {
                        if (finished.compareAndSet(false, true)) {
                            requestLog.logResponse(id, response, startedAt);
                        }
                    })
                    .doOnError(error -> {
                        if (finished.compareAndSet(false, true)) {
                            log.error("Dispatch {} of {} {} failed: {}", id,
                                    dispatched.getMethod(), dispatched.getUrl(), error.getMessage());
                            requestLog.logError(id, error, startedAt);
                        }
                    })
                    .doOnCancel(() -> {
                        if (finished.compareAndSet(false, true)) {
                            requestLog.logError(id, "Request cancelled", startedAt);
                        }
                    });
        });
    }

    private Mono<ResponseDescriptor> process(RequestDescriptor dispatched, InterceptionContext context) {
        return Mono.fromCallable(() -> pipeline.applyRequest(dispatched, context))
                .flatMap(processed -> {
                    Optional<ResponseDescriptor> mocked = mockRuleMatcher.match(processed);
                    if (mocked.isPresent()) {
                        log.debug("Serving mocked response for {}", context.getRequestId());
                        return Mono.just(mocked.get());
                    }

                    Optional<ResponseDescriptor> cached = responseCache.lookup(processed);
                    if (cached.isPresent()) {
                        log.debug("Serving cached response for {}", context.getRequestId());
                        return Mono.just(cached.get());
                    }

                    InterceptionContext responseContext = context.withRequest(processed);
                    return retryExecutor.execute(processed)
                            .map(response -> pipeline.applyResponse(response, responseContext))
                            .doOnNext(response -> responseCache.store(processed, response));
                });
    }

    public void addRequestInterceptor(RequestInterceptor interceptor) {
        pipeline.addRequestInterceptor(interceptor);
    }

    public void addResponseInterceptor(ResponseInterceptor interceptor) {
        pipeline.addResponseInterceptor(interceptor);
    }

    public boolean removeRequestInterceptor(RequestInterceptor interceptor) {
        return pipeline.removeRequestInterceptor(interceptor);
    }

    public boolean removeResponseInterceptor(ResponseInterceptor interceptor) {
        return pipeline.removeResponseInterceptor(interceptor);
    }

    public InterceptorSummary getInterceptors() {
        return InterceptorSummary.builder()
                .request(pipeline.getRequestInterceptors().stream().map(RequestInterceptor::getName).toList())
                .response(pipeline.getResponseInterceptors().stream().map(ResponseInterceptor::getName).toList())
                .build();
    }

    public void addMockRule(MockRule rule) {
        mockRuleMatcher.addRule(rule);
    }

    public boolean removeMockRule(MockRule rule) {
        return mockRuleMatcher.removeRule(rule);
    }

    public void clearMockRules() {
        mockRuleMatcher.clearRules();
    }

    public List<MockRule> getMockRules() {
        return mockRuleMatcher.getRules();
    }

    public void enableMocking() {
        mockRuleMatcher.setEnabled(true);
    }

    public void disableMocking() {
        mockRuleMatcher.setEnabled(false);
    }

    public boolean isMockingEnabled() {
        return mockRuleMatcher.isEnabled();
    }

    public List<LogEntry> getLog() {
        return requestLog.getEntries();
    }

    public void clearLog() {
        requestLog.clear();
    }

    public RequestStats getStats() {
        return requestLog.getStats();
    }

    public void clearCache() {
        responseCache.clear();
    }

    public int getCacheSize() {
        return responseCache.size();
    }

    /**
     * Wrap the transport again after {@link #disable()}.
     */
    public void enable() {
        enabled.set(true);
        log.info("Interception enabled");
    }

    /**
     * Forward dispatches straight to the transport: no interceptors, mocks, cache, retry or log.
     */
    public void disable() {
        enabled.set(false);
        log.info("Interception disabled");
    }

    public boolean isEnabled() {
        return enabled.get();
    }

    private String nextRequestId() {
        long suffix = ThreadLocalRandom.current().nextLong(ID_SUFFIX_MIN, ID_SUFFIX_BOUND);
        return "req-" + clock.millis() + "-" + Long.toString(suffix, 36);
    }
}
