package com.detour.interceptor;

import com.detour.model.RequestDescriptor;
import com.detour.model.ResponseDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.springframework.http.HttpHeaders;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Ready-made interceptors for common cross-cutting concerns.
 */
@Slf4j
public final class StandardInterceptors {

    private StandardInterceptors() {
    }

    /**
     * Sets {@code Authorization: Bearer <token>}.
     */
    public static RequestInterceptor bearerAuth(String token) {
        return auth(token, HttpHeaders.AUTHORIZATION, "Bearer ");
    }

    public static RequestInterceptor auth(String token, String headerName, String headerPrefix) {
        Objects.requireNonNull(token, "token");
        String prefix = headerPrefix != null ? headerPrefix : "";
        return RequestInterceptor.named("auth:" + headerName,
                (request, context) -> request.withHeader(headerName, prefix + token));
    }

    /**
     * Logs every outgoing request at info level on the given logger.
     */
    public static RequestInterceptor requestLogger(Logger logger) {
        return RequestInterceptor.named("request-logger", (request, context) -> {
            logger.info("Outgoing request: {} {}", request.getMethod(), request.getUrl());
            return request;
        });
    }

    public static RequestInterceptor requestLogger() {
        return requestLogger(log);
    }

    /**
     * Invokes the handler for every non-2xx response and passes the response through.
     */
    public static ResponseInterceptor errorHandler(Consumer<ResponseDescriptor> handler) {
        return ResponseInterceptor.named("error-handler", (response, context) -> {
            if (!response.isSuccessful()) {
                handler.accept(response);
            }
            return response;
        });
    }

    public static ResponseInterceptor errorHandler() {
        return errorHandler(response -> log.error("Request failed: {} {}",
                response.getStatus(), response.getStatusText()));
    }

    public static RequestInterceptor requestTransform(String name, UnaryOperator<RequestDescriptor> transform) {
        return RequestInterceptor.named(name, (request, context) -> transform.apply(request));
    }

    public static ResponseInterceptor responseTransform(String name, UnaryOperator<ResponseDescriptor> transform) {
        return ResponseInterceptor.named(name, (response, context) -> transform.apply(response));
    }
}
