package com.detour.interceptor;

import com.detour.model.RequestDescriptor;

import java.util.Objects;

/**
 * Transformation applied to every outbound request, in registration order,
 * before mocking, caching and the transport call.
 *
 * <p>Returning {@code null} leaves the request unchanged. Throwing aborts the
 * dispatch; the failure is not retried.
 */
@FunctionalInterface
public interface RequestInterceptor {

    RequestDescriptor intercept(RequestDescriptor request, InterceptionContext context);

    default String getName() {
        return getClass().getSimpleName();
    }

    /**
     * Wrap an interceptor so that diagnostics report the given name.
     */
    static RequestInterceptor named(String name, RequestInterceptor delegate) {
        Objects.requireNonNull(delegate, "delegate");
        return new RequestInterceptor() {
            @Override
            public RequestDescriptor intercept(RequestDescriptor request, InterceptionContext context) {
                return delegate.intercept(request, context);
            }

            @Override
            public String getName() {
                return name;
            }
        };
    }
}
