package com.detour.interceptor;

import com.detour.model.ResponseDescriptor;

import java.util.Objects;

/**
 * Transformation applied to every network response, in registration order,
 * before it is cached and returned. Returning {@code null} leaves it unchanged.
 */
@FunctionalInterface
public interface ResponseInterceptor {

    ResponseDescriptor intercept(ResponseDescriptor response, InterceptionContext context);

    default String getName() {
        return getClass().getSimpleName();
    }

    static ResponseInterceptor named(String name, ResponseInterceptor delegate) {
        Objects.requireNonNull(delegate, "delegate");
        return new ResponseInterceptor() {
            @Override
            public ResponseDescriptor intercept(ResponseDescriptor response, InterceptionContext context) {
                return delegate.intercept(response, context);
            }

            @Override
            public String getName() {
                return name;
            }
        };
    }
}
