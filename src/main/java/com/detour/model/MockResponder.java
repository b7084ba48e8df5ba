package com.detour.model;

import java.util.Objects;

/**
 * Produces the synthetic response for a matched mock rule.
 */
@FunctionalInterface
public interface MockResponder {

    MockResponse respond(RequestDescriptor request);

    static MockResponder fixed(MockResponse response) {
        Objects.requireNonNull(response, "response");
        return request -> response;
    }
}
