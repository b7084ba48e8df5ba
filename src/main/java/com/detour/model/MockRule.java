package com.detour.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Registered URL/method pattern paired with a responder.
 */
@Value
@Builder
public class MockRule {

    /**
     * Label used in logs and the admin API.
     */
    String name;

    @NonNull
    UrlMatcher url;

    /**
     * Method filter, compared ignoring case; null matches any method.
     */
    String method;

    @NonNull
    MockResponder responder;

    public static MockRule of(String urlFragment, String method, MockResponse response) {
        return MockRule.builder()
                .name((method != null ? method + " " : "") + urlFragment)
                .url(UrlMatcher.contains(urlFragment))
                .method(method)
                .responder(MockResponder.fixed(response))
                .build();
    }

    public boolean matches(RequestDescriptor request) {
        boolean methodMatches = method == null || method.equalsIgnoreCase(request.getMethod());
        return methodMatches && url.matches(request.getUrl());
    }

    public String describe() {
        if (name != null) {
            return name;
        }
        return (method != null ? method + " " : "") + url;
    }
}
