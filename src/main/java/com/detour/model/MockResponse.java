package com.detour.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Response value produced by a mock responder.
 *
 * <p>A raw {@code body} wins over {@code data}; {@code data} is rendered as JSON.
 * When no headers are given the content type defaults to JSON.
 */
@Value
@Builder(toBuilder = true)
public class MockResponse {

    @Builder.Default
    int status = 200;

    String statusText;

    @Singular
    Map<String, String> headers;

    String body;

    Object data;

    public static MockResponse json(Object data) {
        return MockResponse.builder().data(data).build();
    }

    public static MockResponse json(int status, Object data) {
        return MockResponse.builder().status(status).data(data).build();
    }

    public static MockResponse text(String body) {
        return MockResponse.builder()
                .body(body)
                .header("Content-Type", "text/plain")
                .build();
    }

    public static MockResponse status(int status) {
        return MockResponse.builder().status(status).build();
    }
}
