package com.detour.model.dto;

import com.detour.model.Headers;
import com.detour.model.RequestDescriptor;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * JSON form of a request relayed through {@code POST /v1/dispatch}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchRequest {

    private String method;
    private String url;
    private Map<String, String> headers;

    /**
     * UTF-8 request body (optional).
     */
    private String body;

    /**
     * Per-dispatch deadline in milliseconds (optional).
     */
    private Long timeoutMs;

    public RequestDescriptor toDescriptor() {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must be specified");
        }
        return RequestDescriptor.builder()
                .method(method != null ? method : "GET")
                .url(url)
                .headers(Headers.of(headers))
                .body(body != null ? body.getBytes(StandardCharsets.UTF_8) : null)
                .timeout(timeoutMs != null ? Duration.ofMillis(timeoutMs) : null)
                .build();
    }
}
