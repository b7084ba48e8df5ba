package com.detour.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.springframework.http.HttpHeaders;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable description of an outbound request.
 *
 * <p>Interceptors never mutate a descriptor; they derive a new one through
 * {@link #toBuilder()} or the {@code with*} helpers, so in-flight dispatches
 * never share mutable state. Headers are a read-only copy and the body is
 * copied on the way in and on the way out.
 */
@Getter
@ToString(exclude = "body")
public final class RequestDescriptor {

    /**
     * Correlation id assigned by the dispatcher; null until dispatched.
     */
    private final String id;

    /**
     * Upper-cased HTTP method.
     */
    private final String method;
    private final String url;
    private final HttpHeaders headers;
    private final byte[] body;
    private final Instant createdAt;

    /**
     * Optional per-dispatch deadline; the configured transport timeout applies when null.
     */
    private final Duration timeout;

    @Builder(toBuilder = true)
    private RequestDescriptor(String id,
                              String method,
                              String url,
                              HttpHeaders headers,
                              byte[] body,
                              Instant createdAt,
                              Duration timeout) {
        this.id = id;
        this.method = Objects.requireNonNull(method, "method").toUpperCase(Locale.ROOT);
        this.url = Objects.requireNonNull(url, "url");
        this.headers = Headers.freeze(headers);
        this.body = body == null ? null : body.clone();
        this.createdAt = createdAt == null ? Instant.now() : createdAt;
        this.timeout = timeout;
    }

    public static RequestDescriptor get(String url) {
        return RequestDescriptor.builder().method("GET").url(url).build();
    }

    public static RequestDescriptor of(String method, String url) {
        return RequestDescriptor.builder().method(method).url(url).build();
    }

    public byte[] getBody() {
        return body == null ? null : body.clone();
    }

    public boolean hasBody() {
        return body != null;
    }

    public String getBodyAsString() {
        return body == null ? null : new String(body, StandardCharsets.UTF_8);
    }

    public RequestDescriptor withId(String newId) {
        return toBuilder().id(newId).build();
    }

    public RequestDescriptor withUrl(String newUrl) {
        return toBuilder().url(newUrl).build();
    }

    /**
     * Copy with the named header replaced by a single value.
     */
    public RequestDescriptor withHeader(String name, String value) {
        HttpHeaders copy = new HttpHeaders();
        copy.addAll(headers);
        copy.set(name, value);
        return toBuilder().headers(copy).build();
    }

    public RequestDescriptor withoutHeader(String name) {
        HttpHeaders copy = new HttpHeaders();
        copy.addAll(headers);
        copy.remove(name);
        return toBuilder().headers(copy).build();
    }
}
