package com.detour.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

import java.nio.charset.StandardCharsets;

/**
 * Immutable response handed back by the dispatcher.
 */
@Getter
@ToString(exclude = "body")
public final class ResponseDescriptor {

    private static final byte[] EMPTY_BODY = new byte[0];

    private final int status;
    private final String statusText;

    /**
     * URL of the request that produced this response, when known.
     */
    private final String url;
    private final HttpHeaders headers;
    private final byte[] body;
    private final ResponseSource source;

    @Builder(toBuilder = true)
    private ResponseDescriptor(int status,
                               String statusText,
                               String url,
                               HttpHeaders headers,
                               byte[] body,
                               ResponseSource source) {
        this.status = status;
        this.statusText = statusText != null ? statusText : reasonPhrase(status);
        this.url = url;
        this.headers = Headers.freeze(headers);
        this.body = body == null ? EMPTY_BODY : body.clone();
        this.source = source != null ? source : ResponseSource.NETWORK;
    }

    public byte[] getBody() {
        return body.clone();
    }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public int getBodyLength() {
        return body.length;
    }

    /**
     * 2xx status.
     */
    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    /**
     * Content-Length header value, or null when absent or unparsable.
     */
    public Long getContentLength() {
        String value = headers.getFirst(HttpHeaders.CONTENT_LENGTH);
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public ResponseDescriptor withSource(ResponseSource newSource) {
        return toBuilder().source(newSource).build();
    }

    public ResponseDescriptor withHeader(String name, String value) {
        HttpHeaders copy = new HttpHeaders();
        copy.addAll(headers);
        copy.set(name, value);
        return toBuilder().headers(copy).build();
    }

    /**
     * Independent copy, safe to hand out repeatedly (e.g. from the cache).
     */
    public ResponseDescriptor snapshot() {
        return toBuilder().build();
    }

    private static String reasonPhrase(int status) {
        HttpStatus resolved = HttpStatus.resolve(status);
        return resolved != null ? resolved.getReasonPhrase() : "";
    }
}
