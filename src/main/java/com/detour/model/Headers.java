package com.detour.model;

import org.springframework.http.HttpHeaders;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Header helpers shared by the descriptors and the request log.
 */
public final class Headers {

    private Headers() {
    }

    /**
     * Read-only copy that no longer aliases the given headers.
     */
    public static HttpHeaders freeze(HttpHeaders headers) {
        if (headers == null || headers.isEmpty()) {
            return HttpHeaders.EMPTY;
        }
        HttpHeaders copy = new HttpHeaders();
        copy.addAll(headers);
        return HttpHeaders.readOnlyHttpHeaders(copy);
    }

    /**
     * Flatten to one value per name, joining repeated values with ", ".
     */
    public static Map<String, String> flatten(HttpHeaders headers) {
        Map<String, String> flat = new LinkedHashMap<>();
        if (headers == null) {
            return flat;
        }
        headers.forEach((name, values) -> flat.put(name, String.join(", ", values)));
        return flat;
    }

    public static HttpHeaders of(Map<String, String> values) {
        HttpHeaders headers = new HttpHeaders();
        if (values != null) {
            values.forEach(headers::add);
        }
        return headers;
    }
}
