package com.detour.interceptor;

import com.detour.model.RequestDescriptor;
import com.detour.model.ResponseDescriptor;
import com.detour.support.StubTransport;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StandardInterceptors.
 */
class StandardInterceptorsTest {

    private static final RequestDescriptor REQUEST = RequestDescriptor.get("https://api.example.com/me");
    private static final InterceptionContext CONTEXT = InterceptionContext.builder()
            .requestId("req-1")
            .request(REQUEST)
            .startedAt(Instant.EPOCH)
            .build();

    @Test
    void testBearerAuthSetsAuthorizationHeader() {
        RequestDescriptor result = StandardInterceptors.bearerAuth("s3cr3t").intercept(REQUEST, CONTEXT);

        assertEquals("Bearer s3cr3t", result.getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
        assertNull(REQUEST.getHeaders().getFirst(HttpHeaders.AUTHORIZATION), "original must be untouched");
    }

    @Test
    void testCustomAuthHeaderReplacesExistingValue() {
        RequestDescriptor withKey = REQUEST.withHeader("X-Api-Key", "old");

        RequestDescriptor result = StandardInterceptors.auth("new", "X-Api-Key", null).intercept(withKey, CONTEXT);

        assertEquals(List.of("new"), result.getHeaders().get("X-Api-Key"));
    }

    @Test
    void testErrorHandlerOnlySeesFailedResponses() {
        List<Integer> seen = new ArrayList<>();
        ResponseInterceptor handler = StandardInterceptors.errorHandler(response -> seen.add(response.getStatus()));

        ResponseDescriptor ok = StubTransport.response(200, "ok");
        assertSame(ok, handler.intercept(ok, CONTEXT));
        handler.intercept(StubTransport.response(503, "down"), CONTEXT);

        assertEquals(List.of(503), seen);
        assertEquals("error-handler", handler.getName());
    }

    @Test
    void testTransformAdapters() {
        RequestInterceptor upgrade = StandardInterceptors.requestTransform("https-upgrade",
                request -> request.withUrl(request.getUrl().replace("http://", "https://")));
        ResponseInterceptor tag = StandardInterceptors.responseTransform("tag",
                response -> response.withHeader("X-Seen", "true"));

        assertEquals("https://plain.example.com",
                upgrade.intercept(RequestDescriptor.get("http://plain.example.com"), CONTEXT).getUrl());
        assertEquals("true", tag.intercept(StubTransport.response(200, ""), CONTEXT).getHeaders().getFirst("X-Seen"));
        assertEquals("https-upgrade", upgrade.getName());
    }

    @Test
    void testRequestLoggerPassesRequestThrough() {
        assertSame(REQUEST, StandardInterceptors.requestLogger().intercept(REQUEST, CONTEXT));
    }
}
