package com.detour.service;

import com.detour.config.DetourProperties;
import com.detour.model.RequestDescriptor;
import com.detour.model.ResponseDescriptor;
import com.detour.model.ResponseSource;
import com.detour.support.MutableClock;
import com.detour.support.StubTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ResponseCache.
 */
class ResponseCacheTest {

    private MutableClock clock;
    private ResponseCache cache;

    @BeforeEach
    void setUp() {
        DetourProperties properties = new DetourProperties();
        properties.getCache().setEnabled(true);
        properties.getCache().setDuration(Duration.ofMillis(1000));
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        cache = new ResponseCache(properties, clock);
    }

    @Test
    void testLookupReturnsStoredResponseMarkedAsCached() {
        RequestDescriptor request = RequestDescriptor.get("https://api.example.com/items");
        cache.store(request, StubTransport.response(200, "items"));

        Optional<ResponseDescriptor> hit = cache.lookup(request);

        assertTrue(hit.isPresent());
        assertEquals("items", hit.get().getBodyAsString());
        assertEquals(ResponseSource.CACHE, hit.get().getSource());
    }

    @Test
    void testEntryExpiresLazilyOnLookup() {
        RequestDescriptor request = RequestDescriptor.get("https://api.example.com/items");
        cache.store(request, StubTransport.response(200, "items"));

        clock.advance(Duration.ofMillis(999));
        assertTrue(cache.lookup(request).isPresent());

        clock.advance(Duration.ofMillis(1));
        assertEquals(1, cache.size(), "expired entries stay until looked up");
        assertFalse(cache.lookup(request).isPresent());
        assertEquals(0, cache.size());
    }

    @Test
    void testKeyIncludesMethodAndRawUrl() {
        cache.store(RequestDescriptor.get("https://x/search?a=1&b=2"), StubTransport.response(200, "ab"));

        assertTrue(cache.lookup(RequestDescriptor.get("https://x/search?a=1&b=2")).isPresent());
        assertFalse(cache.lookup(RequestDescriptor.get("https://x/search?b=2&a=1")).isPresent());
        assertEquals("GET:https://x/search?a=1&b=2", ResponseCache.keyOf(RequestDescriptor.get("https://x/search?a=1&b=2")));
    }

    @Test
    void testOnlySuccessfulGetResponsesAreStored() {
        cache.store(RequestDescriptor.of("POST", "https://x/orders"), StubTransport.response(200, "created"));
        cache.store(RequestDescriptor.get("https://x/missing"), StubTransport.response(404, "nope"));

        assertEquals(0, cache.size());
        assertFalse(cache.lookup(RequestDescriptor.of("POST", "https://x/orders")).isPresent());
    }

    @Test
    void testCachedSnapshotIsIndependentOfReturnedCopies() {
        RequestDescriptor request = RequestDescriptor.get("https://x/data");
        cache.store(request, StubTransport.response(200, "original"));

        byte[] body = cache.lookup(request).orElseThrow().getBody();
        body[0] = 'X';

        assertEquals("original", cache.lookup(request).orElseThrow().getBodyAsString());
    }

    @Test
    void testDisabledCacheNeitherStoresNorServes() {
        RequestDescriptor request = RequestDescriptor.get("https://x/data");
        cache.setEnabled(false);
        cache.store(request, StubTransport.response(200, "data"));

        assertEquals(0, cache.size());
        assertFalse(cache.lookup(request).isPresent());
    }

    @Test
    void testClear() {
        cache.store(RequestDescriptor.get("https://x/1"), StubTransport.response(200, "1"));
        cache.store(RequestDescriptor.get("https://x/2"), StubTransport.response(200, "2"));

        cache.clear();

        assertEquals(0, cache.size());
    }
}
