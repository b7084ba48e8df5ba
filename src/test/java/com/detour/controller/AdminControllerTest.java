package com.detour.controller;

import com.detour.config.DetourProperties;
import com.detour.interceptor.InterceptorException;
import com.detour.interceptor.RequestInterceptor;
import com.detour.model.MockResponse;
import com.detour.model.MockRule;
import com.detour.model.dto.DispatchRequest;
import com.detour.service.DispatchService;
import com.detour.support.StubTransport;
import com.detour.transport.TransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AdminController, DispatchController and ErrorHandler.
 */
class AdminControllerTest {

    private DetourProperties properties;
    private StubTransport transport;
    private DispatchService dispatchService;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        properties = new DetourProperties();
        transport = StubTransport.always(200);
        dispatchService = DispatchService.create(properties, transport);
        client = bind(dispatchService);
    }

    private static WebTestClient bind(DispatchService service) {
        return WebTestClient.bindToController(new AdminController(service), new DispatchController(service))
                .controllerAdvice(new ErrorHandler())
                .build();
    }

    private WebTestClient.ResponseSpec dispatch(String method, String url) {
        return client.post().uri("/v1/dispatch")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(DispatchRequest.builder().method(method).url(url).build())
                .exchange();
    }

    @Test
    void testDispatchRelaysNetworkResponse() {
        dispatch("GET", "https://api.example.com/items")
                .expectStatus().isOk()
                .expectHeader().valueEquals("x-detour-source", "network")
                .expectHeader().valueEquals("x-detour-status", "200")
                .expectBody()
                .jsonPath("$.status").isEqualTo(200)
                .jsonPath("$.body").isEqualTo("call-0");

        assertEquals(1, transport.getCallCount());
    }

    @Test
    void testDispatchServesMock() {
        dispatchService.addMockRule(MockRule.of("/users", "GET", MockResponse.json(Map.of("name", "Ada"))));
        dispatchService.enableMocking();

        dispatch("GET", "https://api.example.com/users/1")
                .expectStatus().isOk()
                .expectHeader().valueEquals("x-detour-source", "mock")
                .expectBody()
                .jsonPath("$.body").isEqualTo("{\"name\":\"Ada\"}");

        assertEquals(0, transport.getCallCount());
    }

    @Test
    void testMissingUrlIsBadRequest() {
        dispatch("GET", " ")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("BAD_REQUEST");
    }

    @Test
    void testNetworkFailureMapsToBadGateway() {
        properties.getRetry().setEnabled(false);
        WebTestClient failing = bind(DispatchService.create(properties,
                StubTransport.failing(TransportException.network("connection refused", null))));

        failing.post().uri("/v1/dispatch")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(DispatchRequest.builder().url("https://down.example.com").build())
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.code").isEqualTo("UPSTREAM_UNREACHABLE")
                .jsonPath("$.kind").isEqualTo("NETWORK");
    }

    @Test
    void testTimeoutMapsToGatewayTimeout() {
        properties.getRetry().setEnabled(false);
        WebTestClient failing = bind(DispatchService.create(properties,
                StubTransport.failing(TransportException.timeout("too slow", null))));

        failing.post().uri("/v1/dispatch")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(DispatchRequest.builder().url("https://slow.example.com").build())
                .exchange()
                .expectStatus().isEqualTo(504)
                .expectBody()
                .jsonPath("$.code").isEqualTo("UPSTREAM_TIMEOUT");
    }

    @Test
    void testInterceptorFailureMapsToServerError() {
        dispatchService.addRequestInterceptor(RequestInterceptor.named("broken", (request, context) -> {
            throw new IllegalStateException("nope");
        }));

        dispatch("GET", "https://api.example.com/items")
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.code").isEqualTo("INTERCEPTOR_FAILED")
                .jsonPath("$.interceptor").isEqualTo("broken");

        assertEquals(0, transport.getCallCount());
    }

    @Test
    void testLogAndStats() {
        dispatch("GET", "https://api.example.com/a").expectStatus().isOk();

        client.get().uri("/v1/admin/log")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].type").isEqualTo("request")
                .jsonPath("$[1].type").isEqualTo("response")
                .jsonPath("$[1].status").isEqualTo(200);

        client.get().uri("/v1/admin/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.total").isEqualTo(1)
                .jsonPath("$.successful").isEqualTo(1)
                .jsonPath("$.successRate").isEqualTo(100.0);

        client.delete().uri("/v1/admin/log").exchange().expectStatus().isNoContent();
        assertTrue(dispatchService.getLog().isEmpty());
    }

    @Test
    void testMockAdministration() {
        dispatchService.addMockRule(MockRule.of("/orders", "POST", MockResponse.status(201)));

        client.get().uri("/v1/admin/mocks")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.enabled").isEqualTo(false)
                .jsonPath("$.rules[0].position").isEqualTo(0)
                .jsonPath("$.rules[0].method").isEqualTo("POST");

        client.post().uri("/v1/admin/mocking/enable").exchange().expectStatus().isOk();
        assertTrue(dispatchService.isMockingEnabled());

        client.delete().uri("/v1/admin/mocks").exchange().expectStatus().isNoContent();
        assertTrue(dispatchService.getMockRules().isEmpty());
    }

    @Test
    void testInterceptionSwitch() {
        client.post().uri("/v1/admin/intercept/disable")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.intercept").isEqualTo(false);
        assertFalse(dispatchService.isEnabled());

        dispatch("GET", "https://api.example.com/a").expectStatus().isOk();
        assertTrue(dispatchService.getLog().isEmpty(), "bypassed dispatches are not logged");

        client.post().uri("/v1/admin/intercept/enable").exchange().expectStatus().isOk();
        assertTrue(dispatchService.isEnabled());
    }

    @Test
    void testCacheEndpoints() {
        client.get().uri("/v1/admin/cache/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.entries").isEqualTo(0);

        client.post().uri("/v1/admin/cache/clear")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("success");
    }

    @Test
    void testInterceptorListing() {
        dispatchService.addRequestInterceptor(RequestInterceptor.named("auth", (request, context) -> request));

        client.get().uri("/v1/admin/interceptors")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.request[0]").isEqualTo("auth");
    }

    @Test
    void testInterceptorExceptionMessageNamesPhase() {
        InterceptorException error = new InterceptorException("auth", InterceptorException.Phase.REQUEST,
                new IllegalStateException("no token"));
        assertTrue(error.getMessage().startsWith("request interceptor 'auth' failed"));
    }
}
