package com.detour.transport;

import com.detour.config.DetourProperties;
import com.detour.config.WebClientConfiguration;
import com.detour.model.RequestDescriptor;
import com.detour.model.ResponseDescriptor;
import com.detour.service.DispatchService;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for WebClientTransport over a real connector against a local HTTP server.
 */
class WebClientTransportServerTest {

    private static final int LARGE_BODY_SIZE = 300 * 1024;

    private HttpServer server;
    private ExecutorService executor;
    private String baseUrl;
    private DetourProperties properties;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/big", exchange -> {
            byte[] body = new byte[LARGE_BODY_SIZE];
            Arrays.fill(body, (byte) 'x');
            reply(exchange, 200, body);
        });
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(800);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            reply(exchange, 200, "late".getBytes(StandardCharsets.UTF_8));
        });
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

        properties = new DetourProperties();
        properties.getRetry().setEnabled(false);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        executor.shutdownNow();
    }

    private static void reply(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().add("Content-Type", "text/plain");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    private DispatchService dispatcher() {
        WebClientTransport transport = new WebClientTransport(new WebClientConfiguration(properties).webClient());
        return DispatchService.create(properties, transport);
    }

    @Test
    void testBodyLargerThanCodecDefaultIsReturned() {
        ResponseDescriptor response = dispatcher()
                .dispatch(RequestDescriptor.get(baseUrl + "/big"))
                .block(Duration.ofSeconds(10));

        assertNotNull(response);
        assertEquals(200, response.getStatus());
        assertEquals(LARGE_BODY_SIZE, response.getBodyLength());
    }

    @Test
    void testBodyOverConfiguredLimitFails() {
        properties.getTransport().setMaxBodySize(DataSize.ofKilobytes(64));
        DispatchService dispatchService = dispatcher();

        assertThrows(RuntimeException.class, () -> dispatchService
                .dispatch(RequestDescriptor.get(baseUrl + "/big"))
                .block(Duration.ofSeconds(10)));
        assertEquals(1, dispatchService.getStats().getFailed());
    }

    @Test
    void testRequestDeadlineLongerThanDefaultTimeoutIsHonoured() {
        properties.getTransport().setTimeout(Duration.ofMillis(300));
        RequestDescriptor request = RequestDescriptor.get(baseUrl + "/slow").toBuilder()
                .timeout(Duration.ofSeconds(5))
                .build();

        ResponseDescriptor response = dispatcher().dispatch(request).block(Duration.ofSeconds(10));

        assertNotNull(response);
        assertEquals(200, response.getStatus());
        assertEquals("late", response.getBodyAsString());
    }

    @Test
    void testDefaultTimeoutAppliesWhenRequestHasNoDeadline() {
        properties.getTransport().setTimeout(Duration.ofMillis(300));
        DispatchService dispatchService = dispatcher();

        TransportException error = assertThrows(TransportException.class, () -> dispatchService
                .dispatch(RequestDescriptor.get(baseUrl + "/slow"))
                .block(Duration.ofSeconds(10)));

        assertEquals(ErrorKind.TIMEOUT, error.getKind());
        assertFalse(error.getMessage().contains("null"), error.getMessage());
    }
}
