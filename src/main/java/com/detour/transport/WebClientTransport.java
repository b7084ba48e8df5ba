package com.detour.transport;

import com.detour.model.RequestDescriptor;
import com.detour.model.ResponseDescriptor;
import com.detour.model.ResponseSource;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.WriteTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.concurrent.TimeoutException;

/**
 * Default transport backed by Spring's reactive {@link WebClient}.
 */
@Slf4j
@Component
public class WebClientTransport implements HttpTransport {

    private final WebClient webClient;

    public WebClientTransport(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public String getName() {
        return "webclient";
    }

    @Override
    public Mono<ResponseDescriptor> perform(RequestDescriptor request) {
        return Mono.defer(() -> {
            log.debug("Sending {} {}", request.getMethod(), request.getUrl());

            WebClient.RequestBodySpec spec = webClient.method(HttpMethod.valueOf(request.getMethod()))
                    .uri(URI.create(request.getUrl()))
                    .headers(headers -> headers.addAll(request.getHeaders()));

            WebClient.RequestHeadersSpec<?> ready = request.hasBody()
                    ? spec.bodyValue(request.getBody())
                    : spec;

            return ready.exchangeToMono(response -> toDescriptor(request, response));
        }).onErrorMap(WebClientRequestException.class, this::toTransportException);
    }

    private Mono<ResponseDescriptor> toDescriptor(RequestDescriptor request, ClientResponse response) {
        return response.bodyToMono(byte[].class)
                .defaultIfEmpty(new byte[0])
                .map(body -> ResponseDescriptor.builder()
                        .status(response.statusCode().value())
                        .url(request.getUrl())
                        .headers(response.headers().asHttpHeaders())
                        .body(body)
                        .source(ResponseSource.NETWORK)
                        .build());
    }

    private TransportException toTransportException(WebClientRequestException e) {
        String message = e.getMethod() + " " + e.getUri() + " failed: " + describe(e);
        if (isTimeout(e)) {
            return TransportException.timeout(message, e);
        }
        return TransportException.network(message, e);
    }

    /**
     * First message found along the cause chain, or the root cause's class name
     * when none has one (Netty's ReadTimeoutException, for one).
     */
    private static String describe(Throwable error) {
        Throwable current = error;
        Throwable root = error;
        while (current != null) {
            if (current.getMessage() != null) {
                return current.getMessage();
            }
            root = current;
            current = current.getCause() == current ? null : current.getCause();
        }
        return root.getClass().getSimpleName();
    }

    private boolean isTimeout(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ReadTimeoutException
                    || current instanceof WriteTimeoutException
                    || current instanceof SocketTimeoutException
                    || current instanceof TimeoutException) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
