package com.detour.controller;

import com.detour.model.dto.DispatchRequest;
import com.detour.model.dto.DispatchResult;
import com.detour.service.DispatchService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Relays a JSON-described request through the dispatcher, with provenance headers.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class DispatchController {

    private final DispatchService dispatchService;

    public DispatchController(DispatchService dispatchService) {
        this.dispatchService = dispatchService;
    }

    @PostMapping(value = "/dispatch", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<DispatchResult>> dispatch(@RequestBody DispatchRequest request) {
        log.info("Received dispatch request: {} {}", request.getMethod(), request.getUrl());

        return Mono.fromCallable(request::toDescriptor)
                .flatMap(dispatchService::dispatch)
                .map(response -> {
                    HttpHeaders headers = new HttpHeaders();
                    headers.add("x-detour-source", response.getSource().name().toLowerCase());
                    headers.add("x-detour-status", String.valueOf(response.getStatus()));

                    // the relayed status travels in the body; the relay itself succeeded
                    return ResponseEntity.ok()
                            .headers(headers)
                            .body(DispatchResult.from(response));
                });
    }
}
