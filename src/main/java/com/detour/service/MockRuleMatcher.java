package com.detour.service;

import com.detour.config.DetourProperties;
import com.detour.model.MockResponse;
import com.detour.model.MockRule;
import com.detour.model.RequestDescriptor;
import com.detour.model.ResponseDescriptor;
import com.detour.model.ResponseSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Matches requests against registered mock rules and synthesizes responses.
 *
 * <p>Rules are evaluated in registration order and the first match wins.
 * While mocking is disabled no rule is evaluated, but rules can still be
 * registered ahead of time.
 */
@Slf4j
@Service
public class MockRuleMatcher {

    private final List<MockRule> rules = new CopyOnWriteArrayList<>();
    private final ObjectMapper objectMapper;
    private volatile boolean enabled;

    public MockRuleMatcher(DetourProperties properties, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.enabled = properties.getMocking().isEnabled();
    }

    public Optional<ResponseDescriptor> match(RequestDescriptor request) {
        if (!enabled) {
            return Optional.empty();
        }

        for (MockRule rule : rules) {
            if (rule.matches(request)) {
                log.debug("Mock rule '{}' matched {} {}", rule.describe(), request.getMethod(), request.getUrl());
                MockResponse mock = rule.getResponder().respond(request);
                return Optional.of(toResponse(request, mock));
            }
        }

        return Optional.empty();
    }

    public void addRule(MockRule rule) {
        rules.add(Objects.requireNonNull(rule, "rule"));
        log.info("Registered mock rule '{}' (mocking {})", rule.describe(), enabled ? "enabled" : "disabled");
    }

    public boolean removeRule(MockRule rule) {
        return rules.removeIf(existing -> existing == rule);
    }

    public void clearRules() {
        rules.clear();
        log.info("Mock rules cleared");
    }

    public List<MockRule> getRules() {
        return List.copyOf(rules);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
        log.info("Mocking {}", enabled ? "enabled" : "disabled");
    }

    private ResponseDescriptor toResponse(RequestDescriptor request, MockResponse mock) {
        if (mock == null) {
            throw new IllegalStateException("Mock responder returned no response for " + request.getUrl());
        }

        HttpHeaders headers = new HttpHeaders();
        if (mock.getHeaders().isEmpty()) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        } else {
            mock.getHeaders().forEach(headers::add);
        }

        return ResponseDescriptor.builder()
                .status(mock.getStatus())
                .statusText(mock.getStatusText())
                .url(request.getUrl())
                .headers(headers)
                .body(renderBody(mock))
                .source(ResponseSource.MOCK)
                .build();
    }

    private byte[] renderBody(MockResponse mock) {
        if (mock.getBody() != null) {
            return mock.getBody().getBytes(StandardCharsets.UTF_8);
        }
        if (mock.getData() == null) {
            return new byte[0];
        }
        try {
            return objectMapper.writeValueAsBytes(mock.getData());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Mock data is not serializable to JSON", e);
        }
    }
}
