package com.detour.controller;

import com.detour.model.LogEntry;
import com.detour.model.MockRule;
import com.detour.model.dto.InterceptorSummary;
import com.detour.model.dto.MockRuleSummary;
import com.detour.model.dto.RequestStats;
import com.detour.service.DispatchService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Admin API for the request log, statistics, mock rules and interception switches.
 */
@Slf4j
@RestController
@RequestMapping("/v1/admin")
public class AdminController {

    private final DispatchService dispatchService;

    public AdminController(DispatchService dispatchService) {
        this.dispatchService = dispatchService;
    }

    /**
     * Get the request log, oldest entry first.
     */
    @GetMapping("/log")
    public ResponseEntity<List<LogEntry>> getLog() {
        return ResponseEntity.ok(dispatchService.getLog());
    }

    @DeleteMapping("/log")
    public ResponseEntity<Void> clearLog() {
        log.info("Admin: Clearing request log");
        dispatchService.clearLog();
        return ResponseEntity.noContent().build();
    }

    /**
     * Get statistics derived from the current log contents.
     */
    @GetMapping("/stats")
    public ResponseEntity<RequestStats> getStats() {
        return ResponseEntity.ok(dispatchService.getStats());
    }

    @GetMapping("/interceptors")
    public ResponseEntity<InterceptorSummary> getInterceptors() {
        return ResponseEntity.ok(dispatchService.getInterceptors());
    }

    /**
     * List mock rules in evaluation order.
     */
    @GetMapping("/mocks")
    public ResponseEntity<Map<String, Object>> getMocks() {
        List<MockRule> rules = dispatchService.getMockRules();
        List<MockRuleSummary> summaries = new ArrayList<>();
        for (int i = 0; i < rules.size(); i++) {
            summaries.add(MockRuleSummary.from(i, rules.get(i)));
        }
        return ResponseEntity.ok(Map.of(
                "enabled", dispatchService.isMockingEnabled(),
                "rules", summaries
        ));
    }

    @DeleteMapping("/mocks")
    public ResponseEntity<Void> clearMocks() {
        log.warn("Admin: Clearing ALL mock rules");
        dispatchService.clearMockRules();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/mocking/enable")
    public ResponseEntity<Map<String, Object>> enableMocking() {
        dispatchService.enableMocking();
        return ResponseEntity.ok(Map.of("mocking", true));
    }

    @PostMapping("/mocking/disable")
    public ResponseEntity<Map<String, Object>> disableMocking() {
        dispatchService.disableMocking();
        return ResponseEntity.ok(Map.of("mocking", false));
    }

    @PostMapping("/intercept/enable")
    public ResponseEntity<Map<String, Object>> enableInterception() {
        log.info("Admin: Enabling interception");
        dispatchService.enable();
        return ResponseEntity.ok(Map.of("intercept", true));
    }

    @PostMapping("/intercept/disable")
    public ResponseEntity<Map<String, Object>> disableInterception() {
        log.warn("Admin: Disabling interception");
        dispatchService.disable();
        return ResponseEntity.ok(Map.of("intercept", false));
    }

    /**
     * Clear the response cache.
     */
    @PostMapping("/cache/clear")
    public ResponseEntity<Map<String, String>> clearCache() {
        log.info("Admin: Cache clear requested");
        dispatchService.clearCache();

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Response cache cleared"
        ));
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<Map<String, Object>> getCacheStats() {
        return ResponseEntity.ok(Map.of(
                "entries", dispatchService.getCacheSize()
        ));
    }
}
