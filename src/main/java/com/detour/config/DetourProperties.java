package com.detour.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Configuration properties for Detour.
 */
@Data
@Component
@ConfigurationProperties(prefix = "detour")
public class DetourProperties {

    private InterceptConfig intercept = new InterceptConfig();
    private LoggingConfig logging = new LoggingConfig();
    private MockingConfig mocking = new MockingConfig();
    private CacheConfig cache = new CacheConfig();
    private RetryConfig retry = new RetryConfig();
    private TransportConfig transport = new TransportConfig();

    @Data
    public static class InterceptConfig {
        /**
         * Whether dispatch wraps the transport at all.
         */
        private boolean enabled = true;
        private boolean requestTransform = true;
        private boolean responseTransform = true;
    }

    @Data
    public static class LoggingConfig {
        private boolean enabled = true;
        private int maxEntries = 100;
    }

    @Data
    public static class MockingConfig {
        private boolean enabled = false;
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = false;
        private Duration duration = Duration.ofMinutes(5);
    }

    @Data
    public static class RetryConfig {
        private boolean enabled = true;
        private int maxRetries = 3;

        /**
         * Base delay; retry k waits delay * 2^k.
         */
        private Duration delay = Duration.ofSeconds(1);
        private boolean onNetworkError = true;
        private boolean onTimeout = true;
    }

    @Data
    public static class TransportConfig {
        /**
         * Per-attempt deadline used when a request carries none.
         */
        private Duration timeout = Duration.ofSeconds(10);

        /**
         * Largest response body buffered in memory; negative means unbounded.
         */
        private DataSize maxBodySize = DataSize.ofMegabytes(16);
    }
}
