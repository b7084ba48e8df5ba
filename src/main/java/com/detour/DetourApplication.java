package com.detour;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Detour - HTTP interception and resilience layer
 * with mocking, caching, retry and request logging.
 */
@SpringBootApplication
public class DetourApplication {

    public static void main(String[] args) {
        SpringApplication.run(DetourApplication.class, args);
    }
}
