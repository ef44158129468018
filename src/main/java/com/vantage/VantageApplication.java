package com.vantage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Vantage dashboard back end.
 *
 * Serves the security operations and item valuation dashboards over GraphQL:
 * - request-scoped batch loading on top of java-dataloader
 * - live subscriptions with per-subscriber filtering and bounded buffers
 * - bounded correlation graph walks around a security event
 */
@SpringBootApplication
public class VantageApplication {

    public static void main(String[] args) {
        SpringApplication.run(VantageApplication.class, args);
    }
}
