package com.loomify.ratelimit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the request admission rate limiter.
 *
 * <p>Applies token bucket limits to inbound HTTP requests:</p>
 * <ul>
 *   <li>Authentication endpoints: layered per-minute and per-hour limits per client IP</li>
 *   <li>Business endpoints: pricing-plan quota per API key</li>
 * </ul>
 */
@SpringBootApplication
public class RateLimiterApplication {

    /**
     * Application entry point.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(RateLimiterApplication.class, args);
    }
}
