package com.loomify.ratelimit.endpoint;

import com.loomify.ratelimit.config.BucketConfigurationStrategy;
import com.loomify.ratelimit.config.RateLimitProperties;
import com.loomify.ratelimit.model.RateLimitStrategy;
import com.loomify.ratelimit.service.PricingPlanResolver;
import com.loomify.ratelimit.service.RateLimiterService;
import com.loomify.ratelimit.support.ManualTimeMeter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RateLimiterEndpoint Tests")
class RateLimiterEndpointTest {

    @Test
    @DisplayName("status reports cache size, switches and configured limits")
    void shouldReportStatus() {
        RateLimitProperties properties = new RateLimitProperties();
        properties.getBusiness().setEnabled(false);
        BucketConfigurationStrategy configurationStrategy = new BucketConfigurationStrategy(properties);
        RateLimiterService service = new RateLimiterService(
            configurationStrategy, new PricingPlanResolver(), new ManualTimeMeter(), Runnable::run);
        service.consume("IP:10.0.0.1", RateLimitStrategy.AUTH);

        Map<String, Object> status =
            new RateLimiterEndpoint(service, configurationStrategy, properties).rateLimiterStatus();

        assertEquals(1, status.get("cacheSize"));
        assertEquals(Boolean.TRUE, status.get("authEnabled"));
        assertEquals(Boolean.FALSE, status.get("businessEnabled"));
        assertEquals(List.of("per-minute", "per-hour"), status.get("authLimits"));
        assertEquals(List.of("free", "basic", "professional"), status.get("pricingPlans"));
    }
}
