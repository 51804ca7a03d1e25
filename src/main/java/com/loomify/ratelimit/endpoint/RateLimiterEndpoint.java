package com.loomify.ratelimit.endpoint;

import com.loomify.ratelimit.config.BucketConfigurationStrategy;
import com.loomify.ratelimit.config.RateLimitProperties;
import com.loomify.ratelimit.model.BandwidthLimit;
import com.loomify.ratelimit.service.RateLimiterService;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Actuator endpoint exposing rate limiter state at {@code /actuator/ratelimiter}.
 *
 * <p>Reports the number of cached buckets, the strategy switches and the names
 * of the configured auth limits and pricing plans.</p>
 */
@Component
@Endpoint(id = "ratelimiter")
public class RateLimiterEndpoint {

    private final RateLimiterService rateLimiterService;
    private final BucketConfigurationStrategy configurationStrategy;
    private final RateLimitProperties properties;

    public RateLimiterEndpoint(
            RateLimiterService rateLimiterService,
            BucketConfigurationStrategy configurationStrategy,
            RateLimitProperties properties) {
        this.rateLimiterService = rateLimiterService;
        this.configurationStrategy = configurationStrategy;
        this.properties = properties;
    }

    @ReadOperation
    public Map<String, Object> rateLimiterStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("cacheSize", rateLimiterService.getCacheSize());
        status.put("authEnabled", configurationStrategy.isAuthRateLimitEnabled());
        status.put("businessEnabled", configurationStrategy.isBusinessRateLimitEnabled());
        status.put("authLimits", properties.getAuth().getLimits().stream().map(BandwidthLimit::name).toList());
        status.put("pricingPlans", new ArrayList<>(properties.getBusiness().getPricingPlans().keySet()));
        return status;
    }
}
