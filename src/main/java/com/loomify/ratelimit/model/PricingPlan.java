package com.loomify.ratelimit.model;

import java.time.Duration;
import java.util.Locale;

/**
 * Pricing tiers for business API quotas.
 *
 * <p>Each plan carries the API key prefix that selects it and its default
 * hourly limit. The limits actually enforced come from the configured plan map,
 * keyed by {@link #planName()}; these defaults seed that map.</p>
 */
public enum PricingPlan {

    FREE(null, 20),
    BASIC("BX001-", 40),
    PROFESSIONAL("PX001-", 100);

    private static final Duration REFILL_PERIOD = Duration.ofHours(1);

    private final String apiKeyPrefix;
    private final long hourlyRequests;

    PricingPlan(String apiKeyPrefix, long hourlyRequests) {
        this.apiKeyPrefix = apiKeyPrefix;
        this.hourlyRequests = hourlyRequests;
    }

    /**
     * API key prefix for this plan, {@code null} for the fallback plan.
     */
    public String apiKeyPrefix() {
        return apiKeyPrefix;
    }

    /**
     * Lower-case plan name used as the configuration key, e.g. "professional".
     */
    public String planName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public BandwidthLimit defaultLimit() {
        return BandwidthLimit.of(planName() + "-plan", hourlyRequests, hourlyRequests, REFILL_PERIOD);
    }
}
