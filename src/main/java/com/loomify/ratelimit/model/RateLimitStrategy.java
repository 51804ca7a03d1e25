package com.loomify.ratelimit.model;

/**
 * Kind of rate limit applied to a request.
 */
public enum RateLimitStrategy {

    /**
     * Authentication endpoints: layered per-minute/per-hour limits per client IP
     * against brute force attacks.
     */
    AUTH,

    /**
     * Business endpoints: one pricing-plan limit per API key.
     */
    BUSINESS;

    /**
     * Builds the bucket cache key for an identifier under this strategy.
     *
     * <p>The strategy prefix keeps the same identifier in separate buckets
     * across strategies.</p>
     *
     * @param identifier the client IP or API key
     * @return {@code "<STRATEGY>:<identifier>"}
     */
    public String cacheKey(String identifier) {
        return name() + ":" + identifier;
    }
}
