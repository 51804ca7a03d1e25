package com.loomify.ratelimit.model;

import com.loomify.ratelimit.exception.RateLimitConfigurationException;

import java.time.Duration;

/**
 * Declarative description of one rate limit tier.
 *
 * <p>A tier holds at most {@code capacity} tokens and regains
 * {@code refillTokens} tokens per {@code refillPeriod}, accrued continuously.
 * A freshly created bucket starts with {@code initialTokens} tokens, or full
 * capacity when none are given.</p>
 *
 * <p>Bound directly from {@code application.yml}, so a malformed tier fails the
 * application at startup.</p>
 *
 * @param name          diagnostic name, e.g. "per-minute"
 * @param capacity      maximum number of tokens
 * @param refillTokens  tokens added per refill period
 * @param refillPeriod  period over which {@code refillTokens} are added
 * @param initialTokens tokens available on creation, {@code null} for capacity
 */
public record BandwidthLimit(
        String name,
        long capacity,
        long refillTokens,
        Duration refillPeriod,
        Long initialTokens) {

    public BandwidthLimit {
        if (capacity <= 0) {
            throw new RateLimitConfigurationException(
                String.format("Limit '%s': capacity must be positive, got: %d", name, capacity));
        }
        if (refillTokens <= 0) {
            throw new RateLimitConfigurationException(
                String.format("Limit '%s': refill tokens must be positive, got: %d", name, refillTokens));
        }
        if (refillPeriod == null || refillPeriod.isNegative() || refillPeriod.isZero()) {
            throw new RateLimitConfigurationException(
                String.format("Limit '%s': refill period must be positive, got: %s", name, refillPeriod));
        }
        if (refillTokens > periodNanos(name, refillPeriod)) {
            throw new RateLimitConfigurationException(
                String.format("Limit '%s': refill rate of %d tokens per %s exceeds 1 token per nanosecond",
                    name, refillTokens, refillPeriod));
        }
        if (initialTokens != null && (initialTokens < 0 || initialTokens > capacity)) {
            throw new RateLimitConfigurationException(
                String.format("Limit '%s': initial tokens must be between 0 and %d, got: %d",
                    name, capacity, initialTokens));
        }
    }

    private static long periodNanos(String name, Duration refillPeriod) {
        try {
            return refillPeriod.toNanos();
        } catch (ArithmeticException ex) {
            throw new RateLimitConfigurationException(
                String.format("Limit '%s': refill period is too long, got: %s", name, refillPeriod), ex);
        }
    }

    /**
     * Creates a limit that starts full.
     */
    public static BandwidthLimit of(String name, long capacity, long refillTokens, Duration refillPeriod) {
        return new BandwidthLimit(name, capacity, refillTokens, refillPeriod, null);
    }

    /**
     * Returns the number of tokens a new bucket starts with.
     *
     * @return the configured initial tokens, or capacity when unset
     */
    public long effectiveInitialTokens() {
        return initialTokens != null ? initialTokens : capacity;
    }

    @Override
    public String toString() {
        return name + "{capacity=" + capacity + ", refill=" + refillTokens + "/" + refillPeriod + "}";
    }
}
