package com.loomify.ratelimit.model;

import com.loomify.ratelimit.exception.RateLimitConfigurationException;

import java.util.List;

/**
 * Ordered set of bandwidth limits that must all have capacity for a request
 * to be admitted (for example a per-minute burst tier AND a per-hour
 * sustained tier).
 *
 * @param limits the tiers, never empty
 */
public record BucketSpec(List<BandwidthLimit> limits) {

    public BucketSpec {
        if (limits == null || limits.isEmpty()) {
            throw new RateLimitConfigurationException("A bucket requires at least one bandwidth limit");
        }
        limits = List.copyOf(limits);
    }

    public static BucketSpec of(BandwidthLimit... limits) {
        return new BucketSpec(List.of(limits));
    }

    public int size() {
        return limits.size();
    }
}
