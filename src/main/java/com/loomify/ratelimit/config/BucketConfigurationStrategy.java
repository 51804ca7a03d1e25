package com.loomify.ratelimit.config;

import com.loomify.ratelimit.exception.RateLimitConfigurationException;
import com.loomify.ratelimit.model.BandwidthLimit;
import com.loomify.ratelimit.model.BucketSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Builds bucket specifications from the rate limit properties.
 *
 * <p>This is the seam between declarative configuration and the bucket
 * engine. It is consulted once per bucket creation; steady-state requests are
 * served from the bucket cache.</p>
 */
public class BucketConfigurationStrategy {

    private static final Logger logger = LoggerFactory.getLogger(BucketConfigurationStrategy.class);

    private final RateLimitProperties properties;

    public BucketConfigurationStrategy(RateLimitProperties properties) {
        this.properties = properties;
    }

    /**
     * Builds the layered specification for authentication endpoints.
     *
     * <p>All configured tiers are combined; each one must have capacity for a
     * request to pass.</p>
     *
     * @return the AUTH bucket specification
     * @throws RateLimitConfigurationException if no auth limit is configured
     */
    public BucketSpec buildAuthSpec() {
        List<BandwidthLimit> limits = properties.getAuth().getLimits();
        logger.debug("Creating auth bucket specification with {} limits", limits == null ? 0 : limits.size());

        BucketSpec spec = new BucketSpec(limits);
        spec.limits().forEach(limit -> logger.debug("Auth limit: {}", limit));
        return spec;
    }

    /**
     * Builds the single-tier specification for a pricing plan.
     *
     * @param planName the plan name, matched case-insensitively
     * @return the BUSINESS bucket specification for the plan
     * @throws RateLimitConfigurationException if the plan has no configured limit
     */
    public BucketSpec buildBusinessSpec(String planName) {
        String key = planName == null ? "" : planName.toLowerCase(Locale.ROOT);
        BandwidthLimit limit = properties.getBusiness().getPricingPlans().get(key);
        if (limit == null) {
            throw new RateLimitConfigurationException(String.format(
                "Unknown pricing plan: %s. Available plans: %s",
                planName, properties.getBusiness().getPricingPlans().keySet()));
        }

        logger.debug("Creating business bucket specification for plan {}: {}", key, limit);
        return BucketSpec.of(limit);
    }

    /**
     * Path fragments treated as authentication endpoints.
     */
    public List<String> authEndpoints() {
        return properties.getAuth().getEndpoints();
    }

    /**
     * Path prefixes treated as business endpoints.
     */
    public List<String> businessEndpoints() {
        return properties.getBusiness().getEndpoints();
    }

    public boolean isAuthRateLimitEnabled() {
        return properties.isEnabled() && properties.getAuth().isEnabled();
    }

    public boolean isBusinessRateLimitEnabled() {
        return properties.isEnabled() && properties.getBusiness().isEnabled();
    }
}
