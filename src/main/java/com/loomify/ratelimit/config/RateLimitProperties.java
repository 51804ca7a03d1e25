package com.loomify.ratelimit.config;

import com.loomify.ratelimit.model.BandwidthLimit;
import com.loomify.ratelimit.model.PricingPlan;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rate limiting settings bound from {@code app.rate-limit.*}.
 *
 * <h2>Example:</h2>
 * <pre>
 * app:
 *   rate-limit:
 *     enabled: true
 *     auth:
 *       limits:
 *         - name: per-minute
 *           capacity: 10
 *           refill-tokens: 10
 *           refill-period: 1m
 *     business:
 *       pricing-plans:
 *         basic:
 *           name: basic-plan
 *           capacity: 40
 *           refill-tokens: 40
 *           refill-period: 1h
 * </pre>
 *
 * <p>Every limit is validated while binding, so a malformed tier stops the
 * application from starting.</p>
 */
@ConfigurationProperties(prefix = "app.rate-limit")
public class RateLimitProperties {

    /**
     * Global switch for all rate limiting.
     */
    private boolean enabled = true;

    private final Auth auth = new Auth();

    private final Business business = new Business();

    private final Executor executor = new Executor();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Auth getAuth() {
        return auth;
    }

    public Business getBusiness() {
        return business;
    }

    public Executor getExecutor() {
        return executor;
    }

    /**
     * Authentication endpoint limits, applied per client IP.
     */
    public static class Auth {

        private boolean enabled = true;

        /**
         * Path fragments identifying authentication endpoints.
         */
        private List<String> endpoints = new ArrayList<>(List.of(
            "/api/auth/login",
            "/api/auth/register",
            "/api/auth/password/reset",
            "/api/auth/refresh-token",
            "/api/auth/token/refresh",
            "/api/auth/federated"
        ));

        /**
         * Tiers applied together, e.g. a burst tier and a sustained tier.
         */
        private List<BandwidthLimit> limits = new ArrayList<>(List.of(
            BandwidthLimit.of("per-minute", 10, 10, Duration.ofMinutes(1)),
            BandwidthLimit.of("per-hour", 100, 100, Duration.ofHours(1))
        ));

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getEndpoints() {
            return endpoints;
        }

        public void setEndpoints(List<String> endpoints) {
            this.endpoints = endpoints;
        }

        public List<BandwidthLimit> getLimits() {
            return limits;
        }

        public void setLimits(List<BandwidthLimit> limits) {
            this.limits = limits;
        }
    }

    /**
     * Business endpoint limits, one per pricing plan, applied per API key.
     */
    public static class Business {

        private boolean enabled = true;

        /**
         * Path prefixes identifying business endpoints.
         */
        private List<String> endpoints = new ArrayList<>(List.of("/api/"));

        /**
         * Plan name (lower case) to limit.
         */
        private Map<String, BandwidthLimit> pricingPlans = defaultPricingPlans();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getEndpoints() {
            return endpoints;
        }

        public void setEndpoints(List<String> endpoints) {
            this.endpoints = endpoints;
        }

        public Map<String, BandwidthLimit> getPricingPlans() {
            return pricingPlans;
        }

        /**
         * Replaces the plan map, normalizing plan names to lower case.
         */
        public void setPricingPlans(Map<String, BandwidthLimit> pricingPlans) {
            Map<String, BandwidthLimit> normalized = new LinkedHashMap<>();
            pricingPlans.forEach((plan, limit) -> normalized.put(plan.toLowerCase(Locale.ROOT), limit));
            this.pricingPlans = normalized;
        }

        private static Map<String, BandwidthLimit> defaultPricingPlans() {
            Map<String, BandwidthLimit> plans = new LinkedHashMap<>();
            for (PricingPlan plan : PricingPlan.values()) {
                plans.put(plan.planName(), plan.defaultLimit());
            }
            return plans;
        }
    }

    /**
     * Bounded pool used by asynchronous consumption.
     */
    public static class Executor {

        private int corePoolSize = 4;

        private int maxPoolSize = 16;

        private int queueCapacity = 500;

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }
}
