package com.loomify.ratelimit.service;

import com.loomify.ratelimit.bucket.TokenBucket;
import com.loomify.ratelimit.config.BucketConfigurationStrategy;
import com.loomify.ratelimit.model.BucketSpec;
import com.loomify.ratelimit.model.PricingPlan;
import com.loomify.ratelimit.model.RateLimitResult;
import com.loomify.ratelimit.model.RateLimitStrategy;
import io.github.bucket4j.TimeMeter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Owns the token buckets, one per strategy and identifier.
 *
 * <p>Buckets are created on first use from the {@link BucketConfigurationStrategy}
 * and cached for subsequent requests under {@code "<STRATEGY>:<identifier>"}.
 * Creation goes through {@link ConcurrentHashMap#computeIfAbsent}, so concurrent
 * first requests for one identifier share a single bucket.</p>
 *
 * <p><b>Note:</b> the cache is in-memory and unbounded. It suits single-instance
 * deployments; entries for identifiers that stop sending traffic are kept until
 * the process exits.</p>
 */
@Service
public class RateLimiterService {

    private static final Logger logger = LoggerFactory.getLogger(RateLimiterService.class);

    // Number of characters shown when logging an API key
    private static final int IDENTIFIER_PREVIEW_LENGTH = 10;

    private final BucketConfigurationStrategy configurationStrategy;
    private final PricingPlanResolver pricingPlanResolver;
    private final TimeMeter timeMeter;
    private final Executor executor;

    private final Map<String, TokenBucket> cache = new ConcurrentHashMap<>();

    public RateLimiterService(
            BucketConfigurationStrategy configurationStrategy,
            PricingPlanResolver pricingPlanResolver,
            TimeMeter timeMeter,
            @Qualifier("rateLimitExecutor") Executor executor) {
        this.configurationStrategy = configurationStrategy;
        this.pricingPlanResolver = pricingPlanResolver;
        this.timeMeter = timeMeter;
        this.executor = executor;
    }

    /**
     * Consumes one token for an identifier under a strategy.
     *
     * @param identifier the client IP or API key
     * @param strategy   the strategy selecting the bucket configuration
     * @return Allowed with the remaining tokens, or Denied with the retry-after
     * @throws com.loomify.ratelimit.exception.RateLimitConfigurationException
     *         if the bucket cannot be built from the configuration
     */
    public RateLimitResult consume(String identifier, RateLimitStrategy strategy) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");

        TokenBucket bucket = cache.computeIfAbsent(
            strategy.cacheKey(identifier), key -> newBucket(identifier, strategy));
        RateLimitResult result = bucket.tryConsume();

        if (result instanceof RateLimitResult.Allowed allowed) {
            logger.debug("Token consumed for identifier: {}, strategy: {}, remaining: {}",
                loggable(identifier, strategy), strategy, allowed.remainingTokens());
        } else if (result instanceof RateLimitResult.Denied denied) {
            logger.warn("Rate limit exceeded for identifier: {}, strategy: {}, retry after: {}",
                loggable(identifier, strategy), strategy, denied.retryAfter());
        }
        return result;
    }

    /**
     * Same as {@link #consume(String, RateLimitStrategy)}, run on the bounded
     * rate limit executor.
     *
     * <p>A configuration error completes the future exceptionally.</p>
     */
    public CompletableFuture<RateLimitResult> consumeAsync(String identifier, RateLimitStrategy strategy) {
        return CompletableFuture.supplyAsync(() -> consume(identifier, strategy), executor);
    }

    /**
     * Returns the number of cached buckets.
     */
    public int getCacheSize() {
        return cache.size();
    }

    /**
     * Drops every cached bucket. Test support only.
     */
    public void clearCache() {
        cache.clear();
        logger.debug("Cleared all cached buckets");
    }

    private TokenBucket newBucket(String identifier, RateLimitStrategy strategy) {
        BucketSpec spec;
        switch (strategy) {
            case AUTH -> {
                logger.debug("Creating AUTH bucket for identifier: {}", identifier);
                spec = configurationStrategy.buildAuthSpec();
            }
            case BUSINESS -> {
                PricingPlan plan = pricingPlanResolver.resolvePlan(identifier);
                logger.info("Resolved pricing plan {} for identifier {}", plan, preview(identifier));
                spec = configurationStrategy.buildBusinessSpec(plan.planName());
            }
            default -> throw new IllegalStateException("Unhandled strategy: " + strategy);
        }
        return TokenBucket.create(spec, timeMeter);
    }

    private static String loggable(String identifier, RateLimitStrategy strategy) {
        return strategy == RateLimitStrategy.BUSINESS ? preview(identifier) : identifier;
    }

    private static String preview(String identifier) {
        if (identifier.length() <= IDENTIFIER_PREVIEW_LENGTH) {
            return identifier;
        }
        return identifier.substring(0, IDENTIFIER_PREVIEW_LENGTH) + "...";
    }
}
