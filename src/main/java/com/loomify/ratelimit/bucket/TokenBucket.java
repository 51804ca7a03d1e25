package com.loomify.ratelimit.bucket;

import com.loomify.ratelimit.exception.RateLimitConfigurationException;
import com.loomify.ratelimit.model.BandwidthLimit;
import com.loomify.ratelimit.model.BucketSpec;
import com.loomify.ratelimit.model.RateLimitResult;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import io.github.bucket4j.TimeMeter;
import io.github.bucket4j.local.LocalBucketBuilder;
import io.github.bucket4j.local.SynchronizationStrategy;

import java.time.Duration;

/**
 * Token bucket holding one token count per tier of a {@link BucketSpec}.
 *
 * <h2>Consumption rules:</h2>
 * <ul>
 *   <li>Every tier refills greedily: tokens accrue continuously in proportion
 *       to elapsed time, capped at capacity</li>
 *   <li>A request is admitted only if every tier holds at least {@code cost}
 *       tokens; then all tiers are debited</li>
 *   <li>A denied request debits nothing; the reported wait is the longest
 *       among the under-supplied tiers</li>
 *   <li>The reported remaining count is that of the most constrained tier</li>
 * </ul>
 *
 * <p>Backed by a Bucket4j local bucket with lock-free synchronization, so
 * concurrent consumers of one bucket are linearized without a lock shared
 * between buckets.</p>
 */
public final class TokenBucket {

    private final Bucket bucket;

    private TokenBucket(Bucket bucket) {
        this.bucket = bucket;
    }

    /**
     * Creates a bucket filled to each tier's initial tokens.
     *
     * @param spec      the tiers to enforce
     * @param timeMeter time source used for refill
     * @return a new bucket
     * @throws RateLimitConfigurationException if Bucket4j rejects a tier
     */
    public static TokenBucket create(BucketSpec spec, TimeMeter timeMeter) {
        LocalBucketBuilder builder = Bucket.builder()
            .withCustomTimePrecision(timeMeter)
            .withSynchronizationStrategy(SynchronizationStrategy.LOCK_FREE);
        try {
            for (BandwidthLimit limit : spec.limits()) {
                builder.addLimit(toBandwidth(limit));
            }
            return new TokenBucket(builder.build());
        } catch (IllegalArgumentException ex) {
            throw new RateLimitConfigurationException("Invalid bucket configuration " + spec.limits(), ex);
        }
    }

    static Bandwidth toBandwidth(BandwidthLimit limit) {
        return Bandwidth
            .classic(limit.capacity(), Refill.greedy(limit.refillTokens(), limit.refillPeriod()))
            .withInitialTokens(limit.effectiveInitialTokens());
    }

    /**
     * Attempts to take one token from every tier.
     */
    public RateLimitResult tryConsume() {
        return tryConsume(1);
    }

    /**
     * Attempts to take {@code cost} tokens from every tier, atomically.
     *
     * @param cost tokens to take, positive
     * @return Allowed with the remaining count, or Denied with the wait
     */
    public RateLimitResult tryConsume(long cost) {
        if (cost <= 0) {
            throw new IllegalArgumentException("cost must be positive, got: " + cost);
        }
        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(cost);
        if (probe.isConsumed()) {
            return RateLimitResult.allowed(probe.getRemainingTokens());
        }
        return RateLimitResult.denied(Duration.ofNanos(probe.getNanosToWaitForRefill()));
    }

    /**
     * Tokens currently available in the most constrained tier, after refill.
     */
    public long availableTokens() {
        return bucket.getAvailableTokens();
    }
}
