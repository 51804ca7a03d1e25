package com.loomify.ratelimit.model;

import java.time.Duration;

/**
 * Outcome of a token consumption attempt.
 *
 * <p>A denial is a normal value, not an error. Callers branch on the two
 * variants: {@link Allowed} continues the request, {@link Denied} rejects it
 * with a wait duration.</p>
 */
public sealed interface RateLimitResult permits RateLimitResult.Allowed, RateLimitResult.Denied {

    static Allowed allowed(long remainingTokens) {
        return new Allowed(remainingTokens);
    }

    static Denied denied(Duration retryAfter) {
        return new Denied(retryAfter);
    }

    boolean isAllowed();

    /**
     * The request was admitted.
     *
     * @param remainingTokens tokens left in the most constrained tier
     */
    record Allowed(long remainingTokens) implements RateLimitResult {

        public Allowed {
            if (remainingTokens < 0) {
                throw new IllegalArgumentException("remainingTokens must be non-negative, got: " + remainingTokens);
            }
        }

        @Override
        public boolean isAllowed() {
            return true;
        }
    }

    /**
     * The request was rejected.
     *
     * @param retryAfter time until every tier can serve the request again
     */
    record Denied(Duration retryAfter) implements RateLimitResult {

        public Denied {
            if (retryAfter == null || retryAfter.isNegative()) {
                throw new IllegalArgumentException("retryAfter must be non-negative, got: " + retryAfter);
            }
        }

        @Override
        public boolean isAllowed() {
            return false;
        }

        /**
         * Retry-after rounded up to whole seconds, so that waiting this long
         * is always enough.
         */
        public long retryAfterSeconds() {
            long seconds = retryAfter.getSeconds();
            return retryAfter.getNano() > 0 ? seconds + 1 : seconds;
        }
    }
}
