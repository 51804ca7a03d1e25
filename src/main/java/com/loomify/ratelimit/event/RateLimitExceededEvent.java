package com.loomify.ratelimit.event;

import com.loomify.ratelimit.model.RateLimitStrategy;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Event published when a request is denied by the rate limiter.
 *
 * <p>Consumed for security auditing, e.g. spotting brute force attempts
 * against authentication endpoints.</p>
 *
 * @param identifier     the identifier that exceeded the limit (IP or API key)
 * @param endpoint       the request path that was limited
 * @param attemptCount   attempts made in the window, if known
 * @param maxAttempts    attempts allowed in the window, if known
 * @param windowDuration time until the limit lifts
 * @param strategy       the strategy that denied the request
 * @param timestamp      when the limit was exceeded
 * @param resetTime      when the limit lifts, if known
 */
public record RateLimitExceededEvent(
        String identifier,
        String endpoint,
        Integer attemptCount,
        Integer maxAttempts,
        Duration windowDuration,
        RateLimitStrategy strategy,
        Instant timestamp,
        Instant resetTime) {

    public RateLimitExceededEvent {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Identifier cannot be blank");
        }
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("Endpoint cannot be blank");
        }
        if (attemptCount != null && maxAttempts != null) {
            if (attemptCount <= 0) {
                throw new IllegalArgumentException("Attempt count must be positive");
            }
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            if (attemptCount < maxAttempts) {
                throw new IllegalArgumentException("Attempt count must be >= max attempts for exceeded event");
            }
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    /**
     * Creates an event for a denial reported by the token bucket, which does not
     * count individual attempts.
     *
     * @param identifier the limited identifier
     * @param endpoint   the limited path
     * @param retryAfter the wait reported by the bucket
     * @param strategy   the strategy that denied the request
     * @return the event, timestamped now
     */
    public static RateLimitExceededEvent fromDenial(
            String identifier, String endpoint, Duration retryAfter, RateLimitStrategy strategy) {
        Instant now = Instant.now();
        return new RateLimitExceededEvent(
            identifier, endpoint, null, null, retryAfter, strategy, now, now.plus(retryAfter));
    }

    /**
     * Returns a human-readable description of the violation.
     */
    public String describe() {
        String attempts = attemptCount != null && maxAttempts != null
            ? ": " + attemptCount + "/" + maxAttempts + " attempts"
            : "";
        return "Rate limit exceeded for " + identifier + " on " + endpoint + attempts;
    }

    /**
     * Time remaining between the event and the reset, if a reset time is known.
     */
    public Optional<Duration> timeUntilReset() {
        return Optional.ofNullable(resetTime).map(reset -> Duration.between(timestamp, reset));
    }
}
