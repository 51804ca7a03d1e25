package com.loomify.ratelimit.exception;

/**
 * Exception thrown when rate limit configuration is malformed or incomplete.
 *
 * <p>Raised for:</p>
 * <ul>
 *   <li>Non-positive capacity, refill tokens or refill period</li>
 *   <li>Initial tokens outside {@code [0, capacity]}</li>
 *   <li>A bucket specification without any limit</li>
 *   <li>A pricing plan that has no configured limit</li>
 * </ul>
 *
 * <p>This indicates a deployment defect, not a client mistake. It is never
 * translated into an admission or a denial; the HTTP layer answers with a
 * generic 500 response.</p>
 */
public class RateLimitConfigurationException extends RuntimeException {

    /**
     * Constructs a RateLimitConfigurationException with the specified message.
     *
     * @param message the error message describing the misconfiguration
     */
    public RateLimitConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructs a RateLimitConfigurationException with a message and cause.
     *
     * @param message the error message
     * @param cause   the underlying cause of the exception
     */
    public RateLimitConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
