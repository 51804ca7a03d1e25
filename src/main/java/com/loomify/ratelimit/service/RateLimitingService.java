package com.loomify.ratelimit.service;

import com.loomify.ratelimit.event.RateLimitExceededEvent;
import com.loomify.ratelimit.model.RateLimitResult;
import com.loomify.ratelimit.model.RateLimitStrategy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Application service applying the rate limiter to an endpoint access.
 *
 * <p>On top of {@link RateLimiterService} it:</p>
 * <ul>
 *   <li>Publishes a {@link RateLimitExceededEvent} for every denial</li>
 *   <li>Counts decisions per strategy and outcome in {@code rate.limit.decisions}</li>
 * </ul>
 */
@Service
public class RateLimitingService {

    private static final String DECISIONS_METER = "rate.limit.decisions";

    private final RateLimiterService rateLimiter;
    private final ApplicationEventPublisher eventPublisher;
    private final Map<RateLimitStrategy, Counter> allowedCounters = new EnumMap<>(RateLimitStrategy.class);
    private final Map<RateLimitStrategy, Counter> deniedCounters = new EnumMap<>(RateLimitStrategy.class);

    public RateLimitingService(
            RateLimiterService rateLimiter,
            ApplicationEventPublisher eventPublisher,
            MeterRegistry meterRegistry) {
        this.rateLimiter = rateLimiter;
        this.eventPublisher = eventPublisher;

        for (RateLimitStrategy strategy : RateLimitStrategy.values()) {
            allowedCounters.put(strategy, decisionCounter(meterRegistry, strategy, "allowed"));
            deniedCounters.put(strategy, decisionCounter(meterRegistry, strategy, "denied"));
        }
    }

    /**
     * Consumes a token with the BUSINESS strategy.
     *
     * @param identifier the API key
     * @param endpoint   the path being accessed
     * @return the admission decision
     */
    public RateLimitResult consumeToken(String identifier, String endpoint) {
        return consumeToken(identifier, endpoint, RateLimitStrategy.BUSINESS);
    }

    /**
     * Consumes a token and publishes an event if the limit is exceeded.
     *
     * @param identifier the client IP or API key
     * @param endpoint   the path being accessed
     * @param strategy   the strategy to apply
     * @return the admission decision
     */
    public RateLimitResult consumeToken(String identifier, String endpoint, RateLimitStrategy strategy) {
        RateLimitResult result = rateLimiter.consume(identifier, strategy);

        if (result instanceof RateLimitResult.Denied denied) {
            deniedCounters.get(strategy).increment();
            eventPublisher.publishEvent(
                RateLimitExceededEvent.fromDenial(identifier, endpoint, denied.retryAfter(), strategy));
        } else {
            allowedCounters.get(strategy).increment();
        }
        return result;
    }

    private static Counter decisionCounter(MeterRegistry registry, RateLimitStrategy strategy, String outcome) {
        return Counter.builder(DECISIONS_METER)
                .tag("strategy", strategy.name().toLowerCase(Locale.ROOT))
                .tag("outcome", outcome)
                .description("Rate limit admission decisions")
                .register(registry);
    }
}
