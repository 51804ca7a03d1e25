package com.loomify.ratelimit.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes rate limit violations to the security audit log.
 */
@Component
public class RateLimitAuditListener {

    private static final Logger log = LoggerFactory.getLogger("security.audit");

    @EventListener
    public void onRateLimitExceeded(RateLimitExceededEvent event) {
        log.warn("event=RATE_LIMIT_EXCEEDED strategy={} resetTime={} detail=\"{}\"",
                 event.strategy(), event.resetTime(), event.describe());
    }
}
