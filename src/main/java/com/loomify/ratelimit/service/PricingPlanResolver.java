package com.loomify.ratelimit.service;

import com.loomify.ratelimit.model.PricingPlan;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Resolves the pricing plan of an API key from its prefix.
 *
 * <p>Prefixes are checked highest tier first. Anything that matches no prefix,
 * including {@code null}, blank or malformed keys, resolves to
 * {@link PricingPlan#FREE}. Resolution never fails.</p>
 */
@Component
public class PricingPlanResolver {

    private static final List<PricingPlan> PLANS_BY_PRIORITY = List.of(
        PricingPlan.PROFESSIONAL,
        PricingPlan.BASIC
    );

    /**
     * Resolves the plan for an identifier.
     *
     * @param identifier the API key (or any identifier)
     * @return the matching plan, FREE when nothing matches
     */
    public PricingPlan resolvePlan(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return PricingPlan.FREE;
        }
        for (PricingPlan plan : PLANS_BY_PRIORITY) {
            if (identifier.startsWith(plan.apiKeyPrefix())) {
                return plan;
            }
        }
        return PricingPlan.FREE;
    }
}
