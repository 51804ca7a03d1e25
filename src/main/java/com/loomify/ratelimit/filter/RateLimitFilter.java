package com.loomify.ratelimit.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loomify.ratelimit.config.BucketConfigurationStrategy;
import com.loomify.ratelimit.exception.RateLimitConfigurationException;
import com.loomify.ratelimit.model.RateLimitResult;
import com.loomify.ratelimit.model.RateLimitStrategy;
import com.loomify.ratelimit.service.RateLimitingService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP filter admitting or rejecting requests with the token bucket rate limiter.
 *
 * <h2>Behavior:</h2>
 * <ul>
 *   <li>Authentication endpoints are limited per client IP (AUTH strategy)</li>
 *   <li>Business endpoints are limited per API key (BUSINESS strategy)</li>
 *   <li>Allowed requests carry an X-Rate-Limit-Remaining header</li>
 *   <li>Denied requests get 429 Too Many Requests with Retry-After headers
 *       and a JSON error body</li>
 *   <li>A rate limit misconfiguration answers 500, never an admission</li>
 * </ul>
 */
@Component
@Order(1)
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitFilter.class);

    static final String PROCESSED_ATTRIBUTE = "rateLimitProcessed";
    static final String REMAINING_HEADER = "X-Rate-Limit-Remaining";
    static final String RETRY_AFTER_SECONDS_HEADER = "X-Rate-Limit-Retry-After-Seconds";
    static final String API_KEY_HEADER = "X-API-Key";

    private static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    private static final String STRATEGY_MDC_KEY = "rateLimitStrategy";

    private final RateLimitingService rateLimitingService;
    private final BucketConfigurationStrategy configurationStrategy;
    private final ObjectMapper objectMapper;

    public RateLimitFilter(
            RateLimitingService rateLimitingService,
            BucketConfigurationStrategy configurationStrategy,
            ObjectMapper objectMapper) {
        this.rateLimitingService = rateLimitingService;
        this.configurationStrategy = configurationStrategy;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        if (request.getAttribute(PROCESSED_ATTRIBUTE) != null) {
            logger.debug("Request already processed by rate limiter, skipping");
            filterChain.doFilter(request, response);
            return;
        }
        request.setAttribute(PROCESSED_ATTRIBUTE, Boolean.TRUE);

        String path = request.getRequestURI();
        RateLimitStrategy strategy = resolveStrategy(path);
        if (strategy == null) {
            filterChain.doFilter(request, response);
            return;
        }

        String identifier = getIdentifier(request, strategy);
        logger.debug("Resolved identifier {} with strategy {} for path {}", identifier, strategy, path);

        RateLimitResult result;
        try {
            result = rateLimitingService.consumeToken(identifier, path, strategy);
        } catch (RateLimitConfigurationException ex) {
            logger.error("Rate limit configuration error for path {}", path, ex);
            sendConfigurationErrorResponse(response);
            return;
        }

        if (result instanceof RateLimitResult.Denied denied) {
            logger.warn("Rate limit exceeded for identifier {} on path {}", identifier, path);
            sendRateLimitResponse(response, denied, strategy, path);
            return;
        }

        RateLimitResult.Allowed allowed = (RateLimitResult.Allowed) result;
        response.setHeader(REMAINING_HEADER, String.valueOf(allowed.remainingTokens()));

        MDC.put(STRATEGY_MDC_KEY, strategy.name());
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(STRATEGY_MDC_KEY);
        }
    }

    /**
     * Picks the strategy for a path, or {@code null} when the path is not
     * limited or its strategy is disabled.
     */
    private RateLimitStrategy resolveStrategy(String path) {
        if (configurationStrategy.authEndpoints().stream().anyMatch(path::contains)) {
            if (!configurationStrategy.isAuthRateLimitEnabled()) {
                logger.debug("Authentication rate limiting is disabled, skipping");
                return null;
            }
            return RateLimitStrategy.AUTH;
        }
        if (configurationStrategy.businessEndpoints().stream().anyMatch(path::startsWith)) {
            if (!configurationStrategy.isBusinessRateLimitEnabled()) {
                logger.debug("Business rate limiting is disabled, skipping");
                return null;
            }
            return RateLimitStrategy.BUSINESS;
        }
        logger.debug("Path {} is not rate limited", path);
        return null;
    }

    /**
     * Client IP for authentication endpoints; API key for business endpoints,
     * falling back to the client IP when no key is sent.
     */
    private String getIdentifier(HttpServletRequest request, RateLimitStrategy strategy) {
        if (strategy == RateLimitStrategy.BUSINESS) {
            String apiKey = request.getHeader(API_KEY_HEADER);
            if (apiKey != null && !apiKey.isBlank()) {
                return apiKey.trim();
            }
        }
        return "IP:" + getClientIP(request);
    }

    /**
     * Takes the first X-Forwarded-For entry (original client), then the
     * remote address.
     */
    private String getClientIP(HttpServletRequest request) {
        String xForwardedFor = request.getHeader(FORWARDED_FOR_HEADER);
        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            return xForwardedFor.split(",")[0].trim();
        }
        String remoteAddr = request.getRemoteAddr();
        return remoteAddr != null && !remoteAddr.isBlank() ? remoteAddr : "unknown";
    }

    private void sendRateLimitResponse(HttpServletResponse response,
                                       RateLimitResult.Denied denied,
                                       RateLimitStrategy strategy,
                                       String path) throws IOException {
        long retryAfterSeconds = denied.retryAfterSeconds();

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setHeader("Retry-After", String.valueOf(retryAfterSeconds));
        response.setHeader(RETRY_AFTER_SECONDS_HEADER, String.valueOf(retryAfterSeconds));

        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", "RATE_LIMIT_EXCEEDED");
        error.put("message", strategy == RateLimitStrategy.AUTH
            ? "Too many authentication attempts. Please try again later."
            : "API quota exceeded for your plan. Please try again later.");
        error.put("timestamp", Instant.now().toString());
        error.put("retryAfter", retryAfterSeconds);
        error.put("path", path);

        response.getOutputStream().write(objectMapper.writeValueAsBytes(Map.of("error", error)));
    }

    private void sendConfigurationErrorResponse(HttpServletResponse response) throws IOException {
        response.setStatus(HttpStatus.INTERNAL_SERVER_ERROR.value());
        response.setContentType(MediaType.TEXT_PLAIN_VALUE);
        response.getWriter().write("Error: An unexpected error occurred. Please try again later.");
    }
}
