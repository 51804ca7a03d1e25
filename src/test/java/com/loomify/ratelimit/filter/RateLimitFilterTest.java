package com.loomify.ratelimit.filter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loomify.ratelimit.config.BucketConfigurationStrategy;
import com.loomify.ratelimit.config.RateLimitProperties;
import com.loomify.ratelimit.model.BandwidthLimit;
import com.loomify.ratelimit.service.PricingPlanResolver;
import com.loomify.ratelimit.service.RateLimiterService;
import com.loomify.ratelimit.service.RateLimitingService;
import com.loomify.ratelimit.support.ManualTimeMeter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link RateLimitFilter}.
 * Runs against a real limiter with small limits: 2/min for auth, 3/h for the free plan.
 */
@DisplayName("RateLimitFilter Unit Tests")
class RateLimitFilterTest {

    private static final String LOGIN = "/api/auth/login";
    private static final String PROJECTS = "/api/projects";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private RateLimitProperties properties;
    private RateLimiterService rateLimiterService;
    private ApplicationEventPublisher eventPublisher;
    private RateLimitFilter filter;
    private FilterChain filterChain;

    @BeforeEach
    void setUp() {
        properties = new RateLimitProperties();
        properties.getAuth().setLimits(List.of(BandwidthLimit.of("per-minute", 2, 2, Duration.ofMinutes(1))));
        Map<String, BandwidthLimit> plans = new LinkedHashMap<>();
        plans.put("free", BandwidthLimit.of("free-plan", 3, 3, Duration.ofHours(1)));
        plans.put("basic", BandwidthLimit.of("basic-plan", 5, 5, Duration.ofHours(1)));
        properties.getBusiness().setPricingPlans(plans);

        BucketConfigurationStrategy configurationStrategy = new BucketConfigurationStrategy(properties);
        rateLimiterService = new RateLimiterService(
            configurationStrategy, new PricingPlanResolver(), new ManualTimeMeter(), Runnable::run);
        eventPublisher = mock(ApplicationEventPublisher.class);
        RateLimitingService rateLimitingService =
            new RateLimitingService(rateLimiterService, eventPublisher, new SimpleMeterRegistry());

        filter = new RateLimitFilter(rateLimitingService, configurationStrategy, objectMapper);
        filterChain = mock(FilterChain.class);
    }

    private MockHttpServletRequest request(String path, String remoteAddr) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", path);
        request.setRemoteAddr(remoteAddr);
        return request;
    }

    private MockHttpServletResponse send(MockHttpServletRequest request) throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilterInternal(request, response, filterChain);
        return response;
    }

    @Nested
    @DisplayName("Authentication endpoints")
    class AuthEndpoints {

        @Test
        @DisplayName("allowed request passes through with remaining header")
        void shouldAllowUnderLimit() throws Exception {
            MockHttpServletRequest request = request(LOGIN, "10.0.0.1");
            MockHttpServletResponse response = send(request);

            assertEquals(200, response.getStatus());
            assertEquals("1", response.getHeader("X-Rate-Limit-Remaining"));
            verify(filterChain).doFilter(eq(request), any());
        }

        @Test
        @DisplayName("request over the limit gets 429 with retry headers and JSON body")
        void shouldRejectOverLimit() throws Exception {
            send(request(LOGIN, "10.0.0.2"));
            send(request(LOGIN, "10.0.0.2"));

            MockHttpServletResponse response = send(request(LOGIN, "10.0.0.2"));

            assertEquals(429, response.getStatus());
            assertEquals("30", response.getHeader("Retry-After"));
            assertEquals("30", response.getHeader("X-Rate-Limit-Retry-After-Seconds"));
            assertNull(response.getHeader("X-Rate-Limit-Remaining"));
            assertTrue(response.getContentType().startsWith("application/json"));

            JsonNode error = objectMapper.readTree(response.getContentAsString()).get("error");
            assertEquals("RATE_LIMIT_EXCEEDED", error.get("code").asText());
            assertEquals("Too many authentication attempts. Please try again later.", error.get("message").asText());
            assertEquals(30, error.get("retryAfter").asLong());
            assertEquals(LOGIN, error.get("path").asText());
            assertFalse(error.get("timestamp").asText().isEmpty());

            verify(filterChain, times(2)).doFilter(any(), any());
            verify(eventPublisher).publishEvent(any(Object.class));
        }

        @Test
        @DisplayName("client is identified by the first X-Forwarded-For entry")
        void shouldUseForwardedForHeader() throws Exception {
            for (int i = 0; i < 2; i++) {
                MockHttpServletRequest request = request(LOGIN, "10.9.9.9");
                request.addHeader("X-Forwarded-For", "203.0.113.5, 10.9.9.9");
                send(request);
            }

            MockHttpServletRequest sameClient = request(LOGIN, "10.9.9.8");
            sameClient.addHeader("X-Forwarded-For", "203.0.113.5");
            assertEquals(429, send(sameClient).getStatus());

            assertEquals(200, send(request(LOGIN, "10.9.9.9")).getStatus());
        }

        @Test
        @DisplayName("auth paths are matched anywhere in the URI")
        void shouldMatchAuthPathFragment() throws Exception {
            send(request("/v2/api/auth/login", "10.0.0.3"));

            assertEquals(1, rateLimiterService.getCacheSize());
        }
    }

    @Nested
    @DisplayName("Business endpoints")
    class BusinessEndpoints {

        @Test
        @DisplayName("API key selects the plan quota")
        void shouldLimitByApiKey() throws Exception {
            MockHttpServletRequest request = request(PROJECTS, "10.0.0.4");
            request.addHeader("X-API-Key", "BX001-team");

            MockHttpServletResponse response = send(request);

            assertEquals("4", response.getHeader("X-Rate-Limit-Remaining"));
        }

        @Test
        @DisplayName("request without API key falls back to the client IP on the free plan")
        void shouldFallBackToClientIp() throws Exception {
            for (int i = 0; i < 3; i++) {
                assertEquals(200, send(request(PROJECTS, "10.0.0.5")).getStatus());
            }

            MockHttpServletResponse response = send(request(PROJECTS, "10.0.0.5"));

            assertEquals(429, response.getStatus());
            assertEquals("1200", response.getHeader("Retry-After"));
            JsonNode error = objectMapper.readTree(response.getContentAsString()).get("error");
            assertEquals("API quota exceeded for your plan. Please try again later.", error.get("message").asText());
        }

        @Test
        @DisplayName("plan without a configured limit answers 500 and does not admit")
        void shouldFailClosedOnConfigurationError() throws Exception {
            MockHttpServletRequest request = request(PROJECTS, "10.0.0.6");
            request.addHeader("X-API-Key", "PX001-enterprise");

            MockHttpServletResponse response = send(request);

            assertEquals(500, response.getStatus());
            assertEquals("Error: An unexpected error occurred. Please try again later.", response.getContentAsString());
            verifyNoInteractions(filterChain);
        }
    }

    @Nested
    @DisplayName("Skipped requests")
    class SkippedRequests {

        @Test
        @DisplayName("paths outside limited endpoints are not rate limited")
        void shouldSkipUnlimitedPaths() throws Exception {
            MockHttpServletResponse response = send(request("/actuator/health", "10.0.0.7"));

            assertNull(response.getHeader("X-Rate-Limit-Remaining"));
            verify(filterChain).doFilter(any(), any());
            assertEquals(0, rateLimiterService.getCacheSize());
        }

        @Test
        @DisplayName("disabled auth limiting lets auth requests through")
        void shouldSkipWhenAuthDisabled() throws Exception {
            properties.getAuth().setEnabled(false);

            for (int i = 0; i < 5; i++) {
                assertEquals(200, send(request(LOGIN, "10.0.0.8")).getStatus());
            }
            assertEquals(0, rateLimiterService.getCacheSize());
        }

        @Test
        @DisplayName("global switch disables every strategy")
        void shouldSkipWhenGloballyDisabled() throws Exception {
            properties.setEnabled(false);

            send(request(LOGIN, "10.0.0.9"));
            send(request(PROJECTS, "10.0.0.9"));

            assertEquals(0, rateLimiterService.getCacheSize());
        }

        @Test
        @DisplayName("request already processed is not charged twice")
        void shouldSkipAlreadyProcessedRequest() throws Exception {
            MockHttpServletRequest request = request(LOGIN, "10.0.0.10");
            request.setAttribute(RateLimitFilter.PROCESSED_ATTRIBUTE, Boolean.TRUE);

            MockHttpServletResponse response = send(request);

            assertNull(response.getHeader("X-Rate-Limit-Remaining"));
            assertEquals(0, rateLimiterService.getCacheSize());
        }
    }
}
