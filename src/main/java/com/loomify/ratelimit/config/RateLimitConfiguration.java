package com.loomify.ratelimit.config;

import io.github.bucket4j.TimeMeter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Wires the rate limiting components from {@link RateLimitProperties}.
 */
@Configuration
@EnableConfigurationProperties(RateLimitProperties.class)
public class RateLimitConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitConfiguration.class);

    @Bean
    public BucketConfigurationStrategy bucketConfigurationStrategy(RateLimitProperties properties) {
        logger.info("Rate limiting enabled: {}, auth limits: {}, pricing plans: {}",
            properties.isEnabled(),
            properties.getAuth().getLimits(),
            properties.getBusiness().getPricingPlans().keySet());
        return new BucketConfigurationStrategy(properties);
    }

    /**
     * Time source for bucket refill.
     */
    @Bean
    public TimeMeter rateLimitTimeMeter() {
        return TimeMeter.SYSTEM_MILLISECONDS;
    }

    /**
     * Bounded pool for asynchronous token consumption. Runs the task on the
     * caller's thread when saturated.
     */
    @Bean(name = "rateLimitExecutor")
    public ThreadPoolTaskExecutor rateLimitExecutor(RateLimitProperties properties) {
        RateLimitProperties.Executor settings = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(settings.getMaxPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("rate-limit-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
