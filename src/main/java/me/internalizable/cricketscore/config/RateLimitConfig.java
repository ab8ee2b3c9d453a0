package me.internalizable.cricketscore.config;

import me.internalizable.cricketscore.ratelimit.LocalRateLimiter;
import me.internalizable.cricketscore.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class RateLimitConfig {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitConfig.class);

    @Bean
    public RateLimiter rateLimiter(
            @Value("${rate-limit.cooldown-seconds:2}") int cooldownSeconds,
            Clock clock) {
        logger.info("Rate limiting shots to one per {}s per roll number", cooldownSeconds);
        return new LocalRateLimiter(Duration.ofSeconds(cooldownSeconds), clock);
    }
}
