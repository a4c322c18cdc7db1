package com.team.formtest.config;

import io.github.bucket4j.Bucket;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Budget for AI test data requests. Both limits apply; a request needs a token from each.
 */
@Configuration
@ConfigurationProperties(prefix = "rate-limit.claude-api")
@Getter
@Setter
public class RateLimitConfig {

    private int requestsPerMinute = 10;

    private int requestsPerHour = 100;

    @Bean(name = "claudeApiRateLimiter")
    public Bucket claudeApiRateLimiter() {
        return buildBucket(requestsPerMinute, requestsPerHour);
    }

    public static Bucket buildBucket(int perMinute, int perHour) {
        return Bucket.builder()
                .addLimit(limit -> limit.capacity(perMinute).refillGreedy(perMinute, Duration.ofMinutes(1)))
                .addLimit(limit -> limit.capacity(perHour).refillGreedy(perHour, Duration.ofHours(1)))
                .build();
    }
}
