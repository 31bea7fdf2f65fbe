package com.starscape.videoteca.common.config;

import com.starscape.videoteca.common.web.RateLimiter;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Enables @Scheduled and runs the periodic cleanup of expired rate-limit windows.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {
    
    private final RateLimiter rateLimiter;
    
    public SchedulingConfig(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }
    
    @Scheduled(fixedDelayString = "${app.web.rate-limit-eviction-interval-ms:300000}")
    public void evictExpiredRateLimitWindows() {
        rateLimiter.evictExpired();
    }
}
