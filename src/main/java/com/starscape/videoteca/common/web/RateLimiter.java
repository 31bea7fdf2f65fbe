package com.starscape.videoteca.common.web;

import com.starscape.videoteca.common.config.RateLimitProperties;
import org.springframework.util.AntPathMatcher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window request counter driven by the quota table. Each client gets one window per rule.
 */
public class RateLimiter {
    
    private final List<RateLimitProperties.Rule> rules;
    private final Clock clock;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();
    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    
    public RateLimiter(List<RateLimitProperties.Rule> rules, Clock clock) {
        this.rules = List.copyOf(rules);
        this.clock = clock;
    }
    
    /**
     * Count a request against the first rule matching the path.
     * @return empty if allowed, otherwise the time to wait before retrying
     */
    public Optional<Duration> tryAcquire(String clientKey, String path) {
        Optional<RateLimitProperties.Rule> rule = ruleFor(path);
        if (rule.isEmpty()) {
            return Optional.empty();
        }
        RateLimitProperties.Rule r = rule.get();
        Instant now = clock.instant();
        String key = r.getName() + ":" + clientKey;
        
        Window window = windows.compute(key, (k, current) -> {
            if (current == null || !now.isBefore(current.start().plus(r.getWindow()))) {
                return new Window(now, 1);
            }
            return new Window(current.start(), current.count() + 1);
        });
        
        if (window.count() > r.getMaxRequests()) {
            return Optional.of(Duration.between(now, window.start().plus(r.getWindow())));
        }
        return Optional.empty();
    }
    
    Optional<RateLimitProperties.Rule> ruleFor(String path) {
        return rules.stream()
                .filter(r -> pathMatcher.match(r.getPathPattern(), path))
                .findFirst();
    }
    
    /**
     * Drop windows that expired, so idle clients do not accumulate.
     */
    public void evictExpired() {
        Instant now = clock.instant();
        Duration longest = rules.stream()
                .map(RateLimitProperties.Rule::getWindow)
                .max(Duration::compareTo)
                .orElse(Duration.ZERO);
        windows.entrySet().removeIf(e -> !now.isBefore(e.getValue().start().plus(longest)));
    }
    
    private record Window(Instant start, int count) {}
}
