package com.starscape.videoteca.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Quota table for request rate limiting.
 * Binds to app.web.rate-limits.* properties. Rules are evaluated in order, first match wins.
 */
@ConfigurationProperties(prefix = "app.web.rate-limits")
public class RateLimitProperties {
    
    private boolean enabled = true;
    private List<Rule> rules = new ArrayList<>();
    
    public boolean isEnabled() {
        return enabled;
    }
    
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
    
    public List<Rule> getRules() {
        return rules;
    }
    
    public void setRules(List<Rule> rules) {
        this.rules = rules;
    }
    
    public static class Rule {
        
        private String name;
        private String pathPattern;
        private Duration window;
        private int maxRequests;
        
        public Rule() {
        }
        
        public Rule(String name, String pathPattern, Duration window, int maxRequests) {
            this.name = name;
            this.pathPattern = pathPattern;
            this.window = window;
            this.maxRequests = maxRequests;
        }
        
        public String getName() {
            return name;
        }
        
        public void setName(String name) {
            this.name = name;
        }
        
        public String getPathPattern() {
            return pathPattern;
        }
        
        public void setPathPattern(String pathPattern) {
            this.pathPattern = pathPattern;
        }
        
        public Duration getWindow() {
            return window;
        }
        
        public void setWindow(Duration window) {
            this.window = window;
        }
        
        public int getMaxRequests() {
            return maxRequests;
        }
        
        public void setMaxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
        }
    }
}
