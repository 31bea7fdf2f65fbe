package com.starscape.videoteca.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Cross-origin allow-lists. The upload route gets its own, narrower list.
 */
@ConfigurationProperties(prefix = "app.web.cors")
public class CorsProperties {
    
    private List<String> allowedOrigins = new ArrayList<>();
    private List<String> uploadAllowedOrigins = new ArrayList<>();
    private Duration maxAge = Duration.ofHours(24);
    
    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }
    
    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }
    
    public List<String> getUploadAllowedOrigins() {
        return uploadAllowedOrigins;
    }
    
    public void setUploadAllowedOrigins(List<String> uploadAllowedOrigins) {
        this.uploadAllowedOrigins = uploadAllowedOrigins;
    }
    
    public Duration getMaxAge() {
        return maxAge;
    }
    
    public void setMaxAge(Duration maxAge) {
        this.maxAge = maxAge;
    }
}
