package com.starscape.videoteca.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the object storage gateway.
 * Binds to app.storage.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.storage")
public class StorageProperties {
    
    private String bucket;
    private String keyPrefix = "videos";
    private Duration signedUrlTtl = Duration.ofHours(1);
    private Duration callTimeout = Duration.ofSeconds(30);
    private Duration uploadTimeout = Duration.ofMinutes(10);
    
    public String getBucket() {
        return bucket;
    }
    
    public void setBucket(String bucket) {
        this.bucket = bucket;
    }
    
    public String getKeyPrefix() {
        return keyPrefix;
    }
    
    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }
    
    public Duration getSignedUrlTtl() {
        return signedUrlTtl;
    }
    
    public void setSignedUrlTtl(Duration signedUrlTtl) {
        this.signedUrlTtl = signedUrlTtl;
    }
    
    /**
     * Timeout applied to every ordinary S3 call (HEAD, DELETE).
     */
    public Duration getCallTimeout() {
        return callTimeout;
    }
    
    public void setCallTimeout(Duration callTimeout) {
        this.callTimeout = callTimeout;
    }
    
    /**
     * Timeout applied to the PUT of an uploaded video only.
     */
    public Duration getUploadTimeout() {
        return uploadTimeout;
    }
    
    public void setUploadTimeout(Duration uploadTimeout) {
        this.uploadTimeout = uploadTimeout;
    }
}
