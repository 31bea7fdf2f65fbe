package com.starscape.videoteca.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.util.regex.Pattern;

/**
 * Configuration properties for video uploads.
 * Binds to app.upload.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.upload")
public class UploadProperties {
    
    private DataSize maxSize = DataSize.ofGigabytes(2);
    private String contentTypePattern = "video/[A-Za-z0-9.+-]+";
    private int titleMaxLength = 255;
    private int descriptionMaxLength = 4000;
    private int filenameMaxLength = 255;
    private int contentTypeMaxLength = 255;
    
    private Pattern compiledContentType;
    
    public DataSize getMaxSize() {
        return maxSize;
    }
    
    public void setMaxSize(DataSize maxSize) {
        this.maxSize = maxSize;
    }
    
    public String getContentTypePattern() {
        return contentTypePattern;
    }
    
    public void setContentTypePattern(String contentTypePattern) {
        this.contentTypePattern = contentTypePattern;
        this.compiledContentType = null;
    }
    
    public int getTitleMaxLength() {
        return titleMaxLength;
    }
    
    public void setTitleMaxLength(int titleMaxLength) {
        this.titleMaxLength = titleMaxLength;
    }
    
    public int getDescriptionMaxLength() {
        return descriptionMaxLength;
    }
    
    public void setDescriptionMaxLength(int descriptionMaxLength) {
        this.descriptionMaxLength = descriptionMaxLength;
    }
    
    public int getFilenameMaxLength() {
        return filenameMaxLength;
    }
    
    public void setFilenameMaxLength(int filenameMaxLength) {
        this.filenameMaxLength = filenameMaxLength;
    }
    
    public int getContentTypeMaxLength() {
        return contentTypeMaxLength;
    }
    
    public void setContentTypeMaxLength(int contentTypeMaxLength) {
        this.contentTypeMaxLength = contentTypeMaxLength;
    }
    
    /**
     * Check if a content type is an accepted video media type.
     * Parameters such as "; codecs=..." are ignored, comparison is case-insensitive.
     * @param contentType The declared content type
     * @return true if the content type matches the configured pattern
     */
    public boolean isAcceptedContentType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return false;
        }
        if (compiledContentType == null) {
            compiledContentType = Pattern.compile(contentTypePattern, Pattern.CASE_INSENSITIVE);
        }
        int paramStart = contentType.indexOf(';');
        String mediaType = (paramStart >= 0 ? contentType.substring(0, paramStart) : contentType).trim();
        return compiledContentType.matcher(mediaType).matches();
    }
}
