package com.starscape.videoteca.features.uploadvideo.domain;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Objects;

/**
 * Catalog entry for an uploaded video. The file key, size and content type describe the stored
 * object and never change after creation; only title and description are editable.
 */
@Entity
@Table(name = "videos")
public class Video {
    
    @Id
    @Column(name = "video_id")
    private String videoId;
    
    @Column(nullable = false)
    private String title;
    
    @Column(length = 4000)
    private String description;
    
    @Column(name = "file_key", nullable = false, unique = true, updatable = false)
    private String fileKey;
    
    @Column(name = "original_filename", nullable = false, updatable = false)
    private String originalFilename;
    
    @Column(name = "size_bytes", nullable = false, updatable = false)
    private long size;
    
    @Column(name = "content_type", nullable = false, updatable = false)
    private String contentType;
    
    @Column(name = "etag", updatable = false)
    private String etag;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    protected Video() {
        // JPA constructor
    }
    
    public Video(String videoId, String title, String description, String fileKey,
                 String originalFilename, long size, String contentType, String etag) {
        validateInput(videoId, title, fileKey, originalFilename, size, contentType);
        
        this.videoId = videoId;
        this.title = title;
        this.description = description;
        this.fileKey = fileKey;
        this.originalFilename = originalFilename;
        this.size = size;
        this.contentType = contentType;
        this.etag = etag;
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }
    
    private void validateInput(String videoId, String title, String fileKey,
                               String originalFilename, long size, String contentType) {
        if (videoId == null || videoId.isBlank()) {
            throw new IllegalArgumentException("Video ID cannot be blank");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Title cannot be blank");
        }
        if (fileKey == null || fileKey.isBlank()) {
            throw new IllegalArgumentException("File key cannot be blank");
        }
        if (originalFilename == null || originalFilename.isBlank()) {
            throw new IllegalArgumentException("Original filename cannot be blank");
        }
        if (size <= 0) {
            throw new IllegalArgumentException("Size must be positive");
        }
        if (contentType == null || contentType.isBlank()) {
            throw new IllegalArgumentException("Content type cannot be blank");
        }
    }
    
    public String getId() { return videoId; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public String getFileKey() { return fileKey; }
    public String getOriginalFilename() { return originalFilename; }
    public long getSize() { return size; }
    public String getContentType() { return contentType; }
    public String getEtag() { return etag; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    
    public boolean hasFileKey() {
        return fileKey != null && !fileKey.isBlank();
    }
    
    /**
     * Apply a metadata change. A null argument leaves the field as it is.
     * @return true if anything changed
     */
    public boolean updateMetadata(String newTitle, String newDescription) {
        boolean changed = false;
        if (newTitle != null && !newTitle.equals(title)) {
            if (newTitle.isBlank()) {
                throw new IllegalArgumentException("Title cannot be blank");
            }
            this.title = newTitle;
            changed = true;
        }
        if (newDescription != null && !Objects.equals(newDescription, description)) {
            this.description = newDescription;
            changed = true;
        }
        if (changed) {
            this.updatedAt = Instant.now();
        }
        return changed;
    }
    
    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
