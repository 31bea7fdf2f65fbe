package com.starscape.videoteca.features.uploadvideo.api.dto;

import com.starscape.videoteca.features.uploadvideo.domain.Video;

import java.time.Instant;

/**
 * JSON view of a video record.
 */
public record VideoResponse(
    String id,
    String title,
    String description,
    String fileKey,
    String originalFilename,
    long size,
    String contentType,
    String etag,
    Instant createdAt,
    Instant updatedAt
) {
    
    public static VideoResponse from(Video video) {
        return new VideoResponse(
            video.getId(),
            video.getTitle(),
            video.getDescription(),
            video.getFileKey(),
            video.getOriginalFilename(),
            video.getSize(),
            video.getContentType(),
            video.getEtag(),
            video.getCreatedAt(),
            video.getUpdatedAt()
        );
    }
}
