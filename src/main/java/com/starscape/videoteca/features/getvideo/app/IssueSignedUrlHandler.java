package com.starscape.videoteca.features.getvideo.app;

import com.starscape.videoteca.common.config.StorageProperties;
import com.starscape.videoteca.common.exception.NotFoundException;
import com.starscape.videoteca.common.storage.ObjectStorageGateway;
import com.starscape.videoteca.common.storage.SignedUrl;
import com.starscape.videoteca.features.uploadvideo.app.VideoRecordStore;
import com.starscape.videoteca.features.uploadvideo.domain.Video;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Resolves a video to its file key and asks the storage gateway for a temporary playback URL.
 */
@Service
public class IssueSignedUrlHandler {
    
    private static final Logger log = LoggerFactory.getLogger(IssueSignedUrlHandler.class);
    
    private final VideoRecordStore videoRecordStore;
    private final ObjectStorageGateway storageGateway;
    private final Duration signedUrlTtl;
    
    public IssueSignedUrlHandler(
            VideoRecordStore videoRecordStore,
            ObjectStorageGateway storageGateway,
            StorageProperties storageProperties) {
        this.videoRecordStore = videoRecordStore;
        this.storageGateway = storageGateway;
        this.signedUrlTtl = storageProperties.getSignedUrlTtl();
    }
    
    public SignedUrl handle(String videoId) {
        Video video = videoRecordStore.findById(videoId)
                .filter(Video::hasFileKey)
                .orElseThrow(() -> new NotFoundException("Video not found"));
        
        try {
            return storageGateway.signedUrl(video.getFileKey(), signedUrlTtl);
        } catch (NotFoundException e) {
            log.warn("Video {} references missing object {}", videoId, video.getFileKey());
            throw new NotFoundException("Video file not found");
        }
    }
}
