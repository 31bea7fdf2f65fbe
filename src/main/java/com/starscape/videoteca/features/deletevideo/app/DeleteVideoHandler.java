package com.starscape.videoteca.features.deletevideo.app;

import com.starscape.videoteca.common.storage.ObjectStorageGateway;
import com.starscape.videoteca.features.uploadvideo.app.VideoRecordStore;
import com.starscape.videoteca.features.uploadvideo.domain.Video;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Deletes the record, then the backing object on a best-effort basis.
 * Storage errors are logged so that an unavailable store never blocks catalog deletion.
 */
@Service
public class DeleteVideoHandler {
    
    private static final Logger log = LoggerFactory.getLogger(DeleteVideoHandler.class);
    
    private final VideoRecordStore videoRecordStore;
    private final ObjectStorageGateway storageGateway;
    
    public DeleteVideoHandler(VideoRecordStore videoRecordStore, ObjectStorageGateway storageGateway) {
        this.videoRecordStore = videoRecordStore;
        this.storageGateway = storageGateway;
    }
    
    /**
     * @return true if a video was deleted, false if none had the identifier
     */
    public boolean handle(String videoId) {
        Optional<Video> deleted = videoRecordStore.delete(videoId);
        if (deleted.isEmpty()) {
            return false;
        }
        
        Video video = deleted.get();
        log.info("Deleted video record {}", videoId);
        if (video.hasFileKey()) {
            try {
                storageGateway.delete(video.getFileKey());
            } catch (RuntimeException e) {
                log.warn("Failed to delete object {} of video {}, object left behind: {}",
                    video.getFileKey(), videoId, e.getMessage());
            }
        }
        return true;
    }
}
