package com.starscape.videoteca.features.updatevideo.app;

import com.starscape.videoteca.common.config.UploadProperties;
import com.starscape.videoteca.common.exception.NotFoundException;
import com.starscape.videoteca.features.updatevideo.api.dto.UpdateVideoRequest;
import com.starscape.videoteca.features.uploadvideo.api.dto.VideoResponse;
import com.starscape.videoteca.features.uploadvideo.app.VideoMetadataValidator;
import com.starscape.videoteca.features.uploadvideo.app.VideoRecordStore;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Updates title and description. File key, size and content type are not reachable from here.
 */
@Service
public class UpdateVideoHandler {
    
    private final VideoRecordStore videoRecordStore;
    private final UploadProperties uploadProperties;
    
    public UpdateVideoHandler(VideoRecordStore videoRecordStore, UploadProperties uploadProperties) {
        this.videoRecordStore = videoRecordStore;
        this.uploadProperties = uploadProperties;
    }
    
    /**
     * @return the updated video, empty if no video has the identifier
     */
    public Optional<VideoResponse> handle(String videoId, UpdateVideoRequest request) {
        String title = request.title() != null ? request.title().trim() : null;
        VideoMetadataValidator.validateForUpdate(title, request.description(), uploadProperties)
                .throwIfRejected();
        
        try {
            return Optional.of(VideoResponse.from(
                videoRecordStore.updateMetadata(videoId, title, request.description())));
        } catch (NotFoundException e) {
            return Optional.empty();
        }
    }
}
