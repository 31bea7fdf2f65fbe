package com.starscape.videoteca.features.listvideos.app;

import com.starscape.videoteca.features.uploadvideo.api.dto.VideoResponse;
import com.starscape.videoteca.features.uploadvideo.app.VideoRecordStore;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Lists the whole catalog, newest first.
 */
@Service
public class ListVideosHandler {
    
    private final VideoRecordStore videoRecordStore;
    
    public ListVideosHandler(VideoRecordStore videoRecordStore) {
        this.videoRecordStore = videoRecordStore;
    }
    
    public List<VideoResponse> handle() {
        return videoRecordStore.findAll().stream()
                .map(VideoResponse::from)
                .toList();
    }
}
