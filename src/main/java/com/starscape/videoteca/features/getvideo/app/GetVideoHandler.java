package com.starscape.videoteca.features.getvideo.app;

import com.starscape.videoteca.features.uploadvideo.api.dto.VideoResponse;
import com.starscape.videoteca.features.uploadvideo.app.VideoRecordStore;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class GetVideoHandler {
    
    private final VideoRecordStore videoRecordStore;
    
    public GetVideoHandler(VideoRecordStore videoRecordStore) {
        this.videoRecordStore = videoRecordStore;
    }
    
    public Optional<VideoResponse> handle(String videoId) {
        return videoRecordStore.findById(videoId).map(VideoResponse::from);
    }
}
