package com.starscape.videoteca.features.updatevideo.api;

import com.starscape.videoteca.common.api.ApiResponse;
import com.starscape.videoteca.features.updatevideo.api.dto.UpdateVideoRequest;
import com.starscape.videoteca.features.updatevideo.app.UpdateVideoHandler;
import com.starscape.videoteca.features.uploadvideo.api.dto.VideoResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/videos")
public class UpdateVideoController {
    
    private final UpdateVideoHandler updateVideoHandler;
    
    public UpdateVideoController(UpdateVideoHandler updateVideoHandler) {
        this.updateVideoHandler = updateVideoHandler;
    }
    
    @PatchMapping("/{videoId}")
    public ResponseEntity<ApiResponse<VideoResponse>> updateVideo(
            @PathVariable String videoId,
            @RequestBody UpdateVideoRequest request) {
        
        return updateVideoHandler.handle(videoId, request)
                .map(video -> ApiResponse.of(HttpStatus.OK, "Video updated successfully", video))
                .orElseGet(() -> ApiResponse.of(HttpStatus.OK, "Video not found", null))
                .toResponseEntity();
    }
}
