package com.starscape.videoteca.features.getvideo.api;

import com.starscape.videoteca.common.api.ApiResponse;
import com.starscape.videoteca.features.getvideo.app.GetVideoHandler;
import com.starscape.videoteca.features.uploadvideo.api.dto.VideoResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/videos")
public class VideoQueryController {
    
    private final GetVideoHandler getVideoHandler;
    
    public VideoQueryController(GetVideoHandler getVideoHandler) {
        this.getVideoHandler = getVideoHandler;
    }
    
    /**
     * A missing video is a successful lookup with no data, not an error.
     */
    @GetMapping("/{videoId}")
    public ResponseEntity<ApiResponse<VideoResponse>> getVideo(@PathVariable String videoId) {
        return getVideoHandler.handle(videoId)
                .map(video -> ApiResponse.of(HttpStatus.OK, "Video retrieved successfully", video))
                .orElseGet(() -> ApiResponse.of(HttpStatus.OK, "Video not found", null))
                .toResponseEntity();
    }
}
