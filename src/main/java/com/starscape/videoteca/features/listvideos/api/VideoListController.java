package com.starscape.videoteca.features.listvideos.api;

import com.starscape.videoteca.common.api.ApiResponse;
import com.starscape.videoteca.features.listvideos.app.ListVideosHandler;
import com.starscape.videoteca.features.uploadvideo.api.dto.VideoResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/videos")
public class VideoListController {
    
    private final ListVideosHandler listVideosHandler;
    
    public VideoListController(ListVideosHandler listVideosHandler) {
        this.listVideosHandler = listVideosHandler;
    }
    
    @GetMapping
    public ResponseEntity<ApiResponse<List<VideoResponse>>> listVideos() {
        List<VideoResponse> videos = listVideosHandler.handle();
        return ApiResponse.of(HttpStatus.OK, "Videos retrieved successfully", videos).toResponseEntity();
    }
}
