package com.starscape.videoteca.features.uploadvideo.api;

import com.starscape.videoteca.common.api.ApiResponse;
import com.starscape.videoteca.features.uploadvideo.api.dto.VideoResponse;
import com.starscape.videoteca.features.uploadvideo.app.UploadRequest;
import com.starscape.videoteca.features.uploadvideo.app.UploadVideoHandler;
import com.starscape.videoteca.features.uploadvideo.domain.Video;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/v1/videos")
public class UploadVideoController {
    
    private final UploadVideoHandler uploadVideoHandler;
    
    public UploadVideoController(UploadVideoHandler uploadVideoHandler) {
        this.uploadVideoHandler = uploadVideoHandler;
    }
    
    /**
     * Upload a video file with its title and description.
     * POST /api/v1/videos/upload (multipart/form-data: file, title, description)
     */
    @PostMapping(path = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<VideoResponse>> uploadVideo(
            @RequestPart(value = "file", required = false) MultipartFile file,
            @RequestParam(value = "title", required = false) String title,
            @RequestParam(value = "description", required = false) String description) {
        
        Video video = uploadVideoHandler.handle(UploadRequest.of(file, title, description));
        return ApiResponse.of(HttpStatus.CREATED, "Video uploaded successfully", VideoResponse.from(video))
                .toResponseEntity();
    }
}
