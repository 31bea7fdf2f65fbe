package com.starscape.videoteca.features.deletevideo.api;

import com.starscape.videoteca.common.api.ApiResponse;
import com.starscape.videoteca.features.deletevideo.app.DeleteVideoHandler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/videos")
public class DeleteVideoController {
    
    private final DeleteVideoHandler deleteVideoHandler;
    
    public DeleteVideoController(DeleteVideoHandler deleteVideoHandler) {
        this.deleteVideoHandler = deleteVideoHandler;
    }
    
    @DeleteMapping("/{videoId}")
    public ResponseEntity<ApiResponse<Void>> deleteVideo(@PathVariable String videoId) {
        String message = deleteVideoHandler.handle(videoId) ? "Video deleted successfully" : "Video not found";
        return ApiResponse.<Void>of(HttpStatus.OK, message, null).toResponseEntity();
    }
}
