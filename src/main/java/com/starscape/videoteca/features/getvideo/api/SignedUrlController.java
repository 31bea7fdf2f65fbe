package com.starscape.videoteca.features.getvideo.api;

import com.starscape.videoteca.common.api.ApiResponse;
import com.starscape.videoteca.common.storage.SignedUrl;
import com.starscape.videoteca.features.getvideo.app.IssueSignedUrlHandler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Hands out time-limited playback URLs for stored videos.
 */
@RestController
@RequestMapping("/api/v1/videos")
public class SignedUrlController {
    
    private final IssueSignedUrlHandler issueSignedUrlHandler;
    
    public SignedUrlController(IssueSignedUrlHandler issueSignedUrlHandler) {
        this.issueSignedUrlHandler = issueSignedUrlHandler;
    }
    
    @GetMapping("/{videoId}/signed-url")
    public ResponseEntity<ApiResponse<String>> getSignedUrl(@PathVariable String videoId) {
        SignedUrl signedUrl = issueSignedUrlHandler.handle(videoId);
        return ApiResponse.of(HttpStatus.OK, "Signed URL generated successfully", signedUrl.url())
                .toResponseEntity();
    }
}
