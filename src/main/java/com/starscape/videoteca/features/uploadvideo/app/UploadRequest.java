package com.starscape.videoteca.features.uploadvideo.app;

import org.springframework.core.io.InputStreamSource;
import org.springframework.web.multipart.MultipartFile;

/**
 * An incoming upload: the file body with its declared attributes plus the descriptive metadata.
 * Not persisted.
 */
public record UploadRequest(
    InputStreamSource content,
    String originalFilename,
    String contentType,
    long size,
    String title,
    String description
) {
    
    public static UploadRequest of(MultipartFile file, String title, String description) {
        if (file == null) {
            return new UploadRequest(null, null, null, 0, title, description);
        }
        return new UploadRequest(
            file,
            file.getOriginalFilename(),
            file.getContentType(),
            file.getSize(),
            title,
            description
        );
    }
    
    public boolean hasContent() {
        return content != null;
    }
}
