package com.starscape.videoteca.features.uploadvideo.app;

import com.starscape.videoteca.common.config.UploadProperties;
import com.starscape.videoteca.common.validation.ValidationResult;
import org.springframework.stereotype.Component;

/**
 * Checks an upload against the size, type and metadata constraints. Performs no I/O.
 */
@Component
public class UploadValidator {
    
    private final UploadProperties uploadProperties;
    
    public UploadValidator(UploadProperties uploadProperties) {
        this.uploadProperties = uploadProperties;
    }
    
    public ValidationResult validate(UploadRequest request) {
        if (!request.hasContent()) {
            return ValidationResult.rejected("File validation failed: file is required");
        }
        if (request.size() <= 0) {
            return ValidationResult.rejected("File validation failed: file is empty");
        }
        long maxBytes = uploadProperties.getMaxSize().toBytes();
        if (request.size() > maxBytes) {
            return ValidationResult.rejected(String.format(
                "File validation failed: size %d exceeds the maximum of %d bytes", request.size(), maxBytes));
        }
        if (request.contentType() != null && request.contentType().length() > uploadProperties.getContentTypeMaxLength()) {
            return ValidationResult.rejected(
                "File validation failed: content type must be " + uploadProperties.getContentTypeMaxLength() + " characters or less");
        }
        if (!uploadProperties.isAcceptedContentType(request.contentType())) {
            return ValidationResult.rejected(String.format(
                "File validation failed: content type '%s' is not a video type", request.contentType()));
        }
        if (request.originalFilename() == null || request.originalFilename().isBlank()) {
            return ValidationResult.rejected("File validation failed: original filename is required");
        }
        if (request.originalFilename().length() > uploadProperties.getFilenameMaxLength()) {
            return ValidationResult.rejected(
                "File validation failed: filename must be " + uploadProperties.getFilenameMaxLength() + " characters or less");
        }
        return VideoMetadataValidator.validateForCreate(request.title(), request.description(), uploadProperties);
    }
}
