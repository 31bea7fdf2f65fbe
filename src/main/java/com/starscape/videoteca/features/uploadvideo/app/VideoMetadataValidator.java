package com.starscape.videoteca.features.uploadvideo.app;

import com.starscape.videoteca.common.config.UploadProperties;
import com.starscape.videoteca.common.validation.ValidationResult;

/**
 * Title and description rules, shared by upload and metadata update.
 */
public final class VideoMetadataValidator {
    
    private VideoMetadataValidator() {
    }
    
    public static ValidationResult validateForCreate(String title, String description, UploadProperties limits) {
        if (title == null || title.isBlank()) {
            return ValidationResult.rejected("Title is required");
        }
        return validateForUpdate(title, description, limits);
    }
    
    /**
     * Null fields are allowed here and mean "leave unchanged".
     */
    public static ValidationResult validateForUpdate(String title, String description, UploadProperties limits) {
        if (title != null) {
            if (title.isBlank()) {
                return ValidationResult.rejected("Title cannot be blank");
            }
            if (title.length() > limits.getTitleMaxLength()) {
                return ValidationResult.rejected(
                    "Title must be " + limits.getTitleMaxLength() + " characters or less");
            }
        }
        if (description != null && description.length() > limits.getDescriptionMaxLength()) {
            return ValidationResult.rejected(
                "Description must be " + limits.getDescriptionMaxLength() + " characters or less");
        }
        return ValidationResult.ok();
    }
}
