package com.starscape.videoteca.common.validation;

import com.starscape.videoteca.common.exception.ValidationException;

/**
 * Outcome of an explicit input check. A rejected result carries the reason.
 */
public record ValidationResult(boolean valid, String message) {
    
    private static final ValidationResult OK = new ValidationResult(true, null);
    
    public static ValidationResult ok() {
        return OK;
    }
    
    public static ValidationResult rejected(String message) {
        return new ValidationResult(false, message);
    }
    
    public void throwIfRejected() {
        if (!valid) {
            throw new ValidationException(message);
        }
    }
}
