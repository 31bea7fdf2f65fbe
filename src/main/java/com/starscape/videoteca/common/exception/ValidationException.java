package com.starscape.videoteca.common.exception;

/**
 * Bad input. Raised before any storage or persistence I/O takes place.
 */
public class ValidationException extends BusinessException {
    
    public ValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }
    
    public ValidationException(String message, Throwable cause) {
        super("VALIDATION_ERROR", message, cause);
    }
}
