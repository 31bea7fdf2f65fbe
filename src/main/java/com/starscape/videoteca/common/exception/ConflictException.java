package com.starscape.videoteca.common.exception;

public class ConflictException extends BusinessException {
    
    public ConflictException(String message) {
        super("CONFLICT", message);
    }
    
    public ConflictException(String message, Throwable cause) {
        super("CONFLICT", message, cause);
    }
}
