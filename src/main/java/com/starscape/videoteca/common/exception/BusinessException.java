package com.starscape.videoteca.common.exception;

/**
 * Base class for classified application errors. The code is stable and machine readable,
 * the message is meant for the caller.
 */
public class BusinessException extends RuntimeException {
    
    private final String code;
    
    public BusinessException(String code, String message) {
        super(message);
        this.code = code;
    }
    
    public BusinessException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
    
    public String getCode() {
        return code;
    }
}
