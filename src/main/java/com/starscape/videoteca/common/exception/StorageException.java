package com.starscape.videoteca.common.exception;

/**
 * Object store I/O failure.
 */
public class StorageException extends BusinessException {
    
    public StorageException(String message, Throwable cause) {
        super("STORAGE_ERROR", message, cause);
    }
}
