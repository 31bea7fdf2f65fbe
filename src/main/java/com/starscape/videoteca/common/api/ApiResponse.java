package com.starscape.videoteca.common.api;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Uniform response envelope. The HTTP status of the response always mirrors statusCode.
 */
public record ApiResponse<T>(
    int statusCode,
    String message,
    T data
) {
    
    public static <T> ApiResponse<T> of(HttpStatus status, String message, T data) {
        return new ApiResponse<>(status.value(), message, data);
    }
    
    public static <T> ApiResponse<T> error(HttpStatus status, String message) {
        return new ApiResponse<>(status.value(), message, null);
    }
    
    public ResponseEntity<ApiResponse<T>> toResponseEntity() {
        return ResponseEntity.status(statusCode).body(this);
    }
}
