package com.starscape.videoteca.common.exception;

import com.starscape.videoteca.common.api.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Translates workflow errors into the response envelope.
 * The classification of the error decides the status code, unclassified errors become 500.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(ValidationException ex) {
        return ApiResponse.<Void>error(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage()).toResponseEntity();
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        return ApiResponse.<Void>error(HttpStatus.UNPROCESSABLE_ENTITY,
                "File validation failed: file exceeds the maximum upload size").toResponseEntity();
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingPart(MissingServletRequestPartException ex) {
        return ApiResponse.<Void>error(HttpStatus.UNPROCESSABLE_ENTITY,
                "Missing multipart field: " + ex.getRequestPartName()).toResponseEntity();
    }

    // Aborted or malformed multipart bodies end up here, before any workflow runs
    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<ApiResponse<Void>> handleMultipart(MultipartException ex) {
        log.warn("Rejected multipart request: {}", ex.getMessage());
        return ApiResponse.<Void>error(HttpStatus.BAD_REQUEST,
                "Upload body could not be read").toResponseEntity();
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ApiResponse<Void>> handleMalformedRequest(Exception ex) {
        return ApiResponse.<Void>error(HttpStatus.BAD_REQUEST, "Malformed request").toResponseEntity();
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(NotFoundException ex) {
        return ApiResponse.<Void>error(HttpStatus.NOT_FOUND, ex.getMessage()).toResponseEntity();
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiResponse<Void>> handleConflict(ConflictException ex) {
        return ApiResponse.<Void>error(HttpStatus.CONFLICT, ex.getMessage()).toResponseEntity();
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ApiResponse<Void>> handleStorage(StorageException ex) {
        log.error("Object storage failure: {}", ex.getMessage(), ex);
        return ApiResponse.<Void>error(HttpStatus.BAD_GATEWAY, ex.getMessage()).toResponseEntity();
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ApiResponse<Void>> handleAccessDenied(AccessDeniedException ex) {
        return ApiResponse.<Void>error(HttpStatus.FORBIDDEN, "Access denied").toResponseEntity();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex) {
        log.error("Unhandled error", ex);
        return ApiResponse.<Void>error(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred").toResponseEntity();
    }
}
