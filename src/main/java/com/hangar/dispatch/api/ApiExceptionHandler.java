package com.hangar.dispatch.api;

import com.hangar.core.error.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps the Hangar exception hierarchy onto HTTP status codes.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({ValidationException.class, IllegalArgumentException.class,
            HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiResponse<Void>> handleConflict(ConflictException e) {
        return respond(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(ResourceNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(RuntimeUnavailableException.class)
    public ResponseEntity<ApiResponse<Void>> handleRuntimeUnavailable(RuntimeUnavailableException e) {
        log.warn("Container runtime unavailable: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    /**
     * The daemon answered but the operation failed: upstream error.
     */
    @ExceptionHandler({ImagePullFailedException.class, ContainerOperationException.class,
            BootstrapTimeoutException.class})
    public ResponseEntity<ApiResponse<Void>> handleUpstream(HangarException e) {
        log.warn("Container operation failed: {}", e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoRoute(NoResourceFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({StorageException.class, CatalogCorruptException.class})
    public ResponseEntity<ApiResponse<Void>> handleStorage(HangarException e) {
        log.error("Storage failure: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception e) {
        log.error("Unhandled API error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage() != null ? e.getMessage() : "Internal error");
    }

    private static ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiResponse.failure(message));
    }
}
