package com.pcoptimizer.licensing.api;

import com.pcoptimizer.licensing.dto.ApiException;
import com.pcoptimizer.licensing.dto.ErrorResponse;
import com.pcoptimizer.licensing.store.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.UUID;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorResponse> handleApi(ApiException e) {
        if (e.getStatus().is5xxServerError()) {
            log.error("API error {} {}: {}", e.getStatus().value(), e.getCode(), e.getMessage());
        }
        return body(e.getStatus(), e.getCode(), e.getMessage(), e.getDetails());
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStorage(StorageUnavailableException e) {
        log.error("License storage unavailable: {}", e.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "STORAGE_UNAVAILABLE",
                "License storage is unavailable, try again later", Map.of());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST_BODY", "Request body is missing or malformed", Map.of());
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(RuntimeException e) {
        log.error("Unexpected error", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal server error", Map.of());
    }

    private static ResponseEntity<ErrorResponse> body(HttpStatus status, String code, String message,
                                                      Map<String, Object> details) {
        String requestId = UUID.randomUUID().toString();
        return ResponseEntity.status(status)
                .body(new ErrorResponse(new ErrorResponse.ErrorBody(code, message, requestId, details)));
    }
}
