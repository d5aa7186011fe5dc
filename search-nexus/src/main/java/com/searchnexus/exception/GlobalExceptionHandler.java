package com.searchnexus.exception;

import com.searchnexus.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    // same body as a failed validate call
    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ValidationResult> handleConflictException(ConflictException e) {
        log.warn("Configuration conflict: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getValidation());
    }

    @ExceptionHandler(NexusException.class)
    public ResponseEntity<ErrorResponse> handleNexusException(NexusException e) {
        if (e.getErrorCode().getHttpStatus().is5xxServerError()) {
            log.error("Request failed: [Code: {}] {}", e.getErrorCode().getCode(), e.getMessage(), e);
        } else {
            log.warn("Request rejected: [Code: {}] {}", e.getErrorCode().getCode(), e.getMessage());
        }
        return ErrorResponse.toResponseEntity(e.getErrorCode(), e.getMessage(), e.getPayload());
    }

    @ExceptionHandler(Exception.class)
    protected ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unhandled Exception: ", e);
        return ErrorResponse.toResponseEntity(NexusErrorCode.INTERNAL_ERROR);
    }
}
