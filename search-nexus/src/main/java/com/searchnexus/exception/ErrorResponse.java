package com.searchnexus.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import org.springframework.http.ResponseEntity;

import java.util.Map;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ErrorResponse {
    private final int status;
    private final String code;
    private final String reason;
    private final String message;
    private final Map<String, Object> details;

    public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode) {
        return toResponseEntity(errorCode, errorCode.getMessage(), Map.of());
    }

    public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode, String customMessage,
                                                                 Map<String, Object> details) {
        return ResponseEntity
                .status(errorCode.getHttpStatus())
                .body(ErrorResponse.builder()
                        .status(errorCode.getHttpStatus().value())
                        .code(errorCode.getCode())
                        .reason(errorCode.getReason())
                        .message(customMessage)
                        .details(details)
                        .build()
                );
    }
}
