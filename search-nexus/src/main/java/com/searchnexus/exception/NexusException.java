package com.searchnexus.exception;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
public class NexusException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> payload = new LinkedHashMap<>();

    public NexusException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public NexusException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public NexusException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public NexusException with(String key, Object value) {
        payload.put(key, value);
        return this;
    }
}
