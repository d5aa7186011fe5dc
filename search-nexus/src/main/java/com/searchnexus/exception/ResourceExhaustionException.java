package com.searchnexus.exception;

public class ResourceExhaustionException extends NexusException {

    public ResourceExhaustionException(String message) {
        super(NexusErrorCode.SUGGESTION_EXHAUSTED, message);
    }
}
