package com.searchnexus.exception;

public class ProcessControlException extends NexusException {

    public ProcessControlException(String message) {
        super(NexusErrorCode.PROCESS_CONTROL_FAILED, message);
    }

    public ProcessControlException(String message, Throwable cause) {
        super(NexusErrorCode.PROCESS_CONTROL_FAILED, message, cause);
    }
}
