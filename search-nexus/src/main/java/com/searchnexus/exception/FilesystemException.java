package com.searchnexus.exception;

public class FilesystemException extends NexusException {

    public FilesystemException(String message, Throwable cause) {
        super(NexusErrorCode.FILESYSTEM_FAILURE, message, cause);
    }

    public FilesystemException(NexusErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
