package com.searchnexus.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum NexusErrorCode implements ErrorCode {

    INVALID_INPUT(HttpStatus.BAD_REQUEST, "N-400", "invalid_input", "Request is missing or has malformed fields."),
    NODE_NOT_FOUND(HttpStatus.NOT_FOUND, "N-404", "node_not_found", "Node does not exist."),
    CLUSTER_NOT_FOUND(HttpStatus.NOT_FOUND, "N-405", "cluster_not_found", "Cluster does not exist."),
    TASK_NOT_FOUND(HttpStatus.NOT_FOUND, "N-406", "task_not_found", "Lifecycle task does not exist or has expired."),
    CONFIGURATION_CONFLICT(HttpStatus.CONFLICT, "N-409", "configuration_conflict", "Node configuration conflicts with registered nodes."),
    NODE_RUNNING(HttpStatus.CONFLICT, "N-410", "node_running", "Node must be stopped first."),
    DESTINATION_EXISTS(HttpStatus.CONFLICT, "N-411", "destination_exists", "Destination already holds other content."),
    CLUSTER_NOT_EMPTY(HttpStatus.CONFLICT, "N-412", "cluster_not_empty", "Cluster still has member nodes."),
    DEFAULT_CLUSTER(HttpStatus.BAD_REQUEST, "N-413", "default_cluster", "The default cluster cannot be deleted."),
    SUGGESTION_EXHAUSTED(HttpStatus.UNPROCESSABLE_ENTITY, "N-422", "suggestion_exhausted", "No free value found within the search window."),
    FILESYSTEM_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "N-500", "filesystem_failure", "Filesystem operation failed."),
    PROCESS_CONTROL_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "N-501", "process_control_failed", "Could not control the node process."),
    VALIDATION_TIMEOUT(HttpStatus.SERVICE_UNAVAILABLE, "N-503", "validation_timeout", "Validation did not finish in time."),
    RECONCILIATION_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "N-504", "reconciliation_timeout", "Node did not reach the requested state in time."),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "N-599", "internal_error", "Internal server error.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String reason;
    private final String message;
}
