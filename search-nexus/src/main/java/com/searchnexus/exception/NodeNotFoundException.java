package com.searchnexus.exception;

public class NodeNotFoundException extends NexusException {

    public NodeNotFoundException(String nodeName) {
        super(NexusErrorCode.NODE_NOT_FOUND, "Node \"" + nodeName + "\" not found");
        with("nodeName", nodeName);
    }
}
