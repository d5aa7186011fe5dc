package com.searchnexus.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConflictType {
    NODE_NAME("node_name"),
    HTTP_PORT("http_port"),
    TRANSPORT_PORT("transport_port"),
    DATA_PATH("data_path"),
    LOGS_PATH("logs_path"),
    HEAP_SIZE("heap_size"),
    NODE_ROLES("node_roles");

    private final String tag;

    ConflictType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    public boolean isPort() {
        return this == HTTP_PORT || this == TRANSPORT_PORT;
    }
}
