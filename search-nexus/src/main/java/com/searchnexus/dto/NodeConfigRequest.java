package com.searchnexus.dto;

import com.searchnexus.model.NodeRoles;
import lombok.Data;

/**
 * Create/update body. Every field is optional on update; absent fields keep
 * their current value.
 */
@Data
public class NodeConfigRequest {
    private String name;
    private String host;
    private Integer httpPort;
    private Integer transportPort;
    private String cluster;
    private String dataPath;
    private String logsPath;
    private NodeRoles roles;
    private String heapSize;
}
