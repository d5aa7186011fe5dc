package com.searchnexus.exception;

public class ClusterNotFoundException extends NexusException {

    public ClusterNotFoundException(String clusterName) {
        super(NexusErrorCode.CLUSTER_NOT_FOUND, "Cluster \"" + clusterName + "\" not found");
        with("cluster", clusterName);
    }
}
