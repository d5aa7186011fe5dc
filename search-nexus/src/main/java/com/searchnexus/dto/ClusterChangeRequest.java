package com.searchnexus.dto;

import lombok.Data;

@Data
public class ClusterChangeRequest {
    private String cluster;
}
