package com.searchnexus.dto;

import lombok.Data;

@Data
public class ClusterRenameRequest {
    private String newName;
}
