package com.searchnexus.dto;

import lombok.Data;

@Data
public class ValidateRequest {
    private NodeConfigRequest nodeConfig;
    private String originalName;
}
