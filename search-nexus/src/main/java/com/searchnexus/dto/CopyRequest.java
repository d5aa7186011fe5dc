package com.searchnexus.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CopyRequest {
    private String newName;
    private String targetBasePath;
    private boolean copyData;
    private Integer httpPort;
    private Integer transportPort;

    public CopyRequest(String newName, String targetBasePath, boolean copyData) {
        this(newName, targetBasePath, copyData, null, null);
    }
}
