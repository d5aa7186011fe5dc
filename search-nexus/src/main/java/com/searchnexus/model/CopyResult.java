package com.searchnexus.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class CopyResult {
    private String sourceNode;
    private NodeStatus node;
    private boolean copiedData;
    private List<String> warnings;
}
