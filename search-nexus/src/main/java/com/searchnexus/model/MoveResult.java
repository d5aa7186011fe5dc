package com.searchnexus.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class MoveResult {
    private String nodeName;
    private NodeStatus node;
    private boolean preservedData;
    private List<String> warnings;
}
