package com.searchnexus.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class DeleteResult {
    private String nodeName;
    private boolean preservedData;
    private List<String> warnings;
}
