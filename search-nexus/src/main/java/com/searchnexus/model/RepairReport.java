package com.searchnexus.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class RepairReport {
    private List<String> verified = new ArrayList<>();
    private List<String> repaired = new ArrayList<>();
    private List<String> removed = new ArrayList<>();
    private String timestamp;
}
