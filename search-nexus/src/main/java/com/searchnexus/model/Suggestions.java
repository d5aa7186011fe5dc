package com.searchnexus.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Suggestions {
    private Integer httpPort;
    private Integer transportPort;
    private List<String> nodeName;

    @JsonIgnore
    public boolean isEmpty() {
        return httpPort == null && transportPort == null && (nodeName == null || nodeName.isEmpty());
    }
}
