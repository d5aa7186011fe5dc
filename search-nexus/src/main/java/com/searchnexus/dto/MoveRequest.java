package com.searchnexus.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MoveRequest {
    private String targetBasePath;
    private Boolean preserveData; // required: dropping the data must be asked for explicitly
}
