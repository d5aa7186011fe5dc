package com.searchnexus.exception;

import com.searchnexus.model.ValidationResult;
import lombok.Getter;

@Getter
public class ConflictException extends NexusException {

    private final ValidationResult validation;

    public ConflictException(String nodeName, ValidationResult validation) {
        super(NexusErrorCode.CONFIGURATION_CONFLICT,
                "Configuration for node \"" + nodeName + "\" conflicts with " + validation.getConflicts().size()
                        + " registered value(s)");
        this.validation = validation;
    }
}
