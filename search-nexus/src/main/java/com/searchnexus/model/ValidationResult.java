package com.searchnexus.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResult {
    private boolean valid;
    private List<Conflict> conflicts = new ArrayList<>();
    private Suggestions suggestions = new Suggestions();
    private List<String> warnings = new ArrayList<>();

    public static ValidationResult of(List<Conflict> conflicts, Suggestions suggestions, List<String> warnings) {
        return new ValidationResult(conflicts.isEmpty(), List.copyOf(conflicts), suggestions, List.copyOf(warnings));
    }

    public boolean hasConflict(ConflictType type) {
        return conflicts.stream().anyMatch(c -> c.getType() == type);
    }
}
