package com.driftfix.domain;

import java.util.List;

public record ValidationReport(ValidationSplit split, List<PatchValidationResult> results) {

    public ValidationReport {
        results = List.copyOf(results);
    }
}
