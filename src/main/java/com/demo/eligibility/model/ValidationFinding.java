package com.demo.eligibility.model;

import lombok.Builder;

import java.util.List;

/**
 * One detected issue. {@code findingType} is a short machine code such as
 * {@code missing_field} or {@code income_mismatch}.
 */
@Builder
public record ValidationFinding(
        FindingCategory category,
        Severity severity,
        String findingType,
        String message,
        List<String> fieldsInvolved,
        List<DocumentKind> affectedDocuments,
        boolean autoResolvable,
        String suggestedResolution
) {
    public ValidationFinding {
        fieldsInvolved = fieldsInvolved == null ? List.of() : List.copyOf(fieldsInvolved);
        affectedDocuments = affectedDocuments == null ? List.of() : List.copyOf(affectedDocuments);
    }
}
