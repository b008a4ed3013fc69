package com.demo.eligibility.model;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of running one document's extractor. Created once, never modified.
 */
public record ExtractionMetadata(
        DocumentKind documentKind,
        ExtractionStatus status,
        double confidence,
        String extractionMethod,
        List<String> errors,
        List<String> warnings,
        Duration processingDuration
) {
    public ExtractionMetadata {
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        processingDuration = processingDuration == null ? Duration.ZERO : processingDuration;
    }

    public static ExtractionMetadata missing(DocumentKind kind) {
        return new ExtractionMetadata(kind, ExtractionStatus.MISSING, 0.0, "none",
                List.of("Document not found"), List.of(), Duration.ZERO);
    }

    public static ExtractionMetadata failed(DocumentKind kind, String method, String error, Duration took) {
        return new ExtractionMetadata(kind, ExtractionStatus.FAILED, 0.0, method,
                List.of(error == null ? "unknown error" : error), List.of(), took);
    }

    public boolean isPresent() {
        return status != ExtractionStatus.MISSING;
    }
}
