package com.demo.eligibility.service.extraction;

import com.demo.eligibility.model.DocumentKind;
import com.demo.eligibility.model.ExtractionMetadata;

import java.time.Duration;

/** Typed fields of one document, or {@code null}, together with how the extraction went. */
public record ExtractionOutcome<T>(T fields, ExtractionMetadata metadata) {

    public static <T> ExtractionOutcome<T> missing(DocumentKind kind) {
        return new ExtractionOutcome<>(null, ExtractionMetadata.missing(kind));
    }

    public static <T> ExtractionOutcome<T> failed(DocumentKind kind, String method, String error, Duration took) {
        return new ExtractionOutcome<>(null, ExtractionMetadata.failed(kind, method, error, took));
    }

    public boolean hasFields() {
        return fields != null;
    }
}
