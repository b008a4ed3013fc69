package com.demo.eligibility.service.extraction;

import com.demo.eligibility.model.DocumentKind;

import java.nio.file.Path;

/**
 * Reads one document kind. Implementations never throw: every failure comes back as an
 * outcome with status {@code FAILED} and the reason in its errors.
 */
public interface FieldExtractor<T> {

    DocumentKind kind();

    ExtractionOutcome<T> extract(Path file);
}
