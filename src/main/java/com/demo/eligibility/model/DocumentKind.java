package com.demo.eligibility.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The six documents of one application. Each kind knows the file-name marker and extension the
 * locator matches on, and its weight in the completeness score.
 */
public enum DocumentKind {
    IDENTITY_CARD("identity_card", "emirates_id", ".png", 0.15),
    EMPLOYMENT_LETTER("employment_letter", "employment_letter", ".pdf", 0.15),
    BANK_STATEMENT("bank_statement", "bank_statement", ".pdf", 0.20),
    RESUME("resume", "resume", ".pdf", 0.15),
    ASSET_LIABILITY_SHEET("assets_liabilities", "assets_liabilities", ".xlsx", 0.20),
    CREDIT_REPORT("credit_report", "credit_report", ".json", 0.15);

    private final String code;
    private final String fileMarker;
    private final String extension;
    private final double completenessWeight;

    DocumentKind(String code, String fileMarker, String extension, double completenessWeight) {
        this.code = code;
        this.fileMarker = fileMarker;
        this.extension = extension;
        this.completenessWeight = completenessWeight;
    }

    @JsonValue
    public String code() { return code; }

    public String fileMarker() { return fileMarker; }

    public String extension() { return extension; }

    public double completenessWeight() { return completenessWeight; }

    /** Substring-and-extension match, case-insensitive. */
    public boolean matches(String fileName) {
        if (fileName == null) return false;
        String fn = fileName.toLowerCase(Locale.ROOT);
        return fn.contains(fileMarker) && fn.endsWith(extension);
    }
}
