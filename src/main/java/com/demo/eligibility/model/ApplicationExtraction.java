package com.demo.eligibility.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Unified record of one application, assembled once from the six document extractions and
 * read-only afterwards. Document sections are {@code null} when the document yielded nothing.
 */
public record ApplicationExtraction(
        String applicationId,
        PersonalInfo personalInfo,
        EmploymentInfo employmentInfo,
        BankStatementExtraction bankStatement,
        ResumeExtraction resume,
        AssetLiabilityExtraction assetsLiabilities,
        CreditReportExtraction creditReport,
        Map<DocumentKind, ExtractionMetadata> metadata,
        List<DocumentKind> missingDocuments,
        VerificationStatus verificationStatus,
        double dataQualityScore
) {
    public ApplicationExtraction {
        personalInfo = personalInfo == null ? PersonalInfo.EMPTY : personalInfo;
        employmentInfo = employmentInfo == null ? EmploymentInfo.EMPTY : employmentInfo;
        EnumMap<DocumentKind, ExtractionMetadata> copy = new EnumMap<>(DocumentKind.class);
        if (metadata != null) copy.putAll(metadata);
        metadata = Collections.unmodifiableMap(copy);
        missingDocuments = missingDocuments == null ? List.of() : List.copyOf(missingDocuments);
    }

    public ApplicationExtraction withPersonalInfo(PersonalInfo info) {
        return new ApplicationExtraction(applicationId, info, employmentInfo, bankStatement, resume,
                assetsLiabilities, creditReport, metadata, missingDocuments, verificationStatus, dataQualityScore);
    }

    public boolean isPresent(DocumentKind kind) {
        return !missingDocuments.contains(kind);
    }

    public int documentsPresent() {
        return DocumentKind.values().length - missingDocuments.size();
    }

    /** Average monthly salary credited to the bank account, if the statement showed any. */
    public Double bankMonthlyIncome() {
        return bankStatement == null ? null : bankStatement.monthlyIncome();
    }
}
