package com.demo.eligibility.service.extraction;

import com.demo.eligibility.model.AssetLiabilityExtraction;
import com.demo.eligibility.model.BankStatementExtraction;
import com.demo.eligibility.model.CreditReportExtraction;
import com.demo.eligibility.model.DocumentKind;
import com.demo.eligibility.model.EmploymentInfo;
import com.demo.eligibility.model.ExtractionMetadata;
import com.demo.eligibility.model.PersonalInfo;
import com.demo.eligibility.model.ResumeExtraction;

import java.util.EnumMap;
import java.util.Map;

/** The six per-document outcomes of one application, all complete. */
public record ExtractedDocuments(
        ExtractionOutcome<PersonalInfo> identityCard,
        ExtractionOutcome<EmploymentInfo> employmentLetter,
        ExtractionOutcome<BankStatementExtraction> bankStatement,
        ExtractionOutcome<ResumeExtraction> resume,
        ExtractionOutcome<AssetLiabilityExtraction> assetsLiabilities,
        ExtractionOutcome<CreditReportExtraction> creditReport
) {

    public static ExtractedDocuments allMissing() {
        return new ExtractedDocuments(
                ExtractionOutcome.missing(DocumentKind.IDENTITY_CARD),
                ExtractionOutcome.missing(DocumentKind.EMPLOYMENT_LETTER),
                ExtractionOutcome.missing(DocumentKind.BANK_STATEMENT),
                ExtractionOutcome.missing(DocumentKind.RESUME),
                ExtractionOutcome.missing(DocumentKind.ASSET_LIABILITY_SHEET),
                ExtractionOutcome.missing(DocumentKind.CREDIT_REPORT));
    }

    public Map<DocumentKind, ExtractionMetadata> metadata() {
        Map<DocumentKind, ExtractionMetadata> out = new EnumMap<>(DocumentKind.class);
        out.put(DocumentKind.IDENTITY_CARD, identityCard.metadata());
        out.put(DocumentKind.EMPLOYMENT_LETTER, employmentLetter.metadata());
        out.put(DocumentKind.BANK_STATEMENT, bankStatement.metadata());
        out.put(DocumentKind.RESUME, resume.metadata());
        out.put(DocumentKind.ASSET_LIABILITY_SHEET, assetsLiabilities.metadata());
        out.put(DocumentKind.CREDIT_REPORT, creditReport.metadata());
        return out;
    }
}
