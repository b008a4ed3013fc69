package com.demo.eligibility.service.extraction;

import com.demo.eligibility.model.ApplicationExtraction;
import com.demo.eligibility.model.DocumentKind;
import com.demo.eligibility.model.EmploymentInfo;
import com.demo.eligibility.model.ExtractionMetadata;
import com.demo.eligibility.model.ExtractionStatus;
import com.demo.eligibility.model.PersonalInfo;
import com.demo.eligibility.model.VerificationStatus;
import com.demo.eligibility.repository.GroundTruthLookup;
import com.demo.eligibility.repository.GroundTruthRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merges the six document outcomes into one {@link ApplicationExtraction}. The data-quality
 * score reflects what the documents yielded; ground-truth back-fill happens afterwards and only
 * fills personal fields that are still empty.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApplicationAssembler {

    private static final int DOCUMENT_COUNT = DocumentKind.values().length;
    private static final double CORE_FIELDS = 3.0;

    private final Clock clock;

    public ApplicationExtraction assemble(String applicationId, ExtractedDocuments docs, GroundTruthLookup groundTruth) {
        Map<DocumentKind, ExtractionMetadata> metadata = docs.metadata();
        List<DocumentKind> missing = Arrays.stream(DocumentKind.values())
                .filter(k -> metadata.get(k).status() == ExtractionStatus.MISSING)
                .toList();

        PersonalInfo personal = Optional.ofNullable(docs.identityCard().fields()).orElse(PersonalInfo.EMPTY);
        EmploymentInfo employment = Optional.ofNullable(docs.employmentLetter().fields()).orElse(EmploymentInfo.EMPTY);

        double quality = dataQualityScore(metadata, missing.size(), personal, employment);
        ApplicationExtraction assembled = new ApplicationExtraction(
                applicationId,
                personal,
                employment,
                docs.bankStatement().fields(),
                docs.resume().fields(),
                docs.assetsLiabilities().fields(),
                docs.creditReport().fields(),
                metadata,
                missing,
                verificationStatus(metadata, missing),
                quality);

        return groundTruth.find(applicationId)
                .map(gt -> backFill(assembled, gt))
                .orElse(assembled);
    }

    static VerificationStatus verificationStatus(Map<DocumentKind, ExtractionMetadata> metadata, List<DocumentKind> missing) {
        if (!missing.isEmpty()) return VerificationStatus.INCOMPLETE;
        boolean allSucceeded = metadata.values().stream().allMatch(m -> m.status() == ExtractionStatus.SUCCESS);
        return allSucceeded ? VerificationStatus.VERIFIED : VerificationStatus.INCOMPLETE;
    }

    /** Mean of document presence, mean confidence, core personal fields and core employment fields. */
    static double dataQualityScore(Map<DocumentKind, ExtractionMetadata> metadata, int missingCount,
                                   PersonalInfo personal, EmploymentInfo employment) {
        int present = DOCUMENT_COUNT - missingCount;
        double presence = present / (double) DOCUMENT_COUNT;
        double confidence = metadata.values().stream()
                .filter(ExtractionMetadata::isPresent)
                .mapToDouble(ExtractionMetadata::confidence)
                .average()
                .orElse(0.0);
        double personalFields = personal.coreFieldCount() / CORE_FIELDS;
        double employmentFields = employment.coreFieldCount() / CORE_FIELDS;
        return (presence + confidence + personalFields + employmentFields) / 4.0;
    }

    private ApplicationExtraction backFill(ApplicationExtraction extraction, GroundTruthRecord gt) {
        LocalDate today = LocalDate.now(clock);
        PersonalInfo before = extraction.personalInfo();
        PersonalInfo after = before.fillGaps(
                blankToNull(gt.getFullName()),
                blankToNull(gt.getEmiratesId()),
                gt.approximateDateOfBirth(today),
                blankToNull(gt.getMaritalStatus()));
        if (after.equals(before)) {
            return extraction;
        }
        log.debug("[{}] personal fields back-filled from ground truth", extraction.applicationId());
        return extraction.withPersonalInfo(after);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.strip();
    }
}
