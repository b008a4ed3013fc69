package com.demo.eligibility.service;

import com.demo.eligibility.model.ApplicationExtraction;
import com.demo.eligibility.model.DecisionResult;
import com.demo.eligibility.model.DecisionStatus;
import com.demo.eligibility.model.ValidationResult;
import com.demo.eligibility.repository.DecisionReportRepository;
import com.demo.eligibility.repository.GroundTruthLookup;
import com.demo.eligibility.repository.GroundTruthRepository;
import com.demo.eligibility.repository.ValidationResultsRepository;
import com.demo.eligibility.service.decision.DecisionEngine;
import com.demo.eligibility.service.decision.DecisionSummary;
import com.demo.eligibility.service.dto.DecisionReport;
import com.demo.eligibility.service.dto.DecisionResponse;
import com.demo.eligibility.service.dto.ReasonDtos;
import com.demo.eligibility.service.dto.ValidationRecord;
import com.demo.eligibility.service.extraction.ApplicationAssembler;
import com.demo.eligibility.service.extraction.DocumentLocator;
import com.demo.eligibility.service.extraction.ExtractedDocuments;
import com.demo.eligibility.service.extraction.ExtractionService;
import com.demo.eligibility.service.validation.ConsistencyValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Batch over a documents root: one sub-directory per application. Applications run in
 * parallel; the decision stage reads back the validation-results file it was handed.
 */
@Slf4j
@Service
public class EligibilityPipeline {

    static final int TOP_REASONS = 3;

    private final DocumentLocator locator;
    private final ExtractionService extractionService;
    private final ApplicationAssembler assembler;
    private final ConsistencyValidator validator;
    private final DecisionEngine decisionEngine;
    private final GroundTruthRepository groundTruthRepository;
    private final ValidationResultsRepository validationResultsRepository;
    private final DecisionReportRepository decisionReportRepository;
    private final ExplainService explainService;
    private final Executor executor;
    private final Clock clock;

    public EligibilityPipeline(DocumentLocator locator,
                               ExtractionService extractionService,
                               ApplicationAssembler assembler,
                               ConsistencyValidator validator,
                               DecisionEngine decisionEngine,
                               GroundTruthRepository groundTruthRepository,
                               ValidationResultsRepository validationResultsRepository,
                               DecisionReportRepository decisionReportRepository,
                               ExplainService explainService,
                               @Qualifier("pipelineExecutor") Executor executor,
                               Clock clock) {
        this.locator = locator;
        this.extractionService = extractionService;
        this.assembler = assembler;
        this.validator = validator;
        this.decisionEngine = decisionEngine;
        this.groundTruthRepository = groundTruthRepository;
        this.validationResultsRepository = validationResultsRepository;
        this.decisionReportRepository = decisionReportRepository;
        this.explainService = explainService;
        this.executor = executor;
        this.clock = clock;
    }

    public record Assessed(ApplicationExtraction extraction, ValidationResult validation) {}

    public record BatchResult(List<ValidationResult> validations, List<DecisionResult> decisions, DecisionSummary summary) {}

    /** Extraction, assembly and validation of one application directory. */
    public Assessed assess(String applicationId, Path applicationDir, GroundTruthLookup groundTruth) {
        log.info("[{}] processing {}", applicationId, applicationDir);
        ExtractedDocuments docs = extractionService.extract(applicationId, applicationDir);
        ApplicationExtraction extraction = assembler.assemble(applicationId, docs, groundTruth);
        ValidationResult validation = validator.validate(extraction);
        log.info("[{}] validation {} (quality {}, {} findings, missing {})", applicationId,
                validation.validationStatus().code(), DecisionResponse.round4(validation.qualityScore()),
                validation.findings().size(), extraction.missingDocuments().size());
        return new Assessed(extraction, validation);
    }

    public BatchResult run(Path documentsRoot, Path groundTruthFile, Path validationFile, Path decisionFile) {
        // 1) side-channel loaded once, shared read-only
        GroundTruthLookup groundTruth = groundTruthRepository.load(groundTruthFile);

        // 2) fan out across applications
        List<String> ids = locator.applicationIds(documentsRoot);
        log.info("Starting batch of {} applications under {}", ids.size(), documentsRoot);
        List<CompletableFuture<ValidationResult>> futures = ids.stream()
                .map(id -> CompletableFuture
                        .supplyAsync(() -> assess(id, documentsRoot.resolve(id), groundTruth).validation(), executor)
                        .exceptionally(e -> {
                            log.error("[{}] processing aborted", id, e);
                            return null;
                        }))
                .toList();
        List<ValidationResult> validations = futures.stream()
                .map(CompletableFuture::join)
                .filter(Objects::nonNull)
                .toList();

        // 3) validation results in the decision-input format
        validationResultsRepository.write(validationFile,
                validations.stream().map(ValidationRecord::from).toList());

        // 4) decisions for every located application, read back from the file just written
        Map<String, ValidationRecord> records = validationResultsRepository.read(validationFile);
        List<DecisionResult> decisions = decisionEngine.decideAll(ids, records);
        DecisionSummary summary = decisionEngine.summarize(decisions);

        DecisionReport report = new DecisionReport();
        report.setGeneratedAt(clock.instant());
        report.setSummary(summary);
        report.setDecisions(decisions.stream().map(this::toResponse).toList());
        decisionReportRepository.write(decisionFile, report);

        log.info("Batch done: {} applications, decisions {}", summary.totalApplications(), summary.decisions());
        return new BatchResult(validations, decisions, summary);
    }

    private DecisionResponse toResponse(DecisionResult decision) {
        DecisionResponse response = DecisionResponse.from(decision);
        if (decision.finalDecision() != DecisionStatus.APPROVE) {
            List<ReasonDtos.Reason> reasons = explainService.topReasons(decision, TOP_REASONS);
            for (ReasonDtos.Reason r : reasons) {
                log.info("[{}] {} reason: {}: {}", decision.applicationId(), decision.finalDecision(), r.title, r.text);
            }
            response.setTopReasons(reasons);
        }
        return response;
    }
}
