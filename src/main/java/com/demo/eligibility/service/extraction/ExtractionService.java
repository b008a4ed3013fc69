package com.demo.eligibility.service.extraction;

import com.demo.eligibility.model.AssetLiabilityExtraction;
import com.demo.eligibility.model.BankStatementExtraction;
import com.demo.eligibility.model.CreditReportExtraction;
import com.demo.eligibility.model.DocumentKind;
import com.demo.eligibility.model.EmploymentInfo;
import com.demo.eligibility.model.ExtractionMetadata;
import com.demo.eligibility.model.ExtractionStatus;
import com.demo.eligibility.model.PersonalInfo;
import com.demo.eligibility.model.ResumeExtraction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs the six extractors of one application concurrently and waits for all of them.
 * Each document gets its own deadline, counted from the moment it starts running. A late
 * document is recorded as failed and its worker interrupted; the others are kept.
 */
@Slf4j
@Service
public class ExtractionService {

    static final String TIMEOUT_ERROR = "extraction timed out";

    private final DocumentLocator locator;
    private final IdentityCardExtractor identityCardExtractor;
    private final EmploymentLetterExtractor employmentLetterExtractor;
    private final BankStatementExtractor bankStatementExtractor;
    private final ResumeExtractor resumeExtractor;
    private final AssetLiabilityExtractor assetLiabilityExtractor;
    private final CreditReportExtractor creditReportExtractor;
    private final Executor executor;
    private final Duration timeout;

    public ExtractionService(DocumentLocator locator,
                             IdentityCardExtractor identityCardExtractor,
                             EmploymentLetterExtractor employmentLetterExtractor,
                             BankStatementExtractor bankStatementExtractor,
                             ResumeExtractor resumeExtractor,
                             AssetLiabilityExtractor assetLiabilityExtractor,
                             CreditReportExtractor creditReportExtractor,
                             @Qualifier("extractionExecutor") Executor executor,
                             @Value("${eligibility.extraction.timeout:30s}") Duration timeout) {
        this.locator = locator;
        this.identityCardExtractor = identityCardExtractor;
        this.employmentLetterExtractor = employmentLetterExtractor;
        this.bankStatementExtractor = bankStatementExtractor;
        this.resumeExtractor = resumeExtractor;
        this.assetLiabilityExtractor = assetLiabilityExtractor;
        this.creditReportExtractor = creditReportExtractor;
        this.executor = executor;
        this.timeout = timeout;
    }

    public ExtractedDocuments extract(String applicationId, Path applicationDir) {
        Map<DocumentKind, Path> files = locator.locate(applicationDir);
        log.debug("[{}] located {} of {} documents", applicationId, files.size(), DocumentKind.values().length);

        CompletableFuture<ExtractionOutcome<PersonalInfo>> identity = submit(applicationId, identityCardExtractor, files);
        CompletableFuture<ExtractionOutcome<EmploymentInfo>> employment = submit(applicationId, employmentLetterExtractor, files);
        CompletableFuture<ExtractionOutcome<BankStatementExtraction>> bank = submit(applicationId, bankStatementExtractor, files);
        CompletableFuture<ExtractionOutcome<ResumeExtraction>> resume = submit(applicationId, resumeExtractor, files);
        CompletableFuture<ExtractionOutcome<AssetLiabilityExtraction>> assets = submit(applicationId, assetLiabilityExtractor, files);
        CompletableFuture<ExtractionOutcome<CreditReportExtraction>> credit = submit(applicationId, creditReportExtractor, files);

        // barrier: assembly only starts once every document has an outcome
        CompletableFuture.allOf(identity, employment, bank, resume, assets, credit).join();

        return new ExtractedDocuments(identity.join(), employment.join(), bank.join(),
                resume.join(), assets.join(), credit.join());
    }

    private <T> CompletableFuture<ExtractionOutcome<T>> submit(String applicationId,
                                                               FieldExtractor<T> extractor,
                                                               Map<DocumentKind, Path> files) {
        DocumentKind kind = extractor.kind();
        Path file = files.get(kind);
        if (file == null) {
            return CompletableFuture.completedFuture(ExtractionOutcome.missing(kind));
        }
        CompletableFuture<ExtractionOutcome<T>> result = new CompletableFuture<>();
        try {
            executor.execute(new Deadlined<>(extractor, file, result));
        } catch (RejectedExecutionException e) {
            result.complete(ExtractionOutcome.failed(kind, "rejected", "extraction rejected: " + e.getMessage(), Duration.ZERO));
        }
        return result.whenComplete((outcome, e) -> report(applicationId, outcome));
    }

    /**
     * One extraction whose deadline starts when a worker picks it up, not when it is queued.
     * When the deadline fires first the outcome becomes the timeout failure and the worker is
     * interrupted so the pool thread is handed back.
     */
    private final class Deadlined<T> implements Runnable {

        private final FieldExtractor<T> extractor;
        private final Path file;
        private final CompletableFuture<ExtractionOutcome<T>> result;
        private final Object guard = new Object();
        private Thread worker;

        Deadlined(FieldExtractor<T> extractor, Path file, CompletableFuture<ExtractionOutcome<T>> result) {
            this.extractor = extractor;
            this.file = file;
            this.result = result;
        }

        @Override
        public void run() {
            DocumentKind kind = extractor.kind();
            synchronized (guard) {
                worker = Thread.currentThread();
            }
            CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS).execute(this::expire);
            try {
                result.complete(extractor.extract(file));
            } catch (Exception e) {
                result.complete(ExtractionOutcome.failed(kind, "unknown", String.valueOf(e.getMessage()), Duration.ZERO));
            } finally {
                // no-op unless an Error escaped the extractor
                result.complete(ExtractionOutcome.failed(kind, "unknown", "extraction aborted", Duration.ZERO));
                synchronized (guard) {
                    worker = null;
                }
                // an interrupt that raced the finish must not leak into the next task
                Thread.interrupted();
            }
        }

        private void expire() {
            if (!result.complete(ExtractionOutcome.failed(extractor.kind(), "timeout", TIMEOUT_ERROR, timeout))) {
                return;
            }
            synchronized (guard) {
                if (worker != null) worker.interrupt();
            }
        }
    }

    private static void report(String applicationId, ExtractionOutcome<?> outcome) {
        if (outcome == null) return;
        ExtractionMetadata m = outcome.metadata();
        if (m.status() == ExtractionStatus.FAILED) {
            log.warn("[{}] {} failed: {}", applicationId, m.documentKind().code(), m.errors());
        } else {
            log.debug("[{}] {} {} (confidence {}, {} ms)", applicationId, m.documentKind().code(),
                    m.status().code(), m.confidence(), m.processingDuration().toMillis());
        }
    }
}
