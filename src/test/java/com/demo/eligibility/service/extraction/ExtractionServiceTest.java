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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.demo.eligibility.model.ApplicationFixtures.success;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ExtractionService")
class ExtractionServiceTest {

    private static final Path DIR = Path.of("APP-00001");

    @Mock private DocumentLocator locator;
    @Mock private IdentityCardExtractor identity;
    @Mock private EmploymentLetterExtractor employment;
    @Mock private BankStatementExtractor bank;
    @Mock private ResumeExtractor resume;
    @Mock private AssetLiabilityExtractor assets;
    @Mock private CreditReportExtractor credit;

    private ExecutorService executor;
    private final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(6);
        lenient().when(identity.kind()).thenReturn(DocumentKind.IDENTITY_CARD);
        lenient().when(employment.kind()).thenReturn(DocumentKind.EMPLOYMENT_LETTER);
        lenient().when(bank.kind()).thenReturn(DocumentKind.BANK_STATEMENT);
        lenient().when(resume.kind()).thenReturn(DocumentKind.RESUME);
        lenient().when(assets.kind()).thenReturn(DocumentKind.ASSET_LIABILITY_SHEET);
        lenient().when(credit.kind()).thenReturn(DocumentKind.CREDIT_REPORT);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
    }

    private ExtractionService service(Duration timeout) {
        return new ExtractionService(locator, identity, employment, bank, resume, assets, credit, executor, timeout);
    }

    private static Map<DocumentKind, Path> files(DocumentKind... kinds) {
        Map<DocumentKind, Path> m = new EnumMap<>(DocumentKind.class);
        for (DocumentKind k : kinds) m.put(k, DIR.resolve(k.fileMarker() + k.extension()));
        return m;
    }

    private static <T> ExtractionOutcome<T> ok(T fields, DocumentKind kind) {
        return new ExtractionOutcome<>(fields, success(kind));
    }

    @Test
    @DisplayName("Absent documents are missing and never reach an extractor")
    void missingDocuments() {
        // Arrange
        when(locator.locate(DIR)).thenReturn(files(DocumentKind.IDENTITY_CARD));
        when(identity.extract(any())).thenReturn(ok(PersonalInfo.EMPTY, DocumentKind.IDENTITY_CARD));

        // Act
        ExtractedDocuments docs = service(Duration.ofSeconds(5)).extract("APP-00001", DIR);

        // Assert
        assertThat(docs.identityCard().metadata().status()).isEqualTo(ExtractionStatus.SUCCESS);
        assertThat(docs.metadata()).hasSize(6);
        assertThat(docs.metadata().values()).filteredOn(m -> m.status() == ExtractionStatus.MISSING).hasSize(5);
        verify(employment, never()).extract(any());
        verify(bank, never()).extract(any());
        verify(credit, never()).extract(any());
    }

    @Test
    @DisplayName("A slow extractor times out without losing the other documents")
    void timeout() {
        // Arrange
        when(locator.locate(DIR)).thenReturn(files(DocumentKind.values()));
        when(identity.extract(any())).thenReturn(ok(PersonalInfo.EMPTY, DocumentKind.IDENTITY_CARD));
        when(employment.extract(any())).thenReturn(ok(EmploymentInfo.EMPTY, DocumentKind.EMPLOYMENT_LETTER));
        when(bank.extract(any())).thenAnswer(inv -> {
            release.await(10, TimeUnit.SECONDS);
            return ok(new BankStatementExtraction(null, null, null, null, null, null, null, null, null, null),
                    DocumentKind.BANK_STATEMENT);
        });
        when(resume.extract(any())).thenReturn(ok(new ResumeExtraction(null, null, null), DocumentKind.RESUME));
        when(assets.extract(any())).thenReturn(ok(new AssetLiabilityExtraction(null, null, null, null, null, null,
                1.0, 0.0), DocumentKind.ASSET_LIABILITY_SHEET));
        when(credit.extract(any())).thenReturn(ok(new CreditReportExtraction(700, null, null, null, null, null),
                DocumentKind.CREDIT_REPORT));

        // Act
        ExtractedDocuments docs = service(Duration.ofMillis(200)).extract("APP-00001", DIR);

        // Assert
        ExtractionMetadata late = docs.bankStatement().metadata();
        assertThat(late.status()).isEqualTo(ExtractionStatus.FAILED);
        assertThat(late.errors()).containsExactly(ExtractionService.TIMEOUT_ERROR);
        assertThat(docs.bankStatement().hasFields()).isFalse();
        assertThat(List.of(docs.identityCard(), docs.employmentLetter(), docs.resume(),
                docs.assetsLiabilities(), docs.creditReport()))
                .allSatisfy(o -> assertThat(o.metadata().status()).isEqualTo(ExtractionStatus.SUCCESS));
    }

    @Test
    @DisplayName("A hung document hands its worker back so the next application is still extracted")
    void hungDocumentReleasesWorker() {
        // Arrange
        ExecutorService single = Executors.newSingleThreadExecutor();
        Path stuckDir = Path.of("APP-00001");
        Path healthyDir = Path.of("APP-00002");
        Path stuckFile = stuckDir.resolve("credit_report.json");
        Path healthyFile = healthyDir.resolve("credit_report.json");
        when(locator.locate(stuckDir)).thenReturn(Map.of(DocumentKind.CREDIT_REPORT, stuckFile));
        when(locator.locate(healthyDir)).thenReturn(Map.of(DocumentKind.CREDIT_REPORT, healthyFile));
        CreditReportExtraction report = new CreditReportExtraction(700, null, null, null, null, null);
        when(credit.extract(stuckFile)).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return ok(report, DocumentKind.CREDIT_REPORT);
        });
        when(credit.extract(healthyFile)).thenAnswer(inv -> {
            Thread.sleep(50);
            return ok(report, DocumentKind.CREDIT_REPORT);
        });
        ExtractionService service = new ExtractionService(locator, identity, employment, bank, resume, assets, credit,
                single, Duration.ofMillis(500));

        try {
            // Act
            ExtractedDocuments stuck = service.extract("APP-00001", stuckDir);
            ExtractedDocuments healthy = service.extract("APP-00002", healthyDir);

            // Assert
            assertThat(stuck.creditReport().metadata().errors()).containsExactly(ExtractionService.TIMEOUT_ERROR);
            assertThat(healthy.creditReport().metadata().status()).isEqualTo(ExtractionStatus.SUCCESS);
            assertThat(healthy.creditReport().fields().creditScore()).isEqualTo(700);
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    @DisplayName("Time spent queued does not count against the deadline")
    void deadlineStartsWhenRunning() {
        // Arrange: six documents of 150 ms each on one thread, 300 ms per document
        ExecutorService single = Executors.newSingleThreadExecutor();
        when(locator.locate(DIR)).thenReturn(files(DocumentKind.values()));
        when(identity.extract(any())).thenAnswer(inv -> slow(ok(PersonalInfo.EMPTY, DocumentKind.IDENTITY_CARD)));
        when(employment.extract(any())).thenAnswer(inv -> slow(ok(EmploymentInfo.EMPTY, DocumentKind.EMPLOYMENT_LETTER)));
        when(bank.extract(any())).thenAnswer(inv -> slow(ok(new BankStatementExtraction(null, null, null, null, null,
                null, null, null, null, null), DocumentKind.BANK_STATEMENT)));
        when(resume.extract(any())).thenAnswer(inv -> slow(ok(new ResumeExtraction(null, null, null), DocumentKind.RESUME)));
        when(assets.extract(any())).thenAnswer(inv -> slow(ok(new AssetLiabilityExtraction(null, null, null, null,
                null, null, 1.0, 0.0), DocumentKind.ASSET_LIABILITY_SHEET)));
        when(credit.extract(any())).thenAnswer(inv -> slow(ok(new CreditReportExtraction(700, null, null, null, null,
                null), DocumentKind.CREDIT_REPORT)));
        ExtractionService service = new ExtractionService(locator, identity, employment, bank, resume, assets, credit,
                single, Duration.ofMillis(300));

        try {
            // Act
            ExtractedDocuments docs = service.extract("APP-00001", DIR);

            // Assert
            assertThat(docs.metadata().values())
                    .allSatisfy(m -> assertThat(m.status()).isEqualTo(ExtractionStatus.SUCCESS));
        } finally {
            single.shutdownNow();
        }
    }

    private static <T> T slow(T value) throws InterruptedException {
        Thread.sleep(150);
        return value;
    }

    @Test
    @DisplayName("An unexpected exception becomes a failed outcome")
    void unexpectedException() {
        when(locator.locate(DIR)).thenReturn(files(DocumentKind.CREDIT_REPORT));
        when(credit.extract(any())).thenThrow(new IllegalStateException("boom"));

        ExtractedDocuments docs = service(Duration.ofSeconds(5)).extract("APP-00001", DIR);

        assertThat(docs.creditReport().metadata().status()).isEqualTo(ExtractionStatus.FAILED);
        assertThat(docs.creditReport().metadata().errors().get(0)).contains("boom");
    }
}
