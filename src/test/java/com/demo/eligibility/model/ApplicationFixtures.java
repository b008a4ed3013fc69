package com.demo.eligibility.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** A clean, fully documented applicant and helpers to spoil one aspect at a time. */
public final class ApplicationFixtures {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T08:00:00Z"), ZoneOffset.UTC);
    public static final String APP_ID = "APP-00001";

    private ApplicationFixtures() {}

    public static PersonalInfo person() {
        return new PersonalInfo("Ahmed Ali Hassan", "784-1990-1234567-1", LocalDate.of(1990, 5, 15),
                "United Arab Emirates", "Married", "Male");
    }

    public static EmploymentInfo job(Double monthlySalary) {
        return new EmploymentInfo("Emirates Steel", "Maintenance Engineer", LocalDate.of(2018, 3, 1), null,
                monthlySalary, "AED");
    }

    public static BankStatementExtraction bank(Double monthlyIncome) {
        return new BankStatementExtraction("Emirates NBD", "1234567890123456", "Ahmed Ali Hassan",
                LocalDate.of(2025, 1, 1), LocalDate.of(2025, 4, 1), List.of(), List.of(),
                42_000.0, monthlyIncome, monthlyIncome);
    }

    public static ResumeExtraction resume() {
        return new ResumeExtraction(
                List.of(new WorkExperience("Maintenance Engineer", "Emirates Steel", 2018, null, true)),
                List.of("Bachelor of Engineering in Mechanical Engineering"),
                List.of("Maintenance planning", "AutoCAD"));
    }

    public static AssetLiabilityExtraction assets(double totalAssets, double totalLiabilities) {
        return new AssetLiabilityExtraction(
                List.of(new Property("Real Estate", "Apartment in Sharjah", 250_000)),
                List.of(new Vehicle("Toyota Camry 2019", 45_000)),
                5_000.0, null,
                List.of(new Loan("Auto Loans", 30_000, 1_500.0)),
                null, totalAssets, totalLiabilities);
    }

    public static CreditReportExtraction credit(Integer score) {
        return new CreditReportExtraction(score, "Good",
                List.of(new CreditAccount("Credit Card", "Mashreq Bank", 4_000, 20_000.0, 400.0, "Current")),
                new PaymentHistory(24, 0, 0, 0, 0), 1, 4_000.0);
    }

    public static ExtractionMetadata success(DocumentKind kind) {
        return new ExtractionMetadata(kind, ExtractionStatus.SUCCESS, 0.9, "test", List.of(), List.of(), Duration.ZERO);
    }

    public static Map<DocumentKind, ExtractionMetadata> allSucceeded() {
        Map<DocumentKind, ExtractionMetadata> m = new EnumMap<>(DocumentKind.class);
        for (DocumentKind k : DocumentKind.values()) m.put(k, success(k));
        return m;
    }

    /** Every document present and mutually consistent. */
    public static ApplicationExtraction complete() {
        return new ApplicationExtraction(APP_ID, person(), job(15_000.0), bank(15_000.0), resume(),
                assets(300_000, 150_000), credit(720), allSucceeded(), List.of(), VerificationStatus.VERIFIED, 0.93);
    }

    public static ApplicationExtraction withPersonal(ApplicationExtraction a, PersonalInfo p) {
        return a.withPersonalInfo(p);
    }

    public static ApplicationExtraction withIncome(ApplicationExtraction a, Double salary, Double bankIncome) {
        return new ApplicationExtraction(a.applicationId(), a.personalInfo(), job(salary),
                bankIncome == null ? null : bank(bankIncome), a.resume(), a.assetsLiabilities(), a.creditReport(),
                a.metadata(), a.missingDocuments(), a.verificationStatus(), a.dataQualityScore());
    }

    public static ApplicationExtraction withEmployment(ApplicationExtraction a, EmploymentInfo e) {
        return new ApplicationExtraction(a.applicationId(), a.personalInfo(), e, a.bankStatement(), a.resume(),
                a.assetsLiabilities(), a.creditReport(), a.metadata(), a.missingDocuments(),
                a.verificationStatus(), a.dataQualityScore());
    }

    public static ApplicationExtraction withAssets(ApplicationExtraction a, AssetLiabilityExtraction assets) {
        return new ApplicationExtraction(a.applicationId(), a.personalInfo(), a.employmentInfo(), a.bankStatement(),
                a.resume(), assets, a.creditReport(), a.metadata(), a.missingDocuments(),
                a.verificationStatus(), a.dataQualityScore());
    }

    public static ApplicationExtraction withCredit(ApplicationExtraction a, CreditReportExtraction credit) {
        return new ApplicationExtraction(a.applicationId(), a.personalInfo(), a.employmentInfo(), a.bankStatement(),
                a.resume(), a.assetsLiabilities(), credit, a.metadata(), a.missingDocuments(),
                a.verificationStatus(), a.dataQualityScore());
    }

    /** Nothing on disk for the application. */
    public static ApplicationExtraction nothingFound() {
        Map<DocumentKind, ExtractionMetadata> m = new EnumMap<>(DocumentKind.class);
        for (DocumentKind k : DocumentKind.values()) m.put(k, ExtractionMetadata.missing(k));
        return new ApplicationExtraction(APP_ID, null, null, null, null, null, null, m,
                List.of(DocumentKind.values()), VerificationStatus.INCOMPLETE, 0.0);
    }
}
