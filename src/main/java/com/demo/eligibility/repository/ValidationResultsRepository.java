package com.demo.eligibility.repository;

import com.demo.eligibility.service.PipelineException;
import com.demo.eligibility.service.dto.ValidationRecord;
import com.demo.eligibility.service.dto.ValidationResultsDocument;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** The validation-results file: written by the validation stage, read by the decision stage. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ValidationResultsRepository {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void write(Path file, List<ValidationRecord> records) {
        ValidationResultsDocument doc = new ValidationResultsDocument();
        doc.setGeneratedAt(clock.instant());
        doc.setTotalApplications(records.size());
        doc.setApplications(records);
        try {
            createParent(file);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), doc);
        } catch (IOException e) {
            throw new PipelineException("Cannot write validation results to " + file, e);
        }
        log.info("Wrote {} validation results to {}", records.size(), file);
    }

    /** Records keyed by application id, in file order. Entries without an id are skipped. */
    public Map<String, ValidationRecord> read(Path file) {
        ValidationResultsDocument doc;
        try {
            doc = objectMapper.readValue(file.toFile(), ValidationResultsDocument.class);
        } catch (IOException e) {
            throw new PipelineException("Cannot read validation results from " + file, e);
        }
        Map<String, ValidationRecord> byId = new LinkedHashMap<>();
        if (doc.getApplications() == null) return byId;
        for (ValidationRecord r : doc.getApplications()) {
            if (r == null || r.getApplicationId() == null || r.getApplicationId().isBlank()) continue;
            byId.putIfAbsent(r.getApplicationId(), r);
        }
        return byId;
    }

    static void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }
}
