package com.demo.eligibility.repository;

import com.demo.eligibility.service.PipelineException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Repository
@RequiredArgsConstructor
public class GroundTruthRepository {

    private final CsvMapper csvMapper;

    /**
     * Loads the CSV at {@code file}. A missing file yields an empty lookup; an unreadable one is
     * an error. The first row wins when an id repeats.
     */
    public GroundTruthLookup load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            log.warn("Ground-truth file {} not found, back-fill disabled", file);
            return GroundTruthLookup.empty();
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        Map<String, GroundTruthRecord> byId = new LinkedHashMap<>();
        try (MappingIterator<GroundTruthRecord> it = csvMapper.readerFor(GroundTruthRecord.class)
                .with(schema)
                .readValues(file.toFile())) {
            while (it.hasNextValue()) {
                GroundTruthRecord r = it.nextValue();
                if (r.getApplicationId() == null || r.getApplicationId().isBlank()) continue;
                byId.putIfAbsent(r.getApplicationId().strip(), r);
            }
        } catch (IOException | RuntimeException e) {
            throw new PipelineException("Cannot read ground-truth file " + file, e);
        }
        log.info("Loaded {} ground-truth records from {}", byId.size(), file);
        return new GroundTruthLookup(byId);
    }
}
