package com.demo.eligibility.repository;

import com.demo.eligibility.service.PipelineException;
import com.demo.eligibility.service.dto.DecisionReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Path;

@Slf4j
@Repository
@RequiredArgsConstructor
public class DecisionReportRepository {

    private final ObjectMapper objectMapper;

    public void write(Path file, DecisionReport report) {
        try {
            ValidationResultsRepository.createParent(file);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), report);
        } catch (IOException e) {
            throw new PipelineException("Cannot write decisions to " + file, e);
        }
        log.info("Wrote {} decisions to {}", report.getDecisions().size(), file);
    }
}
