package com.demo.eligibility.service.validation;

import com.demo.eligibility.model.ApplicationExtraction;
import com.demo.eligibility.model.ValidationFinding;
import com.demo.eligibility.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Runs every checker in category order and hands the findings to the aggregator. */
@Slf4j
@Service
public class ConsistencyValidator {

    private final List<ConsistencyChecker> checkers;
    private final ScoreAggregator aggregator;

    public ConsistencyValidator(List<ConsistencyChecker> checkers, ScoreAggregator aggregator) {
        this.checkers = checkers.stream()
                .sorted(Comparator.comparing(ConsistencyChecker::category))
                .toList();
        this.aggregator = aggregator;
    }

    public List<ValidationFinding> findings(ApplicationExtraction application) {
        List<ValidationFinding> out = new ArrayList<>();
        for (ConsistencyChecker checker : checkers) {
            out.addAll(checker.check(application));
        }
        if (log.isDebugEnabled()) {
            out.forEach(f -> log.debug("[{}] {} {} {}", application.applicationId(),
                    f.severity().code(), f.category().code(), f.message()));
        }
        return out;
    }

    public ValidationResult validate(ApplicationExtraction application) {
        return aggregator.aggregate(application, findings(application));
    }
}
