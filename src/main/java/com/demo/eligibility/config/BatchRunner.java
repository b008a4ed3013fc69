package com.demo.eligibility.config;

import com.demo.eligibility.service.EligibilityPipeline;
import com.demo.eligibility.service.PipelineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/** Runs one batch when the application is ready, unless {@code eligibility.batch.enabled} is false. */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class BatchRunner {

    private static final AtomicBoolean RAN = new AtomicBoolean(false);

    private final EligibilityPipeline pipeline;

    @Value("${eligibility.batch.enabled:true}")
    private boolean enabled;

    @Value("${eligibility.documents-root:data/processed/documents}")
    private String documentsRoot;

    @Value("${eligibility.ground-truth-file:data/processed/applications.csv}")
    private String groundTruthFile;

    @Value("${eligibility.output.validation-file:data/processed/validation_results.json}")
    private String validationFile;

    @Value("${eligibility.output.decision-file:data/processed/decision_results.json}")
    private String decisionFile;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!enabled)
            return;
        // once per process
        if (!RAN.compareAndSet(false, true))
            return;
        try {
            pipeline.run(Path.of(documentsRoot), Path.of(groundTruthFile), Path.of(validationFile), Path.of(decisionFile));
        } catch (PipelineException e) {
            log.error("Batch failed: {}", e.getMessage(), e);
            throw e;
        }
    }
}
