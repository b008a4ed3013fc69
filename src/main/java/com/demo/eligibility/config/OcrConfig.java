package com.demo.eligibility.config;

import com.demo.eligibility.service.extraction.decode.NullOcrEngine;
import com.demo.eligibility.service.extraction.decode.OcrEngine;
import com.demo.eligibility.service.extraction.decode.TesseractOcrEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Picks the identity-card OCR engine: Tesseract when {@code eligibility.ocr.engine=tesseract}. */
@Slf4j
@Configuration
public class OcrConfig {

    @Bean
    @ConditionalOnProperty(name = "eligibility.ocr.engine", havingValue = "tesseract")
    public OcrEngine tesseractOcrEngine(@Value("${eligibility.ocr.data-path:}") String dataPath,
                                        @Value("${eligibility.ocr.language:eng+ara}") String language) {
        log.info("OCR engine: tesseract (language {}, data path {})", language,
                dataPath.isBlank() ? "<default>" : dataPath);
        return new TesseractOcrEngine(dataPath, language);
    }

    @Bean
    @ConditionalOnMissingBean(OcrEngine.class)
    public OcrEngine nullOcrEngine() {
        log.warn("No OCR engine configured; identity cards will not be read");
        return new NullOcrEngine();
    }
}
