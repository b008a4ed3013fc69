package com.demo.eligibility.service.extraction;

import com.demo.eligibility.model.DocumentKind;
import com.demo.eligibility.model.ExtractionMetadata;
import com.demo.eligibility.model.ExtractionStatus;
import com.demo.eligibility.service.extraction.decode.DecodedDocument;
import com.demo.eligibility.service.extraction.decode.DocumentDecoder;
import com.demo.eligibility.service.extraction.decode.DocumentDecodingException;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Decode, score, parse. Subclasses supply the confidence heuristic and a parser over the
 * decoded content; this class turns their results into metadata and keeps exceptions inside.
 */
@Slf4j
public abstract class AbstractFieldExtractor<T> implements FieldExtractor<T> {

    private final DocumentKind kind;
    private final DocumentDecoder decoder;

    protected AbstractFieldExtractor(DocumentKind kind, DocumentDecoder decoder) {
        this.kind = kind;
        this.decoder = decoder;
    }

    @Override
    public DocumentKind kind() {
        return kind;
    }

    @Override
    public ExtractionOutcome<T> extract(Path file) {
        long started = System.nanoTime();
        String method = decoder.method();
        try {
            DecodedDocument doc = decoder.decode(file);
            double confidence = confidence(doc);
            if (confidence <= 0.0) {
                return ExtractionOutcome.failed(kind, method, "No content could be decoded", since(started));
            }
            List<String> warnings = new ArrayList<>();
            ParseResult<T> parsed = parse(doc, warnings);
            if (!parsed.isOk()) {
                return ExtractionOutcome.failed(kind, method, parsed.error(), since(started));
            }
            ExtractionStatus status = warnings.isEmpty() ? ExtractionStatus.SUCCESS : ExtractionStatus.PARTIAL;
            ExtractionMetadata meta = new ExtractionMetadata(kind, status, confidence, method,
                    List.of(), warnings, since(started));
            return new ExtractionOutcome<>(parsed.value(), meta);
        } catch (DocumentDecodingException e) {
            log.warn("Decoding {} failed: {}", file.getFileName(), e.getMessage());
            return ExtractionOutcome.failed(kind, method, e.getMessage(), since(started));
        } catch (RuntimeException e) {
            log.warn("Parsing {} failed", file.getFileName(), e);
            return ExtractionOutcome.failed(kind, method, "Parsing failed: " + e.getMessage(), since(started));
        }
    }

    /** Confidence in [0, 1] for the decoded content; zero means nothing usable was decoded. */
    protected abstract double confidence(DecodedDocument doc);

    /** Parses fields; missing mandatory fields are reported by adding to {@code warnings}. */
    protected abstract ParseResult<T> parse(DecodedDocument doc, List<String> warnings);

    private static Duration since(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
