package com.demo.eligibility.service.extraction.decode;

/**
 * Null-object engine used when no real engine is configured: recognises nothing, so identity
 * cards come out as failed extractions.
 */
public class NullOcrEngine implements OcrEngine {

    @Override
    public String recognize(byte[] image) {
        return "";
    }

    @Override
    public String name() { return "none"; }
}
