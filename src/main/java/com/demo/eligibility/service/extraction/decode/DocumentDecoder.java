package com.demo.eligibility.service.extraction.decode;

import java.nio.file.Path;

/**
 * Turns the bytes of one file into {@link DecodedDocument} content. Implementations wrap a
 * third-party parser and report every failure as {@link DocumentDecodingException}.
 */
public interface DocumentDecoder {

    DecodedDocument decode(Path file) throws DocumentDecodingException;

    /** Short label recorded in extraction metadata, e.g. {@code pdfbox}. */
    String method();
}
