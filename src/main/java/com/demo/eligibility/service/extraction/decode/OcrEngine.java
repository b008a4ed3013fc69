package com.demo.eligibility.service.extraction.decode;

/** Character recognition over an image; returns the recognised text, possibly empty. */
public interface OcrEngine {

    String recognize(byte[] image) throws DocumentDecodingException;

    String name();
}
