package com.demo.eligibility.service.extraction.decode;

/** A file could not be read or decoded into text, cells or a JSON tree. */
public class DocumentDecodingException extends Exception {

    public DocumentDecodingException(String message) {
        super(message);
    }

    public DocumentDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
