package com.demo.eligibility.service;

/** Batch-level failure: an input file cannot be read or an output file cannot be written. */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
