package com.shiv.pdfredact.exception;

public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(String runId) {
        super("Unknown redaction run: " + runId);
    }
}
