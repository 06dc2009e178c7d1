package com.shiv.pdfredact.exception;

import lombok.Getter;

/**
 * Raised when a run's cancellation token is observed set. Not an error state: callers report
 * the run as cancelled rather than failed.
 */
@Getter
public class RedactionCancelledException extends RuntimeException {

    private final String stage;

    public RedactionCancelledException(String stage) {
        super("Redaction cancelled before " + stage);
        this.stage = stage;
    }
}
