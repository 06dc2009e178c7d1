package com.shiv.pdfredact.exception;

/**
 * An OCR or orientation engine failed or produced output that could not be understood.
 */
public class OcrEngineException extends Exception {

    public OcrEngineException(String message) {
        super(message);
    }

    public OcrEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
