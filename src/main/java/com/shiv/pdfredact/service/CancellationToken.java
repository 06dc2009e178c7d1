package com.shiv.pdfredact.service;

import com.shiv.pdfredact.exception.RedactionCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void checkpoint(String stage) {
        if (isCancelled()) {
            throw new RedactionCancelledException(stage);
        }
    }
}
