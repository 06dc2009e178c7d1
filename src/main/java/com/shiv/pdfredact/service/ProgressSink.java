package com.shiv.pdfredact.service;

import com.shiv.pdfredact.dto.ProgressEvent;

@FunctionalInterface
public interface ProgressSink {

    ProgressSink NONE = event -> { };

    void accept(ProgressEvent event);

    default void report(int percentage, String message) {
        accept(new ProgressEvent(percentage, message));
    }
}
