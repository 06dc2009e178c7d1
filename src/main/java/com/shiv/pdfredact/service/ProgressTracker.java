package com.shiv.pdfredact.service;

import com.shiv.pdfredact.dto.ProgressEvent;
import com.shiv.pdfredact.exception.RedactionCancelledException;
import lombok.extern.slf4j.Slf4j;

/**
 * Forwards events to a caller's sink with percentages clamped to [0,100] and never decreasing.
 * A failing sink does not fail the run.
 */
@Slf4j
class ProgressTracker implements ProgressSink {

    private final ProgressSink target;
    private int last;

    ProgressTracker(ProgressSink target) {
        this.target = target == null ? ProgressSink.NONE : target;
    }

    @Override
    public void accept(ProgressEvent event) {
        int pct = Math.max(last, Math.min(100, Math.max(0, event.getPercentage())));
        last = pct;
        try {
            target.accept(new ProgressEvent(pct, event.getMessage()));
        } catch (RedactionCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Progress listener failed on '{}': {}", event.getMessage(), e.getMessage());
        }
    }

    int last() {
        return last;
    }
}
