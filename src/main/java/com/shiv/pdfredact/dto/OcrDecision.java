package com.shiv.pdfredact.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OcrDecision {

    public enum Outcome {
        COMMITTED,
        REVERTED,
        REVERT_FAILED,
        SKIPPED
    }

    byte[] document;
    Outcome outcome;
    String reason;
    EvidenceSnapshot before;
    EvidenceSnapshot after;    // null when the OCR pass itself failed or was skipped
}
