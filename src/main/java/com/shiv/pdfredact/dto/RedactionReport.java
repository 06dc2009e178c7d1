package com.shiv.pdfredact.dto;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

@Value
@Builder
public class RedactionReport {
    Path output;
    int pageCount;
    int burnedRects;
    int omittedLabels;
    OcrDecision.Outcome ocrOutcome;
    String ocrReason;
    EvidenceSnapshot before;
    EvidenceSnapshot after;
    long elapsedMs;
}
