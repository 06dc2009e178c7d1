package com.shiv.pdfredact.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class JobStatusResponse {
    private String runId;
    private JobStatus status;
    private int percentage;
    private String message;
    private String fileName;       // set once the redacted file is ready
    private Integer burnedRects;
    private String ocrOutcome;
}
