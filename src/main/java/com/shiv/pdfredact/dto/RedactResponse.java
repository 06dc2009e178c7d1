package com.shiv.pdfredact.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class RedactResponse {
    private String runId;
    private JobStatus status;
    private String fileName;
}
