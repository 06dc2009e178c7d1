package com.shiv.pdfredact.dto;

public enum JobStatus {
    RUNNING,
    DONE,
    CANCELLED,
    FAILED
}
