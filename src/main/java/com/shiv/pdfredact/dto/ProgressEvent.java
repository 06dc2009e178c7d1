package com.shiv.pdfredact.dto;

import lombok.Value;

@Value
public class ProgressEvent {
    int percentage;        // 0..100
    String message;
}
