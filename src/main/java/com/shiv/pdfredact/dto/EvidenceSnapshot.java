package com.shiv.pdfredact.dto;

import lombok.Value;

@Value
public class EvidenceSnapshot {
    int charCount;
    int literalHitCount;
}
