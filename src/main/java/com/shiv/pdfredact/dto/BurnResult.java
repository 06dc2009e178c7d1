package com.shiv.pdfredact.dto;

import lombok.Value;

import java.util.List;

@Value
public class BurnResult {
    byte[] document;
    int pageCount;
    int burnedRects;
    List<OmittedLabel> omittedLabels;
}
