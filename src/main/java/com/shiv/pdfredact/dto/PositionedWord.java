package com.shiv.pdfredact.dto;

import lombok.Value;

@Value
public class PositionedWord {
    float x0;
    float y0;
    float x1;
    float y1;
    String text;
    int sequenceIndex;     // reading order on the page

    public float getHeight() {
        return y1 - y0;
    }
}
