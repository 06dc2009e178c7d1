package com.shiv.pdfredact.dto;

import lombok.Value;

/**
 * A rectangle that was burned but whose verification label did not fit at any font size.
 */
@Value
public class OmittedLabel {
    int pageIndex;
    MatchRect rect;
}
