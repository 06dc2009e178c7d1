package com.shiv.pdfredact.dto;

public enum OcrMode {
    /** Rasterize every page and replace any existing text layer. */
    FORCE_OCR,
    /** Normalize the document but leave pages that already carry text untouched. */
    SKIP_TEXT
}
