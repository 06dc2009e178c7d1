package com.shiv.pdfredact.service.ocr;

import com.shiv.pdfredact.exception.OcrEngineException;

import java.awt.image.BufferedImage;

public interface OrientationDetector {

    /**
     * @return clockwise rotation in degrees that makes the rendered page upright, 0 if unknown
     */
    int detectRotation(BufferedImage page) throws OcrEngineException;
}
