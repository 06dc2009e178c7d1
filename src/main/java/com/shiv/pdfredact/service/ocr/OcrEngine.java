package com.shiv.pdfredact.service.ocr;

import com.shiv.pdfredact.dto.OcrMode;
import com.shiv.pdfredact.exception.OcrEngineException;
import com.shiv.pdfredact.service.ProgressSink;

public interface OcrEngine {

    /**
     * @param pdf      document bytes
     * @param mode     whether existing text is replaced or left alone
     * @param progress receives engine progress as 0..100 for this call only; an exception thrown
     *                 by the sink aborts the engine and propagates to the caller
     * @return the rewritten document
     */
    byte[] process(byte[] pdf, OcrMode mode, ProgressSink progress) throws OcrEngineException;
}
