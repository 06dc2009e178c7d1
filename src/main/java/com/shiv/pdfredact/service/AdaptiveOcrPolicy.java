package com.shiv.pdfredact.service;

import com.shiv.pdfredact.config.RedactionProperties;
import com.shiv.pdfredact.dto.EvidenceSnapshot;
import com.shiv.pdfredact.dto.OcrDecision;
import com.shiv.pdfredact.dto.OcrMode;
import com.shiv.pdfredact.exception.OcrEngineException;
import com.shiv.pdfredact.service.ocr.OcrEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Runs a forced OCR pass and keeps it only when it both finds more of the literals and adds a
 * meaningful amount of text. Otherwise the original text layer is kept, normalized through a
 * skip-text pass when the engine allows it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdaptiveOcrPolicy {

    static final int REVERT_PROGRESS = 60;
    static final String REVERT_MESSAGE = "Reverting to original text...";

    private final OcrEngine engine;
    private final TextEvidenceMeter meter;
    private final RedactionProperties properties;

    /**
     * @param document       rotation-corrected document
     * @param engineProgress receives engine progress (0..100); exceptions it throws are never caught here
     * @param stageProgress  receives the policy's own notices, in overall run percentages
     */
    public OcrDecision decide(byte[] document, List<String> literals, ProgressSink engineProgress,
                              ProgressSink stageProgress) {
        if (!properties.getOcr().isEnabled()) {
            log.info("OCR disabled, keeping embedded text");
            return OcrDecision.builder()
                    .document(document)
                    .outcome(OcrDecision.Outcome.SKIPPED)
                    .reason("OCR disabled")
                    .build();
        }

        EvidenceSnapshot before = meter.measure(document, literals);
        log.info("Text evidence before OCR: {} chars, {} literal hits", before.getCharCount(), before.getLiteralHitCount());

        EvidenceSnapshot after = null;
        String reason;
        try {
            byte[] ocred = engine.process(document, OcrMode.FORCE_OCR, engineProgress);
            after = meter.measure(ocred, literals);
            log.info("Text evidence after OCR: {} chars, {} literal hits", after.getCharCount(), after.getLiteralHitCount());

            Optional<String> revert = evaluate(before, after);
            if (revert.isEmpty()) {
                log.info("OCR improved the text layer, keeping it");
                return OcrDecision.builder()
                        .document(ocred)
                        .outcome(OcrDecision.Outcome.COMMITTED)
                        .before(before)
                        .after(after)
                        .build();
            }
            reason = revert.get();
        } catch (OcrEngineException e) {
            reason = "OCR failed: " + e.getMessage();
        }

        log.warn("Reverting to original text: {}", reason);
        stageProgress.report(REVERT_PROGRESS, REVERT_MESSAGE);
        try {
            byte[] normalized = engine.process(document, OcrMode.SKIP_TEXT, engineProgress);
            return OcrDecision.builder()
                    .document(normalized)
                    .outcome(OcrDecision.Outcome.REVERTED)
                    .reason(reason)
                    .before(before)
                    .after(after)
                    .build();
        } catch (OcrEngineException e) {
            log.warn("Skip-text pass failed, using the document before OCR: {}", e.getMessage());
            return OcrDecision.builder()
                    .document(document)
                    .outcome(OcrDecision.Outcome.REVERT_FAILED)
                    .reason(reason + "; skip-text pass failed: " + e.getMessage())
                    .before(before)
                    .after(after)
                    .build();
        }
    }

    public Optional<String> evaluate(EvidenceSnapshot before, EvidenceSnapshot after) {
        RedactionProperties.Ocr cfg = properties.getOcr();
        int diff = after.getCharCount() - before.getCharCount();
        if (cfg.isRequireHitGain() && after.getLiteralHitCount() <= before.getLiteralHitCount()) {
            return Optional.of(String.format("OCR found no additional literal hits (%d -> %d)",
                    before.getLiteralHitCount(), after.getLiteralHitCount()));
        }
        if (diff < cfg.getMinCharGain()) {
            return Optional.of(String.format("OCR did not significantly improve text length (diff=%d)", diff));
        }
        return Optional.empty();
    }
}
