package com.shiv.pdfredact.service;

import com.shiv.pdfredact.dto.BurnResult;
import com.shiv.pdfredact.dto.OcrDecision;
import com.shiv.pdfredact.dto.RedactionReport;
import com.shiv.pdfredact.util.Literals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StopWatch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Load, rotation correction, adaptive OCR, redaction and persistence, in that order.
 * The cancellation token is checked before every stage and on every OCR progress event; a
 * cancelled run throws {@link com.shiv.pdfredact.exception.RedactionCancelledException} and
 * leaves no output behind.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedactionPipeline {

    static final int LOAD = 0;
    static final int ROTATION = 20;
    static final int OCR_START = 40;
    static final double OCR_SPAN = 0.3;
    static final int REDACTION = 70;
    static final int PERSIST = 90;
    static final int DONE = 100;

    private final RotationCorrector rotationCorrector;
    private final AdaptiveOcrPolicy ocrPolicy;
    private final DocumentRedactor redactor;

    public RedactionReport run(Path input, Path output, List<String> literals, ProgressSink sink,
                               CancellationToken token) throws IOException {
        List<String> words = Literals.normalize(literals);
        ProgressTracker progress = new ProgressTracker(sink);
        StopWatch sw = new StopWatch("redaction");

        token.checkpoint("load");
        progress.report(LOAD, "Reading file...");
        sw.start("load");
        byte[] original = Files.readAllBytes(input);
        sw.stop();

        token.checkpoint("rotation");
        progress.report(ROTATION, "Correcting rotation...");
        sw.start("rotation");
        byte[] rotated = rotationCorrector.correct(original);
        sw.stop();

        token.checkpoint("ocr");
        progress.report(OCR_START, "Running OCR (Adaptive)...");
        sw.start("ocr");
        OcrDecision decision = ocrPolicy.decide(rotated, words, ocrProgress(progress, token), event -> {
            token.checkpoint("ocr");
            progress.accept(event);
        });
        sw.stop();

        token.checkpoint("redaction");
        progress.report(REDACTION, "Applying redactions...");
        sw.start("redaction");
        BurnResult burn = redactor.redact(decision.getDocument(), words, token);
        sw.stop();

        token.checkpoint("persist");
        progress.report(PERSIST, "Saving file...");
        sw.start("persist");
        Files.write(output, burn.getDocument());
        sw.stop();

        progress.report(DONE, "Done!");
        log.info("Redacted {} -> {}: {} rect(s) on {} page(s), OCR {}. {}", input.getFileName(), output.getFileName(),
                burn.getBurnedRects(), burn.getPageCount(), decision.getOutcome(), sw.prettyPrint());

        return RedactionReport.builder()
                .output(output)
                .pageCount(burn.getPageCount())
                .burnedRects(burn.getBurnedRects())
                .omittedLabels(burn.getOmittedLabels().size())
                .ocrOutcome(decision.getOutcome())
                .ocrReason(decision.getReason())
                .before(decision.getBefore())
                .after(decision.getAfter())
                .elapsedMs(sw.getTotalTimeMillis())
                .build();
    }

    public BurnResult redact(byte[] document, List<String> literals) throws IOException {
        return redactor.redact(document, Literals.normalize(literals));
    }

    private static ProgressSink ocrProgress(ProgressSink progress, CancellationToken token) {
        return event -> {
            token.checkpoint("ocr");
            progress.report(OCR_START + (int) (event.getPercentage() * OCR_SPAN), "OCR: " + event.getMessage());
        };
    }
}
