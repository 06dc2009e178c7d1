package com.shiv.pdfredact.service.ocr;

import com.shiv.pdfredact.config.RedactionProperties;
import com.shiv.pdfredact.dto.OcrMode;
import com.shiv.pdfredact.exception.OcrEngineException;
import com.shiv.pdfredact.service.ProgressSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;
import org.springframework.util.StopWatch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Drives the {@code ocrmypdf} command line. Each call works in its own temp directory.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OcrMyPdfEngine implements OcrEngine {

    // ocrmypdf prefixes per-page log lines with the 1-based page number
    private static final Pattern PAGE_LINE = Pattern.compile("^\\s*(\\d+)\\s+\\S.*$");
    private static final int ERROR_TAIL_LINES = 5;

    private final RedactionProperties properties;

    @Override
    public byte[] process(byte[] pdf, OcrMode mode, ProgressSink progress) throws OcrEngineException {
        RedactionProperties.Ocr ocr = properties.getOcr();
        int pageCount = countPages(pdf);

        StopWatch sw = new StopWatch("ocrmypdf");
        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("ocr-");
            Path input = workDir.resolve("input.pdf");
            Path output = workDir.resolve("output.pdf");
            Files.write(input, pdf);

            sw.start(mode.name());
            ProcessRunner.Result result = ProcessRunner.run(buildCommand(mode, input, output), ocr.getTimeoutSeconds(),
                    line -> pageProgress(line, pageCount).ifPresent(pct -> progress.report(pct, line.trim())));
            sw.stop();

            if (result.getExitCode() != 0) {
                throw new OcrEngineException(ocr.getCommand() + " exited with " + result.getExitCode() + ": "
                        + result.tail(ERROR_TAIL_LINES));
            }
            if (!Files.isRegularFile(output)) {
                throw new OcrEngineException(ocr.getCommand() + " produced no output file");
            }
            log.info("OCR {} finished on {} page(s) in {} ms", mode, pageCount, sw.getTotalTimeMillis());
            return Files.readAllBytes(output);
        } catch (IOException e) {
            throw new OcrEngineException("OCR temp file handling failed: " + e.getMessage(), e);
        } finally {
            if (workDir != null) {
                deleteQuietly(workDir);
            }
        }
    }

    List<String> buildCommand(OcrMode mode, Path input, Path output) {
        RedactionProperties.Ocr ocr = properties.getOcr();
        List<String> cmd = new ArrayList<>();
        cmd.add(ocr.getCommand());
        cmd.add("--optimize");
        cmd.add(String.valueOf(ocr.getOptimize()));
        cmd.add("-l");
        cmd.add(ocr.getLanguage());
        cmd.add(mode == OcrMode.FORCE_OCR ? "--force-ocr" : "--skip-text");
        cmd.add(input.toString());
        cmd.add(output.toString());
        return cmd;
    }

    static Optional<Integer> pageProgress(String line, int pageCount) {
        if (pageCount <= 0) return Optional.empty();
        Matcher m = PAGE_LINE.matcher(line);
        if (!m.matches()) return Optional.empty();
        long page;
        try {
            page = Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        if (page < 1 || page > pageCount) return Optional.empty();
        return Optional.of((int) (page * 100 / pageCount));
    }

    private static int countPages(byte[] pdf) throws OcrEngineException {
        try (PDDocument doc = Loader.loadPDF(pdf)) {
            return doc.getNumberOfPages();
        } catch (IOException e) {
            throw new OcrEngineException("Cannot open document for OCR: " + e.getMessage(), e);
        }
    }

    private static void deleteQuietly(Path dir) {
        try {
            FileSystemUtils.deleteRecursively(dir);
        } catch (IOException e) {
            log.warn("Could not remove OCR temp dir {}: {}", dir, e.getMessage());
        }
    }
}
